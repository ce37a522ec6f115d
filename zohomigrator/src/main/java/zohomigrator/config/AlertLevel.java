package zohomigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events written by
 * {@link zohomigrator.alert.MigrationEventLogger}. Configured via the
 * {@code migration.alert.level} property; the {@code --verbose} CLI flag
 * forces {@link #DEBUG}.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: run and stage transitions, rate-limit waits, token refreshes</li>
 *   <li>{@link #WARNING} - throttling, rejected records and failures</li>
 *   <li>{@link #ERROR} - aborted stages only</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log every event. Use when troubleshooting a run. */
    DEBUG,

    /** Log warnings and errors. Default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
