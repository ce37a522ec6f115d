package zohomigrator.pipeline;

/**
 * Run-wide switches from the command line.
 *
 * @param dryRun skip every write and use placeholder ids
 * @param verbose log per-record progress
 * @param hierarchicalCategories build accounts from the configured hierarchy instead of FreshBooks categories
 */
public record PipelineOptions(boolean dryRun, boolean verbose, boolean hierarchicalCategories) {

    public static final PipelineOptions DEFAULTS = new PipelineOptions(false, false, false);
}
