package zohomigrator.gateway;

import java.time.Duration;

/**
 * Blocks the calling thread. Abstracted so rate limiting can be tested
 * against a virtual clock.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}. Durations are rounded up
     * to whole milliseconds so the caller never wakes before the deadline.
     */
    static Sleeper system() {
        return d -> {
            if (!d.isNegative() && !d.isZero()) {
                Thread.sleep(millisRoundedUp(d));
            }
        };
    }

    static long millisRoundedUp(Duration d) {
        long millis = d.toMillis();
        return d.minusMillis(millis).isZero() ? millis : millis + 1;
    }
}
