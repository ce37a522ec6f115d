package zohomigrator.gateway;

import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.exceptions.MigrationInterruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window admission control for outgoing requests.
 *
 * <p>Keeps the send timestamps of the trailing window. A caller that finds
 * the window full sleeps exactly until the oldest timestamp leaves it; there
 * is no polling. The timestamp is recorded at admission, immediately before
 * the request is transmitted.
 *
 * <p>Invariant: at most {@code maxRequests} timestamps lie within any
 * {@code window}-long interval.
 *
 * <p>Admission is serialized by a lock held across the wait, so parallel
 * callers queue up instead of overshooting the limit.
 */
public final class RateWindow {

    private static final Logger log = LoggerFactory.getLogger(RateWindow.class);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> sent = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long waits;
    private Duration totalWait = Duration.ZERO;

    public RateWindow(int maxRequests, Duration window, Clock clock, Sleeper sleeper) {
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests must be positive");
        this.maxRequests = maxRequests;
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Blocks until a request may be sent, then records it.
     *
     * @return how long the caller waited
     * @throws MigrationInterruptedException if interrupted while waiting
     */
    public Duration acquire() throws MigrationInterruptedException {
        lock.lock();
        try {
            Duration waited = Duration.ZERO;
            while (true) {
                Instant now = clock.instant();
                prune(now);
                if (sent.size() < maxRequests) {
                    sent.addLast(now);
                    return waited;
                }
                Duration wait = Duration.between(now, sent.peekFirst().plus(window));
                log.debug("Rate window full ({} requests), waiting {} ms", sent.size(), wait.toMillis());
                MigrationEventLogger.rateLimitWait(wait.toMillis(), sent.size());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MigrationInterruptedException("Interrupted while waiting for rate limit", e);
                }
                waits++;
                waited = waited.plus(wait);
                totalWait = totalWait.plus(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!sent.isEmpty() && !sent.peekFirst().isAfter(cutoff)) {
            sent.removeFirst();
        }
    }

    /** Returns the number of requests currently inside the window. */
    public int inWindow() {
        lock.lock();
        try {
            prune(clock.instant());
            return sent.size();
        } finally {
            lock.unlock();
        }
    }

    /** Returns how many times a caller had to wait. */
    public long waitCount() {
        lock.lock();
        try {
            return waits;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the accumulated wait time. */
    public Duration totalWait() {
        lock.lock();
        try {
            return totalWait;
        } finally {
            lock.unlock();
        }
    }
}
