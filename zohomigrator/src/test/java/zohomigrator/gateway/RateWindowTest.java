package zohomigrator.gateway;

import zohomigrator.exceptions.MigrationInterruptedException;
import zohomigrator.support.VirtualClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateWindow")
class RateWindowTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        @DisplayName("should admit up to the limit without waiting")
        void shouldAdmitUpToLimit() throws Exception {
            VirtualClock clock = new VirtualClock(START);
            RateWindow window = new RateWindow(100, Duration.ofSeconds(60), clock, clock);

            for (int i = 0; i < 100; i++) {
                assertThat(window.acquire()).isZero();
            }

            assertThat(clock.sleeps()).isEmpty();
            assertThat(window.inWindow()).isEqualTo(100);
        }

        @Test
        @DisplayName("should make the 101st request wait until the oldest leaves the window")
        void shouldWaitForOldest() throws Exception {
            VirtualClock clock = new VirtualClock(START);
            RateWindow window = new RateWindow(100, Duration.ofSeconds(60), clock, clock);
            for (int i = 0; i < 100; i++) {
                window.acquire();
                clock.advance(Duration.ofMillis(100));
            }
            // now = START + 10 s, oldest at START

            Duration waited = window.acquire();

            assertThat(waited).isEqualTo(Duration.ofSeconds(50));
            assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(50));
            assertThat(window.waitCount()).isEqualTo(1);
            assertThat(window.totalWait()).isEqualTo(Duration.ofSeconds(50));
        }

        @Test
        @DisplayName("should never let more than the limit into any window")
        void shouldHoldInvariantUnderLoad() throws Exception {
            VirtualClock clock = new VirtualClock(START);
            RateWindow window = new RateWindow(5, Duration.ofSeconds(10), clock, clock);
            List<Instant> admitted = new ArrayList<>();

            for (int i = 0; i < 23; i++) {
                window.acquire();
                admitted.add(clock.instant());
                clock.advance(Duration.ofMillis(700));
            }

            for (Instant t : admitted) {
                long inside = admitted.stream()
                        .filter(o -> !o.isBefore(t) && o.isBefore(t.plusSeconds(10)))
                        .count();
                assertThat(inside).isLessThanOrEqualTo(5);
            }
        }

        @Test
        @DisplayName("should free slots once the window has passed")
        void shouldFreeSlotsAfterWindow() throws Exception {
            VirtualClock clock = new VirtualClock(START);
            RateWindow window = new RateWindow(2, Duration.ofSeconds(60), clock, clock);
            window.acquire();
            window.acquire();

            clock.advance(Duration.ofSeconds(61));

            assertThat(window.inWindow()).isZero();
            assertThat(window.acquire()).isZero();
        }
    }

    @Nested
    @DisplayName("interruption")
    class Interruption {

        @Test
        @DisplayName("should turn an interrupted wait into a fatal error")
        void shouldFailOnInterrupt() throws Exception {
            VirtualClock clock = new VirtualClock(START);
            RateWindow window = new RateWindow(1, Duration.ofSeconds(60), clock, d -> {
                throw new InterruptedException("stop");
            });
            window.acquire();

            assertThatThrownBy(window::acquire)
                    .isInstanceOf(MigrationInterruptedException.class)
                    .satisfies(e -> assertThat(((MigrationInterruptedException) e).isFatal()).isTrue());
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    @Test
    @DisplayName("should reject a non-positive limit")
    void shouldRejectNonPositiveLimit() {
        VirtualClock clock = new VirtualClock(START);
        assertThatThrownBy(() -> new RateWindow(0, Duration.ofSeconds(60), clock, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
