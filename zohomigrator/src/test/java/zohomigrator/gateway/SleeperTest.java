package zohomigrator.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Sleeper")
class SleeperTest {

    @Test
    @DisplayName("should round partial milliseconds up")
    void shouldRoundUp() {
        assertThat(Sleeper.millisRoundedUp(Duration.ofNanos(1))).isEqualTo(1);
        assertThat(Sleeper.millisRoundedUp(Duration.ofNanos(2_500_000))).isEqualTo(3);
        assertThat(Sleeper.millisRoundedUp(Duration.ofMillis(60_000))).isEqualTo(60_000);
    }

    @Test
    @DisplayName("should not wake before a sub-millisecond deadline")
    void shouldSleepAtLeastTheDuration() throws InterruptedException {
        long start = System.nanoTime();

        Sleeper.system().sleep(Duration.ofNanos(300_000));

        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(300_000);
    }
}
