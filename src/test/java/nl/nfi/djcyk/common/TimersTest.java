package nl.nfi.djcyk.common;

import nl.nfi.djcyk.common.Timers.Timed;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimersTest {

    @Test
    void returnsValueAndDuration() {
        final Timed<String> timed = Timers.time(() -> "value");

        assertThat(timed.value()).isEqualTo("value");
        assertThat(timed.duration().isNegative()).isFalse();
        assertThat(timed.seconds()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void propagatesCheckedException() {
        assertThatThrownBy(() -> Timers.time(() -> {
            throw new IOException("failed");
        })).isInstanceOf(IOException.class).hasMessage("failed");
    }
}
