package com.phillippitts.speechgate.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmFormatTest {

    @Test
    void defaultFormatIs32KilobytesPerSecond() {
        assertThat(PcmFormat.DEFAULT.blockAlign()).isEqualTo(2);
        assertThat(PcmFormat.DEFAULT.byteRate()).isEqualTo(32_000);
        assertThat(PcmFormat.DEFAULT.durationMs(64_000)).isEqualTo(2000);
    }

    @Test
    void alignsDownToWholeFrames() {
        PcmFormat stereo = new PcmFormat(16_000, 16, 2);

        assertThat(PcmFormat.DEFAULT.alignDown(64_001)).isEqualTo(64_000);
        assertThat(stereo.alignDown(10)).isEqualTo(8);
        assertThat(stereo.alignDown(3)).isZero();
    }

    @Test
    void rejectsPartialByteSamples() {
        assertThatThrownBy(() -> new PcmFormat(16_000, 12, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bitsPerSample");
    }
}
