package com.phillippitts.speechgate.service.audio;

/**
 * Raw PCM stream format: signed, little-endian.
 *
 * @param sampleRate    samples per second
 * @param bitsPerSample bits per sample (multiple of 8)
 * @param channels      channel count
 */
public record PcmFormat(int sampleRate, int bitsPerSample, int channels) {

    /** 16 kHz, 16-bit, mono: 32,000 bytes per second. */
    public static final PcmFormat DEFAULT = new PcmFormat(16_000, 16, 1);

    public PcmFormat {
        if (sampleRate <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate and channels must be positive");
        }
        if (bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("bitsPerSample must be a positive multiple of 8, got: " + bitsPerSample);
        }
    }

    /** Bytes per frame (one sample for every channel). */
    public int blockAlign() {
        return (bitsPerSample / 8) * channels;
    }

    public int byteRate() {
        return sampleRate * blockAlign();
    }

    /**
     * Converts a byte count to whole milliseconds of audio.
     */
    public long durationMs(long bytes) {
        return bytes * 1000L / byteRate();
    }

    /**
     * Rounds a byte count down to a whole number of frames.
     */
    public int alignDown(int bytes) {
        return bytes - (bytes % blockAlign());
    }
}
