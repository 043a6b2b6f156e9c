package com.phillippitts.speechgate.config.properties;

import com.phillippitts.speechgate.service.audio.PcmFormat;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Buffering and chunking thresholds for the recognition endpoint.
 *
 * <p>All sizes are raw PCM bytes at the configured format (default 16 kHz, 16-bit, mono,
 * which is 32,000 bytes per second).
 *
 * <p>Properties:
 * <ul>
 *   <li>stt.recognition.min-audio-bytes - buffers below this are answered with an empty result
 *       without calling the recognizer (default: 64000, 2 s)</li>
 *   <li>stt.recognition.max-chunk-bytes - largest buffer sent to the recognizer in one call
 *       (default: 320000, 10 s)</li>
 *   <li>stt.recognition.chunk-overlap-bytes - audio shared by consecutive chunks
 *       (default: 16000, 0.5 s)</li>
 *   <li>stt.recognition.min-chunk-ms - chunks shorter than this are skipped (default: 300)</li>
 *   <li>stt.recognition.max-audio-bytes - largest utterance held per connection; later frames
 *       are dropped (default: 19200000, 10 min)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "stt.recognition")
@Validated
public class RecognitionProperties {

    @Positive(message = "Sample rate must be positive")
    private int sampleRate = 16_000;

    @Positive(message = "Bits per sample must be positive")
    private int bitsPerSample = 16;

    @Positive(message = "Channel count must be positive")
    private int channels = 1;

    @PositiveOrZero(message = "Minimum audio size must not be negative")
    private int minAudioBytes = 64_000;

    @Positive(message = "Maximum chunk size must be positive")
    private int maxChunkBytes = 320_000;

    @PositiveOrZero(message = "Chunk overlap must not be negative")
    private int chunkOverlapBytes = 16_000;

    @PositiveOrZero(message = "Minimum chunk duration must not be negative")
    private int minChunkMs = 300;

    @Positive(message = "Maximum utterance size must be positive")
    private int maxAudioBytes = 19_200_000;

    public PcmFormat toPcmFormat() {
        return new PcmFormat(sampleRate, bitsPerSample, channels);
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getBitsPerSample() {
        return bitsPerSample;
    }

    public void setBitsPerSample(int bitsPerSample) {
        this.bitsPerSample = bitsPerSample;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public int getMinAudioBytes() {
        return minAudioBytes;
    }

    public void setMinAudioBytes(int minAudioBytes) {
        this.minAudioBytes = minAudioBytes;
    }

    public int getMaxChunkBytes() {
        return maxChunkBytes;
    }

    public void setMaxChunkBytes(int maxChunkBytes) {
        this.maxChunkBytes = maxChunkBytes;
    }

    public int getChunkOverlapBytes() {
        return chunkOverlapBytes;
    }

    public void setChunkOverlapBytes(int chunkOverlapBytes) {
        this.chunkOverlapBytes = chunkOverlapBytes;
    }

    public int getMinChunkMs() {
        return minChunkMs;
    }

    public void setMinChunkMs(int minChunkMs) {
        this.minChunkMs = minChunkMs;
    }

    public int getMaxAudioBytes() {
        return maxAudioBytes;
    }

    public void setMaxAudioBytes(int maxAudioBytes) {
        this.maxAudioBytes = maxAudioBytes;
    }
}
