package com.phillippitts.speechgate.config.properties;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Background cache pre-warming of common phrases for registered voices.
 *
 * <p>Properties:
 * <ul>
 *   <li>tts.prewarm.enabled - run pre-warming at all (default: true)</li>
 *   <li>tts.prewarm.initial-delay-ms - delay after startup before the first run (default: 3000)</li>
 *   <li>tts.prewarm.busy-backoff-ms - how long one attempt waits for foreground requests to
 *       drain before it is skipped (default: 1000)</li>
 *   <li>tts.prewarm.include-builtin-voices - also pre-warm configured built-in voices (default: false)</li>
 *   <li>tts.prewarm.phrases - phrases to pre-synthesize</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "tts.prewarm")
@Validated
public class PrewarmProperties {

    private boolean enabled = true;

    @PositiveOrZero(message = "Initial delay must not be negative")
    private long initialDelayMs = 3000;

    @PositiveOrZero(message = "Busy back-off must not be negative")
    private long busyBackoffMs = 1000;

    private boolean includeBuiltinVoices = false;

    private List<String> phrases = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
    }

    public long getBusyBackoffMs() {
        return busyBackoffMs;
    }

    public void setBusyBackoffMs(long busyBackoffMs) {
        this.busyBackoffMs = busyBackoffMs;
    }

    public boolean isIncludeBuiltinVoices() {
        return includeBuiltinVoices;
    }

    public void setIncludeBuiltinVoices(boolean includeBuiltinVoices) {
        this.includeBuiltinVoices = includeBuiltinVoices;
    }

    public List<String> getPhrases() {
        return phrases;
    }

    public void setPhrases(List<String> phrases) {
        this.phrases = phrases;
    }
}
