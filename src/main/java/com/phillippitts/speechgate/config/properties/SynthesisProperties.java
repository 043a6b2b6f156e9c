package com.phillippitts.speechgate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the synthesis endpoint: result cache bound and voice storage.
 *
 * <p>Example application.properties:
 * <pre>
 * tts.cache.max-entries=50
 * tts.voices.directory=data/voices
 * tts.voices.builtin.xiaoyi=zh-CN-XiaoyiNeural
 * </pre>
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public class SynthesisProperties {

    private CacheProperties cache = new CacheProperties();
    private VoiceProperties voices = new VoiceProperties();

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public VoiceProperties getVoices() {
        return voices;
    }

    public void setVoices(VoiceProperties voices) {
        this.voices = voices;
    }

    /**
     * Synthesis result cache. A bound of 0 disables caching.
     */
    public static class CacheProperties {
        @PositiveOrZero(message = "Cache size must not be negative")
        private int maxEntries = 50;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    /**
     * Voice sample storage and the built-in voice catalogue (voice id to engine voice name).
     */
    public static class VoiceProperties {
        @NotBlank(message = "Voice directory must not be blank")
        private String directory = "data/voices";

        @NotBlank(message = "Default voice id must not be blank")
        private String defaultVoiceId = "default";

        @Positive(message = "Maximum sample size must be positive")
        private int maxSampleBytes = 10 * 1024 * 1024;

        private Map<String, String> builtin = new LinkedHashMap<>();

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getDefaultVoiceId() {
            return defaultVoiceId;
        }

        public void setDefaultVoiceId(String defaultVoiceId) {
            this.defaultVoiceId = defaultVoiceId;
        }

        public int getMaxSampleBytes() {
            return maxSampleBytes;
        }

        public void setMaxSampleBytes(int maxSampleBytes) {
            this.maxSampleBytes = maxSampleBytes;
        }

        public Map<String, String> getBuiltin() {
            return builtin;
        }

        public void setBuiltin(Map<String, String> builtin) {
            this.builtin = builtin;
        }
    }
}
