package com.phillippitts.speechgate.service.tts;

import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded least-recently-used store of synthesized audio.
 *
 * <p>Keys are the lowercase hex SHA-256 of {@code text + "|" + voiceKey}, so the key depends on
 * nothing but the request text and voice. A hit promotes the entry; a store overwrites an
 * existing entry and makes it most recent, then evicts from the cold end while the bound is
 * exceeded. A bound of 0 disables caching.
 *
 * <p>One lock guards the access-ordered map, which gives all sessions the same eviction order.
 * Audio arrays are copied on the way in and out so callers cannot mutate cached entries.
 */
@Component
public class SynthesisCache {

    private static final Logger LOG = LogManager.getLogger(SynthesisCache.class);

    private final int maxEntries;
    private final SpeechMetrics metrics;
    private final Object lock = new Object();
    private final LinkedHashMap<String, byte[]> entries = new LinkedHashMap<>(16, 0.75f, true);

    @Autowired
    public SynthesisCache(SynthesisProperties props, SpeechMetrics metrics) {
        this(props.getCache().getMaxEntries(), metrics);
    }

    public SynthesisCache(int maxEntries, SpeechMetrics metrics) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Computes the cache key for a text and voice.
     */
    public static String key(String text, String voiceKey) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voiceKey, "voiceKey");
        return sha256Hex((text + "|" + voiceKey).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return lowercase hex SHA-256 of {@code data}
     */
    public static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * @return a copy of the cached audio, promoted to most recently used, or empty on a miss
     */
    public Optional<byte[]> lookup(String text, String voiceKey) {
        String key = key(text, voiceKey);
        byte[] audio;
        synchronized (lock) {
            audio = entries.get(key);
        }
        metrics.incrementCache(audio != null ? "hit" : "miss");
        return audio == null ? Optional.empty() : Optional.of(audio.clone());
    }

    /**
     * Checks presence without touching recency or hit/miss counters.
     */
    public boolean contains(String text, String voiceKey) {
        String key = key(text, voiceKey);
        synchronized (lock) {
            return entries.containsKey(key);
        }
    }

    public void store(String text, String voiceKey, byte[] audio) {
        Objects.requireNonNull(audio, "audio");
        if (maxEntries == 0) {
            return;
        }
        String key = key(text, voiceKey);
        int evicted = 0;
        synchronized (lock) {
            entries.remove(key);
            entries.put(key, audio.clone());
            Iterator<Map.Entry<String, byte[]>> it = entries.entrySet().iterator();
            while (entries.size() > maxEntries && it.hasNext()) {
                it.next();
                it.remove();
                evicted++;
            }
        }
        for (int i = 0; i < evicted; i++) {
            metrics.incrementCache("eviction");
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} synthesis cache entries", evicted);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }
}
