package com.phillippitts.speechgate.service.tts;

import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisCacheTest {

    private SimpleMeterRegistry registry;
    private SpeechMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SpeechMetrics(registry);
    }

    private static byte[] audio(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void keyIsSha256OfTextAndVoice() {
        // sha256("hello|v1")
        assertThat(SynthesisCache.key("hello", "v1"))
                .hasSize(64)
                .isEqualTo(SynthesisCache.sha256Hex(audio("hello|v1")))
                .isNotEqualTo(SynthesisCache.key("hello", "v2"));
    }

    @Test
    void knownDigest() {
        assertThat(SynthesisCache.sha256Hex(audio("abc")))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void storedAudioIsReturned() {
        SynthesisCache cache = new SynthesisCache(5, metrics);

        cache.store("hello", "v1", audio("a1"));

        assertThat(cache.lookup("hello", "v1")).hasValueSatisfying(a -> assertThat(a).isEqualTo(audio("a1")));
        assertThat(cache.lookup("hello", "v2")).isEmpty();
        assertThat(registry.find("speechgate.cache").tag("result", "hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("speechgate.cache").tag("result", "miss").counter().count()).isEqualTo(1.0);
    }

    @Test
    void evictsLeastRecentlyUsedEntry() {
        SynthesisCache cache = new SynthesisCache(3, metrics);
        cache.store("a", "v", audio("A"));
        cache.store("b", "v", audio("B"));
        cache.store("c", "v", audio("C"));

        // touching "a" makes "b" the coldest entry
        cache.lookup("a", "v");
        cache.store("d", "v", audio("D"));

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.contains("b", "v")).isFalse();
        assertThat(cache.contains("a", "v")).isTrue();
        assertThat(cache.contains("c", "v")).isTrue();
        assertThat(cache.contains("d", "v")).isTrue();
        assertThat(registry.find("speechgate.cache").tag("result", "eviction").counter().count()).isEqualTo(1.0);
    }

    @Test
    void neverExceedsBound() {
        SynthesisCache cache = new SynthesisCache(50, metrics);

        for (int i = 0; i < 51; i++) {
            cache.store("phrase " + i, "v", audio("x" + i));
        }

        assertThat(cache.size()).isEqualTo(50);
        assertThat(cache.contains("phrase 0", "v")).isFalse();
        assertThat(cache.contains("phrase 50", "v")).isTrue();
    }

    @Test
    void storeOverwritesAndPromotes() {
        SynthesisCache cache = new SynthesisCache(2, metrics);
        cache.store("a", "v", audio("old"));
        cache.store("b", "v", audio("B"));

        cache.store("a", "v", audio("new"));
        cache.store("c", "v", audio("C"));

        assertThat(cache.lookup("a", "v")).hasValueSatisfying(a -> assertThat(a).isEqualTo(audio("new")));
        assertThat(cache.contains("b", "v")).isFalse();
    }

    @Test
    void containsDoesNotPromote() {
        SynthesisCache cache = new SynthesisCache(2, metrics);
        cache.store("a", "v", audio("A"));
        cache.store("b", "v", audio("B"));

        cache.contains("a", "v");
        cache.store("c", "v", audio("C"));

        assertThat(cache.contains("a", "v")).isFalse();
    }

    @Test
    void zeroBoundDisablesCaching() {
        SynthesisCache cache = new SynthesisCache(0, metrics);

        cache.store("a", "v", audio("A"));

        assertThat(cache.size()).isZero();
        assertThat(cache.lookup("a", "v")).isEmpty();
    }

    @Test
    void cachedAudioCannotBeMutatedByCallers() {
        SynthesisCache cache = new SynthesisCache(2, metrics);
        byte[] original = audio("AB");
        cache.store("a", "v", original);

        original[0] = 'Z';
        Optional<byte[]> first = cache.lookup("a", "v");
        first.get()[1] = 'Z';

        assertThat(cache.lookup("a", "v")).hasValueSatisfying(a -> assertThat(a).isEqualTo(audio("AB")));
    }

    @Test
    void rejectsNegativeBound() {
        assertThatThrownBy(() -> new SynthesisCache(-1, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
