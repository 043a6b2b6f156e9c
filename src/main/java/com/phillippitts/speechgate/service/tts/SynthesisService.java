package com.phillippitts.speechgate.service.tts;

import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.SynthesisResult;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import com.phillippitts.speechgate.service.inference.ForegroundActivity;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.service.tts.event.VoiceRegisteredEvent;
import com.phillippitts.speechgate.util.LogSanitizer;
import com.phillippitts.speechgate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Synthesis request orchestration: cache lookup, coordinator call on a miss, cache store.
 *
 * <p>User-initiated calls ({@link #synthesize}, {@link #cloneAndSpeak}) are counted as
 * foreground activity for their whole duration so background pre-warming steps aside.
 * {@link #warm} performs the same sequence without being counted.
 */
@Service
public class SynthesisService {

    private static final Logger LOG = LogManager.getLogger(SynthesisService.class);

    private final ModelAccessCoordinator coordinator;
    private final SynthesisCache cache;
    private final VoiceRegistry voices;
    private final ForegroundActivity foreground;
    private final SpeechMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public SynthesisService(ModelAccessCoordinator coordinator,
                            SynthesisCache cache,
                            VoiceRegistry voices,
                            ForegroundActivity foreground,
                            SpeechMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this.coordinator = coordinator;
        this.cache = cache;
        this.voices = voices;
        this.foreground = foreground;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    /**
     * Speaks {@code text} with a registered or built-in voice.
     *
     * @throws InvalidRequestException if the text is blank
     * @throws com.phillippitts.speechgate.exception.VoiceNotFoundException if the voice is unknown
     * @throws com.phillippitts.speechgate.exception.InferenceException if synthesis fails
     */
    public SynthesisResult synthesize(String text, String voiceId, SynthesisOptions options) {
        String normalized = requireText(text);
        long start = System.nanoTime();
        try (ForegroundActivity.Scope ignored = foreground.enter()) {
            VoiceIdentity voice = voices.resolve(voiceId);
            SynthesisResult result = synthesizeCached(normalized, voice, voice.cacheKey(), options);
            metrics.recordSynthesis("synthesize", System.nanoTime() - start);
            LOG.info("synthesize voice={} chars={} cacheHit={} in {} ms", voice.id(), normalized.length(),
                    result.cacheHit(), TimeUtils.elapsedMillis(start));
            return result;
        }
    }

    /**
     * Stores the sample under {@code voiceId} and speaks {@code text} with it.
     *
     * <p>The cache key is derived from the sample bytes, so replacing the sample can never return
     * audio of a previous one. On a miss the model reads a private copy of this request's sample,
     * never the shared {@code <id>.wav} another request may overwrite meanwhile.
     */
    public SynthesisResult cloneAndSpeak(String text, String sampleBase64, String voiceId, SynthesisOptions options) {
        String normalized = requireText(text);
        long start = System.nanoTime();
        try (ForegroundActivity.Scope ignored = foreground.enter()) {
            byte[] sample = voices.decodeSample(sampleBase64);
            VoiceIdentity voice = voices.storeSample(voiceId, sample);
            String voiceKey = "sample:" + SynthesisCache.sha256Hex(sample);
            SynthesisResult result = cache.lookup(normalized, voiceKey)
                    .map(audio -> new SynthesisResult(audio, voice.id(), true))
                    .orElseGet(() -> new SynthesisResult(
                            synthesizeFromSample(normalized, voice, sample, voiceKey, options), voice.id(), false));
            metrics.recordSynthesis("clone_and_speak", System.nanoTime() - start);
            LOG.info("clone_and_speak voice={} sample={}B chars={} cacheHit={} in {} ms", voice.id(), sample.length,
                    normalized.length(), result.cacheHit(), TimeUtils.elapsedMillis(start));
            return result;
        }
    }

    /**
     * Registers a named voice and announces it so the cache can be pre-warmed for it.
     */
    public VoiceIdentity registerVoice(String voiceId, String displayName, String sampleBase64) {
        byte[] sample = voices.decodeSample(sampleBase64);
        VoiceIdentity voice = voices.register(voiceId, displayName, sample);
        publisher.publishEvent(new VoiceRegisteredEvent(voice.id(), Instant.now()));
        return voice;
    }

    /**
     * Background variant used by pre-warming: not counted as foreground activity.
     *
     * @return true if audio was synthesized, false if it was already cached
     */
    public boolean warm(String phrase, VoiceIdentity voice) {
        String normalized = requireText(phrase);
        if (cache.contains(normalized, voice.cacheKey())) {
            return false;
        }
        byte[] audio = coordinator.synthesize(normalized, voice, SynthesisOptions.DEFAULT);
        cache.store(normalized, voice.cacheKey(), audio);
        LOG.debug("Pre-warmed voice={} phrase='{}'", voice.id(), LogSanitizer.preview(normalized, 20));
        return true;
    }

    private SynthesisResult synthesizeCached(String text, VoiceIdentity voice, String voiceKey,
                                             SynthesisOptions options) {
        Optional<byte[]> cached = cache.lookup(text, voiceKey);
        if (cached.isPresent()) {
            return new SynthesisResult(cached.get(), voice.id(), true);
        }
        byte[] audio = coordinator.synthesize(text, voice, options);
        cache.store(text, voiceKey, audio);
        return new SynthesisResult(audio, voice.id(), false);
    }

    private byte[] synthesizeFromSample(String text, VoiceIdentity voice, byte[] sample, String voiceKey,
                                        SynthesisOptions options) {
        Path snapshot = voices.snapshotSample(voice.id(), sample);
        try {
            VoiceIdentity pinned = VoiceIdentity.registered(voice.id(), voice.displayName(), snapshot,
                    voice.registeredAt());
            byte[] audio = coordinator.synthesize(text, pinned, options);
            cache.store(text, voiceKey, audio);
            return audio;
        } finally {
            voices.discardSnapshot(snapshot);
        }
    }

    private static String requireText(String text) {
        String normalized = text == null ? "" : text.trim();
        if (normalized.isEmpty()) {
            throw new InvalidRequestException("text", "Text must not be empty");
        }
        return normalized;
    }
}
