package com.phillippitts.speechgate.service.tts;

import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.SynthesisResult;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InferenceException;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import com.phillippitts.speechgate.exception.VoiceNotFoundException;
import com.phillippitts.speechgate.service.inference.ForegroundActivity;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.service.tts.event.VoiceRegisteredEvent;
import com.phillippitts.speechgate.testutil.EventCapturingPublisher;
import com.phillippitts.speechgate.testutil.FakeInferenceModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisServiceTest {

    @TempDir
    Path voiceDir;

    private final List<Integer> foregroundDuringCall = new CopyOnWriteArrayList<>();
    private ForegroundActivity foreground;
    private FakeInferenceModel model;
    private SynthesisCache cache;
    private VoiceRegistry voices;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private SynthesisService service;

    @BeforeEach
    void setUp() {
        foreground = new ForegroundActivity();
        model = new FakeInferenceModel() {
            @Override
            public void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output) {
                foregroundDuringCall.add(foreground.activeCount());
                super.synthesize(text, voice, options, output);
            }
        };
        registry = new SimpleMeterRegistry();
        SpeechMetrics metrics = new SpeechMetrics(registry);
        SynthesisProperties props = new SynthesisProperties();
        props.getVoices().setDirectory(voiceDir.toString());
        props.getVoices().getBuiltin().put("v1", "zh-CN-XiaoyiNeural");
        cache = new SynthesisCache(50, metrics);
        voices = new VoiceRegistry(props);
        publisher = new EventCapturingPublisher();
        service = new SynthesisService(new ModelAccessCoordinator(model, metrics), cache, voices, foreground,
                metrics, publisher);
    }

    private static String base64(String content) {
        return Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void repeatedRequestIsServedFromCache() {
        // Act
        SynthesisResult first = service.synthesize("hello", "v1", SynthesisOptions.DEFAULT);
        SynthesisResult second = service.synthesize("hello", "v1", SynthesisOptions.DEFAULT);

        // Assert
        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.audio()).isEqualTo(first.audio()).isEqualTo(FakeInferenceModel.audioFor("hello", "v1"));
        assertThat(model.synthesizeCalls()).isEqualTo(1);
        assertThat(registry.find("speechgate.synthesis.latency").tag("action", "synthesize").timer().count())
                .isEqualTo(2);
    }

    @Test
    void optionsDoNotAffectCacheKey() {
        service.synthesize("hello", "v1", new SynthesisOptions(0.2, false));

        SynthesisResult second = service.synthesize("hello", "v1", new SynthesisOptions(0.9, true));

        assertThat(second.cacheHit()).isTrue();
        assertThat(model.synthesizeCalls()).isEqualTo(1);
    }

    @Test
    void textIsTrimmedBeforeLookup() {
        service.synthesize("hello", "v1", SynthesisOptions.DEFAULT);

        assertThat(service.synthesize("  hello ", "v1", SynthesisOptions.DEFAULT).cacheHit()).isTrue();
    }

    @Test
    void blankTextIsRejectedWithoutModelCall() {
        assertThatThrownBy(() -> service.synthesize("  ", "v1", SynthesisOptions.DEFAULT))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Text must not be empty");
        assertThat(model.synthesizeCalls()).isZero();
    }

    @Test
    void unknownVoiceIsRejected() {
        assertThatThrownBy(() -> service.synthesize("hello", "nobody", SynthesisOptions.DEFAULT))
                .isInstanceOf(VoiceNotFoundException.class);
        assertThat(foreground.isIdle()).isTrue();
    }

    @Test
    void countsAsForegroundOnlyWhileServing() {
        service.synthesize("hello", "v1", SynthesisOptions.DEFAULT);

        assertThat(foregroundDuringCall).containsExactly(1);
        assertThat(foreground.isIdle()).isTrue();
    }

    @Test
    void failedSynthesisIsNotCachedAndReleasesForeground() {
        model.failSynthesis = true;

        assertThatThrownBy(() -> service.synthesize("hello", "v1", SynthesisOptions.DEFAULT))
                .isInstanceOf(InferenceException.class);

        assertThat(cache.size()).isZero();
        assertThat(foreground.isIdle()).isTrue();
    }

    @Test
    void cloneAndSpeakCachesBySampleContent() {
        SynthesisResult first = service.cloneAndSpeak("hi", base64("sample-A"), "guest", SynthesisOptions.DEFAULT);
        SynthesisResult sameSample = service.cloneAndSpeak("hi", base64("sample-A"), "guest", SynthesisOptions.DEFAULT);
        SynthesisResult newSample = service.cloneAndSpeak("hi", base64("sample-B"), "guest", SynthesisOptions.DEFAULT);

        assertThat(first.cacheHit()).isFalse();
        assertThat(first.voiceId()).isEqualTo("guest");
        assertThat(sameSample.cacheHit()).isTrue();
        assertThat(newSample.cacheHit()).isFalse();
        assertThat(model.synthesizeCalls()).isEqualTo(2);
        assertThat(voices.resolve("guest").samplePath()).isEqualTo(voiceDir.resolve("guest.wav"));
    }

    @Test
    void registerVoicePublishesEvent() {
        VoiceIdentity voice = service.registerVoice("alice", "Alice", base64("RIFF"));

        assertThat(voice.id()).isEqualTo("alice");
        assertThat(publisher.eventsOfType(VoiceRegisteredEvent.class))
                .extracting(VoiceRegisteredEvent::voiceId)
                .containsExactly("alice");
        assertThat(model.synthesizeCalls()).isZero();
    }

    @Test
    void invalidSampleDoesNotRegister() {
        assertThatThrownBy(() -> service.registerVoice("alice", "Alice", ""))
                .isInstanceOf(InvalidRequestException.class);

        assertThat(publisher.eventsOfType(VoiceRegisteredEvent.class)).isEmpty();
        assertThat(voices.registeredNewestFirst()).isEmpty();
    }

    @Test
    void reRegisteredVoiceNeverServesOldAudio() {
        service.registerVoice("alice", "Alice", base64("old"));
        service.synthesize("hello", "alice", SynthesisOptions.DEFAULT);

        service.registerVoice("alice", "Alice", base64("new"));
        SynthesisResult result = service.synthesize("hello", "alice", SynthesisOptions.DEFAULT);

        assertThat(result.cacheHit()).isFalse();
        assertThat(model.synthesizeCalls()).isEqualTo(2);
    }

    @Test
    void warmSynthesizesOnceAndSkipsCachedPhrases() {
        VoiceIdentity voice = voices.resolve("v1");

        assertThat(service.warm("早上好", voice)).isTrue();
        assertThat(service.warm("早上好", voice)).isFalse();

        assertThat(model.synthesizeCalls()).isEqualTo(1);
        assertThat(foregroundDuringCall).containsExactly(0);
        assertThat(service.synthesize("早上好", "v1", SynthesisOptions.DEFAULT).cacheHit()).isTrue();
    }

    @Test
    void concurrentClonesOfSameIdEachSpeakWithTheirOwnSample() throws Exception {
        // Arrange: synthesized audio echoes the sample file the model reads
        CountDownLatch firstInModel = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        FakeInferenceModel echoing = new FakeInferenceModel() {
            @Override
            public void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output) {
                if (firstInModel.getCount() > 0) {
                    firstInModel.countDown();
                    awaitQuietly(releaseFirst);
                }
                try {
                    Files.write(output, Files.readAllBytes(voice.samplePath()));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
        SpeechMetrics metrics = new SpeechMetrics(new SimpleMeterRegistry());
        SynthesisService cloning = new SynthesisService(new ModelAccessCoordinator(echoing, metrics),
                new SynthesisCache(50, metrics), voices, foreground, metrics, publisher);

        // Act: the second clone replaces default.wav while the first waits inside the model
        CompletableFuture<SynthesisResult> first = CompletableFuture.supplyAsync(
                () -> cloning.cloneAndSpeak("hi", base64("SAMPLE-A"), "default", SynthesisOptions.DEFAULT));
        assertThat(firstInModel.await(5, TimeUnit.SECONDS)).isTrue();
        voices.storeSample("default", "SAMPLE-B".getBytes(StandardCharsets.UTF_8));
        releaseFirst.countDown();
        SynthesisResult firstResult = first.get(5, TimeUnit.SECONDS);
        SynthesisResult second = cloning.cloneAndSpeak("hi", base64("SAMPLE-B"), "default", SynthesisOptions.DEFAULT);
        SynthesisResult repeatOfFirst = cloning.cloneAndSpeak("hi", base64("SAMPLE-A"), "default",
                SynthesisOptions.DEFAULT);

        // Assert
        assertThat(new String(firstResult.audio(), StandardCharsets.UTF_8)).isEqualTo("SAMPLE-A");
        assertThat(new String(second.audio(), StandardCharsets.UTF_8)).isEqualTo("SAMPLE-B");
        assertThat(repeatOfFirst.cacheHit()).isTrue();
        assertThat(new String(repeatOfFirst.audio(), StandardCharsets.UTF_8)).isEqualTo("SAMPLE-A");
        assertThat(Files.readString(voiceDir.resolve("default.wav"))).isEqualTo("SAMPLE-A");
    }

    @Test
    void cloneSampleCopyIsRemovedAfterSynthesis() {
        List<Path> samplesRead = new CopyOnWriteArrayList<>();
        FakeInferenceModel recording = new FakeInferenceModel() {
            @Override
            public void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output) {
                samplesRead.add(voice.samplePath());
                super.synthesize(text, voice, options, output);
            }
        };
        SpeechMetrics metrics = new SpeechMetrics(new SimpleMeterRegistry());
        SynthesisService cloning = new SynthesisService(new ModelAccessCoordinator(recording, metrics),
                new SynthesisCache(50, metrics), voices, foreground, metrics, publisher);

        cloning.cloneAndSpeak("hi", base64("sample"), "carol", SynthesisOptions.DEFAULT);

        assertThat(samplesRead).singleElement().satisfies(path -> {
            assertThat(path).isNotEqualTo(voiceDir.resolve("carol.wav"));
            assertThat(path).doesNotExist();
        });
        assertThat(voiceDir.resolve("carol.wav")).exists();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
