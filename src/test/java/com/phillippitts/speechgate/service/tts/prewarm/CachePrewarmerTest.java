package com.phillippitts.speechgate.service.tts.prewarm;

import com.phillippitts.speechgate.config.properties.PrewarmProperties;
import com.phillippitts.speechgate.config.properties.RecognitionProperties;
import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.TranscriptionOutcome;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.inference.ForegroundActivity;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.service.stt.RecognitionService;
import com.phillippitts.speechgate.service.tts.SynthesisCache;
import com.phillippitts.speechgate.service.tts.SynthesisService;
import com.phillippitts.speechgate.service.tts.VoiceRegistry;
import com.phillippitts.speechgate.service.tts.event.VoiceRegisteredEvent;
import com.phillippitts.speechgate.testutil.EventCapturingPublisher;
import com.phillippitts.speechgate.testutil.FakeInferenceModel;
import com.phillippitts.speechgate.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class CachePrewarmerTest {

    @TempDir
    Path voiceDir;

    private final List<String> spokenBy = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> onSynthesize = voiceId -> { };

    private FakeInferenceModel model;
    private ForegroundActivity foreground;
    private VoiceRegistry voices;
    private SynthesisService synthesisService;
    private PrewarmProperties props;
    private SimpleMeterRegistry registry;
    private SpeechMetrics metrics;
    private ModelAccessCoordinator coordinator;

    @BeforeEach
    void setUp() {
        model = new FakeInferenceModel() {
            @Override
            public void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output) {
                spokenBy.add(voice.id() + ":" + text);
                onSynthesize.accept(voice.id());
                super.synthesize(text, voice, options, output);
            }
        };
        registry = new SimpleMeterRegistry();
        metrics = new SpeechMetrics(registry);
        foreground = new ForegroundActivity();
        SynthesisProperties synthesisProps = new SynthesisProperties();
        synthesisProps.getVoices().setDirectory(voiceDir.toString());
        synthesisProps.getVoices().getBuiltin().put("xiaoyi", "zh-CN-XiaoyiNeural");
        voices = new VoiceRegistry(synthesisProps);
        coordinator = new ModelAccessCoordinator(model, metrics);
        synthesisService = new SynthesisService(coordinator,
                new SynthesisCache(50, metrics), voices, foreground, metrics, new EventCapturingPublisher());
        props = new PrewarmProperties();
        props.setInitialDelayMs(0);
        props.setBusyBackoffMs(20);
        props.setPhrases(List.of("你好", "谢谢"));
    }

    private CachePrewarmer prewarmer(Executor executor) {
        return new CachePrewarmer(synthesisService, voices, foreground, props, metrics, executor);
    }

    private void register(String id) {
        voices.register(id, id, id.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void warmsNewestVoiceFirst() {
        // Arrange
        register("older");
        register("newer");

        // Act
        PrewarmReport report = prewarmer(new SyncExecutor()).runOnce();

        // Assert
        assertThat(spokenBy).containsExactly("newer:你好", "newer:谢谢", "older:你好", "older:谢谢");
        assertThat(report).isEqualTo(new PrewarmReport(4, 0, 0, 0));
    }

    @Test
    void doesNotResynthesizeCachedPairs() {
        register("alice");
        CachePrewarmer prewarmer = prewarmer(new SyncExecutor());
        prewarmer.runOnce();

        PrewarmReport second = prewarmer.runOnce();

        assertThat(second).isEqualTo(new PrewarmReport(0, 2, 0, 0));
        assertThat(model.synthesizeCalls()).isEqualTo(2);
    }

    @Test
    void yieldsToRecognitionInProgress() throws Exception {
        // Arrange
        register("alice");
        CountDownLatch recognizing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        model.recognizer = pcm -> {
            recognizing.countDown();
            awaitQuietly(release);
            return "hello";
        };
        RecognitionService recognition = new RecognitionService(coordinator, new RecognitionProperties(), metrics,
                foreground);
        CompletableFuture<TranscriptionOutcome> utterance =
                CompletableFuture.supplyAsync(() -> recognition.finalizeAudio(new byte[64_000]));
        assertThat(recognizing.await(5, TimeUnit.SECONDS)).isTrue();

        // Act
        PrewarmReport report;
        try {
            report = prewarmer(new SyncExecutor()).runOnce();
        } finally {
            release.countDown();
        }

        // Assert
        assertThat(report).isEqualTo(new PrewarmReport(0, 0, 2, 0));
        assertThat(model.synthesizeCalls()).isZero();
        assertThat(utterance.get(5, TimeUnit.SECONDS).text()).isEqualTo("hello");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void skipsAttemptsWhileForegroundIsBusy() {
        register("alice");

        PrewarmReport report;
        try (ForegroundActivity.Scope ignored = foreground.enter()) {
            report = prewarmer(new SyncExecutor()).runOnce();
        }

        assertThat(report).isEqualTo(new PrewarmReport(0, 0, 2, 0));
        assertThat(model.synthesizeCalls()).isZero();
        assertThat(registry.find("speechgate.prewarm.attempts").tag("outcome", "skipped").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void failedAttemptDoesNotStopTheRun() {
        register("alice");
        model.failSynthesis = true;

        PrewarmReport report = prewarmer(new SyncExecutor()).runOnce();

        assertThat(report).isEqualTo(new PrewarmReport(0, 0, 0, 2));
        assertThat(report.attempted()).isEqualTo(2);
    }

    @Test
    void builtinVoicesOnlyWhenEnabled() {
        assertThat(prewarmer(new SyncExecutor()).runOnce()).isEqualTo(PrewarmReport.EMPTY);

        props.setIncludeBuiltinVoices(true);
        PrewarmReport report = prewarmer(new SyncExecutor()).runOnce();

        assertThat(report.synthesized()).isEqualTo(2);
        assertThat(spokenBy).allMatch(s -> s.startsWith("xiaoyi:"));
    }

    @Test
    void blankPhrasesAreIgnored() {
        register("alice");
        props.setPhrases(List.of(" ", ""));

        assertThat(prewarmer(new SyncExecutor()).runOnce()).isEqualTo(PrewarmReport.EMPTY);
    }

    @Test
    void voiceRegistrationTriggersRun() {
        register("alice");
        CachePrewarmer prewarmer = prewarmer(new SyncExecutor());

        prewarmer.onVoiceRegistered(new VoiceRegisteredEvent("alice", Instant.now()));

        assertThat(prewarmer.lastReport()).contains(new PrewarmReport(2, 0, 0, 0));
        assertThat(prewarmer.isRunning()).isFalse();
    }

    @Test
    void requestDuringRunQueuesOneFollowUpRun() {
        // Arrange
        register("alice");
        CachePrewarmer prewarmer = prewarmer(new SyncExecutor());
        List<Boolean> nestedResults = new CopyOnWriteArrayList<>();
        onSynthesize = voiceId -> nestedResults.add(prewarmer.requestPrewarm());

        // Act
        boolean started = prewarmer.requestPrewarm();

        // Assert
        assertThat(started).isTrue();
        assertThat(nestedResults).containsExactly(false, false);
        // the follow-up run found everything cached
        assertThat(prewarmer.lastReport()).contains(new PrewarmReport(0, 2, 0, 0));
        assertThat(model.synthesizeCalls()).isEqualTo(2);
    }

    @Test
    void disabledPrewarmerNeverRuns() {
        register("alice");
        props.setEnabled(false);
        CachePrewarmer prewarmer = prewarmer(new SyncExecutor());

        prewarmer.onApplicationReady();

        assertThat(prewarmer.requestPrewarm()).isFalse();
        assertThat(prewarmer.lastReport()).isEmpty();
    }

    @Test
    void startupRunsImmediatelyWithoutDelay() {
        register("alice");
        CachePrewarmer prewarmer = prewarmer(new SyncExecutor());

        prewarmer.onApplicationReady();

        assertThat(prewarmer.lastReport()).contains(new PrewarmReport(2, 0, 0, 0));
    }

    @Test
    void rejectedSubmissionLeavesPrewarmerIdle() {
        CachePrewarmer prewarmer = prewarmer(command -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThat(prewarmer.requestPrewarm()).isFalse();
        assertThat(prewarmer.isRunning()).isFalse();
    }
}
