package com.phillippitts.speechgate.service.tts.prewarm;

import com.phillippitts.speechgate.config.properties.PrewarmProperties;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.service.inference.ForegroundActivity;
import com.phillippitts.speechgate.service.tts.SynthesisService;
import com.phillippitts.speechgate.service.tts.VoiceRegistry;
import com.phillippitts.speechgate.service.tts.event.VoiceRegisteredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Low-priority background filling of the synthesis cache with common phrases.
 *
 * <p>A run walks the registered voices, most recently registered first (then the built-in
 * voices if enabled), and for each voice every configured phrase. Before each attempt it waits
 * for foreground recognition and synthesis to drain; if demand persists past the back-off the
 * attempt is skipped. Phrases already cached are not synthesized again. A run ends after every
 * pair was attempted once, without retries.
 *
 * <p>At most one run executes at a time. A request that arrives while a run is active is
 * folded into one follow-up run, so a voice registered mid-run is still pre-warmed.
 *
 * <p>Runs are started once after startup (after the configured delay) and after every voice
 * registration.
 */
@Component
public class CachePrewarmer {

    private static final Logger LOG = LogManager.getLogger(CachePrewarmer.class);

    private final SynthesisService synthesisService;
    private final VoiceRegistry voices;
    private final ForegroundActivity foreground;
    private final PrewarmProperties props;
    private final SpeechMetrics metrics;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean rerunRequested = new AtomicBoolean(false);
    private volatile PrewarmReport lastReport;

    public CachePrewarmer(SynthesisService synthesisService,
                          VoiceRegistry voices,
                          ForegroundActivity foreground,
                          PrewarmProperties props,
                          SpeechMetrics metrics,
                          @Qualifier("prewarmExecutor") Executor executor) {
        this.synthesisService = synthesisService;
        this.voices = voices;
        this.foreground = foreground;
        this.props = props;
        this.metrics = metrics;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!props.isEnabled()) {
            LOG.info("Cache pre-warming disabled");
            return;
        }
        long delayMs = props.getInitialDelayMs();
        LOG.info("Scheduling cache pre-warm in {} ms ({} phrases)", delayMs, props.getPhrases().size());
        if (delayMs > 0) {
            CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS).execute(this::requestPrewarm);
        } else {
            requestPrewarm();
        }
    }

    @EventListener
    public void onVoiceRegistered(VoiceRegisteredEvent event) {
        LOG.debug("Voice '{}' registered; requesting pre-warm", event.voiceId());
        requestPrewarm();
    }

    /**
     * Starts a run unless one is already active, in which case one follow-up run is queued.
     *
     * @return true if a new run was submitted
     */
    public boolean requestPrewarm() {
        if (!props.isEnabled()) {
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            rerunRequested.set(true);
            LOG.debug("Pre-warm already running; follow-up run queued");
            return false;
        }
        try {
            executor.execute(this::runLoop);
            return true;
        } catch (RejectedExecutionException e) {
            running.set(false);
            LOG.warn("Pre-warm rejected by executor: {}", e.getMessage());
            return false;
        }
    }

    private void runLoop() {
        do {
            try {
                do {
                    rerunRequested.set(false);
                    lastReport = runOnce();
                } while (rerunRequested.get() && !Thread.currentThread().isInterrupted());
            } finally {
                running.set(false);
            }
        } while (rerunRequested.get() && !Thread.currentThread().isInterrupted()
                && running.compareAndSet(false, true));
    }

    /**
     * Executes one full pass over all (voice, phrase) pairs on the calling thread.
     */
    PrewarmReport runOnce() {
        List<VoiceIdentity> targets = new ArrayList<>(voices.registeredNewestFirst());
        if (props.isIncludeBuiltinVoices()) {
            targets.addAll(voices.builtinVoices());
        }
        List<String> phrases = props.getPhrases().stream().filter(p -> p != null && !p.isBlank()).toList();
        if (targets.isEmpty() || phrases.isEmpty()) {
            LOG.info("Nothing to pre-warm (voices={}, phrases={})", targets.size(), phrases.size());
            return PrewarmReport.EMPTY;
        }

        Duration backoff = Duration.ofMillis(props.getBusyBackoffMs());
        int synthesized = 0;
        int cached = 0;
        int skipped = 0;
        int failed = 0;
        ThreadContext.put("endpoint", "prewarm");
        LOG.info("Pre-warm started: {} voice(s) x {} phrase(s)", targets.size(), phrases.size());
        outer:
        for (VoiceIdentity voice : targets) {
            for (String phrase : phrases) {
                try {
                    if (!foreground.awaitIdle(backoff)) {
                        skipped++;
                        metrics.incrementPrewarm("skipped");
                        LOG.debug("Foreground busy; skipping pre-warm of voice {}", voice.id());
                        continue;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.info("Pre-warm interrupted");
                    break outer;
                }
                try {
                    if (synthesisService.warm(phrase, voice)) {
                        synthesized++;
                        metrics.incrementPrewarm("synthesized");
                    } else {
                        cached++;
                        metrics.incrementPrewarm("cached");
                    }
                } catch (RuntimeException e) {
                    failed++;
                    metrics.incrementPrewarm("failed");
                    LOG.warn("Pre-warm of voice {} failed: {}", voice.id(), e.getMessage());
                }
            }
        }
        PrewarmReport report = new PrewarmReport(synthesized, cached, skipped, failed);
        LOG.info("Pre-warm finished: synthesized={}, cached={}, skipped={}, failed={}",
                synthesized, cached, skipped, failed);
        ThreadContext.remove("endpoint");
        return report;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<PrewarmReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }
}
