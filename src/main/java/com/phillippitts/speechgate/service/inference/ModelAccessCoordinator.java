package com.phillippitts.speechgate.service.inference;

import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InferenceException;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Single-flight gate in front of the {@link InferenceModel}.
 *
 * <p>All recognition and synthesis calls, from every connection and from the background
 * pre-warmer, pass through one fair {@link Semaphore} with a single permit. Waiters are served
 * in arrival order and wait without a timeout. The permit is released on every exit path.
 *
 * <p>Usage:
 * <pre>{@code
 * String text = coordinator.recognize(pcm);
 * byte[] wav = coordinator.synthesize("hello", voice, SynthesisOptions.DEFAULT);
 * }</pre>
 */
@Component
public class ModelAccessCoordinator {

    private static final Logger LOG = LogManager.getLogger(ModelAccessCoordinator.class);

    private final InferenceModel model;
    private final SpeechMetrics metrics;
    private final Semaphore permit = new Semaphore(1, true);

    public ModelAccessCoordinator(InferenceModel model, SpeechMetrics metrics) {
        this.model = Objects.requireNonNull(model, "model");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs one recognition call with exclusive model access.
     */
    public String recognize(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");
        String text = withExclusiveAccess("recognize", () -> model.recognize(pcm));
        return text == null ? "" : text;
    }

    /**
     * Runs one synthesis call with exclusive model access and returns the WAV bytes.
     *
     * <p>The runtime writes into a private temp file which is deleted afterwards, whether the
     * call succeeded or not.
     */
    public byte[] synthesize(String text, VoiceIdentity voice, SynthesisOptions options) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        SynthesisOptions opts = options != null ? options : SynthesisOptions.DEFAULT;
        return withExclusiveAccess("synthesize", () -> {
            Path output = createOutputFile();
            try {
                model.synthesize(text, voice, opts, output);
                return readOutput(output);
            } finally {
                deleteQuietly(output);
            }
        });
    }

    /**
     * Runs {@code action} while holding the model permit.
     *
     * @param operation name used in logs, metrics and exceptions
     * @throws InferenceException if the thread is interrupted while waiting
     */
    public <T> T withExclusiveAccess(String operation, Supplier<T> action) {
        long waitStart = System.nanoTime();
        try {
            permit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for model access", operation, e);
        }
        long acquired = System.nanoTime();
        metrics.recordModelWait(operation, acquired - waitStart);
        try {
            LOG.debug("Model permit acquired for {} after {} ms", operation, TimeUtils.nanosToMillis(acquired - waitStart));
            return action.get();
        } finally {
            permit.release();
            metrics.recordModelHold(operation, System.nanoTime() - acquired);
        }
    }

    /**
     * @return approximate number of threads waiting for the model
     */
    public int queueLength() {
        return permit.getQueueLength();
    }

    /**
     * @return true while some call holds the model
     */
    public boolean isBusy() {
        return permit.availablePermits() == 0;
    }

    public boolean isModelReady() {
        return model.isReady();
    }

    public boolean isModelConfigured() {
        return model.isConfigured();
    }

    private static Path createOutputFile() {
        try {
            return Files.createTempFile("speechgate-tts-", ".wav");
        } catch (IOException e) {
            throw new InferenceException("Cannot create synthesis output file", "synthesize", e);
        }
    }

    private static byte[] readOutput(Path output) {
        try {
            byte[] audio = Files.readAllBytes(output);
            if (audio.length == 0) {
                throw new InferenceException("Synthesizer produced no audio", "synthesize");
            }
            return audio;
        } catch (IOException e) {
            throw new InferenceException("Cannot read synthesis output", "synthesize", e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }
}
