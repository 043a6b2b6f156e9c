package com.phillippitts.speechgate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for recognition, synthesis, model access and pre-warming.
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class SpeechMetrics {

    private static final String METRIC_PREFIX = "speechgate";

    private final MeterRegistry registry;

    public SpeechMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end finalization time of one utterance.
     *
     * @param outcome OK, EMPTY or FAILED
     */
    public void recordRecognition(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".recognition.latency")
                .description("Time taken to finalize an utterance")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordChunks(int chunkCount) {
        Counter.builder(METRIC_PREFIX + ".recognition.chunks")
                .description("Number of recognizer calls made for chunked utterances")
                .register(registry)
                .increment(chunkCount);
    }

    public void incrementChunkFailure() {
        Counter.builder(METRIC_PREFIX + ".recognition.chunk.failures")
                .description("Number of chunks whose recognition failed")
                .register(registry)
                .increment();
    }

    public void recordSynthesis(String action, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken to serve a synthesis request")
                .tag("action", action)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param result hit, miss or eviction
     */
    public void incrementCache(String result) {
        Counter.builder(METRIC_PREFIX + ".cache")
                .description("Synthesis cache lookups and evictions")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordModelWait(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".model.wait")
                .description("Time spent waiting for exclusive model access")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordModelHold(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".model.hold")
                .description("Time the model was held by one call")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome synthesized, cached, skipped or failed
     */
    public void incrementPrewarm(String outcome) {
        Counter.builder(METRIC_PREFIX + ".prewarm.attempts")
                .description("Pre-warm attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
