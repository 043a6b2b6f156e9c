package com.phillippitts.speechgate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SpeechMetricsTest {

    private SimpleMeterRegistry registry;
    private SpeechMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SpeechMetrics(registry);
    }

    @Test
    void recordsRecognitionLatencyByOutcome() {
        metrics.recordRecognition("OK", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordRecognition("OK", TimeUnit.MILLISECONDS.toNanos(80));

        Timer timer = registry.find("speechgate.recognition.latency").tag("outcome", "OK").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void countsCacheResultsSeparately() {
        metrics.incrementCache("hit");
        metrics.incrementCache("hit");
        metrics.incrementCache("miss");

        Counter hits = registry.find("speechgate.cache").tag("result", "hit").counter();
        Counter misses = registry.find("speechgate.cache").tag("result", "miss").counter();
        assertThat(hits.count()).isEqualTo(2.0);
        assertThat(misses.count()).isEqualTo(1.0);
    }

    @Test
    void countsChunksAndFailures() {
        metrics.recordChunks(3);
        metrics.incrementChunkFailure();

        assertThat(registry.find("speechgate.recognition.chunks").counter().count()).isEqualTo(3.0);
        assertThat(registry.find("speechgate.recognition.chunk.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void tagsModelTimesByOperation() {
        metrics.recordModelWait("synthesize", 1_000_000L);
        metrics.recordModelHold("synthesize", 2_000_000L);
        metrics.recordSynthesis("clone_and_speak", 3_000_000L);
        metrics.incrementPrewarm("skipped");

        assertThat(registry.find("speechgate.model.wait").tag("operation", "synthesize").timer().count()).isEqualTo(1);
        assertThat(registry.find("speechgate.model.hold").tag("operation", "synthesize").timer().count()).isEqualTo(1);
        assertThat(registry.find("speechgate.synthesis.latency").tag("action", "clone_and_speak").timer())
                .isNotNull();
        assertThat(registry.find("speechgate.prewarm.attempts").tag("outcome", "skipped").counter().count())
                .isEqualTo(1.0);
    }
}
