package com.phillippitts.speechgate.service.stt;

import com.phillippitts.speechgate.domain.AudioChunk;
import com.phillippitts.speechgate.domain.TranscriptFragment;
import com.phillippitts.speechgate.domain.TranscriptionOutcome;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Transcribes an utterance of any length through the model access coordinator.
 *
 * <p>Short utterances take one recognizer call. Longer ones are cut into overlapping windows by
 * {@link ChunkPlanner}; each window is recognized on its own (a failing window is logged and
 * contributes nothing) and the fragments are joined by {@link TranscriptStitcher}. Windows
 * shorter than the minimum chunk size are skipped.
 */
public class ChunkedTranscriber {

    private static final Logger LOG = LogManager.getLogger(ChunkedTranscriber.class);

    private final ModelAccessCoordinator coordinator;
    private final ChunkPlanner planner;
    private final int minChunkBytes;
    private final SpeechMetrics metrics;

    public ChunkedTranscriber(ModelAccessCoordinator coordinator, ChunkPlanner planner, int minChunkBytes,
                              SpeechMetrics metrics) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.minChunkBytes = minChunkBytes;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public TranscriptionOutcome transcribe(byte[] audio) {
        Objects.requireNonNull(audio, "audio");
        if (audio.length == 0) {
            return TranscriptionOutcome.empty();
        }
        if (!planner.requiresChunking(audio.length)) {
            return transcribeWhole(audio);
        }
        return transcribeChunked(audio);
    }

    private TranscriptionOutcome transcribeWhole(byte[] audio) {
        try {
            return TranscriptionOutcome.fromText(coordinator.recognize(audio).trim());
        } catch (RuntimeException e) {
            LOG.warn("Recognition of {}-byte utterance failed: {}", audio.length, e.getMessage());
            return TranscriptionOutcome.failed(e.getMessage());
        }
    }

    private TranscriptionOutcome transcribeChunked(byte[] audio) {
        List<AudioChunk> chunks = planner.plan(audio.length);
        List<TranscriptFragment> fragments = new ArrayList<>(chunks.size());
        int attempted = 0;
        int failed = 0;
        for (AudioChunk chunk : chunks) {
            if (chunk.length() < minChunkBytes) {
                LOG.debug("Skipping chunk {} ({} bytes, below {} byte minimum)", chunk.index(), chunk.length(),
                        minChunkBytes);
                continue;
            }
            attempted++;
            byte[] window = Arrays.copyOfRange(audio, chunk.startOffset(), chunk.endOffset());
            try {
                String text = coordinator.recognize(window);
                fragments.add(new TranscriptFragment(chunk.index(), text));
            } catch (RuntimeException e) {
                failed++;
                metrics.incrementChunkFailure();
                LOG.warn("Chunk {}/{} [{}..{}) failed, continuing: {}", chunk.index() + 1, chunks.size(),
                        chunk.startOffset(), chunk.endOffset(), e.getMessage());
            }
        }
        metrics.recordChunks(attempted);
        LOG.debug("Chunked pass: {} bytes, {} windows, {} attempted, {} failed", audio.length, chunks.size(),
                attempted, failed);
        if (attempted > 0 && failed == attempted) {
            return TranscriptionOutcome.failed("All " + attempted + " chunks failed");
        }
        return TranscriptionOutcome.fromText(TranscriptStitcher.stitch(fragments));
    }
}
