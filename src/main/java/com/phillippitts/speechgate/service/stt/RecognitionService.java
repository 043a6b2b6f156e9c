package com.phillippitts.speechgate.service.stt;

import com.phillippitts.speechgate.config.properties.RecognitionProperties;
import com.phillippitts.speechgate.domain.TranscriptionOutcome;
import com.phillippitts.speechgate.service.audio.PcmFormat;
import com.phillippitts.speechgate.service.inference.ForegroundActivity;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.metrics.SpeechMetrics;
import com.phillippitts.speechgate.util.LogSanitizer;
import com.phillippitts.speechgate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Turns one finished utterance buffer into exactly one final transcript.
 *
 * <p>Buffers below the minimum audio size are answered with an empty transcript without calling
 * the recognizer. A trailing partial PCM frame is dropped before recognition. Recognition counts
 * as foreground activity so background pre-warming does not queue ahead of it.
 */
@Service
public class RecognitionService {

    private static final Logger LOG = LogManager.getLogger(RecognitionService.class);

    private final ChunkedTranscriber transcriber;
    private final PcmFormat format;
    private final int minAudioBytes;
    private final int maxAudioBytes;
    private final SpeechMetrics metrics;
    private final ForegroundActivity foreground;

    public RecognitionService(ModelAccessCoordinator coordinator, RecognitionProperties props, SpeechMetrics metrics,
                              ForegroundActivity foreground) {
        this.foreground = foreground;
        this.format = props.toPcmFormat();
        this.minAudioBytes = props.getMinAudioBytes();
        this.maxAudioBytes = props.getMaxAudioBytes();
        this.metrics = metrics;
        int minChunkBytes = format.alignDown((int) ((long) props.getMinChunkMs() * format.byteRate() / 1000));
        ChunkPlanner planner = new ChunkPlanner(props.getMaxChunkBytes(), props.getChunkOverlapBytes(), format);
        this.transcriber = new ChunkedTranscriber(coordinator, planner, minChunkBytes, metrics);
    }

    /**
     * Finalizes an utterance.
     *
     * @param audio everything buffered between start and stop
     * @return outcome whose text is what the client receives (empty unless OK)
     */
    public TranscriptionOutcome finalizeAudio(byte[] audio) {
        long start = System.nanoTime();
        TranscriptionOutcome outcome;
        if (audio == null || audio.length < minAudioBytes) {
            int size = audio == null ? 0 : audio.length;
            LOG.debug("Utterance of {} bytes ({} ms) below minimum of {} bytes; skipping recognition",
                    size, format.durationMs(size), minAudioBytes);
            outcome = TranscriptionOutcome.empty();
        } else {
            int aligned = format.alignDown(audio.length);
            byte[] pcm = aligned == audio.length ? audio : Arrays.copyOf(audio, aligned);
            try (ForegroundActivity.Scope ignored = foreground.enter()) {
                outcome = transcriber.transcribe(pcm);
            }
        }
        metrics.recordRecognition(outcome.status().name(), System.nanoTime() - start);

        switch (outcome.status()) {
            case OK -> {
                LOG.info("Transcribed utterance in {} ms: chars={}", TimeUtils.elapsedMillis(start),
                        outcome.text().length());
                LOG.debug("Transcript preview: '{}'", LogSanitizer.preview(outcome.text()));
            }
            case EMPTY -> LOG.debug("Utterance produced no text");
            case FAILED -> LOG.warn("Utterance transcription failed after {} ms: {}",
                    TimeUtils.elapsedMillis(start), outcome.reason());
        }
        return outcome;
    }

    /**
     * @return largest utterance a connection may buffer before frames are dropped
     */
    public int maxAudioBytes() {
        return maxAudioBytes;
    }
}
