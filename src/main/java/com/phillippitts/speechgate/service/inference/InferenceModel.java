package com.phillippitts.speechgate.service.inference;

import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.VoiceIdentity;

import java.nio.file.Path;

/**
 * Opaque recognition and synthesis runtime.
 *
 * <p>Implementations are blocking and NOT reentrant: at most one call (of either kind) may be in
 * flight. Only {@link ModelAccessCoordinator} may invoke {@link #recognize} and
 * {@link #synthesize}; everything else goes through the coordinator.
 */
public interface InferenceModel {

    /**
     * Transcribes raw PCM audio.
     *
     * @param pcm raw little-endian PCM in the configured recognition format
     * @return recognized text, possibly empty, never null
     * @throws com.phillippitts.speechgate.exception.InferenceException if the call fails
     */
    String recognize(byte[] pcm);

    /**
     * Speaks {@code text} with {@code voice} and writes a WAV file to {@code output}.
     *
     * @throws com.phillippitts.speechgate.exception.InferenceException if the call fails
     */
    void synthesize(String text, VoiceIdentity voice, SynthesisOptions options, Path output);

    /**
     * @return true if the runtime is configured at all
     */
    boolean isConfigured();

    /**
     * @return true if the runtime can serve calls right now
     */
    boolean isReady();
}
