package com.phillippitts.speechgate.domain;

import java.util.Objects;

/**
 * Synthesized WAV audio for one request.
 *
 * @param audio    complete WAV file bytes
 * @param voiceId  voice that spoke the text
 * @param cacheHit whether the audio came from the synthesis cache
 */
public record SynthesisResult(byte[] audio, String voiceId, boolean cacheHit) {

    public SynthesisResult {
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(voiceId, "voiceId must not be null");
    }
}
