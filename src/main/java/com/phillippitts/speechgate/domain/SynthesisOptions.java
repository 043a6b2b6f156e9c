package com.phillippitts.speechgate.domain;

/**
 * Per-request synthesis knobs passed through to the synthesizer.
 *
 * <p>Options do not take part in the cache key: a cached utterance for a text and voice is
 * returned regardless of the options of the later request.
 *
 * @param emoAlpha   emotion strength, 0.0 to 1.0
 * @param useEmoText derive emotion from the text itself
 */
public record SynthesisOptions(double emoAlpha, boolean useEmoText) {

    public static final SynthesisOptions DEFAULT = new SynthesisOptions(1.0, false);

    public SynthesisOptions {
        if (Double.isNaN(emoAlpha) || emoAlpha < 0.0 || emoAlpha > 1.0) {
            throw new IllegalArgumentException("emoAlpha must be between 0.0 and 1.0, got: " + emoAlpha);
        }
    }
}
