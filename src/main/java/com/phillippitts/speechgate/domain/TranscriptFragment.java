package com.phillippitts.speechgate.domain;

import java.util.Objects;

/**
 * Recognizer output for one chunk, prior to stitching.
 */
public record TranscriptFragment(int chunkIndex, String text) {

    public TranscriptFragment {
        Objects.requireNonNull(text, "text must not be null");
    }
}
