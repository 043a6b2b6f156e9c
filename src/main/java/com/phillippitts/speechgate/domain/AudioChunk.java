package com.phillippitts.speechgate.domain;

/**
 * A contiguous window of an utterance buffer that is sent to the recognizer in one call.
 *
 * @param index         position of the chunk in the pass (0-based)
 * @param startOffset   first byte of the window within the utterance buffer
 * @param length        window length in bytes
 * @param overlapLength bytes shared with the previous chunk (0 for the first chunk)
 */
public record AudioChunk(int index, int startOffset, int length, int overlapLength) {

    public AudioChunk {
        if (index < 0 || startOffset < 0) {
            throw new IllegalArgumentException("index and startOffset must be >= 0");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0, got: " + length);
        }
        if (overlapLength < 0 || overlapLength > length) {
            throw new IllegalArgumentException("overlapLength out of range: " + overlapLength);
        }
    }

    /**
     * @return offset one past the last byte of the window
     */
    public int endOffset() {
        return startOffset + length;
    }
}
