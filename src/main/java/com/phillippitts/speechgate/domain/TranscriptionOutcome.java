package com.phillippitts.speechgate.domain;

import java.util.Objects;

/**
 * Result of finalizing one utterance.
 *
 * <p>EMPTY (too little audio, silence, nothing recognized) is an expected outcome and is not an
 * error. FAILED means the recognizer could not be used at all; the client still receives an
 * empty final transcript, but the failure is logged.
 *
 * @param status outcome kind
 * @param text   final text, never null (empty unless status is OK)
 * @param reason failure reason, only set for FAILED
 */
public record TranscriptionOutcome(Status status, String text, String reason) {

    public enum Status {
        OK,
        EMPTY,
        FAILED
    }

    public TranscriptionOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static TranscriptionOutcome ok(String text) {
        return new TranscriptionOutcome(Status.OK, text, null);
    }

    public static TranscriptionOutcome empty() {
        return new TranscriptionOutcome(Status.EMPTY, "", null);
    }

    public static TranscriptionOutcome failed(String reason) {
        return new TranscriptionOutcome(Status.FAILED, "", reason);
    }

    /**
     * Classifies stitched text: blank text is EMPTY, anything else OK.
     */
    public static TranscriptionOutcome fromText(String text) {
        return text == null || text.isBlank() ? empty() : ok(text);
    }
}
