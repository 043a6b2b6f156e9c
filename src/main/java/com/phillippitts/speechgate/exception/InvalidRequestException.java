package com.phillippitts.speechgate.exception;

/**
 * Thrown when a client message is missing a required field or carries a malformed value
 * (blank text, undecodable base64 sample, illegal voice id).
 */
public class InvalidRequestException extends SpeechGateException {

    private final String field;

    public InvalidRequestException(String message) {
        super(message);
        this.field = null;
    }

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidRequestException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * @return offending request field, or null when the whole message is invalid
     */
    public String getField() {
        return field;
    }
}
