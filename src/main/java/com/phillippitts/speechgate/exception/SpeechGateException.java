package com.phillippitts.speechgate.exception;

/**
 * Base exception for all SpeechGate application-specific errors.
 * The WebSocket handlers translate any subclass into a single error reply.
 */
public class SpeechGateException extends RuntimeException {

    public SpeechGateException(String message) {
        super(message);
    }

    public SpeechGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
