package com.phillippitts.speechgate.exception;

/**
 * Thrown when a whole recognition or synthesis call fails: the runtime exited non-zero,
 * produced no usable output, or the waiting thread was interrupted.
 */
public class InferenceException extends SpeechGateException {

    private final String operation;

    public InferenceException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public InferenceException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    /**
     * @return "recognize" or "synthesize"
     */
    public String getOperation() {
        return operation;
    }
}
