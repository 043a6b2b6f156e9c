package com.phillippitts.speechgate.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link InferenceException} with process diagnostics.
 *
 * <pre>
 * throw InferenceExceptionBuilder.create("Synthesizer exited with error")
 *         .operation("synthesize")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class InferenceExceptionBuilder {

    private final String message;
    private String operation;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InferenceExceptionBuilder(String message) {
        this.message = message;
    }

    public static InferenceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InferenceExceptionBuilder(message);
    }

    public InferenceExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public InferenceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public InferenceExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public InferenceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     */
    public InferenceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * {@code {message} [exitCode={code}, durationMs={ms}, {key}={value}, ...]}.
     */
    public InferenceException build() {
        String op = operation != null ? operation : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new InferenceException(detailed, op, cause)
                : new InferenceException(detailed, op);
    }

    private String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;
        for (Map.Entry<String, String> e : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
