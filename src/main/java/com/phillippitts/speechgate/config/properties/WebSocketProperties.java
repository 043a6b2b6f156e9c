package com.phillippitts.speechgate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Endpoint paths and container limits for the two WebSocket services.
 *
 * <p>Text frames carry base64 voice samples and synthesized audio, so the text buffer
 * defaults to 10 MB.
 */
@ConfigurationProperties(prefix = "websocket")
@Validated
public class WebSocketProperties {

    @NotBlank(message = "Recognition path must not be blank")
    private String recognitionPath = "/ws/asr";

    @NotBlank(message = "Synthesis path must not be blank")
    private String synthesisPath = "/ws/tts";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    @Positive(message = "Text buffer size must be positive")
    private int maxTextMessageBytes = 10 * 1024 * 1024;

    @Positive(message = "Binary buffer size must be positive")
    private int maxBinaryMessageBytes = 10 * 1024 * 1024;

    @Positive(message = "Idle timeout must be positive")
    private long maxSessionIdleTimeoutMs = 300_000L;

    public String getRecognitionPath() {
        return recognitionPath;
    }

    public void setRecognitionPath(String recognitionPath) {
        this.recognitionPath = recognitionPath;
    }

    public String getSynthesisPath() {
        return synthesisPath;
    }

    public void setSynthesisPath(String synthesisPath) {
        this.synthesisPath = synthesisPath;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getMaxTextMessageBytes() {
        return maxTextMessageBytes;
    }

    public void setMaxTextMessageBytes(int maxTextMessageBytes) {
        this.maxTextMessageBytes = maxTextMessageBytes;
    }

    public int getMaxBinaryMessageBytes() {
        return maxBinaryMessageBytes;
    }

    public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) {
        this.maxBinaryMessageBytes = maxBinaryMessageBytes;
    }

    public long getMaxSessionIdleTimeoutMs() {
        return maxSessionIdleTimeoutMs;
    }

    public void setMaxSessionIdleTimeoutMs(long maxSessionIdleTimeoutMs) {
        this.maxSessionIdleTimeoutMs = maxSessionIdleTimeoutMs;
    }
}
