package com.phillippitts.speechgate.presentation.websocket;

import com.phillippitts.speechgate.config.logging.ConnectionLogContext;
import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.domain.SynthesisOptions;
import com.phillippitts.speechgate.domain.SynthesisResult;
import com.phillippitts.speechgate.domain.VoiceIdentity;
import com.phillippitts.speechgate.exception.InferenceException;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import com.phillippitts.speechgate.exception.SpeechGateException;
import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import com.phillippitts.speechgate.service.tts.SynthesisService;
import com.phillippitts.speechgate.service.tts.VoiceRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.util.List;

/**
 * Text-to-speech endpoint. Every request is one JSON text frame with an {@code action} and is
 * answered with exactly one JSON frame, success or error. Errors never close the connection.
 *
 * <table>
 *   <caption>Actions</caption>
 *   <tr><td>synthesize</td><td>text, voice_id, emo_alpha?, use_emo_text?</td></tr>
 *   <tr><td>clone_and_speak</td><td>text, voice_sample (base64), voice_id?, emo_alpha?, use_emo_text?</td></tr>
 *   <tr><td>register_voice</td><td>voice_sample, voice_id, voice_name</td></tr>
 *   <tr><td>list_voices</td><td></td></tr>
 *   <tr><td>check_status</td><td></td></tr>
 * </table>
 */
@Component
public class SynthesisWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SynthesisWebSocketHandler.class);

    static final List<String> SUPPORTED_ACTIONS =
            List.of("clone_and_speak", "register_voice", "synthesize", "list_voices", "check_status");
    private static final String ENDPOINT = "tts";

    private final SynthesisService synthesisService;
    private final VoiceRegistry voiceRegistry;
    private final ModelAccessCoordinator coordinator;
    private final String defaultVoiceId;

    public SynthesisWebSocketHandler(SynthesisService synthesisService,
                                     VoiceRegistry voiceRegistry,
                                     ModelAccessCoordinator coordinator,
                                     SynthesisProperties props) {
        this.synthesisService = synthesisService;
        this.voiceRegistry = voiceRegistry;
        this.coordinator = coordinator;
        this.defaultVoiceId = props.getVoices().getDefaultVoiceId();
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            LOG.info("Synthesis connection opened from {}", session.getRemoteAddress());
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            WebSocketReplies.send(session, dispatch(message.getPayload()));
        }
    }

    @Override
    protected void handleBinaryMessage(@NonNull WebSocketSession session, @NonNull BinaryMessage message) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            LOG.warn("Binary frame of {} bytes rejected", message.getPayloadLength());
            WebSocketReplies.send(session, ProtocolMessages.error("Binary frames are not supported; send JSON text"));
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            LOG.info("Synthesis connection closed: {}", status);
        }
    }

    /**
     * Handles one request frame and returns the reply frame.
     */
    String dispatch(String payload) {
        String action = null;
        try {
            JSONObject request = ProtocolMessages.parse(payload);
            action = request.optString("action", "");
            LOG.info("Request action={} ({} chars)", action, payload.length());
            return switch (action) {
                case "synthesize" -> synthesize(request);
                case "clone_and_speak" -> cloneAndSpeak(request);
                case "register_voice" -> registerVoice(request);
                case "list_voices" -> ProtocolMessages.voices(voiceRegistry.listAll());
                case "check_status" -> ProtocolMessages.status(coordinator.isModelReady(),
                        coordinator.isModelConfigured());
                default -> ProtocolMessages.unknownAction(action, SUPPORTED_ACTIONS);
            };
        } catch (InferenceException e) {
            LOG.warn("Action {} failed in the inference runtime: {}", action, e.getMessage());
            return ProtocolMessages.error(e.getMessage());
        } catch (SpeechGateException e) {
            LOG.info("Action {} rejected: {}", action, e.getMessage());
            return ProtocolMessages.error(e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Action {} failed unexpectedly", action, e);
            return ProtocolMessages.error(e.getMessage());
        }
    }

    private String synthesize(JSONObject request) {
        SynthesisResult result = synthesisService.synthesize(
                request.optString("text", ""),
                voiceId(request),
                options(request));
        return ProtocolMessages.audio(result);
    }

    private String cloneAndSpeak(JSONObject request) {
        SynthesisResult result = synthesisService.cloneAndSpeak(
                request.optString("text", ""),
                request.optString("voice_sample", ""),
                voiceId(request),
                options(request));
        return ProtocolMessages.audio(result);
    }

    private String registerVoice(JSONObject request) {
        VoiceIdentity voice = synthesisService.registerVoice(
                voiceId(request),
                request.optString("voice_name", ""),
                request.optString("voice_sample", ""));
        return ProtocolMessages.registered(voice);
    }

    private String voiceId(JSONObject request) {
        String id = request.optString("voice_id", "").trim();
        return id.isEmpty() ? defaultVoiceId : id;
    }

    static SynthesisOptions options(JSONObject request) {
        double emoAlpha = request.optDouble("emo_alpha", SynthesisOptions.DEFAULT.emoAlpha());
        boolean useEmoText = request.optBoolean("use_emo_text", SynthesisOptions.DEFAULT.useEmoText());
        try {
            return new SynthesisOptions(emoAlpha, useEmoText);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("emo_alpha", e.getMessage(), e);
        }
    }
}
