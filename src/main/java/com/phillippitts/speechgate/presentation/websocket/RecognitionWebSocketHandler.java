package com.phillippitts.speechgate.presentation.websocket;

import com.phillippitts.speechgate.config.logging.ConnectionLogContext;
import com.phillippitts.speechgate.domain.TranscriptionOutcome;
import com.phillippitts.speechgate.exception.InvalidRequestException;
import com.phillippitts.speechgate.service.session.AudioIngestBuffer;
import com.phillippitts.speechgate.service.stt.RecognitionService;
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

import java.nio.ByteBuffer;

/**
 * Speech-to-text endpoint.
 *
 * <p>Protocol:
 * <ul>
 *   <li>{@code {"type":"start"}} resets the connection's buffer and is answered with
 *       {@code {"type":"ready"}}</li>
 *   <li>binary frames carry raw PCM and are buffered while an utterance is active</li>
 *   <li>{@code {"type":"stop"}} or {@code {"is_speaking":false}} is answered with exactly one
 *       {@code {"text":"...","is_final":true}}</li>
 *   <li>anything else gets {@code {"error":"..."}}; the connection stays open</li>
 * </ul>
 *
 * <p>If the connection closes in the middle of an utterance the buffered audio is still
 * finalized; the result is logged and discarded since it can no longer be delivered.
 */
@Component
public class RecognitionWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(RecognitionWebSocketHandler.class);

    static final String BUFFER_ATTRIBUTE = "speechgate.ingestBuffer";
    private static final String ENDPOINT = "asr";

    private final RecognitionService recognitionService;

    public RecognitionWebSocketHandler(RecognitionService recognitionService) {
        this.recognitionService = recognitionService;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        session.getAttributes().put(BUFFER_ATTRIBUTE, new AudioIngestBuffer(recognitionService.maxAudioBytes()));
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            LOG.info("Recognition connection opened from {}", session.getRemoteAddress());
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            JSONObject control;
            try {
                control = ProtocolMessages.parse(message.getPayload());
            } catch (InvalidRequestException e) {
                LOG.warn("Invalid control frame ({} chars)", message.getPayloadLength());
                WebSocketReplies.send(session, ProtocolMessages.error(e.getMessage()));
                return;
            }
            AudioIngestBuffer buffer = buffer(session);
            String type = control.optString("type", "");
            if ("start".equals(type)) {
                buffer.onStart();
                LOG.info("Utterance started");
                WebSocketReplies.send(session, ProtocolMessages.ready());
            } else if ("stop".equals(type) || isSpeakingFalse(control)) {
                byte[] audio = buffer.onStop();
                LOG.info("Utterance stopped with {} bytes buffered", audio.length);
                TranscriptionOutcome outcome = recognitionService.finalizeAudio(audio);
                WebSocketReplies.send(session, ProtocolMessages.finalTranscript(outcome.text()));
            } else {
                LOG.debug("Unsupported control frame type '{}'", type);
                WebSocketReplies.send(session, ProtocolMessages.error("Unsupported control message: " + type));
            }
        }
    }

    @Override
    protected void handleBinaryMessage(@NonNull WebSocketSession session, @NonNull BinaryMessage message) {
        ByteBuffer payload = message.getPayload();
        byte[] frame = new byte[payload.remaining()];
        payload.get(frame);
        if (!buffer(session).onAudioFrame(frame) && LOG.isTraceEnabled()) {
            try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
                LOG.trace("Dropped {}-byte frame", frame.length);
            }
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            LOG.warn("Transport error: {}", exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        try (ConnectionLogContext ignored = ConnectionLogContext.open(session, ENDPOINT)) {
            Object attr = session.getAttributes().remove(BUFFER_ATTRIBUTE);
            if (attr instanceof AudioIngestBuffer buffer && buffer.hasPendingAudio()) {
                byte[] audio = buffer.onStop();
                LOG.info("Connection closed mid-utterance; finalizing {} buffered bytes", audio.length);
                TranscriptionOutcome outcome = recognitionService.finalizeAudio(audio);
                WebSocketReplies.send(session, ProtocolMessages.finalTranscript(outcome.text()));
            }
            LOG.info("Recognition connection closed: {}", status);
        }
    }

    private static boolean isSpeakingFalse(JSONObject control) {
        return control.has("is_speaking") && Boolean.FALSE.equals(control.opt("is_speaking"));
    }

    private AudioIngestBuffer buffer(WebSocketSession session) {
        return (AudioIngestBuffer) session.getAttributes()
                .computeIfAbsent(BUFFER_ATTRIBUTE, k -> new AudioIngestBuffer(recognitionService.maxAudioBytes()));
    }
}
