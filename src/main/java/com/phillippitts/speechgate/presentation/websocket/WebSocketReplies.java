package com.phillippitts.speechgate.presentation.websocket;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Writes reply frames, dropping them when the peer is gone.
 */
final class WebSocketReplies {

    private static final Logger LOG = LogManager.getLogger(WebSocketReplies.class);

    private WebSocketReplies() {}

    /**
     * @return true if the frame was written
     */
    static boolean send(WebSocketSession session, String payload) {
        if (!session.isOpen()) {
            LOG.info("Connection no longer open; reply discarded");
            return false;
        }
        try {
            session.sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send reply: {}", e.getMessage());
            return false;
        }
    }
}
