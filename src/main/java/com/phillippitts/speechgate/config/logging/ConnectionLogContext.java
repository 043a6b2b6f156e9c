package com.phillippitts.speechgate.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.web.socket.WebSocketSession;

/**
 * Puts connection values into the Log4j2 ThreadContext for the duration of one frame.
 *
 * <p>Values added: connectionId (WebSocket session id), endpoint, requestId (from the upgrade
 * request). All three are removed on close so container threads do not leak them.
 *
 * <pre>{@code
 * try (ConnectionLogContext ignored = ConnectionLogContext.open(session, "asr")) {
 *     ...
 * }
 * }</pre>
 */
public final class ConnectionLogContext implements AutoCloseable {

    static final String CONNECTION_ID = "connectionId";
    static final String ENDPOINT = "endpoint";
    static final String REQUEST_ID = "requestId";

    private ConnectionLogContext() {
    }

    public static ConnectionLogContext open(WebSocketSession session, String endpoint) {
        ThreadContext.put(CONNECTION_ID, session.getId());
        ThreadContext.put(ENDPOINT, endpoint);
        Object requestId = session.getAttributes().get(MdcHandshakeInterceptor.REQUEST_ID_ATTRIBUTE);
        if (requestId != null) {
            ThreadContext.put(REQUEST_ID, requestId.toString());
        }
        return new ConnectionLogContext();
    }

    @Override
    public void close() {
        ThreadContext.remove(CONNECTION_ID);
        ThreadContext.remove(ENDPOINT);
        ThreadContext.remove(REQUEST_ID);
    }
}
