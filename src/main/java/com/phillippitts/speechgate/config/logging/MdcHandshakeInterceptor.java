package com.phillippitts.speechgate.config.logging;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;
import java.util.UUID;

/**
 * Captures a request id during the WebSocket upgrade so every log line of the connection can
 * carry it.
 *
 * <p>The id is taken from the {@code X-Request-ID} header, or generated, and stored in the
 * session attributes under {@link #REQUEST_ID_ATTRIBUTE}. {@link ConnectionLogContext} copies it
 * into the Log4j2 ThreadContext for each frame.
 */
public class MdcHandshakeInterceptor implements HandshakeInterceptor {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = "speechgate.requestId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String requestId = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        attributes.put(REQUEST_ID_ATTRIBUTE, requestId);
        response.getHeaders().set(REQUEST_ID_HEADER, requestId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }
}
