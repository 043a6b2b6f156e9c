/**
 * Logging infrastructure: per-connection MDC (Log4j2 ThreadContext) values for WebSocket traffic.
 *
 * <p>{@link com.phillippitts.speechgate.config.logging.MdcHandshakeInterceptor} assigns a
 * request id at upgrade time; {@link com.phillippitts.speechgate.config.logging.ConnectionLogContext}
 * scopes connectionId, endpoint and requestId to the handling of each frame. The pre-warm
 * executor copies the ThreadContext of the submitting thread.
 */
package com.phillippitts.speechgate.config.logging;
