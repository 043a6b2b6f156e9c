package com.phillippitts.speechgate.config.websocket;

import com.phillippitts.speechgate.config.logging.MdcHandshakeInterceptor;
import com.phillippitts.speechgate.config.properties.WebSocketProperties;
import com.phillippitts.speechgate.presentation.websocket.RecognitionWebSocketHandler;
import com.phillippitts.speechgate.presentation.websocket.SynthesisWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the recognition and synthesis endpoints and sizes the container buffers.
 *
 * <p>Synthesis replies carry base64 WAV audio and clone requests carry base64 samples, so the
 * text buffer must be much larger than the container default of 8 KB.
 */
@Configuration
@EnableWebSocket
public class SpeechWebSocketConfig implements WebSocketConfigurer {

    private final RecognitionWebSocketHandler recognitionHandler;
    private final SynthesisWebSocketHandler synthesisHandler;
    private final WebSocketProperties props;

    public SpeechWebSocketConfig(RecognitionWebSocketHandler recognitionHandler,
                                 SynthesisWebSocketHandler synthesisHandler,
                                 WebSocketProperties props) {
        this.recognitionHandler = recognitionHandler;
        this.synthesisHandler = synthesisHandler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = props.getAllowedOrigins().toArray(new String[0]);
        MdcHandshakeInterceptor mdc = new MdcHandshakeInterceptor();
        registry.addHandler(recognitionHandler, props.getRecognitionPath())
                .addInterceptors(mdc)
                .setAllowedOrigins(origins);
        registry.addHandler(synthesisHandler, props.getSynthesisPath())
                .addInterceptors(mdc)
                .setAllowedOrigins(origins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(props.getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(props.getMaxBinaryMessageBytes());
        container.setMaxSessionIdleTimeout(props.getMaxSessionIdleTimeoutMs());
        return container;
    }
}
