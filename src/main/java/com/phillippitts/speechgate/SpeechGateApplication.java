package com.phillippitts.speechgate;

import com.phillippitts.speechgate.config.properties.InferenceProperties;
import com.phillippitts.speechgate.config.properties.PrewarmProperties;
import com.phillippitts.speechgate.config.properties.RecognitionProperties;
import com.phillippitts.speechgate.config.properties.SynthesisProperties;
import com.phillippitts.speechgate.config.properties.ThreadPoolProperties;
import com.phillippitts.speechgate.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RecognitionProperties.class,
        SynthesisProperties.class,
        PrewarmProperties.class,
        InferenceProperties.class,
        WebSocketProperties.class,
        ThreadPoolProperties.class
})
public class SpeechGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeechGateApplication.class, args);
    }

}
