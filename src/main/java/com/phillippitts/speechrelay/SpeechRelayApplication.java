package com.phillippitts.speechrelay;

import com.phillippitts.speechrelay.config.properties.RecognitionProperties;
import com.phillippitts.speechrelay.config.properties.RelayProperties;
import com.phillippitts.speechrelay.config.properties.SpeechCredentialsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RecognitionProperties.class,
        SpeechCredentialsProperties.class,
        RelayProperties.class
})
public class SpeechRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeechRelayApplication.class, args);
    }

}
