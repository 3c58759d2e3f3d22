package com.phillippitts.voicebridge;

import com.phillippitts.voicebridge.config.properties.AudioProperties;
import com.phillippitts.voicebridge.config.properties.AuthProperties;
import com.phillippitts.voicebridge.config.properties.DispatchProperties;
import com.phillippitts.voicebridge.config.properties.ProviderHealthProperties;
import com.phillippitts.voicebridge.config.properties.ProviderProperties;
import com.phillippitts.voicebridge.config.properties.QueueProperties;
import com.phillippitts.voicebridge.config.properties.RateLimitProperties;
import com.phillippitts.voicebridge.config.properties.ReorderProperties;
import com.phillippitts.voicebridge.config.properties.SessionProperties;
import com.phillippitts.voicebridge.config.properties.UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        AudioProperties.class,
        DispatchProperties.class,
        ReorderProperties.class,
        QueueProperties.class,
        RateLimitProperties.class,
        ProviderProperties.class,
        ProviderHealthProperties.class,
        AuthProperties.class,
        UploadProperties.class
})
@EnableScheduling
public class VoiceBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceBridgeApplication.class, args);
    }

}
