package com.phillippitts.voiceinventory;

import com.phillippitts.voiceinventory.config.properties.CaptureProperties;
import com.phillippitts.voiceinventory.config.properties.ExtractionProperties;
import com.phillippitts.voiceinventory.config.properties.GeminiProperties;
import com.phillippitts.voiceinventory.config.properties.IntentProperties;
import com.phillippitts.voiceinventory.config.properties.ResolutionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CaptureProperties.class,
        ExtractionProperties.class,
        ResolutionProperties.class,
        IntentProperties.class,
        GeminiProperties.class
})
public class VoiceInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceInventoryApplication.class, args);
    }

}
