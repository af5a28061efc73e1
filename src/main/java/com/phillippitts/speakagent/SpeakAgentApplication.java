package com.phillippitts.speakagent;

import com.phillippitts.speakagent.config.properties.AppLauncherProperties;
import com.phillippitts.speakagent.config.properties.ContactProperties;
import com.phillippitts.speakagent.config.properties.DialogueProperties;
import com.phillippitts.speakagent.config.properties.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DialogueProperties.class,
        LlmProperties.class,
        ContactProperties.class,
        AppLauncherProperties.class
})
public class SpeakAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakAgentApplication.class, args);
    }

}
