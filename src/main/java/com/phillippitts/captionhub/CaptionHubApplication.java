package com.phillippitts.captionhub;

import com.phillippitts.captionhub.config.properties.BroadcastProperties;
import com.phillippitts.captionhub.config.properties.PersistenceProperties;
import com.phillippitts.captionhub.config.properties.ReorderProperties;
import com.phillippitts.captionhub.config.properties.SessionProperties;
import com.phillippitts.captionhub.config.properties.ThreadPoolProperties;
import com.phillippitts.captionhub.config.properties.TranslationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        TranslationProperties.class,
        ReorderProperties.class,
        BroadcastProperties.class,
        PersistenceProperties.class,
        SessionProperties.class
})
@EnableScheduling
public class CaptionHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaptionHubApplication.class, args);
    }

}
