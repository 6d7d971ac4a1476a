package com.phillippitts.captionhub;

import com.phillippitts.captionhub.service.broadcast.BroadcastHub;
import com.phillippitts.captionhub.service.persistence.DurableLogger;
import com.phillippitts.captionhub.service.session.SessionOrchestrator;
import com.phillippitts.captionhub.service.translation.EchoTranslationClient;
import com.phillippitts.captionhub.service.translation.TranslationClient;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest
class CaptionHubApplicationTests {

    @Autowired
    private SessionOrchestrator orchestrator;

    @Autowired
    private TranslationClient translationClient;

    @Autowired
    private BroadcastHub hub;

    @Autowired
    private DurableLogger durableLogger;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(translationClient).isInstanceOf(EchoTranslationClient.class);
        assertThat(hub.openChannelCount()).isZero();
        assertThat(durableLogger.stats().running()).isTrue();
    }

}
