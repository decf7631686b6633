package com.replybot.app;

import com.replybot.app.pipeline.PipelineOrchestrator;
import com.replybot.app.store.MessageStore;
import com.replybot.channel.supervisor.ConnectionSupervisor;
import com.replybot.common.config.ReplyBotConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "replybot.config-path=target/test-config/missing-replybot.json")
class ReplyBotApplicationTest {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private ConnectionSupervisor supervisor;

    @Autowired
    private MessageStore store;

    @Autowired
    private ReplyBotConfig config;

    @Test
    void contextStartsWithDefaults() {
        assertNotNull(store);
        assertFalse(config.getPersistence().isEnabled());
        assertTrue(orchestrator.getSettings().isAutoReply());
        assertFalse(supervisor.isReady());
    }
}
