package ch.so.agi.taskpilot.app;

import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.agi.taskpilot.domain.DomainCatalog;
import ch.so.agi.taskpilot.mock.MockCatalog;
import ch.so.agi.taskpilot.mock.MockSynthesisEngine;
import ch.so.agi.taskpilot.model.ChatModelGenerationBackend;
import ch.so.agi.taskpilot.model.GenerationBackend;
import ch.so.agi.taskpilot.model.GenerationProperties;
import ch.so.agi.taskpilot.model.MockGenerationBackend;

/**
 * Chooses the generation backend once at startup. A chat model is only used when it is configured and
 * available, everything else runs against the mock engine.
 */
@Configuration
public class GenerationBackendConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GenerationBackendConfiguration.class);

    @Bean
    public MockSynthesisEngine mockSynthesisEngine(MockCatalog mockCatalog, DomainCatalog domainCatalog,
            GenerationProperties properties) {
        Random random = properties.getMockSeed() == null ? new Random() : new Random(properties.getMockSeed());
        return new MockSynthesisEngine(mockCatalog, domainCatalog, random);
    }

    @Bean
    @ConditionalOnMissingBean(GenerationBackend.class)
    public GenerationBackend generationBackend(GenerationProperties properties, ObjectProvider<ChatModel> chatModel,
            MockSynthesisEngine mockSynthesisEngine) {
        if (GenerationProperties.PROVIDER_CHAT_MODEL.equals(properties.getProvider())) {
            ChatModel model = chatModel.getIfAvailable();
            if (model != null) {
                log.info("Using chat model backend {}", model.getClass().getSimpleName());
                return new ChatModelGenerationBackend(model);
            }
            log.warn("Provider {} configured but no ChatModel bean available, falling back to mock responses",
                    properties.getProvider());
        }
        log.info("Using mock generation backend");
        return new MockGenerationBackend(mockSynthesisEngine);
    }
}
