package ch.so.agi.taskpilot.processing;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.agi.taskpilot.keyword.KeywordExtractor;
import ch.so.agi.taskpilot.model.GenerationBackend;
import ch.so.agi.taskpilot.model.GenerationBackendException;
import ch.so.agi.taskpilot.model.GenerationErrors;
import ch.so.agi.taskpilot.model.GenerationProperties;
import ch.so.agi.taskpilot.model.GenerationRequest;
import ch.so.agi.taskpilot.profile.SkillParameters;
import ch.so.agi.taskpilot.profile.SkillProfileResolver;
import ch.so.agi.taskpilot.prompt.PromptAssembler;
import ch.so.agi.taskpilot.prompt.PromptEnvelope;
import ch.so.agi.taskpilot.retrieval.RetrievalExtrasRenderer;
import ch.so.agi.taskpilot.retrieval.RetrievalProperties;
import ch.so.agi.taskpilot.retrieval.RetrievalResult;
import ch.so.agi.taskpilot.retrieval.RetrievalService;

/**
 * Answers a single prompt: resolves the user's skill tier, retrieves context for the prompt's keywords,
 * assembles the system prompt and calls the generation backend. Failures are returned as error strings.
 */
@Service
public class PromptProcessingService {

    private static final Logger log = LoggerFactory.getLogger(PromptProcessingService.class);

    private final SkillProfileResolver skillProfileResolver;
    private final KeywordExtractor keywordExtractor;
    private final RetrievalService retrievalService;
    private final PromptAssembler promptAssembler;
    private final GenerationBackend generationBackend;
    private final RetrievalExtrasRenderer extrasRenderer;
    private final GenerationProperties generationProperties;
    private final RetrievalProperties retrievalProperties;

    public PromptProcessingService(SkillProfileResolver skillProfileResolver, KeywordExtractor keywordExtractor,
            RetrievalService retrievalService, PromptAssembler promptAssembler, GenerationBackend generationBackend,
            RetrievalExtrasRenderer extrasRenderer, GenerationProperties generationProperties,
            RetrievalProperties retrievalProperties) {
        this.skillProfileResolver = skillProfileResolver;
        this.keywordExtractor = keywordExtractor;
        this.retrievalService = retrievalService;
        this.promptAssembler = promptAssembler;
        this.generationBackend = generationBackend;
        this.extrasRenderer = extrasRenderer;
        this.generationProperties = generationProperties;
        this.retrievalProperties = retrievalProperties;
    }

    public String process(String userId, String prompt) {
        try {
            SkillParameters skill = skillProfileResolver.resolve(userId);
            List<String> keywords = keywordExtractor.extract(prompt, retrievalProperties.getKeywordLimit());
            RetrievalResult retrieval = retrievalService.retrieve(keywords);
            PromptEnvelope envelope = promptAssembler.assemble(prompt, skill.guidance(), retrieval);

            if (log.isDebugEnabled()) {
                log.debug("Processing prompt for user '{}' with tier {}, keywords {} and blocks {}", userId,
                        skill.tier(), keywords, envelope.blockTypes());
            }

            GenerationRequest request = new GenerationRequest(generationProperties.getModel(),
                    envelope.systemPrompt(), envelope.userPrompt(), skill.temperature(), skill.maxTokens());
            String response;
            try {
                response = generationBackend.generate(request);
            } catch (GenerationBackendException ex) {
                log.error("Generation backend failed for user '{}': {}", userId, ex.getMessage());
                return GenerationErrors
                        .of("Could not process request due to generation backend failure: " + ex.getMessage());
            }
            return extrasRenderer.append(response, retrieval);
        } catch (RuntimeException ex) {
            log.error("Failed to process prompt for user '{}'", userId, ex);
            return GenerationErrors.of("Failed to process prompt. " + ex.getMessage());
        }
    }
}
