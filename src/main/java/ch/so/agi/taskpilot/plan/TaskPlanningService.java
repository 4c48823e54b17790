package ch.so.agi.taskpilot.plan;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.agi.taskpilot.domain.DomainProfile;
import ch.so.agi.taskpilot.domain.DomainSpecializer;
import ch.so.agi.taskpilot.domain.SubtaskClassifier;
import ch.so.agi.taskpilot.intent.IntentClassifier;
import ch.so.agi.taskpilot.model.GenerationBackend;
import ch.so.agi.taskpilot.model.GenerationBackendException;
import ch.so.agi.taskpilot.model.GenerationErrors;
import ch.so.agi.taskpilot.model.GenerationProperties;
import ch.so.agi.taskpilot.model.GenerationRequest;

/**
 * Decomposes a request into subtasks with the generation backend and executes them one by one. Plans that
 * cannot be generated or parsed are replaced by a fallback plan.
 */
@Service
public class TaskPlanningService {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanningService.class);

    private final IntentClassifier intentClassifier;
    private final DomainSpecializer domainSpecializer;
    private final SubtaskClassifier subtaskClassifier;
    private final PlanPromptBuilder promptBuilder;
    private final FallbackPlanStore fallbackPlans;
    private final GenerationBackend generationBackend;
    private final GenerationProperties properties;

    public TaskPlanningService(IntentClassifier intentClassifier, DomainSpecializer domainSpecializer,
            SubtaskClassifier subtaskClassifier, PlanPromptBuilder promptBuilder, FallbackPlanStore fallbackPlans,
            GenerationBackend generationBackend, GenerationProperties properties) {
        this.intentClassifier = intentClassifier;
        this.domainSpecializer = domainSpecializer;
        this.subtaskClassifier = subtaskClassifier;
        this.promptBuilder = promptBuilder;
        this.fallbackPlans = fallbackPlans;
        this.generationBackend = generationBackend;
        this.properties = properties;
    }

    public List<String> plan(String request) {
        return plan(analyze(request));
    }

    public List<SubtaskRecord> execute(List<String> subtasks, String request) {
        return execute(subtasks, analyze(request));
    }

    public TaskPlan planAndExecute(String request) {
        RequestAnalysis analysis = analyze(request);
        List<String> subtasks = plan(analysis);
        return new TaskPlan(subtasks, execute(subtasks, analysis));
    }

    private List<String> plan(RequestAnalysis analysis) {
        String plannerPrompt = promptBuilder.plannerPrompt(analysis.request(), analysis.category(),
                analysis.domain());
        GenerationRequest generationRequest = new GenerationRequest(properties.getPlannerModel(), plannerPrompt,
                analysis.request(), properties.getPlannerTemperature(), properties.getPlannerMaxTokens());
        try {
            List<String> subtasks = PlanParser.parse(generationBackend.generate(generationRequest));
            if (!subtasks.isEmpty()) {
                log.info("Generated plan with {} subtasks", subtasks.size());
                return subtasks;
            }
            log.warn("Generated plan could not be parsed, using fallback plan");
        } catch (GenerationBackendException ex) {
            log.warn("Plan generation failed, using fallback plan: {}", ex.getMessage());
        }
        return fallbackPlans.planFor(analysis.category(), analysis.domain());
    }

    private List<SubtaskRecord> execute(List<String> subtasks, RequestAnalysis analysis) {
        List<SubtaskRecord> records = new ArrayList<>();
        for (String subtask : subtasks) {
            String type = subtaskClassifier.classify(subtask, analysis.domain());
            String executorPrompt = promptBuilder.executorPrompt(analysis.request(), subtask, analysis.category(),
                    analysis.domain(), type);
            GenerationRequest generationRequest = new GenerationRequest(properties.getExecutorModel(),
                    executorPrompt, subtask, properties.getExecutorTemperature(), properties.getExecutorMaxTokens());
            String result;
            try {
                result = generationBackend.generate(generationRequest);
            } catch (GenerationBackendException ex) {
                log.error("Execution of subtask '{}' failed: {}", subtask, ex.getMessage());
                result = GenerationErrors.of(ex.getMessage());
            }
            records.add(new SubtaskRecord(subtask, result, type));
        }
        return records;
    }

    private RequestAnalysis analyze(String request) {
        String category = intentClassifier.classify(request).label();
        DomainProfile domain = domainSpecializer.detect(request).orElse(null);
        return new RequestAnalysis(request == null ? "" : request, category, domain);
    }

    private record RequestAnalysis(String request, String category, DomainProfile domain) {
    }
}
