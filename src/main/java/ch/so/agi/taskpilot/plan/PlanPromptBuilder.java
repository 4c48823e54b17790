package ch.so.agi.taskpilot.plan;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import ch.so.agi.taskpilot.domain.DomainProfile;

/**
 * Builds planner and executor prompts and enriches them with category, domain, subtask and stage guidance.
 */
@Component
public class PlanPromptBuilder {

    private static final List<String> TONE_TRIGGERS = List.of("technical", "professional", "formal", "detailed");
    private static final List<String> THOROUGH_TRIGGERS = List.of("comprehensive", "thorough", "detailed");
    private static final List<String> CREATION_TRIGGERS = List.of("draft", "create", "write", "develop");
    private static final List<String> REFINEMENT_TRIGGERS = List.of("refine", "improve", "optimize", "edit");

    private final GuidanceCatalog guidance;

    public PlanPromptBuilder(GuidanceCatalog guidance) {
        this.guidance = guidance;
    }

    /**
     * @param domain the detected domain, may be {@code null}
     */
    public String plannerPrompt(String request, String category, DomainProfile domain) {
        String base = guidance.plannerTemplate().replace("{request}", request == null ? "" : request);
        return enhance(base, request, category, domain);
    }

    /**
     * @param domain the detected domain, may be {@code null}
     */
    public String executorPrompt(String request, String subtask, String category, DomainProfile domain,
            String subtaskType) {
        StringBuilder prompt = new StringBuilder(enhance(
                guidance.executorTemplate().replace("{subtask}", subtask == null ? "" : subtask), request, category,
                domain));

        String subtaskGuidance = subtaskType == null ? null : guidance.subtasks().get(subtaskType);
        if (StringUtils.hasText(subtaskGuidance)) {
            prompt.append("\n\nSubtask Type: ").append(capitalize(subtaskType)).append('\n').append(subtaskGuidance)
                    .append('\n');
        }

        String stage = stageOf(lower(subtask), lower(request));
        if (stage != null && StringUtils.hasText(guidance.stages().get(stage))) {
            prompt.append("\n\n").append(guidance.stages().get(stage));
        }
        return prompt.toString();
    }

    private String enhance(String base, String request, String category, DomainProfile domain) {
        StringBuilder prompt = new StringBuilder(base);

        String categoryGuidance = category == null ? null : guidance.categories().get(category);
        if (StringUtils.hasText(categoryGuidance)) {
            prompt.append("\n\nTask Category: ").append(capitalize(category)).append('\n').append(categoryGuidance)
                    .append('\n');
        }

        if (domain != null) {
            prompt.append("\n\nDomain Specialization: ").append(domain.name()).append('\n');
            if (StringUtils.hasText(domain.guidance())) {
                prompt.append(domain.guidance()).append('\n');
            }
            if (StringUtils.hasText(domain.matchedKeyword())) {
                prompt.append("Topic keyword: ").append(domain.matchedKeyword()).append('\n');
            }
        }

        if (containsAny(lower(request), TONE_TRIGGERS) && StringUtils.hasText(guidance.toneHint())) {
            prompt.append("\n\n").append(guidance.toneHint());
        }
        return prompt.toString();
    }

    private static String stageOf(String subtask, String request) {
        if (subtask.contains("research") && containsAny(request, THOROUGH_TRIGGERS)) {
            return "research";
        }
        if (containsAny(subtask, CREATION_TRIGGERS)) {
            return "creation";
        }
        if (containsAny(subtask, REFINEMENT_TRIGGERS)) {
            return "refinement";
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> terms) {
        return terms.stream().anyMatch(text::contains);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase(Locale.ROOT);
    }
}
