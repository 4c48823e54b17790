package ch.so.agi.taskpilot.plan;

import java.util.Map;

/**
 * Prompt templates and guidance fragments for planning and subtask execution.
 */
public record GuidanceCatalog(String plannerTemplate, String executorTemplate, Map<String, String> categories,
        Map<String, String> subtasks, Map<String, String> stages, String toneHint) {

    public GuidanceCatalog {
        categories = categories == null ? Map.of() : Map.copyOf(categories);
        subtasks = subtasks == null ? Map.of() : Map.copyOf(subtasks);
        stages = stages == null ? Map.of() : Map.copyOf(stages);
        toneHint = toneHint == null ? "" : toneHint;
    }
}
