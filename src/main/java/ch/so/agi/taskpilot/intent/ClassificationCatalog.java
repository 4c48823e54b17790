package ch.so.agi.taskpilot.intent;

import java.util.List;

import ch.so.agi.taskpilot.domain.SubtaskPattern;

/**
 * Ordered request categories, complex-task indicators and the generic subtask taxonomy. Declaration order
 * of the categories breaks ties.
 */
public record ClassificationCatalog(List<CategoryRule> categories, List<String> complexIndicators,
        List<SubtaskPattern> genericSubtasks, String terminalSubtaskType) {

    public ClassificationCatalog {
        categories = categories == null ? List.of() : List.copyOf(categories);
        complexIndicators = complexIndicators == null ? List.of() : List.copyOf(complexIndicators);
        genericSubtasks = genericSubtasks == null ? List.of() : List.copyOf(genericSubtasks);
        terminalSubtaskType = terminalSubtaskType == null || terminalSubtaskType.isBlank() ? "execute"
                : terminalSubtaskType;
    }
}
