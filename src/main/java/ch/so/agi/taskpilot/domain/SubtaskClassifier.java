package ch.so.agi.taskpilot.domain;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import ch.so.agi.taskpilot.intent.ClassificationCatalog;

/**
 * Determines the type of a single subtask. The domain's own taxonomy wins over the generic one.
 */
@Component
public class SubtaskClassifier {

    private final List<SubtaskPattern> genericSubtasks;
    private final String terminalType;

    public SubtaskClassifier(ClassificationCatalog catalog) {
        this.genericSubtasks = catalog.genericSubtasks();
        this.terminalType = catalog.terminalSubtaskType();
    }

    public String classify(String subtask) {
        return classify(subtask, null);
    }

    /**
     * @param domain the detected domain, may be {@code null}
     */
    public String classify(String subtask, DomainProfile domain) {
        if (!StringUtils.hasText(subtask)) {
            return terminalType;
        }
        String lowerCaseText = subtask.toLowerCase(Locale.ROOT);
        if (domain != null) {
            for (SubtaskPattern pattern : domain.subtasks()) {
                if (pattern.matches(lowerCaseText)) {
                    return pattern.type();
                }
            }
        }
        for (SubtaskPattern pattern : genericSubtasks) {
            if (pattern.matches(lowerCaseText)) {
                return pattern.type();
            }
        }
        return terminalType;
    }
}
