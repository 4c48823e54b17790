package ch.so.agi.taskpilot.domain;

import java.util.List;

import ch.so.agi.taskpilot.mock.ResponseTemplate;

/**
 * A subtask type with its trigger terms. Domain subtasks may carry a mock template; generic ones do not.
 */
public record SubtaskPattern(String type, List<String> triggers, ResponseTemplate template) {

    public SubtaskPattern {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public SubtaskPattern(String type, List<String> triggers) {
        this(type, triggers, null);
    }

    public boolean matches(String lowerCaseText) {
        for (String trigger : triggers) {
            if (lowerCaseText.contains(trigger)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasTemplate() {
        return template != null;
    }
}
