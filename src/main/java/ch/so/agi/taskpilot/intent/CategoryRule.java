package ch.so.agi.taskpilot.intent;

import java.util.List;

/**
 * A request category together with the trigger phrases that vote for it.
 */
public record CategoryRule(String label, List<String> triggers) {

    public CategoryRule {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public int countMatches(String lowerCaseText) {
        int count = 0;
        for (String trigger : triggers) {
            if (lowerCaseText.contains(trigger)) {
                count++;
            }
        }
        return count;
    }
}
