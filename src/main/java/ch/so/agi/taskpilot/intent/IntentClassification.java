package ch.so.agi.taskpilot.intent;

import java.util.List;

public record IntentClassification(String label, boolean complexTask, String rationale, List<IntentLabel> matches) {

    public IntentClassification {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public int matchCount(String category) {
        return matches.stream()
                .filter(match -> match.label().equals(category))
                .mapToInt(IntentLabel::matchCount)
                .findFirst()
                .orElse(0);
    }
}
