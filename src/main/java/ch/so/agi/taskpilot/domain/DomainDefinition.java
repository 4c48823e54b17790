package ch.so.agi.taskpilot.domain;

import java.util.List;
import java.util.Optional;

public record DomainDefinition(String name, List<String> keywords, List<SubtaskPattern> subtasks, String guidance,
        String preferredCategory) {

    public DomainDefinition {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    /**
     * Returns the first keyword, in declaration order, contained in the given lower-case text.
     */
    public Optional<String> firstMatchingKeyword(String lowerCaseText) {
        return keywords.stream().filter(lowerCaseText::contains).findFirst();
    }
}
