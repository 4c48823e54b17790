package ch.so.agi.taskpilot.domain;

import java.util.List;

/**
 * The specialized domain detected for a request, including the keyword that triggered it.
 */
public record DomainProfile(String name, String matchedKeyword, List<SubtaskPattern> subtasks, String guidance,
        String preferredCategory) {

    public DomainProfile {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    static DomainProfile of(DomainDefinition definition, String matchedKeyword) {
        return new DomainProfile(definition.name(), matchedKeyword, definition.subtasks(), definition.guidance(),
                definition.preferredCategory());
    }
}
