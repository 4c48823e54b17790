package ch.so.agi.taskpilot.retrieval;

import java.util.List;
import java.util.Locale;

/**
 * One knowledge base topic. Keywords are stored lower-case.
 */
public record KnowledgeEntry(String topic, List<String> keywords, String context, List<String> tips,
        List<String> offers, List<String> relatedDocs) {

    public KnowledgeEntry {
        keywords = keywords == null ? List.of()
                : keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
        tips = tips == null ? List.of() : List.copyOf(tips);
        offers = offers == null ? List.of() : List.copyOf(offers);
        relatedDocs = relatedDocs == null ? List.of() : List.copyOf(relatedDocs);
    }

    /**
     * Whether the lower-case keyword occurs within any stored keyword.
     */
    public boolean matches(String lowerCaseKeyword) {
        for (String keyword : keywords) {
            if (keyword.contains(lowerCaseKeyword)) {
                return true;
            }
        }
        return false;
    }
}
