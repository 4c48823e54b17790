package ch.so.agi.taskpilot.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated context of all matched topics. Offers and related documents are already truncated according
 * to the number of matched topics.
 */
public record RetrievalResult(String context, List<String> matchedTopics, Map<String, List<String>> offersByTopic,
        Map<String, List<String>> docsByTopic) {

    public static final String NO_CONTEXT = "No specific context found.";

    public RetrievalResult {
        matchedTopics = matchedTopics == null ? List.of() : List.copyOf(matchedTopics);
        offersByTopic = copyOrdered(offersByTopic);
        docsByTopic = copyOrdered(docsByTopic);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(NO_CONTEXT, List.of(), Map.of(), Map.of());
    }

    public boolean hasContext() {
        return !matchedTopics.isEmpty();
    }

    private static Map<String, List<String>> copyOrdered(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((topic, items) -> copy.put(topic, List.copyOf(items)));
        return Collections.unmodifiableMap(copy);
    }
}
