package ch.so.agi.taskpilot.retrieval;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

/**
 * Appends the offers and related documents of a retrieval to a generated response.
 */
@Component
public class RetrievalExtrasRenderer {

    public String append(String response, RetrievalResult retrieval) {
        if (retrieval == null || !retrieval.hasContext()) {
            return response;
        }
        StringBuilder builder = new StringBuilder(response == null ? "" : response);
        appendSection(builder, "--- Relevant Offers ---", retrieval.offersByTopic());
        appendSection(builder, "--- Related Documents & Links ---", retrieval.docsByTopic());
        return builder.toString();
    }

    private static void appendSection(StringBuilder builder, String title, Map<String, List<String>> itemsByTopic) {
        if (itemsByTopic.isEmpty()) {
            return;
        }
        builder.append("\n\n").append(title);
        itemsByTopic.forEach((topic, items) -> {
            builder.append("\nFrom topic '").append(topic).append("':");
            items.forEach(item -> builder.append("\n- ").append(item));
        });
    }
}
