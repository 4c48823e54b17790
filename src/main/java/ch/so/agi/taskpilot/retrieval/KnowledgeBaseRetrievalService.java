package ch.so.agi.taskpilot.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Looks up knowledge base topics by keyword and aggregates their context.
 * <p>
 * The more topics match, the fewer offers and related documents are kept per topic: all of them for a single
 * topic, the configured two-topic cap for two topics and the many-topic cap beyond that. Context text is
 * never truncated.
 */
@Service
public class KnowledgeBaseRetrievalService implements RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseRetrievalService.class);

    private final KnowledgeBase knowledgeBase;
    private final RetrievalProperties properties;

    public KnowledgeBaseRetrievalService(KnowledgeBase knowledgeBase, RetrievalProperties properties) {
        this.knowledgeBase = knowledgeBase;
        this.properties = properties;
    }

    @Override
    public RetrievalResult retrieve(List<String> keywords) {
        List<String> normalized = normalize(keywords);
        if (normalized.isEmpty()) {
            log.info("No keywords provided for knowledge base lookup");
            return RetrievalResult.empty();
        }

        List<KnowledgeEntry> matched = new ArrayList<>();
        for (KnowledgeEntry entry : knowledgeBase.entries()) {
            for (String keyword : normalized) {
                if (entry.matches(keyword)) {
                    if (log.isDebugEnabled()) {
                        log.debug("Keyword '{}' matched topic {}", keyword, entry.topic());
                    }
                    matched.add(entry);
                    break;
                }
            }
        }

        if (matched.isEmpty()) {
            log.info("No knowledge base topic matched keywords {}", normalized);
            return RetrievalResult.empty();
        }

        int cap = capFor(matched.size());
        List<String> topics = new ArrayList<>();
        List<String> contextParts = new ArrayList<>();
        List<String> tips = new ArrayList<>();
        Map<String, List<String>> offers = new LinkedHashMap<>();
        Map<String, List<String>> docs = new LinkedHashMap<>();

        for (KnowledgeEntry entry : matched) {
            topics.add(entry.topic());
            if (StringUtils.hasText(entry.context())) {
                contextParts.add("Topic: " + entry.topic() + "\nContext: " + entry.context());
            }
            entry.tips().forEach(tip -> tips.add("- " + tip));
            if (!entry.offers().isEmpty()) {
                offers.put(entry.topic(), limit(entry.offers(), cap));
            }
            if (!entry.relatedDocs().isEmpty()) {
                docs.put(entry.topic(), limit(entry.relatedDocs(), cap));
            }
        }

        StringBuilder context = new StringBuilder(
                contextParts.isEmpty() ? RetrievalResult.NO_CONTEXT : String.join("\n\n", contextParts));
        if (!tips.isEmpty()) {
            context.append("\n\nRelevant Tips for Context:\n").append(String.join("\n", tips));
        }

        log.info("Knowledge base lookup matched {} topics: {}", topics.size(), topics);
        return new RetrievalResult(context.toString(), topics, offers, docs);
    }

    int capFor(int matchedTopics) {
        if (matchedTopics <= 1) {
            return Integer.MAX_VALUE;
        }
        return matchedTopics == 2 ? properties.getTwoTopicCap() : properties.getManyTopicCap();
    }

    private static List<String> limit(List<String> items, int cap) {
        return items.size() <= cap ? items : items.subList(0, cap);
    }

    private static List<String> normalize(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(StringUtils::hasText)
                .map(keyword -> keyword.strip().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
