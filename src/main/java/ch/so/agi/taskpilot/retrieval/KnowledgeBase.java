package ch.so.agi.taskpilot.retrieval;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only, ordered collection of knowledge entries with unique topic ids.
 */
public class KnowledgeBase {

    private final List<KnowledgeEntry> entries;

    public KnowledgeBase(List<KnowledgeEntry> entries) {
        Set<String> topics = new HashSet<>();
        for (KnowledgeEntry entry : entries) {
            if (!topics.add(entry.topic())) {
                throw new IllegalArgumentException("duplicate knowledge base topic '" + entry.topic() + "'");
            }
        }
        this.entries = List.copyOf(entries);
    }

    public List<KnowledgeEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
