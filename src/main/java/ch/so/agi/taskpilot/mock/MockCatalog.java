package ch.so.agi.taskpilot.mock;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Response templates per category and the lookup tables used to pick category and topic for a mock
 * response.
 */
public record MockCatalog(String marker, String defaultCategory, String namedEntityCategory, String fallbackTopic,
        Map<String, ResponseTemplate> templates, List<TechnicalTerm> technicalTerms,
        List<KeywordCategory> keywordCategories, Set<String> topicStopWords) {

    public MockCatalog {
        if (marker == null || marker.isBlank()) {
            throw new IllegalArgumentException("mock marker must not be blank");
        }
        templates = templates == null ? Map.of() : Map.copyOf(templates);
        if (!templates.containsKey(defaultCategory)) {
            throw new IllegalArgumentException("no templates for default category '" + defaultCategory + "'");
        }
        technicalTerms = technicalTerms == null ? List.of() : List.copyOf(technicalTerms);
        keywordCategories = keywordCategories == null ? List.of() : List.copyOf(keywordCategories);
        topicStopWords = topicStopWords == null ? Set.of() : Set.copyOf(topicStopWords);
    }

    public ResponseTemplate templateFor(String category) {
        return templates.getOrDefault(category, defaultTemplate());
    }

    public ResponseTemplate defaultTemplate() {
        return templates.get(defaultCategory);
    }

    public record TechnicalTerm(Pattern pattern, String category) {

        public static TechnicalTerm of(String regex, String category) {
            return new TechnicalTerm(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category);
        }
    }

    public record KeywordCategory(String category, List<String> terms) {

        public KeywordCategory {
            terms = terms == null ? List.of() : List.copyOf(terms);
        }
    }
}
