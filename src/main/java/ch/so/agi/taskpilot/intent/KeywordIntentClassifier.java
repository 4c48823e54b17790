package ch.so.agi.taskpilot.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Assigns a request to exactly one category by counting trigger phrase hits per category.
 * <p>
 * A request counts as complex when it names a scale indicator and is longer than the configured word
 * threshold, or when it hits more than one category. Complex requests go to the category with the most
 * hits, simple ones to the first category that was hit at all.
 */
@Component
public class KeywordIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(KeywordIntentClassifier.class);

    private final ClassificationCatalog catalog;
    private final IntentClassifierProperties properties;

    public KeywordIntentClassifier(ClassificationCatalog catalog, IntentClassifierProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    @Override
    public IntentClassification classify(String text) {
        if (!StringUtils.hasText(text)) {
            return new IntentClassification(properties.getDefaultLabel(), false, "Empty request.", List.of());
        }

        String lowerCaseText = text.toLowerCase(Locale.ROOT);
        List<IntentLabel> matches = new ArrayList<>();
        for (CategoryRule rule : catalog.categories()) {
            int count = rule.countMatches(lowerCaseText);
            if (count > 0) {
                matches.add(new IntentLabel(rule.label(), count));
            }
        }

        boolean explicitComplex = containsIndicator(lowerCaseText)
                && wordCount(lowerCaseText) > properties.getComplexWordThreshold();
        boolean implicitComplex = matches.size() > 1;

        if (explicitComplex || implicitComplex) {
            if (matches.isEmpty()) {
                log.info("Complex request without category hits, using {}", properties.getComplexFallbackLabel());
                return new IntentClassification(properties.getComplexFallbackLabel(), true,
                        "Complex request without category hits.", matches);
            }
            IntentLabel dominant = matches.get(0);
            for (IntentLabel candidate : matches) {
                if (candidate.matchCount() > dominant.matchCount()) {
                    dominant = candidate;
                }
            }
            log.info("Complex request across {} categories, dominant category {}", matches.size(), dominant.label());
            return new IntentClassification(dominant.label(), true,
                    "Dominant category with " + dominant.matchCount() + " trigger hits.", matches);
        }

        if (!matches.isEmpty()) {
            IntentLabel first = matches.get(0);
            if (log.isDebugEnabled()) {
                log.debug("Request classified as {} with {} trigger hits", first.label(), first.matchCount());
            }
            return new IntentClassification(first.label(), false,
                    "Single category with " + first.matchCount() + " trigger hits.", matches);
        }

        return new IntentClassification(properties.getDefaultLabel(), false, "No trigger phrase matched.", matches);
    }

    private boolean containsIndicator(String lowerCaseText) {
        for (String indicator : catalog.complexIndicators()) {
            if (lowerCaseText.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    private static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
