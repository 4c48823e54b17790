package ch.so.agi.taskpilot.mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import ch.so.agi.taskpilot.domain.DomainCatalog;
import ch.so.agi.taskpilot.domain.DomainDefinition;
import ch.so.agi.taskpilot.domain.SubtaskPattern;
import ch.so.agi.taskpilot.mock.MockCatalog.KeywordCategory;
import ch.so.agi.taskpilot.mock.MockCatalog.TechnicalTerm;

/**
 * Stand-in for a generation backend. Produces a tagged placeholder narrative whose shape depends on the
 * request and whose numbers come from the injected random source.
 * <p>
 * Category and topic are resolved in this order, the first hit wins: domain subtask template, technical
 * term, named entity, generic keywords. Every result carries the catalog marker.
 */
public class MockSynthesisEngine {

    private static final Logger log = LoggerFactory.getLogger(MockSynthesisEngine.class);

    private static final List<Pattern> NAMED_ENTITY_PATTERNS = List.of(
            // multi-word proper nouns
            Pattern.compile("\\b[A-Z][a-zA-Z]*(?:[\\s-][A-Z][a-zA-Z]*)+\\b"),
            // product with version
            Pattern.compile("\\b[A-Z][a-zA-Z]*\\s\\d+(?:\\.\\d+)*\\b"),
            // acronyms
            Pattern.compile("\\b[A-Z]{2,}\\b"));

    private static final Pattern SIGNIFICANT_WORD = Pattern.compile("\\b[a-zA-Z]{4,}\\b");

    private final MockCatalog catalog;
    private final DomainCatalog domains;
    private final Random random;

    public MockSynthesisEngine(MockCatalog catalog, DomainCatalog domains, Random random) {
        this.catalog = catalog;
        this.domains = domains;
        this.random = random;
    }

    public String synthesize(String text) {
        String source = text == null ? "" : text;
        String lowerCaseText = source.toLowerCase(Locale.ROOT);

        Optional<String> domainResponse = renderDomainTemplate(lowerCaseText);
        if (domainResponse.isPresent()) {
            return domainResponse.get();
        }

        Resolution resolution = resolveTechnicalTerm(source)
                .or(() -> resolveNamedEntity(source))
                .orElseGet(() -> new Resolution(keywordCategory(lowerCaseText), fallbackTopic(source)));
        if (log.isDebugEnabled()) {
            log.debug("Mock response uses category {} with topic '{}'", resolution.category(), resolution.topic());
        }
        return render(resolution.category(), resolution.topic());
    }

    String render(String category, String topic) {
        String rendered = catalog.templateFor(category).render(topic, random);
        if (isTagged(rendered)) {
            return rendered;
        }
        log.warn("Template for category {} rendered without marker, using default template", category);
        rendered = catalog.defaultTemplate().render(topic, random);
        if (isTagged(rendered)) {
            return rendered;
        }
        String body = StringUtils.hasText(rendered) ? rendered.strip() : "Completed the requested task for " + topic + ".";
        return catalog.marker() + " " + body;
    }

    private Optional<String> renderDomainTemplate(String lowerCaseText) {
        for (DomainDefinition domain : domains.domains()) {
            Optional<String> keyword = domain.firstMatchingKeyword(lowerCaseText);
            if (keyword.isEmpty()) {
                continue;
            }
            for (SubtaskPattern subtask : domain.subtasks()) {
                if (subtask.hasTemplate() && subtask.matches(lowerCaseText)) {
                    if (log.isDebugEnabled()) {
                        log.debug("Mock response uses {} template of domain {}", subtask.type(), domain.name());
                    }
                    String rendered = subtask.template().render(keyword.get(), random);
                    return Optional.of(isTagged(rendered) ? rendered : render(catalog.defaultCategory(), keyword.get()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Resolution> resolveTechnicalTerm(String source) {
        for (TechnicalTerm term : catalog.technicalTerms()) {
            Matcher matcher = term.pattern().matcher(source);
            if (matcher.find()) {
                return Optional.of(new Resolution(term.category(), matcher.group().toLowerCase(Locale.ROOT)));
            }
        }
        return Optional.empty();
    }

    private Optional<Resolution> resolveNamedEntity(String source) {
        for (Pattern pattern : NAMED_ENTITY_PATTERNS) {
            Matcher matcher = pattern.matcher(source);
            if (matcher.find()) {
                String entity = matcher.group().strip().toLowerCase(Locale.ROOT);
                return Optional.of(new Resolution(catalog.namedEntityCategory(), entity));
            }
        }
        return Optional.empty();
    }

    private String keywordCategory(String lowerCaseText) {
        for (KeywordCategory candidate : catalog.keywordCategories()) {
            for (String term : candidate.terms()) {
                if (lowerCaseText.contains(term)) {
                    return candidate.category();
                }
            }
        }
        return catalog.defaultCategory();
    }

    private String fallbackTopic(String source) {
        List<String> words = new ArrayList<>();
        Matcher matcher = SIGNIFICANT_WORD.matcher(source);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (!catalog.topicStopWords().contains(word)) {
                words.add(word);
            }
        }
        return words.isEmpty() ? catalog.fallbackTopic() : words.get(words.size() - 1);
    }

    private boolean isTagged(String rendered) {
        return StringUtils.hasText(rendered) && rendered.contains(catalog.marker());
    }

    private record Resolution(String category, String topic) {
    }
}
