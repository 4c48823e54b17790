package ch.so.agi.taskpilot.keyword;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Extracts the salient terms of a request for knowledge base lookups.
 */
@Component
public class KeywordExtractor {

    public static final int DEFAULT_LIMIT = 5;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "in", "on", "it", "and", "or", "for", "to", "of",
            "how", "what", "why", "tell", "me", "about");

    public List<String> extract(String text) {
        return extract(text, DEFAULT_LIMIT);
    }

    public List<String> extract(String text, int limit) {
        if (!StringUtils.hasText(text) || limit <= 0) {
            return List.of();
        }

        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT).replace('_', ' '));
        while (matcher.find() && keywords.size() < limit) {
            String token = matcher.group();
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }
}
