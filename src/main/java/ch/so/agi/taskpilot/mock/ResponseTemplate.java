package ch.so.agi.taskpilot.mock;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parametrized response texts of one category. {@code {topic}} is filled by the caller, every other
 * placeholder by the slot generator of the same name.
 */
public record ResponseTemplate(String category, List<String> texts, Map<String, SlotGenerator> slots) {

    public static final String TOPIC_SLOT = "topic";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    public ResponseTemplate {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("template '" + category + "' has no texts");
        }
        texts = List.copyOf(texts);
        slots = slots == null ? Map.of() : Map.copyOf(slots);
    }

    public String render(String topic, Random random) {
        String text = texts.get(random.nextInt(texts.size()));
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value;
            if (TOPIC_SLOT.equals(name)) {
                value = topic;
            } else if (slots.containsKey(name)) {
                value = slots.get(name).next(random);
            } else {
                value = matcher.group();
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * Returns the placeholder names used in a template text, in order of first appearance.
     */
    public static Set<String> placeholders(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
