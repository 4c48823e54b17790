package ch.so.agi.taskpilot.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.util.StringUtils;

/**
 * Reads the subtasks of a generated plan from a numbered or bulleted list.
 */
public final class PlanParser {

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d+[.)]|[-*\\u2022])\\s+(.+?)\\s*$");

    private PlanParser() {
    }

    public static List<String> parse(String text) {
        if (!StringUtils.hasText(text)) {
            return List.of();
        }
        List<String> subtasks = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher matcher = LIST_ITEM.matcher(line);
            if (matcher.matches()) {
                subtasks.add(matcher.group(1));
            }
        }
        return List.copyOf(subtasks);
    }
}
