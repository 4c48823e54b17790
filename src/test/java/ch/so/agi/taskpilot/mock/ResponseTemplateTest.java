package ch.so.agi.taskpilot.mock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ResponseTemplateTest {

    private final Random random = new Random(3);

    @Test
    void fillsTopicAndSlots() {
        ResponseTemplate template = new ResponseTemplate("cloud",
                List.of("[MOCK] {topic}: {users} users, {uptime} uptime, tier {tier}"),
                Map.of("users", new SlotGenerator.IntegerRange(12345, 12345, true, "", ""),
                        "uptime", new SlotGenerator.DecimalRange(99.95, 99.95, 2, "", "%"),
                        "tier", new SlotGenerator.Choice(List.of("gold"))));

        assertEquals("[MOCK] azure: 12,345 users, 99.95% uptime, tier gold", template.render("azure", random));
    }

    @Test
    void keepsUnknownPlaceholders() {
        ResponseTemplate template = new ResponseTemplate("x", List.of("{topic} and {unknown}"), Map.of());

        assertEquals("ml and {unknown}", template.render("ml", random));
    }

    @Test
    void quotesReplacementValues() {
        ResponseTemplate template = new ResponseTemplate("x", List.of("cost {topic}"), Map.of());

        assertEquals("cost $5\\x", template.render("$5\\x", random));
    }

    @Test
    void integerSlotStaysWithinBounds() {
        SlotGenerator.IntegerRange range = new SlotGenerator.IntegerRange(3, 8, false, "", "x");
        for (int i = 0; i < 50; i++) {
            String value = range.next(random);
            int number = Integer.parseInt(value.substring(0, value.length() - 1));
            assertTrue(number >= 3 && number <= 8, value);
        }
    }

    @Test
    void integerSlotHandlesFullIntRange() {
        SlotGenerator.IntegerRange full = new SlotGenerator.IntegerRange(Integer.MIN_VALUE, Integer.MAX_VALUE, false,
                "", "");
        SlotGenerator.IntegerRange upper = new SlotGenerator.IntegerRange(0, Integer.MAX_VALUE, false, "", "");
        for (int i = 0; i < 50; i++) {
            Integer.parseInt(full.next(random));
            assertTrue(Integer.parseInt(upper.next(random)) >= 0);
        }
        assertEquals(Integer.toString(Integer.MAX_VALUE),
                new SlotGenerator.IntegerRange(Integer.MAX_VALUE, Integer.MAX_VALUE, false, "", "").next(random));
    }

    @Test
    void listsPlaceholdersInOrder() {
        assertEquals(List.of("topic", "a", "b"),
                List.copyOf(ResponseTemplate.placeholders("{topic} {a} {b} {a}")));
        assertEquals(Set.of(), ResponseTemplate.placeholders("no slots"));
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseTemplate("x", List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new SlotGenerator.IntegerRange(5, 1, false, "", ""));
        assertThrows(IllegalArgumentException.class, () -> new SlotGenerator.Choice(List.of()));
    }
}
