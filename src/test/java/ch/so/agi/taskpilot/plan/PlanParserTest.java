package ch.so.agi.taskpilot.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class PlanParserTest {

    @Test
    void parsesNumberedAndBulletedItems() {
        String text = """
                Here is the plan:
                1. Research the market
                2) Draft the report  
                - Review the draft
                * Publish it
                • Collect feedback
                Good luck!
                """;

        assertEquals(List.of("Research the market", "Draft the report", "Review the draft", "Publish it",
                "Collect feedback"), PlanParser.parse(text));
    }

    @Test
    void ignoresProseAndEmptyInput() {
        assertTrue(PlanParser.parse("I cannot break this down.").isEmpty());
        assertTrue(PlanParser.parse("").isEmpty());
        assertTrue(PlanParser.parse(null).isEmpty());
        assertTrue(PlanParser.parse("1.\n-").isEmpty());
    }
}
