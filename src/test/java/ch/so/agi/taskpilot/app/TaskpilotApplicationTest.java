package ch.so.agi.taskpilot.app;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import ch.so.agi.taskpilot.model.GenerationBackend;
import ch.so.agi.taskpilot.model.MockGenerationBackend;
import ch.so.agi.taskpilot.plan.FallbackPlanStore;
import ch.so.agi.taskpilot.plan.TaskPlan;
import ch.so.agi.taskpilot.plan.TaskPlanningService;
import ch.so.agi.taskpilot.processing.PromptProcessingService;

@SpringBootTest(properties = "taskpilot.generation.mock-seed=7")
class TaskpilotApplicationTest {

    @Autowired
    private GenerationBackend generationBackend;

    @Autowired
    private PromptProcessingService promptProcessingService;

    @Autowired
    private TaskPlanningService taskPlanningService;

    @Autowired
    private FallbackPlanStore fallbackPlans;

    @Test
    void answersPromptWithMockBackendAndBundledCatalogs() {
        assertInstanceOf(MockGenerationBackend.class, generationBackend);

        String response = promptProcessingService.process("user001", "How do I remortgage my flat?");

        assertAll(
                () -> assertTrue(response.startsWith(
                        "Mock response (model: gpt-4, temperature: 0.5, max tokens: 450)\n\n[MOCK]"), response),
                () -> assertTrue(response.contains("--- Relevant Offers ---\nFrom topic 'remortgaging':")),
                () -> assertTrue(response.contains("--- Related Documents & Links ---")));
    }

    @Test
    void plansWithFallbackWhenMockOutputIsNoList() {
        TaskPlan plan = taskPlanningService.planAndExecute("Write a blog post about savings");

        assertEquals(fallbackPlans.planFor("write", null), plan.subtasks());
        plan.records().forEach(record -> assertTrue(record.result().contains("[MOCK]")));
    }
}
