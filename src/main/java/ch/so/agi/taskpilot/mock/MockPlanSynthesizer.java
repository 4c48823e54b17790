package ch.so.agi.taskpilot.mock;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import ch.so.agi.taskpilot.domain.SubtaskClassifier;
import ch.so.agi.taskpilot.intent.IntentClassifier;
import ch.so.agi.taskpilot.plan.FallbackPlanStore;
import ch.so.agi.taskpilot.plan.SubtaskRecord;
import ch.so.agi.taskpilot.plan.TaskPlan;

/**
 * Produces a complete mock plan with results without touching any backend: the canned plan of the request's
 * category, each step answered by the mock engine.
 */
@Component
public class MockPlanSynthesizer {

    private final IntentClassifier intentClassifier;
    private final FallbackPlanStore fallbackPlans;
    private final SubtaskClassifier subtaskClassifier;
    private final MockSynthesisEngine engine;

    public MockPlanSynthesizer(IntentClassifier intentClassifier, FallbackPlanStore fallbackPlans,
            SubtaskClassifier subtaskClassifier, MockSynthesisEngine engine) {
        this.intentClassifier = intentClassifier;
        this.fallbackPlans = fallbackPlans;
        this.subtaskClassifier = subtaskClassifier;
        this.engine = engine;
    }

    public TaskPlan synthesizePlan(String request) {
        String category = intentClassifier.classify(request).label();
        List<String> subtasks = fallbackPlans.planFor(category, null);
        List<SubtaskRecord> records = new ArrayList<>();
        for (String subtask : subtasks) {
            records.add(new SubtaskRecord(subtask, engine.synthesize(subtask), subtaskClassifier.classify(subtask)));
        }
        return new TaskPlan(subtasks, records);
    }
}
