package ch.so.agi.taskpilot.plan;

import java.util.List;

public record TaskPlan(List<String> subtasks, List<SubtaskRecord> records) {

    public TaskPlan {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        records = records == null ? List.of() : List.copyOf(records);
    }
}
