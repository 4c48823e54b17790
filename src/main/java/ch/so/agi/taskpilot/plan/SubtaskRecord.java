package ch.so.agi.taskpilot.plan;

public record SubtaskRecord(String task, String result, String type) {
}
