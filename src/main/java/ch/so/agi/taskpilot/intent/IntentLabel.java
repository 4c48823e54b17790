package ch.so.agi.taskpilot.intent;

public record IntentLabel(String label, int matchCount) {
}
