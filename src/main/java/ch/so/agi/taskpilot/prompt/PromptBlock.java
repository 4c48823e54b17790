package ch.so.agi.taskpilot.prompt;

public record PromptBlock(Type type, String content) {

    public enum Type {
        PERSONA, SKILL_GUIDANCE, CONTEXT, RESTRICTIONS
    }
}
