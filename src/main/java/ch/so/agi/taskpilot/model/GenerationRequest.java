package ch.so.agi.taskpilot.model;

public record GenerationRequest(String model, String systemPrompt, String userPrompt, double temperature,
        int maxTokens) {

    public GenerationRequest {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        userPrompt = userPrompt == null ? "" : userPrompt;
    }
}
