package ch.so.agi.taskpilot.profile;

public record SkillParameters(String tier, String guidance, double temperature, int maxTokens) {

    public SkillParameters {
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature of tier " + tier + " must be within [0, 1]");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("max tokens of tier " + tier + " must be positive");
        }
        guidance = guidance == null ? "" : guidance;
    }
}
