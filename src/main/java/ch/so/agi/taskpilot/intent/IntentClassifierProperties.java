package ch.so.agi.taskpilot.intent;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskpilot.intent")
public class IntentClassifierProperties {
    private String defaultLabel = "default";
    private String complexFallbackLabel = "data-science";
    private int complexWordThreshold = 15;

    public String getDefaultLabel() {
        return defaultLabel;
    }

    public void setDefaultLabel(String defaultLabel) {
        this.defaultLabel = defaultLabel;
    }

    public String getComplexFallbackLabel() {
        return complexFallbackLabel;
    }

    public void setComplexFallbackLabel(String complexFallbackLabel) {
        this.complexFallbackLabel = complexFallbackLabel;
    }

    public int getComplexWordThreshold() {
        return complexWordThreshold;
    }

    public void setComplexWordThreshold(int complexWordThreshold) {
        this.complexWordThreshold = complexWordThreshold;
    }
}
