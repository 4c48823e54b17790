package ch.so.agi.taskpilot.model;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskpilot.generation")
public class GenerationProperties {
    public static final String PROVIDER_MOCK = "mock";
    public static final String PROVIDER_CHAT_MODEL = "chat-model";

    private String provider = PROVIDER_MOCK;
    private String model = "gpt-4";
    private String plannerModel = "gpt-4";
    private String executorModel = "gpt-4";
    private double plannerTemperature = 0.7;
    private double executorTemperature = 0.7;
    private int plannerMaxTokens = 800;
    private int executorMaxTokens = 800;
    private Long mockSeed;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getPlannerModel() {
        return plannerModel;
    }

    public void setPlannerModel(String plannerModel) {
        this.plannerModel = plannerModel;
    }

    public String getExecutorModel() {
        return executorModel;
    }

    public void setExecutorModel(String executorModel) {
        this.executorModel = executorModel;
    }

    public double getPlannerTemperature() {
        return plannerTemperature;
    }

    public void setPlannerTemperature(double plannerTemperature) {
        this.plannerTemperature = plannerTemperature;
    }

    public double getExecutorTemperature() {
        return executorTemperature;
    }

    public void setExecutorTemperature(double executorTemperature) {
        this.executorTemperature = executorTemperature;
    }

    public int getPlannerMaxTokens() {
        return plannerMaxTokens;
    }

    public void setPlannerMaxTokens(int plannerMaxTokens) {
        this.plannerMaxTokens = plannerMaxTokens;
    }

    public int getExecutorMaxTokens() {
        return executorMaxTokens;
    }

    public void setExecutorMaxTokens(int executorMaxTokens) {
        this.executorMaxTokens = executorMaxTokens;
    }

    public Long getMockSeed() {
        return mockSeed;
    }

    public void setMockSeed(Long mockSeed) {
        this.mockSeed = mockSeed;
    }
}
