package ch.so.agi.taskpilot.prompt;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskpilot.prompt")
public class PromptProperties {
    public static final String TOPIC_PLACEHOLDER = "[topic]";

    private String persona = "You are a helpful assistant.";
    private String restrictions = "- If discussing [topic], stay accurate and professional.";
    private String genericTopic = "the topics discussed";
    private String contextInstruction = "Use the context above to inform your response.";

    public String getPersona() {
        return persona;
    }

    public void setPersona(String persona) {
        this.persona = persona;
    }

    public String getRestrictions() {
        return restrictions;
    }

    public void setRestrictions(String restrictions) {
        this.restrictions = restrictions;
    }

    public String getGenericTopic() {
        return genericTopic;
    }

    public void setGenericTopic(String genericTopic) {
        this.genericTopic = genericTopic;
    }

    public String getContextInstruction() {
        return contextInstruction;
    }

    public void setContextInstruction(String contextInstruction) {
        this.contextInstruction = contextInstruction;
    }
}
