package ch.so.agi.taskpilot.prompt;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import ch.so.agi.taskpilot.retrieval.RetrievalResult;

/**
 * Assembles the system prompt from persona, skill guidance, retrieved context and restrictions, in that
 * order. Skill guidance and context are left out entirely when there is nothing to say.
 */
@Component
public class PromptAssembler {

    static final String SKILL_HEADER = "--- Skill Level Guidance ---";
    static final String CONTEXT_HEADER = "--- Relevant Context ---";
    static final String RESTRICTIONS_HEADER = "--- Restrictions ---";

    private final PromptProperties properties;

    public PromptAssembler(PromptProperties properties) {
        this.properties = properties;
    }

    public PromptEnvelope assemble(String query, String skillGuidance, RetrievalResult retrieval) {
        List<PromptBlock> blocks = new ArrayList<>();
        blocks.add(new PromptBlock(PromptBlock.Type.PERSONA, properties.getPersona().strip()));

        if (StringUtils.hasText(skillGuidance)) {
            blocks.add(new PromptBlock(PromptBlock.Type.SKILL_GUIDANCE, SKILL_HEADER + "\n" + skillGuidance.strip()));
        }

        if (retrieval != null && retrieval.hasContext()) {
            String context = CONTEXT_HEADER + "\n" + retrieval.context().strip();
            if (StringUtils.hasText(properties.getContextInstruction())) {
                context += "\n" + properties.getContextInstruction().strip();
            }
            blocks.add(new PromptBlock(PromptBlock.Type.CONTEXT, context));
        }

        String topic = retrieval != null && retrieval.hasContext() ? retrieval.matchedTopics().get(0)
                : properties.getGenericTopic();
        String restrictions = properties.getRestrictions().replace(PromptProperties.TOPIC_PLACEHOLDER, topic).strip();
        blocks.add(new PromptBlock(PromptBlock.Type.RESTRICTIONS, RESTRICTIONS_HEADER + "\n" + restrictions));

        return new PromptEnvelope(blocks, query == null ? "" : query);
    }
}
