package ch.so.agi.taskpilot.prompt;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.agi.taskpilot.prompt.PromptBlock.Type;
import ch.so.agi.taskpilot.retrieval.RetrievalResult;

class PromptAssemblerTest {

    private final PromptAssembler assembler = new PromptAssembler(properties());

    @Test
    void assemblesAllBlocksInOrder() {
        RetrievalResult retrieval = new RetrievalResult("Topic: mortgages\nContext: Fixed rates.",
                List.of("mortgages", "savings"), Map.of(), Map.of());

        PromptEnvelope envelope = assembler.assemble("How do mortgages work?", "Explain simply.", retrieval);
        String system = envelope.systemPrompt();

        assertAll(
                () -> assertEquals(List.of(Type.PERSONA, Type.SKILL_GUIDANCE, Type.CONTEXT, Type.RESTRICTIONS),
                        envelope.blockTypes()),
                () -> assertTrue(system.startsWith("You are a banking advisor.")),
                () -> assertTrue(system.contains(PromptAssembler.SKILL_HEADER + "\nExplain simply.")),
                () -> assertTrue(system.contains(PromptAssembler.CONTEXT_HEADER + "\nTopic: mortgages")),
                () -> assertTrue(system.contains("Context: Fixed rates.\nUse the context.")),
                () -> assertTrue(system.endsWith("- Stay on message about mortgages.")),
                () -> assertTrue(system.indexOf(PromptAssembler.SKILL_HEADER) < system
                        .indexOf(PromptAssembler.CONTEXT_HEADER)),
                () -> assertEquals("How do mortgages work?", envelope.userPrompt()));
    }

    @Test
    void omitsSkillBlockWithoutGuidance() {
        PromptEnvelope envelope = assembler.assemble("Hi", "  ", RetrievalResult.empty());

        assertFalse(envelope.has(Type.SKILL_GUIDANCE));
        assertFalse(envelope.systemPrompt().contains(PromptAssembler.SKILL_HEADER));
    }

    @Test
    void omitsContextBlockAndUsesGenericTopicWithoutMatch() {
        PromptEnvelope envelope = assembler.assemble("Hi", "Explain simply.", RetrievalResult.empty());

        assertAll(
                () -> assertEquals(List.of(Type.PERSONA, Type.SKILL_GUIDANCE, Type.RESTRICTIONS),
                        envelope.blockTypes()),
                () -> assertFalse(envelope.systemPrompt().contains(RetrievalResult.NO_CONTEXT)),
                () -> assertTrue(envelope.systemPrompt().contains("about the topics discussed.")),
                () -> assertFalse(envelope.systemPrompt().contains(PromptProperties.TOPIC_PLACEHOLDER)));
    }

    private static PromptProperties properties() {
        PromptProperties properties = new PromptProperties();
        properties.setPersona("You are a banking advisor.");
        properties.setRestrictions("- Be positive.\n- Stay on message about [topic].");
        properties.setGenericTopic("the topics discussed");
        properties.setContextInstruction("Use the context.");
        return properties;
    }
}
