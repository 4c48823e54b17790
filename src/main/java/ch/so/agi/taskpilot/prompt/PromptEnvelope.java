package ch.so.agi.taskpilot.prompt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The assembled system prompt as ordered blocks plus the untouched user prompt.
 */
public record PromptEnvelope(List<PromptBlock> blocks, String userPrompt) {

    public PromptEnvelope {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public String systemPrompt() {
        return blocks.stream().map(PromptBlock::content).collect(Collectors.joining("\n\n"));
    }

    public List<PromptBlock.Type> blockTypes() {
        return blocks.stream().map(PromptBlock::type).toList();
    }

    public boolean has(PromptBlock.Type type) {
        return blocks.stream().anyMatch(block -> block.type() == type);
    }
}
