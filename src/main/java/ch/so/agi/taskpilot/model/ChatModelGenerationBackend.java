package ch.so.agi.taskpilot.model;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.StringUtils;

/**
 * Sends generation requests to a Spring AI {@link ChatModel}.
 */
public class ChatModelGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatModelGenerationBackend.class);

    private final ChatModel chatModel;

    public ChatModelGenerationBackend(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String generate(GenerationRequest request) {
        Prompt prompt = toPrompt(request);

        String content;
        try {
            if (log.isDebugEnabled()) {
                log.debug("Invoking ChatModel {} with model {}", chatModel.getClass().getSimpleName(), request.model());
            }
            ChatResponse response = chatModel.call(prompt);
            content = response == null || response.getResult() == null ? null
                    : response.getResult().getOutput().getText();
        } catch (RuntimeException ex) {
            log.error("Chat model invocation failed", ex);
            throw new GenerationBackendException(ex.getMessage() == null ? ex.getClass().getSimpleName()
                    : ex.getMessage(), ex);
        }

        if (!StringUtils.hasText(content)) {
            log.warn("Chat model returned an empty response for model {}", request.model());
            throw new GenerationBackendException("Generation backend returned an empty response");
        }
        if (log.isDebugEnabled()) {
            String preview = content.substring(0, Math.min(content.length(), 200));
            log.debug("ChatModel call completed; received {} characters. Preview: {}", content.length(), preview);
        }
        return content.strip();
    }

    Prompt toPrompt(GenerationRequest request) {
        List<Message> messages = new ArrayList<>();
        if (StringUtils.hasText(request.systemPrompt())) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        messages.add(new UserMessage(request.userPrompt()));

        ChatOptions options = ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();
        return new Prompt(messages, options);
    }
}
