package ch.so.agi.taskpilot.model;

import java.util.Locale;

import ch.so.agi.taskpilot.mock.MockSynthesisEngine;

/**
 * Answers every request with a synthesized mock narrative, headed by the parameters a real backend would
 * have received.
 */
public class MockGenerationBackend implements GenerationBackend {

    private final MockSynthesisEngine engine;

    public MockGenerationBackend(MockSynthesisEngine engine) {
        this.engine = engine;
    }

    @Override
    public String generate(GenerationRequest request) {
        String header = String.format(Locale.ROOT, "Mock response (model: %s, temperature: %.1f, max tokens: %d)",
                request.model(), request.temperature(), request.maxTokens());
        return header + "\n\n" + engine.synthesize(request.userPrompt());
    }
}
