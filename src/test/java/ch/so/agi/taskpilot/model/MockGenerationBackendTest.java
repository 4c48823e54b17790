package ch.so.agi.taskpilot.model;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import ch.so.agi.taskpilot.TestCatalogs;
import ch.so.agi.taskpilot.mock.MockSynthesisEngine;

class MockGenerationBackendTest {

    private final MockGenerationBackend backend = new MockGenerationBackend(
            new MockSynthesisEngine(TestCatalogs.mockCatalog(), TestCatalogs.domains(), new Random(11)));

    @Test
    void headsResponseWithRequestParameters() {
        String response = backend.generate(new GenerationRequest("gpt-4", "system", "Explain Kubernetes", 0.5, 450));

        assertTrue(response.startsWith("Mock response (model: gpt-4, temperature: 0.5, max tokens: 450)\n\n[MOCK]"),
                response);
        assertTrue(response.contains("kubernetes"));
    }

    @Test
    void answersEmptyPrompts() {
        String response = backend.generate(new GenerationRequest("gpt-4", "", "", 0.7, 500));

        assertTrue(response.contains("[MOCK]"));
    }
}
