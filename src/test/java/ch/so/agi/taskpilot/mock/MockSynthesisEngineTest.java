package ch.so.agi.taskpilot.mock;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import ch.so.agi.taskpilot.TestCatalogs;
import ch.so.agi.taskpilot.domain.DomainCatalog;

/**
 * Unit tests for {@link MockSynthesisEngine}.
 */
class MockSynthesisEngineTest {

    private static final MockCatalog CATALOG = TestCatalogs.mockCatalog();
    private static final DomainCatalog DOMAINS = TestCatalogs.domains();

    private final MockSynthesisEngine engine = new MockSynthesisEngine(CATALOG, DOMAINS, new Random(42));

    @Test
    @DisplayName("Every response carries the marker, even for trivial input")
    void alwaysTagged() {
        for (String text : new String[] { "a", "", null, "   ", "?!" }) {
            String response = engine.synthesize(text);
            assertTrue(response.contains("[MOCK]"), () -> "untagged response for '" + text + "'");
        }
    }

    @Test
    @DisplayName("Domain subtask templates are filled with the domain keyword and slot values")
    void domainTemplate() {
        String response = engine.synthesize("Deploy the platform to Azure");

        assertAll(
                () -> assertTrue(response.startsWith("[MOCK] Deployed azure as a multi-region cloud solution")),
                () -> assertFalse(response.contains("{"), "all slots should be filled"));
    }

    @Test
    @DisplayName("Technical terms become the topic")
    void technicalTerm() {
        assertTrue(engine.synthesize("Sketch the Kubernetes rollout").contains("kubernetes"));
    }

    @Test
    @DisplayName("Multi-word proper nouns become the topic")
    void namedEntity() {
        assertTrue(engine.synthesize("Summarize notes from Project Phoenix").contains("project phoenix"));
    }

    @Test
    @DisplayName("Without other hints the last significant word becomes the topic")
    void keywordFallback() {
        assertTrue(engine.synthesize("please draft something lovely").contains("lovely"));
        assertTrue(engine.synthesize("go do it").contains("task"));
    }

    @Test
    @DisplayName("Stop words are not used as topic")
    void stopWordsSkipped() {
        assertTrue(engine.synthesize("please describe rivers and then those").contains("rivers"));
    }

    @Test
    @DisplayName("Equal seeds give equal responses")
    void seededDeterminism() {
        MockSynthesisEngine first = new MockSynthesisEngine(CATALOG, DOMAINS, new Random(7));
        MockSynthesisEngine second = new MockSynthesisEngine(CATALOG, DOMAINS, new Random(7));

        for (String text : List.of("Deploy the platform to Azure", "Train a machine learning model", "go do it")) {
            assertEquals(first.synthesize(text), second.synthesize(text));
        }
    }

    @Test
    @DisplayName("A template without marker is replaced by the default template")
    void untaggedTemplateFallsBackToDefault() {
        MockCatalog catalog = new MockCatalog("[MOCK]", "default", "research", "task",
                Map.of("write", new ResponseTemplate("write", List.of("Plain text about {topic}"), Map.of()),
                        "default", new ResponseTemplate("default", List.of("[MOCK] Default for {topic}"), Map.of())),
                List.of(), List.of(new MockCatalog.KeywordCategory("write", List.of("write"))), Set.of());
        MockSynthesisEngine custom = new MockSynthesisEngine(catalog, new DomainCatalog(List.of()), new Random(1));

        assertEquals("[MOCK] Default for poems", custom.synthesize("write poems"));
    }

    @Test
    @DisplayName("Marker is prepended when no template produces it")
    void markerPrependedAsLastResort() {
        MockCatalog catalog = new MockCatalog("[MOCK]", "default", "research", "task",
                Map.of("default", new ResponseTemplate("default", List.of("Done with {topic}"), Map.of())),
                List.of(), List.of(), Set.of());
        MockSynthesisEngine custom = new MockSynthesisEngine(catalog, new DomainCatalog(List.of()), new Random(1));

        assertEquals("[MOCK] Done with poems", custom.synthesize("poems"));
    }
}
