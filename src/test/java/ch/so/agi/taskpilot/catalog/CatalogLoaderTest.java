package ch.so.agi.taskpilot.catalog;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.agi.taskpilot.TestCatalogs;
import ch.so.agi.taskpilot.domain.DomainCatalog;
import ch.so.agi.taskpilot.domain.DomainDefinition;
import ch.so.agi.taskpilot.domain.SubtaskPattern;
import ch.so.agi.taskpilot.intent.CategoryRule;
import ch.so.agi.taskpilot.intent.ClassificationCatalog;
import ch.so.agi.taskpilot.mock.MockCatalog;
import ch.so.agi.taskpilot.profile.InMemoryUserProfileStore;
import ch.so.agi.taskpilot.profile.SkillLevelTable;
import ch.so.agi.taskpilot.retrieval.KnowledgeBase;
import ch.so.agi.taskpilot.retrieval.KnowledgeEntry;

/**
 * Unit tests for {@link CatalogLoader}.
 */
class CatalogLoaderTest {

    private final CatalogLoader loader = new CatalogLoader(new ObjectMapper());

    @Test
    @DisplayName("Bundled catalogs load completely")
    void bundledCatalogsLoad() {
        ClassificationCatalog categories = TestCatalogs.categories();
        DomainCatalog domains = TestCatalogs.domains();
        MockCatalog mock = TestCatalogs.mockCatalog();
        SkillLevelTable skillLevels = TestCatalogs.skillLevels();

        assertAll(
                () -> assertEquals(18, TestCatalogs.knowledgeBase().size()),
                () -> assertEquals(List.of("data-science", "analyze", "design", "write", "develop"),
                        categories.categories().stream().map(CategoryRule::label).toList()),
                () -> assertEquals("execute", categories.terminalSubtaskType()),
                () -> assertEquals(5, domains.domains().size()),
                () -> assertTrue(domains.domains().get(0).subtasks().stream().allMatch(SubtaskPattern::hasTemplate)),
                () -> assertEquals("[MOCK]", mock.marker()),
                () -> assertFalse(mock.technicalTerms().isEmpty()),
                () -> assertEquals(List.of("BEGINNER", "INTERMEDIATE", "EXPERT", "BANK_AMBASSADOR_TRAINEE"),
                        skillLevels.tiers()),
                () -> assertEquals("BEGINNER", skillLevels.lowestTier()),
                () -> assertEquals(6, TestCatalogs.fallbackPlans().planFor("write", null).size()),
                () -> assertTrue(TestCatalogs.guidance().plannerTemplate().contains("{request}")),
                () -> assertTrue(TestCatalogs.userProfiles().findById("user001").isPresent()));
    }

    @Test
    @DisplayName("Malformed and duplicate knowledge base entries are skipped")
    void skipsMalformedKnowledgeEntries() {
        KnowledgeBase knowledgeBase = loader.loadKnowledgeBase(new ClassPathResource("catalog-broken/knowledge-base.json"));

        assertEquals(List.of("savings", "loans"), knowledgeBase.entries().stream().map(KnowledgeEntry::topic).toList());
        KnowledgeEntry savings = knowledgeBase.entries().get(0);
        KnowledgeEntry loans = knowledgeBase.entries().get(1);
        assertAll(
                () -> assertEquals(List.of("savings", "isa"), savings.keywords()),
                () -> assertEquals("Savings context", savings.context()),
                () -> assertEquals(List.of("loan"), loans.keywords()),
                () -> assertEquals(List.of("Compare rates"), loans.tips()));
    }

    @Test
    @DisplayName("Domain templates without marker, with unknown slots or invalid slot definitions are dropped")
    void dropsInvalidDomainTemplates() {
        DomainCatalog catalog = loader.loadDomains(new ClassPathResource("catalog-broken/domains.json"), "[MOCK]");

        assertEquals(1, catalog.domains().size());
        DomainDefinition cloud = catalog.domains().get(0);
        assertAll(
                () -> assertEquals(List.of("cloud"), cloud.keywords()),
                () -> assertEquals(List.of("deploy", "research", "optimize", "tune"),
                        cloud.subtasks().stream().map(SubtaskPattern::type).toList()),
                () -> assertTrue(cloud.subtasks().get(0).hasTemplate()),
                () -> assertFalse(cloud.subtasks().get(1).hasTemplate()),
                () -> assertFalse(cloud.subtasks().get(2).hasTemplate()),
                () -> assertFalse(cloud.subtasks().get(3).hasTemplate()));
    }

    @Test
    @DisplayName("Mock catalogs without a usable default category are rejected")
    void rejectsMockCatalogWithoutDefault() {
        assertThrows(CatalogLoadException.class,
                () -> loader.loadMockCatalog(new ClassPathResource("catalog-broken/mock-without-default.json")));
    }

    @Test
    @DisplayName("A declared skill tier without valid parameters fails fast")
    void rejectsIncompleteSkillLevels() {
        assertThrows(IllegalStateException.class,
                () -> loader.loadSkillLevels(new ClassPathResource("catalog-broken/skill-levels-incomplete.json")));
    }

    @Test
    @DisplayName("Unreadable documents raise a catalog load exception")
    void unreadableDocuments() {
        assertAll(
                () -> assertThrows(CatalogLoadException.class, () -> loader.loadKnowledgeBase(json("{ not json"))),
                () -> assertThrows(CatalogLoadException.class, () -> loader.loadKnowledgeBase(json("[]"))),
                () -> assertThrows(CatalogLoadException.class,
                        () -> loader.loadGuidance(json("{\"plannerTemplate\": \"x\"}"))),
                () -> assertThrows(CatalogLoadException.class,
                        () -> loader.loadFallbackPlans(json("{\"plans\": {\"write\": [\"a\", \"b\", \"c\"]}}"))),
                () -> assertThrows(CatalogLoadException.class,
                        () -> loader.loadKnowledgeBase(new ClassPathResource("catalog/missing.json"))));
    }

    @Test
    @DisplayName("User profiles without a textual skill level keep it unset")
    void userProfilesWithoutSkillLevel() {
        InMemoryUserProfileStore store = loader.loadUserProfiles(json(
                "{\"profiles\": [{\"id\": \"u1\", \"skillLevel\": 3}, {\"id\": \"u1\"}, {\"name\": \"nobody\"}]}"));

        assertNull(store.findById("u1").orElseThrow().skillLevel());
    }

    private static ByteArrayResource json(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8));
    }
}
