package ch.so.agi.taskpilot.app;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.agi.taskpilot.catalog.CatalogLoader;
import ch.so.agi.taskpilot.catalog.CatalogProperties;
import ch.so.agi.taskpilot.domain.DomainCatalog;
import ch.so.agi.taskpilot.intent.ClassificationCatalog;
import ch.so.agi.taskpilot.mock.MockCatalog;
import ch.so.agi.taskpilot.plan.FallbackPlanStore;
import ch.so.agi.taskpilot.plan.GuidanceCatalog;
import ch.so.agi.taskpilot.profile.SkillLevelTable;
import ch.so.agi.taskpilot.profile.UserProfileStore;
import ch.so.agi.taskpilot.retrieval.KnowledgeBase;

/**
 * Loads the static lookup tables once at startup.
 */
@Configuration
public class CatalogConfiguration {

    @Bean
    public CatalogLoader catalogLoader(ObjectProvider<ObjectMapper> objectMapper) {
        return new CatalogLoader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public KnowledgeBase knowledgeBase(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadKnowledgeBase(properties.getKnowledgeBase());
    }

    @Bean
    public ClassificationCatalog classificationCatalog(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadClassificationCatalog(properties.getCategories());
    }

    @Bean
    public MockCatalog mockCatalog(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadMockCatalog(properties.getMockResponses());
    }

    @Bean
    public DomainCatalog domainCatalog(CatalogLoader loader, CatalogProperties properties, MockCatalog mockCatalog) {
        return loader.loadDomains(properties.getDomains(), mockCatalog.marker());
    }

    @Bean
    public FallbackPlanStore fallbackPlanStore(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadFallbackPlans(properties.getFallbackPlans());
    }

    @Bean
    public SkillLevelTable skillLevelTable(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadSkillLevels(properties.getSkillLevels());
    }

    @Bean
    public UserProfileStore userProfileStore(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadUserProfiles(properties.getUserProfiles());
    }

    @Bean
    public GuidanceCatalog guidanceCatalog(CatalogLoader loader, CatalogProperties properties) {
        return loader.loadGuidance(properties.getGuidance());
    }
}
