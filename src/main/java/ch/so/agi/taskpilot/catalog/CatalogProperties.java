package ch.so.agi.taskpilot.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

@ConfigurationProperties(prefix = "taskpilot.catalog")
public class CatalogProperties {
    private Resource knowledgeBase = new ClassPathResource("catalog/knowledge-base.json");
    private Resource categories = new ClassPathResource("catalog/categories.json");
    private Resource domains = new ClassPathResource("catalog/domains.json");
    private Resource fallbackPlans = new ClassPathResource("catalog/fallback-plans.json");
    private Resource mockResponses = new ClassPathResource("catalog/mock-responses.json");
    private Resource skillLevels = new ClassPathResource("catalog/skill-levels.json");
    private Resource userProfiles = new ClassPathResource("catalog/user-profiles.json");
    private Resource guidance = new ClassPathResource("catalog/guidance.json");

    public Resource getKnowledgeBase() {
        return knowledgeBase;
    }

    public void setKnowledgeBase(Resource knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    public Resource getCategories() {
        return categories;
    }

    public void setCategories(Resource categories) {
        this.categories = categories;
    }

    public Resource getDomains() {
        return domains;
    }

    public void setDomains(Resource domains) {
        this.domains = domains;
    }

    public Resource getFallbackPlans() {
        return fallbackPlans;
    }

    public void setFallbackPlans(Resource fallbackPlans) {
        this.fallbackPlans = fallbackPlans;
    }

    public Resource getMockResponses() {
        return mockResponses;
    }

    public void setMockResponses(Resource mockResponses) {
        this.mockResponses = mockResponses;
    }

    public Resource getSkillLevels() {
        return skillLevels;
    }

    public void setSkillLevels(Resource skillLevels) {
        this.skillLevels = skillLevels;
    }

    public Resource getUserProfiles() {
        return userProfiles;
    }

    public void setUserProfiles(Resource userProfiles) {
        this.userProfiles = userProfiles;
    }

    public Resource getGuidance() {
        return guidance;
    }

    public void setGuidance(Resource guidance) {
        this.guidance = guidance;
    }
}
