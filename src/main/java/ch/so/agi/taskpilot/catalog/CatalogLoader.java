package ch.so.agi.taskpilot.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.agi.taskpilot.domain.DomainCatalog;
import ch.so.agi.taskpilot.domain.DomainDefinition;
import ch.so.agi.taskpilot.domain.SubtaskPattern;
import ch.so.agi.taskpilot.intent.CategoryRule;
import ch.so.agi.taskpilot.intent.ClassificationCatalog;
import ch.so.agi.taskpilot.mock.MockCatalog;
import ch.so.agi.taskpilot.mock.MockCatalog.KeywordCategory;
import ch.so.agi.taskpilot.mock.MockCatalog.TechnicalTerm;
import ch.so.agi.taskpilot.mock.ResponseTemplate;
import ch.so.agi.taskpilot.mock.SlotGenerator;
import ch.so.agi.taskpilot.plan.FallbackPlanStore;
import ch.so.agi.taskpilot.plan.GuidanceCatalog;
import ch.so.agi.taskpilot.profile.InMemoryUserProfileStore;
import ch.so.agi.taskpilot.profile.SkillLevelTable;
import ch.so.agi.taskpilot.profile.SkillParameters;
import ch.so.agi.taskpilot.profile.UserProfile;
import ch.so.agi.taskpilot.retrieval.KnowledgeBase;
import ch.so.agi.taskpilot.retrieval.KnowledgeEntry;

/**
 * Parses the JSON catalog documents into immutable lookup tables.
 * <p>
 * Malformed entries are logged and skipped. A document that cannot be read or parsed, or that lacks an entry
 * the tables cannot do without, fails with a {@link CatalogLoadException}.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public KnowledgeBase loadKnowledgeBase(Resource resource) {
        JsonNode root = read(resource);
        List<KnowledgeEntry> entries = new ArrayList<>();
        Set<String> topics = new HashSet<>();
        for (JsonNode node : root.path("topics")) {
            String topic = text(node, "id");
            List<String> keywords = strings(node, "keywords");
            String context = text(node, "context");
            if (topic == null || keywords.isEmpty() || context == null) {
                log.warn("Skipping knowledge base entry '{}' in {}: id, keywords and context are required", topic,
                        describe(resource));
                continue;
            }
            if (!topics.add(topic)) {
                log.warn("Skipping duplicate knowledge base topic '{}' in {}", topic, describe(resource));
                continue;
            }
            entries.add(new KnowledgeEntry(topic, keywords, context, strings(node, "tips"), strings(node, "offers"),
                    strings(node, "relatedDocs")));
        }
        log.info("Loaded {} knowledge base topics from {}", entries.size(), describe(resource));
        return new KnowledgeBase(entries);
    }

    public ClassificationCatalog loadClassificationCatalog(Resource resource) {
        JsonNode root = read(resource);
        List<CategoryRule> categories = new ArrayList<>();
        Set<String> labels = new HashSet<>();
        for (JsonNode node : root.path("categories")) {
            String label = text(node, "label");
            List<String> triggers = lowerCase(strings(node, "triggers"));
            if (label == null || triggers.isEmpty() || !labels.add(label)) {
                log.warn("Skipping request category '{}' in {}", label, describe(resource));
                continue;
            }
            categories.add(new CategoryRule(label, triggers));
        }
        List<SubtaskPattern> genericSubtasks = new ArrayList<>();
        for (JsonNode node : root.path("genericSubtasks")) {
            String type = text(node, "type");
            List<String> triggers = lowerCase(strings(node, "triggers"));
            if (type == null || triggers.isEmpty()) {
                log.warn("Skipping generic subtask type '{}' in {}", type, describe(resource));
                continue;
            }
            genericSubtasks.add(new SubtaskPattern(type, triggers));
        }
        log.info("Loaded {} request categories and {} generic subtask types from {}", categories.size(),
                genericSubtasks.size(), describe(resource));
        return new ClassificationCatalog(categories, lowerCase(strings(root, "complexIndicators")), genericSubtasks,
                text(root, "terminalSubtaskType"));
    }

    /**
     * @param marker the marker every mock template text has to contain
     */
    public DomainCatalog loadDomains(Resource resource, String marker) {
        JsonNode root = read(resource);
        List<DomainDefinition> domains = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (JsonNode node : root.path("domains")) {
            String name = text(node, "name");
            List<String> keywords = lowerCase(strings(node, "keywords"));
            if (name == null || keywords.isEmpty() || !names.add(name)) {
                log.warn("Skipping domain '{}' in {}", name, describe(resource));
                continue;
            }
            List<SubtaskPattern> subtasks = new ArrayList<>();
            for (JsonNode subtaskNode : node.path("subtasks")) {
                String type = text(subtaskNode, "type");
                List<String> triggers = lowerCase(strings(subtaskNode, "triggers"));
                if (type == null || triggers.isEmpty()) {
                    log.warn("Skipping subtask '{}' of domain {} in {}", type, name, describe(resource));
                    continue;
                }
                ResponseTemplate template = null;
                if (subtaskNode.hasNonNull("template")) {
                    JsonNode templateNode = subtaskNode.get("template");
                    List<String> texts = validTexts(List.of(nullToEmpty(text(templateNode, "text"))),
                            templateNode.path("slots"), marker, name + "/" + type);
                    template = texts.isEmpty() ? null
                            : buildTemplate(name + "/" + type, texts, templateNode.path("slots"));
                }
                subtasks.add(new SubtaskPattern(type, triggers, template));
            }
            domains.add(new DomainDefinition(name, keywords, subtasks, nullToEmpty(text(node, "guidance")),
                    text(node, "preferredCategory")));
        }
        log.info("Loaded {} domains from {}", domains.size(), describe(resource));
        return new DomainCatalog(domains);
    }

    public FallbackPlanStore loadFallbackPlans(Resource resource) {
        JsonNode root = read(resource);
        Map<String, List<String>> plans = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("plans").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> steps = toStrings(field.getValue());
            if (steps.size() < FallbackPlanStore.MIN_STEPS || steps.size() > FallbackPlanStore.MAX_STEPS) {
                log.warn("Skipping fallback plan '{}' in {}: {} steps", field.getKey(), describe(resource),
                        steps.size());
                continue;
            }
            plans.put(field.getKey(), steps);
        }
        String defaultCategory = textOrDefault(root, "defaultCategory", "default");
        try {
            return new FallbackPlanStore(plans, defaultCategory);
        } catch (IllegalArgumentException ex) {
            throw new CatalogLoadException("Invalid fallback plans in " + describe(resource) + ": " + ex.getMessage(),
                    ex);
        }
    }

    public MockCatalog loadMockCatalog(Resource resource) {
        JsonNode root = read(resource);
        String marker = textOrDefault(root, "marker", "[MOCK]");

        Map<String, ResponseTemplate> templates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("categories").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> texts = validTexts(toStrings(field.getValue()), objectMapper.createObjectNode(), marker,
                    field.getKey());
            if (texts.isEmpty()) {
                log.warn("Skipping mock category '{}' in {}: no usable templates", field.getKey(),
                        describe(resource));
                continue;
            }
            templates.put(field.getKey(), new ResponseTemplate(field.getKey(), texts, Map.of()));
        }

        List<TechnicalTerm> technicalTerms = new ArrayList<>();
        for (JsonNode node : root.path("technicalTerms")) {
            String pattern = text(node, "pattern");
            String category = text(node, "category");
            if (pattern == null || category == null) {
                log.warn("Skipping incomplete technical term in {}", describe(resource));
                continue;
            }
            try {
                technicalTerms.add(TechnicalTerm.of(pattern, category));
            } catch (PatternSyntaxException ex) {
                log.warn("Skipping technical term '{}' in {}: {}", pattern, describe(resource), ex.getDescription());
            }
        }

        List<KeywordCategory> keywordCategories = new ArrayList<>();
        for (JsonNode node : root.path("keywordCategories")) {
            String category = text(node, "category");
            List<String> terms = lowerCase(strings(node, "terms"));
            if (category == null || terms.isEmpty()) {
                log.warn("Skipping keyword category '{}' in {}", category, describe(resource));
                continue;
            }
            keywordCategories.add(new KeywordCategory(category, terms));
        }

        try {
            return new MockCatalog(marker, textOrDefault(root, "defaultCategory", "default"),
                    textOrDefault(root, "namedEntityCategory", "research"), textOrDefault(root, "fallbackTopic", "task"),
                    templates, technicalTerms, keywordCategories,
                    new LinkedHashSet<>(lowerCase(strings(root, "topicStopWords"))));
        } catch (IllegalArgumentException ex) {
            throw new CatalogLoadException("Invalid mock catalog in " + describe(resource) + ": " + ex.getMessage(),
                    ex);
        }
    }

    /**
     * @throws IllegalStateException if a declared tier has no usable parameter entry
     */
    public SkillLevelTable loadSkillLevels(Resource resource) {
        JsonNode root = read(resource);
        List<String> tiers = new ArrayList<>();
        for (String tier : strings(root, "tiers")) {
            tiers.add(tier.strip().toUpperCase(Locale.ROOT));
        }
        Map<String, SkillParameters> parameters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("parameters").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            String tier = field.getKey().strip().toUpperCase(Locale.ROOT);
            if (!node.path("temperature").isNumber() || !node.path("maxTokens").canConvertToInt()) {
                log.warn("Skipping skill parameters of tier {} in {}: temperature and maxTokens are required", tier,
                        describe(resource));
                continue;
            }
            try {
                parameters.put(tier, new SkillParameters(tier, nullToEmpty(text(node, "guidance")),
                        node.get("temperature").asDouble(), node.get("maxTokens").asInt()));
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping skill parameters of tier {} in {}: {}", tier, describe(resource), ex.getMessage());
            }
        }
        return new SkillLevelTable(tiers, parameters);
    }

    public InMemoryUserProfileStore loadUserProfiles(Resource resource) {
        JsonNode root = read(resource);
        List<UserProfile> profiles = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonNode node : root.path("profiles")) {
            String id = text(node, "id");
            if (id == null || !ids.add(id)) {
                log.warn("Skipping user profile '{}' in {}", id, describe(resource));
                continue;
            }
            String skillLevel = node.path("skillLevel").isTextual() ? node.get("skillLevel").asText() : null;
            profiles.add(new UserProfile(id, text(node, "name"), skillLevel));
        }
        log.info("Loaded {} user profiles from {}", profiles.size(), describe(resource));
        return new InMemoryUserProfileStore(profiles);
    }

    public GuidanceCatalog loadGuidance(Resource resource) {
        JsonNode root = read(resource);
        String plannerTemplate = text(root, "plannerTemplate");
        String executorTemplate = text(root, "executorTemplate");
        if (plannerTemplate == null || executorTemplate == null) {
            throw new CatalogLoadException("Planner and executor templates are required in " + describe(resource));
        }
        return new GuidanceCatalog(plannerTemplate, executorTemplate, stringMap(root.path("categories")),
                stringMap(root.path("subtasks")), stringMap(root.path("stages")), text(root, "toneHint"));
    }

    private JsonNode read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isObject()) {
                throw new CatalogLoadException("Catalog " + describe(resource) + " is not a JSON object");
            }
            return root;
        } catch (IOException ex) {
            throw new CatalogLoadException("Could not read catalog " + describe(resource), ex);
        }
    }

    private List<String> validTexts(List<String> texts, JsonNode slots, String marker, String name) {
        List<String> valid = new ArrayList<>();
        for (String text : texts) {
            if (!StringUtils.hasText(text) || !text.contains(marker)) {
                log.warn("Skipping template text of '{}' without marker {}", name, marker);
                continue;
            }
            Set<String> unresolved = new LinkedHashSet<>(ResponseTemplate.placeholders(text));
            unresolved.remove(ResponseTemplate.TOPIC_SLOT);
            slots.fieldNames().forEachRemaining(unresolved::remove);
            if (!unresolved.isEmpty()) {
                log.warn("Skipping template text of '{}' with unknown slots {}", name, unresolved);
                continue;
            }
            valid.add(text);
        }
        return valid;
    }

    private ResponseTemplate buildTemplate(String category, List<String> texts, JsonNode slotsNode) {
        Map<String, SlotGenerator> slots = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = slotsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                slots.put(field.getKey(), slotGenerator(field.getValue()));
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping template '{}': slot {} is invalid ({})", category, field.getKey(), ex.getMessage());
                return null;
            }
        }
        return new ResponseTemplate(category, texts, slots);
    }

    private static SlotGenerator slotGenerator(JsonNode node) {
        String type = nullToEmpty(text(node, "type"));
        String prefix = text(node, "prefix");
        String suffix = text(node, "suffix");
        return switch (type) {
            case "integer" -> new SlotGenerator.IntegerRange(requiredNumber(node, "min").asInt(),
                    requiredNumber(node, "max").asInt(), node.path("grouping").asBoolean(false), prefix, suffix);
            case "decimal" -> new SlotGenerator.DecimalRange(requiredNumber(node, "min").asDouble(),
                    requiredNumber(node, "max").asDouble(), node.path("scale").asInt(1), prefix, suffix);
            case "choice" -> new SlotGenerator.Choice(toStrings(node.path("values")));
            default -> throw new IllegalArgumentException("unknown slot type '" + type + "'");
        };
    }

    private static JsonNode requiredNumber(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be a number");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || !StringUtils.hasText(value.asText())) {
            return null;
        }
        return value.asText();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        String value = text(node, field);
        return value == null ? defaultValue : value;
    }

    private static List<String> strings(JsonNode node, String field) {
        return toStrings(node.path(field));
    }

    private static List<String> toStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && StringUtils.hasText(item.asText())) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                values.put(field.getKey(), field.getValue().asText());
            }
        }
        return values;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String describe(Resource resource) {
        return resource.getDescription();
    }
}
