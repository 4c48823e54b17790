package ch.so.agi.taskpilot.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.agi.taskpilot.domain.DomainProfile;

/**
 * Canned subtask lists per category, used when a generated plan cannot be parsed.
 */
public class FallbackPlanStore {

    private static final Logger log = LoggerFactory.getLogger(FallbackPlanStore.class);

    public static final int MIN_STEPS = 3;
    public static final int MAX_STEPS = 7;

    private final Map<String, List<String>> plans;
    private final String defaultCategory;

    public FallbackPlanStore(Map<String, List<String>> plans, String defaultCategory) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        plans.forEach((category, steps) -> {
            if (steps == null || steps.size() < MIN_STEPS || steps.size() > MAX_STEPS) {
                throw new IllegalArgumentException("plan '" + category + "' must have between " + MIN_STEPS + " and "
                        + MAX_STEPS + " steps");
            }
            copy.put(category, List.copyOf(steps));
        });
        if (!copy.containsKey(defaultCategory)) {
            throw new IllegalArgumentException("no plan for default category '" + defaultCategory + "'");
        }
        this.plans = Map.copyOf(copy);
        this.defaultCategory = defaultCategory;
    }

    /**
     * Resolves the plan for a request: the domain's preferred category first, then the classified category,
     * then the default plan.
     *
     * @param domain the detected domain, may be {@code null}
     */
    public List<String> planFor(String category, DomainProfile domain) {
        if (domain != null && domain.preferredCategory() != null && plans.containsKey(domain.preferredCategory())) {
            log.info("Using fallback plan of {} preferred by domain {}", domain.preferredCategory(), domain.name());
            return plans.get(domain.preferredCategory());
        }
        if (category != null && plans.containsKey(category)) {
            log.info("Using fallback plan of category {}", category);
            return plans.get(category);
        }
        log.info("No fallback plan for category {}, using {}", category, defaultCategory);
        return plans.get(defaultCategory);
    }

    public String defaultCategory() {
        return defaultCategory;
    }
}
