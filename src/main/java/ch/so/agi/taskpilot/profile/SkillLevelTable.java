package ch.so.agi.taskpilot.profile;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generation parameters per declared skill tier. The first declared tier is the lowest one and serves as
 * fallback for unknown tiers.
 */
public class SkillLevelTable {

    private final List<String> tiers;
    private final Map<String, SkillParameters> parameters;

    public SkillLevelTable(List<String> tiers, Map<String, SkillParameters> parameters) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalStateException("no skill tiers declared");
        }
        for (String tier : tiers) {
            if (parameters == null || !parameters.containsKey(tier)) {
                throw new IllegalStateException("skill tier " + tier + " has no parameter entry");
            }
        }
        this.tiers = List.copyOf(tiers);
        this.parameters = Map.copyOf(parameters);
    }

    public List<String> tiers() {
        return tiers;
    }

    public String lowestTier() {
        return tiers.get(0);
    }

    public Optional<SkillParameters> find(String tier) {
        if (tier == null || !tiers.contains(tier)) {
            return Optional.empty();
        }
        return Optional.of(parameters.get(tier));
    }

    public SkillParameters lowest() {
        return parameters.get(lowestTier());
    }
}
