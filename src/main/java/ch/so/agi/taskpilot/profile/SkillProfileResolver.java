package ch.so.agi.taskpilot.profile;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the generation parameters of a user. Missing profiles, missing tiers and unknown tiers all fall
 * back to the lowest tier.
 */
@Component
public class SkillProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(SkillProfileResolver.class);

    private final UserProfileStore profileStore;
    private final SkillLevelTable skillLevels;

    public SkillProfileResolver(UserProfileStore profileStore, SkillLevelTable skillLevels) {
        this.profileStore = profileStore;
        this.skillLevels = skillLevels;
    }

    public SkillParameters resolve(String userId) {
        Optional<UserProfile> profile = profileStore.findById(userId);
        if (profile.isEmpty()) {
            log.info("No profile for user '{}', using tier {}", userId, skillLevels.lowestTier());
            return skillLevels.lowest();
        }

        String declared = profile.get().skillLevel();
        String tier = declared == null ? "" : declared.strip().toUpperCase(Locale.ROOT);
        Optional<SkillParameters> parameters = skillLevels.find(tier);
        if (parameters.isEmpty()) {
            log.warn("Invalid or missing skill tier '{}' for user '{}', using {}", declared, userId,
                    skillLevels.lowestTier());
            return skillLevels.lowest();
        }
        if (log.isDebugEnabled()) {
            log.debug("User '{}' resolved to tier {}", userId, tier);
        }
        return parameters.get();
    }
}
