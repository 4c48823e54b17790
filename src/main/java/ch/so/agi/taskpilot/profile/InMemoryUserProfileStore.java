package ch.so.agi.taskpilot.profile;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryUserProfileStore implements UserProfileStore {

    private final Map<String, UserProfile> profiles;

    public InMemoryUserProfileStore(Collection<UserProfile> profiles) {
        Map<String, UserProfile> byId = new LinkedHashMap<>();
        for (UserProfile profile : profiles) {
            byId.put(profile.userId(), profile);
        }
        this.profiles = Map.copyOf(byId);
    }

    @Override
    public Optional<UserProfile> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(userId));
    }
}
