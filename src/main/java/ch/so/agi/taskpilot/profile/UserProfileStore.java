package ch.so.agi.taskpilot.profile;

import java.util.Optional;

public interface UserProfileStore {
    Optional<UserProfile> findById(String userId);
}
