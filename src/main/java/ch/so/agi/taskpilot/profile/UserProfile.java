package ch.so.agi.taskpilot.profile;

/**
 * @param skillLevel declared skill tier as stored, may be {@code null}
 */
public record UserProfile(String userId, String name, String skillLevel) {
}
