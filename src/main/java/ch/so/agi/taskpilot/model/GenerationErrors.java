package ch.so.agi.taskpilot.model;

/**
 * Machine-checkable error strings returned to callers instead of exceptions.
 */
public final class GenerationErrors {

    public static final String PREFIX = "Error: ";

    private GenerationErrors() {
    }

    public static String of(String message) {
        return PREFIX + (message == null ? "unknown failure" : message);
    }

    public static boolean isError(String text) {
        return text != null && text.startsWith(PREFIX);
    }
}
