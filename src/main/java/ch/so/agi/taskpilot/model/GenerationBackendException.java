package ch.so.agi.taskpilot.model;

public class GenerationBackendException extends RuntimeException {

    public GenerationBackendException(String message) {
        super(message);
    }

    public GenerationBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
