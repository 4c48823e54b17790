package ch.so.agi.taskpilot.model;

/**
 * Synchronous request/response contract of an external text generation backend.
 */
public interface GenerationBackend {

    /**
     * @throws GenerationBackendException if the backend cannot produce a response
     */
    String generate(GenerationRequest request);
}
