package net.miragecodex.application.generation;

import tools.jackson.databind.JsonNode;

/**
 * Capability that turns a prompt into a JSON object.
 *
 * <p>Implementations throw {@link ContentGenerationException} with
 * {@code TRANSPORT_FAILED} for network errors and timeouts, and
 * {@code SCHEMA_VIOLATION} when the reply is not a JSON object.</p>
 */
public interface StructuredGenerationClient {

    JsonNode generate(StructuredGenerationRequest request);

    /**
     * Whether a platform credential is configured. Requests carrying a
     * personal key may succeed even when this is false.
     */
    boolean isPlatformConfigured();
}
