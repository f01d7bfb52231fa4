package net.miragecodex.domain.generation;

import jakarta.annotation.Nullable;

/**
 * Which provider model to call, and with whose credentials.
 *
 * @param modelName provider model name
 * @param personalApiKey caller-supplied key; null means the platform key
 */
public record GenerationTarget(String modelName, @Nullable String personalApiKey) {

    public static GenerationTarget platform(String modelName) {
        return new GenerationTarget(modelName, null);
    }

    @Override
    public String toString() {
        return "GenerationTarget[modelName=" + modelName + ", personalKey=" + (personalApiKey != null) + "]";
    }
}
