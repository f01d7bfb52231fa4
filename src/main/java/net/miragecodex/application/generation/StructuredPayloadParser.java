package net.miragecodex.application.generation;

import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Extracts the JSON object from raw model output.
 *
 * <p>Strips markdown fences and falls back to the outermost brace pair when
 * the model wraps the object in prose.</p>
 */
class StructuredPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredPayloadParser.class);

    private final ObjectMapper objectMapper;

    StructuredPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ContentGenerationException with {@code SCHEMA_VIOLATION} when no JSON object can be read
     */
    JsonNode parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw schemaViolation("Generator response was empty", null);
        }
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        JsonNode node;
        try {
            node = objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw schemaViolation("Generator response did not include a JSON object", initialParseException);
            }
            log.warn("Generator response required brace extraction fallback (initial parse failed: {})",
                initialParseException.getMessage());
            try {
                node = objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1));
            } catch (JacksonException exception) {
                throw schemaViolation("Generator response JSON parsing failed", exception);
            }
        }
        if (node == null || !node.isObject()) {
            throw schemaViolation("Generator response was not a JSON object", null);
        }
        return node;
    }

    private static ContentGenerationException schemaViolation(String message, Throwable cause) {
        return new ContentGenerationException(ErrorCode.SCHEMA_VIOLATION, message, cause);
    }
}
