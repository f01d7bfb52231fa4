package net.miragecodex.application.search;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.domain.search.SearchRequest;
import net.miragecodex.util.HashUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Derives the cache key of a search request.
 *
 * <p>The fingerprint is the SHA-256 of a compact JSON object with keys in
 * lexicographic order: {@code freeText} (trimmed, null when blank),
 * {@code genreSlug}, {@code pageNumber}, {@code pageSize} and {@code tagSlugs}
 * (trimmed, de-duplicated, sorted). Language and model are left out: they pick
 * an edition of the same result set.</p>
 */
@Component
public class SearchKeyCanonicalizer {

    // Private mapper so application-wide Jackson settings cannot change the bytes we hash.
    private final ObjectMapper canonicalMapper = new ObjectMapper();

    /**
     * Rejects requests that cannot be fingerprinted.
     *
     * @throws SearchPipelineException with {@code INVALID_REQUEST}
     */
    public void validate(SearchRequest request) {
        if (request == null) {
            throw SearchPipelineException.invalid("Search request is required");
        }
        if (request.modelId() == null) {
            throw SearchPipelineException.invalid("modelId is required");
        }
        if (!StringUtils.hasText(request.freeText())
                && !StringUtils.hasText(request.genreSlug())
                && !StringUtils.hasText(request.languageCode())) {
            throw SearchPipelineException.invalid("Provide freeText, genreSlug or languageCode");
        }
        if (request.pageNumber() < 1) {
            throw SearchPipelineException.invalid("pageNumber must be at least 1");
        }
        if (request.pageSize() < 1) {
            throw SearchPipelineException.invalid("pageSize must be at least 1");
        }
    }

    /**
     * Computes the cache key of a validated request.
     */
    public SearchKey fingerprint(SearchRequest request) {
        validate(request);
        return new SearchKey(HashUtils.sha256Hex(canonicalJson(request)), request.pageNumber());
    }

    String canonicalJson(SearchRequest request) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("freeText", normalizeFreeText(request.freeText()));
        canonical.put("genreSlug", StringUtils.hasText(request.genreSlug()) ? request.genreSlug().trim() : null);
        canonical.put("pageNumber", request.pageNumber());
        canonical.put("pageSize", request.pageSize());
        canonical.put("tagSlugs", normalizeTags(request.tagSlugs()));
        try {
            return canonicalMapper.writeValueAsString(canonical);
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to serialize canonical search key", exception);
        }
    }

    static String normalizeFreeText(String freeText) {
        return StringUtils.hasText(freeText) ? freeText.trim() : null;
    }

    static List<String> normalizeTags(List<String> tagSlugs) {
        if (tagSlugs == null) {
            return List.of();
        }
        return tagSlugs.stream()
            .filter(StringUtils::hasText)
            .map(String::trim)
            .distinct()
            .sorted()
            .toList();
    }
}
