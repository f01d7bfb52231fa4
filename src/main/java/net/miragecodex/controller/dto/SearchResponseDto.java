package net.miragecodex.controller.dto;

import java.util.List;
import net.miragecodex.domain.search.SearchOutcome;

/**
 * Response body of {@code POST /api/search}. Repeated identical requests
 * return an identical {@code books} payload.
 */
public record SearchResponseDto(String searchId, boolean cached, int pageNumber, List<SearchBookDto> books) {

    public static SearchResponseDto fromOutcome(SearchOutcome outcome) {
        return new SearchResponseDto(
            outcome.result().searchId().toString(),
            outcome.cached(),
            outcome.result().key().pageNumber(),
            outcome.result().books().stream().map(SearchBookDto::fromRankedBook).toList()
        );
    }
}
