package net.miragecodex.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.miragecodex.application.search.BookSearchUseCase;
import net.miragecodex.application.search.SearchPipelineException;
import net.miragecodex.controller.dto.SearchRequestPayload;
import net.miragecodex.controller.dto.SearchResponseDto;
import net.miragecodex.controller.support.CurrentUserResolver;
import net.miragecodex.controller.support.ErrorResponseUtils;
import net.miragecodex.domain.search.SearchOutcome;
import net.miragecodex.domain.search.SearchRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Search endpoint over the generated library.
 *
 * <p>Cache hits are public; a miss needs a signed-in caller with credits or a
 * personal provider key. The body is server-paged with a fixed page size.</p>
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class SearchController {

    private final BookSearchUseCase searchUseCase;
    private final CurrentUserResolver currentUserResolver;

    public SearchController(BookSearchUseCase searchUseCase, CurrentUserResolver currentUserResolver) {
        this.searchUseCase = searchUseCase;
        this.currentUserResolver = currentUserResolver;
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponseDto> search(@RequestBody SearchRequestPayload payload,
                                                    HttpServletRequest request) {
        SearchRequest searchRequest = new SearchRequest(
            payload.freeText(),
            payload.languageCode(),
            payload.genreSlug(),
            payload.tagSlugs() == null ? List.of() : payload.tagSlugs(),
            payload.modelId(),
            payload.pageNumber() == null ? 1 : payload.pageNumber(),
            0
        );
        SearchOutcome outcome = searchUseCase.search(searchRequest, currentUserResolver.currentUser(request));
        return ResponseEntity.ok(SearchResponseDto.fromOutcome(outcome));
    }

    @ExceptionHandler(SearchPipelineException.class)
    public ResponseEntity<Map<String, String>> handleSearchFailure(SearchPipelineException exception) {
        if (exception.errorCode().httpStatus() >= 500) {
            log.error("Search failed ({}): {}", exception.errorCode(), exception.getMessage());
        } else {
            log.info("Search rejected ({}): {}", exception.errorCode(), exception.getMessage());
        }
        return ErrorResponseUtils.fromPipelineException(exception);
    }
}
