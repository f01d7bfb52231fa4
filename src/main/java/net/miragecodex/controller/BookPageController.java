package net.miragecodex.controller;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.miragecodex.application.page.BookPageException;
import net.miragecodex.application.page.BookPageService;
import net.miragecodex.controller.dto.BookPageDto;
import net.miragecodex.controller.dto.BookPageStatusDto;
import net.miragecodex.controller.support.CurrentUserResolver;
import net.miragecodex.controller.support.ErrorResponseUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reading the pages of an edition.
 *
 * <p>{@code GET} only reports what is stored. {@code POST} writes the page when
 * it is missing, which needs a signed-in caller.</p>
 */
@RestController
@RequestMapping("/api/editions/{editionId}/pages")
@Slf4j
public class BookPageController {

    private final BookPageService pageService;
    private final CurrentUserResolver currentUserResolver;

    public BookPageController(BookPageService pageService, CurrentUserResolver currentUserResolver) {
        this.pageService = pageService;
        this.currentUserResolver = currentUserResolver;
    }

    @GetMapping("/{pageNumber}")
    public BookPageStatusDto pageStatus(@PathVariable UUID editionId, @PathVariable int pageNumber) {
        return pageService.findStored(editionId, pageNumber)
            .map(page -> new BookPageStatusDto(true, page.content()))
            .orElseGet(() -> new BookPageStatusDto(false, null));
    }

    @PostMapping("/{pageNumber}")
    public BookPageDto readPage(@PathVariable UUID editionId,
                                @PathVariable int pageNumber,
                                HttpServletRequest request) {
        return BookPageDto.fromOutcome(
            pageService.readOrWrite(editionId, pageNumber, currentUserResolver.currentUser(request)));
    }

    @ExceptionHandler(BookPageException.class)
    public ResponseEntity<Map<String, String>> handlePageFailure(BookPageException exception) {
        if (exception.errorCode().httpStatus() >= 500) {
            log.error("Page request failed ({}): {}", exception.errorCode(), exception.getMessage());
        } else {
            log.info("Page request rejected ({}): {}", exception.errorCode(), exception.getMessage());
        }
        return ErrorResponseUtils.fromPageException(exception);
    }
}
