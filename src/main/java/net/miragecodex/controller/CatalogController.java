package net.miragecodex.controller;

import java.util.List;
import java.util.UUID;
import net.miragecodex.application.catalog.CatalogReadService;
import net.miragecodex.controller.dto.AuthorBookDto;
import net.miragecodex.controller.dto.EditionDto;
import net.miragecodex.controller.dto.ModelCreditCostsDto;
import net.miragecodex.controller.dto.RandomBookDto;
import net.miragecodex.controller.support.ErrorResponseUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public read endpoints over models, editions, author bibliographies and a random pick.
 */
@RestController
@RequestMapping("/api")
public class CatalogController {

    private final CatalogReadService catalogReadService;

    public CatalogController(CatalogReadService catalogReadService) {
        this.catalogReadService = catalogReadService;
    }

    @GetMapping("/models/{modelId}/credit-costs")
    public ResponseEntity<?> creditCosts(@PathVariable int modelId) {
        return catalogReadService.creditCosts(modelId)
            .<ResponseEntity<?>>map(costs -> ResponseEntity.ok(ModelCreditCostsDto.fromCosts(costs)))
            .orElseGet(() -> ErrorResponseUtils.notFound("Unknown model " + modelId));
    }

    @GetMapping("/books/{bookId}/editions")
    public List<EditionDto> editions(@PathVariable UUID bookId) {
        return catalogReadService.editions(bookId).stream().map(EditionDto::fromEdition).toList();
    }

    @GetMapping("/books/random")
    public ResponseEntity<?> randomBook() {
        return catalogReadService.randomBook()
            .<ResponseEntity<?>>map(book -> ResponseEntity.ok(RandomBookDto.fromRandomBook(book)))
            .orElseGet(() -> ErrorResponseUtils.notFound("No books available"));
    }

    @GetMapping("/authors/{authorId}/books")
    public List<AuthorBookDto> authorBooks(@PathVariable UUID authorId,
                                           @RequestParam(required = false) UUID excludeBookId,
                                           @RequestParam(defaultValue = "10") int limit,
                                           @RequestParam(defaultValue = "0") int offset) {
        return catalogReadService.authorBooks(authorId, excludeBookId, limit, offset).stream()
            .map(AuthorBookDto::fromSummary)
            .toList();
    }
}
