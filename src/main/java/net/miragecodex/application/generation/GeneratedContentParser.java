package net.miragecodex.application.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.generation.FacetClassification;
import net.miragecodex.domain.generation.GeneratedAuthor;
import net.miragecodex.domain.generation.GeneratedBook;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Maps generator JSON onto domain records, enforcing the exact field set and item count.
 *
 * <p>Every rejection is a {@code SCHEMA_VIOLATION} (or a
 * {@code SECTION_PARTITION_VIOLATION} for bad page ranges) so the gateway
 * retries it like a transport failure.</p>
 */
class GeneratedContentParser {

    static final String AUTHORS_FIELD = "authors";
    static final String BOOKS_FIELD = "books";
    static final String PAGE_FIELD = "content";

    private static final Set<String> AUTHOR_FIELDS = Set.of("penName", "stylePrompt", "bio");
    private static final Set<String> BOOK_FIELDS = Set.of("title", "summary", "pageCount", "bookCoverPrompt", "sections");
    private static final Set<String> SECTION_FIELDS = Set.of("title", "fromPage", "toPage", "summary");
    private static final Set<String> CLASSIFICATION_FIELDS = Set.of("genreSlug", "languageCode", "reasoning");

    private final int maxPagesPerBook;

    GeneratedContentParser(int maxPagesPerBook) {
        this.maxPagesPerBook = maxPagesPerBook;
    }

    List<GeneratedAuthor> parseAuthors(JsonNode payload, int expectedCount) {
        List<GeneratedAuthor> authors = new ArrayList<>();
        for (JsonNode authorNode : requireArray(payload, AUTHORS_FIELD, expectedCount)) {
            requireExactFields(authorNode, AUTHOR_FIELDS, "author");
            authors.add(new GeneratedAuthor(
                requiredText(authorNode, "penName"),
                requiredText(authorNode, "stylePrompt"),
                requiredText(authorNode, "bio")
            ));
        }
        return List.copyOf(authors);
    }

    List<GeneratedBook> parseBooks(JsonNode payload, int expectedCount) {
        List<GeneratedBook> books = new ArrayList<>();
        for (JsonNode bookNode : requireArray(payload, BOOKS_FIELD, expectedCount)) {
            requireExactFields(bookNode, BOOK_FIELDS, "book");
            String title = requiredText(bookNode, "title");
            int pageCount = requiredInt(bookNode, "pageCount");
            if (pageCount < 1 || pageCount > maxPagesPerBook) {
                throw schemaViolation("book '%s' has pageCount %d outside [1, %d]".formatted(title, pageCount, maxPagesPerBook));
            }
            List<BookSection> sections = parseSections(bookNode.get("sections"), title);
            books.add(new GeneratedBook(
                title,
                requiredText(bookNode, "summary"),
                pageCount,
                requiredText(bookNode, "bookCoverPrompt"),
                BookSectionValidator.validate(sections, pageCount)
            ));
        }
        return List.copyOf(books);
    }

    FacetClassification parseClassification(JsonNode payload) {
        for (Map.Entry<String, JsonNode> property : payload.properties()) {
            if (!CLASSIFICATION_FIELDS.contains(property.getKey())) {
                throw schemaViolation("classification has unexpected field '" + property.getKey() + "'");
            }
        }
        return new FacetClassification(
            requiredText(payload, "genreSlug"),
            requiredText(payload, "languageCode")
        );
    }

    String parsePage(JsonNode payload) {
        requireExactFields(payload, Set.of(PAGE_FIELD), "page");
        return requiredText(payload, PAGE_FIELD);
    }

    private List<BookSection> parseSections(JsonNode sectionsNode, String bookTitle) {
        if (sectionsNode == null || !sectionsNode.isArray() || sectionsNode.isEmpty()) {
            throw schemaViolation("book '" + bookTitle + "' has no sections array");
        }
        List<BookSection> sections = new ArrayList<>();
        for (JsonNode sectionNode : sectionsNode) {
            requireExactFields(sectionNode, SECTION_FIELDS, "section");
            sections.add(new BookSection(
                requiredText(sectionNode, "title"),
                requiredInt(sectionNode, "fromPage"),
                requiredInt(sectionNode, "toPage"),
                requiredText(sectionNode, "summary")
            ));
        }
        return sections;
    }

    private static JsonNode requireArray(JsonNode payload, String field, int expectedCount) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isArray()) {
            throw schemaViolation("response is missing array '" + field + "'");
        }
        if (node.size() != expectedCount) {
            throw schemaViolation("expected exactly %d %s but received %d".formatted(expectedCount, field, node.size()));
        }
        return node;
    }

    private static void requireExactFields(JsonNode node, Set<String> expected, String label) {
        if (node == null || !node.isObject()) {
            throw schemaViolation(label + " entry is not an object");
        }
        for (Map.Entry<String, JsonNode> property : node.properties()) {
            if (!expected.contains(property.getKey())) {
                throw schemaViolation(label + " has unexpected field '" + property.getKey() + "'");
            }
        }
        for (String field : expected) {
            if (!node.has(field)) {
                throw schemaViolation(label + " is missing field '" + field + "'");
            }
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isString() || !StringUtils.hasText(value.asString())) {
            throw schemaViolation("field '" + field + "' must be a non-blank string");
        }
        return value.asString().trim();
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isInt()) {
            throw schemaViolation("field '" + field + "' must be an integer");
        }
        return value.asInt();
    }

    private static ContentGenerationException schemaViolation(String detail) {
        return new ContentGenerationException(ErrorCode.SCHEMA_VIOLATION, "Generated content rejected: " + detail);
    }
}
