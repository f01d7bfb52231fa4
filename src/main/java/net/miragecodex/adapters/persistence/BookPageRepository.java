package net.miragecodex.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.domain.book.BookPage;
import net.miragecodex.domain.book.BookPageKey;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.book.EditionDetails;
import net.miragecodex.domain.catalog.GenerationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for generated book pages, addressed by {@code (edition_id, page_number)}.
 */
@Repository
public class BookPageRepository {

    private static final Logger log = LoggerFactory.getLogger(BookPageRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public BookPageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<BookPage> find(BookPageKey key) {
        return jdbcTemplate.query(
            "SELECT edition_id, page_number, content, created_at FROM book_pages WHERE edition_id = ? AND page_number = ?",
            (rs, rowNum) -> new BookPage(
                rs.getObject("edition_id", UUID.class),
                rs.getInt("page_number"),
                rs.getString("content"),
                toInstant(rs.getTimestamp("created_at"))
            ),
            key.editionId(),
            key.pageNumber()
        ).stream().findFirst();
    }

    /**
     * Stores a generated page unless another writer stored it first.
     *
     * @return whether this call created the row
     */
    public boolean insert(BookPageKey key, String content, @Nullable String userId) {
        int inserted = jdbcTemplate.update(
            """
            INSERT INTO book_pages (edition_id, page_number, content, user_id, created_at)
            VALUES (?, ?, ?, ?, NOW())
            ON CONFLICT (edition_id, page_number) DO NOTHING
            """,
            key.editionId(),
            key.pageNumber(),
            content,
            userId
        );
        if (inserted == 0) {
            log.info("Book page {} already stored by another writer", key);
        }
        return inserted > 0;
    }

    /**
     * Loads an edition with its book, author, language, model and sections.
     * Editions whose model is no longer active are still returned.
     */
    @Transactional(readOnly = true)
    public Optional<EditionDetails> findEditionDetails(UUID editionId) {
        Optional<EditionHeader> header = jdbcTemplate.query(
            """
            SELECT e.id AS edition_id, b.id AS book_id, b.title, b.summary, b.page_count,
                   a.pen_name, a.style_prompt, l.code AS language_code,
                   m.id AS model_id, m.name AS model_name, m.domain_code,
                   m.search_credits, m.page_generation_credits
            FROM editions e
            JOIN books b ON b.id = e.book_id
            JOIN authors a ON a.id = b.author_id
            JOIN languages l ON l.id = e.language_id
            JOIN models m ON m.id = e.model_id
            WHERE e.id = ?
            """,
            (rs, rowNum) -> new EditionHeader(
                rs.getObject("edition_id", UUID.class),
                rs.getObject("book_id", UUID.class),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getInt("page_count"),
                rs.getString("pen_name"),
                rs.getString("style_prompt"),
                rs.getString("language_code"),
                new GenerationModel(
                    rs.getInt("model_id"),
                    rs.getString("model_name"),
                    rs.getString("domain_code"),
                    rs.getObject("search_credits", Integer.class),
                    rs.getObject("page_generation_credits", Integer.class)
                )
            ),
            editionId
        ).stream().findFirst();
        if (header.isEmpty()) {
            return Optional.empty();
        }
        EditionHeader found = header.get();
        List<BookSection> sections = jdbcTemplate.query(
            "SELECT title, from_page, to_page, summary FROM book_sections WHERE book_id = ? ORDER BY order_index",
            (rs, rowNum) -> new BookSection(
                rs.getString("title"),
                rs.getInt("from_page"),
                rs.getInt("to_page"),
                rs.getString("summary")
            ),
            found.bookId()
        );
        return Optional.of(new EditionDetails(
            found.editionId(),
            found.bookId(),
            found.title(),
            found.summary(),
            found.pageCount(),
            found.penName(),
            found.stylePrompt(),
            found.languageCode(),
            found.model(),
            sections
        ));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : Instant.EPOCH;
    }

    private record EditionHeader(UUID editionId,
                                 UUID bookId,
                                 String title,
                                 String summary,
                                 int pageCount,
                                 String penName,
                                 String stylePrompt,
                                 String languageCode,
                                 GenerationModel model) {
    }
}
