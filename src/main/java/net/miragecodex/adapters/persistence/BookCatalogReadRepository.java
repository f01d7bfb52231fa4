package net.miragecodex.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.domain.book.AuthorBookSummary;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.book.EditionSummary;
import net.miragecodex.domain.book.RandomBook;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read queries over persisted books for the catalog endpoints.
 */
@Repository
public class BookCatalogReadRepository {

    private final JdbcTemplate jdbcTemplate;

    public BookCatalogReadRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Editions of a book, newest first.
     */
    public List<EditionSummary> findEditions(UUID bookId) {
        return jdbcTemplate.query(
            """
            SELECT e.id, e.book_id, l.code AS language_code, l.label AS language_label,
                   m.id AS model_id, m.name AS model_name, e.created_at
            FROM editions e
            JOIN languages l ON l.id = e.language_id
            JOIN models m ON m.id = e.model_id
            WHERE e.book_id = ?
            ORDER BY e.created_at DESC
            """,
            (rs, rowNum) -> new EditionSummary(
                rs.getObject("id", UUID.class),
                rs.getObject("book_id", UUID.class),
                rs.getString("language_code"),
                rs.getString("language_label"),
                rs.getInt("model_id"),
                rs.getString("model_name"),
                toInstant(rs.getTimestamp("created_at"))
            ),
            bookId
        );
    }

    /**
     * Books by an author, newest first, optionally excluding one book.
     */
    public List<AuthorBookSummary> findBooksByAuthor(UUID authorId, @Nullable UUID excludeBookId, int limit, int offset) {
        StringBuilder sql = new StringBuilder("""
            SELECT id, title, page_count, genre_slug, created_at
            FROM books
            WHERE author_id = ?
            """);
        List<Object> args = new ArrayList<>();
        args.add(authorId);
        if (excludeBookId != null) {
            sql.append("  AND id <> ?\n");
            args.add(excludeBookId);
        }
        sql.append("ORDER BY created_at DESC, id DESC\nLIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);
        return jdbcTemplate.query(
            sql.toString(),
            (rs, rowNum) -> new AuthorBookSummary(
                rs.getObject("id", UUID.class),
                rs.getString("title"),
                rs.getInt("page_count"),
                rs.getString("genre_slug"),
                toInstant(rs.getTimestamp("created_at"))
            ),
            args.toArray()
        );
    }

    /**
     * One stored edition picked at random, with its book, author and genre.
     */
    public Optional<RandomBook> findRandomBook() {
        return jdbcTemplate.query(
            """
            SELECT b.id AS book_id, b.title, b.summary, b.page_count, b.cover_url,
                   a.id AS author_id, a.pen_name, a.style_prompt, a.bio,
                   g.slug AS genre_slug, g.label AS genre_label,
                   e.id AS edition_id, l.code AS language_code, m.id AS model_id, m.name AS model_name
            FROM editions e
            JOIN books b ON b.id = e.book_id
            JOIN authors a ON a.id = b.author_id
            JOIN genres g ON g.slug = b.genre_slug
            JOIN languages l ON l.id = e.language_id
            JOIN models m ON m.id = e.model_id
            ORDER BY random()
            LIMIT 1
            """,
            (rs, rowNum) -> new RandomBook(
                rs.getObject("book_id", UUID.class),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getInt("page_count"),
                rs.getString("cover_url"),
                new AuthorProfile(
                    rs.getObject("author_id", UUID.class),
                    rs.getString("pen_name"),
                    rs.getString("style_prompt"),
                    rs.getString("bio")
                ),
                rs.getString("genre_slug"),
                rs.getString("genre_label"),
                rs.getObject("edition_id", UUID.class),
                rs.getString("language_code"),
                rs.getInt("model_id"),
                rs.getString("model_name")
            )
        ).stream().findFirst();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : Instant.EPOCH;
    }
}
