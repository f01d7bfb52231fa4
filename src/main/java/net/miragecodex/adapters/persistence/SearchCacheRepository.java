package net.miragecodex.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.book.BookRecord;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.generation.GeneratedBook;
import net.miragecodex.domain.search.BookDraft;
import net.miragecodex.domain.search.CacheWrite;
import net.miragecodex.domain.search.CachedSearch;
import net.miragecodex.domain.search.RankedBook;
import net.miragecodex.domain.search.SearchCommit;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for cached search pages.
 *
 * <p>A page is addressed by {@code (fingerprint, page_number)}, which carries a
 * unique constraint. Reads return fully denormalized rows so a hit never
 * needs the generator; writes store the whole book/edition/search graph in
 * one transaction.</p>
 */
@Repository
public class SearchCacheRepository {

    private static final Logger log = LoggerFactory.getLogger(SearchCacheRepository.class);

    private static final TypeReference<List<BookSection>> SECTION_LIST = new TypeReference<>() {};

    private static final String RANKED_BOOKS_SQL = """
        SELECT sb.rank,
               b.id AS book_id, b.title, b.summary, b.page_count, b.cover_prompt, b.cover_url,
               b.primary_language_id,
               a.id AS author_id, a.pen_name, a.style_prompt, a.bio,
               e.id AS edition_id, e.model_id,
               l.code AS language_code, l.label AS language_label,
               COALESCE((
                   SELECT json_agg(json_build_object(
                              'title', s.title,
                              'fromPage', s.from_page,
                              'toPage', s.to_page,
                              'summary', s.summary) ORDER BY s.order_index)
                   FROM book_sections s
                   WHERE s.book_id = b.id
               ), '[]'::json)::text AS sections_json
        FROM search_books sb
        JOIN books b ON b.id = sb.book_id
        JOIN authors a ON a.id = b.author_id
        JOIN editions e ON e.id = sb.edition_id
        JOIN languages l ON l.id = e.language_id
        WHERE sb.search_id = ?
        ORDER BY sb.rank
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SearchCacheRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the cached page for the key. Pure read.
     *
     * @param key fingerprint and page number
     * @return the persisted page when present
     */
    @Transactional(readOnly = true)
    public Optional<CachedSearch> find(SearchKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
        Optional<SearchHeader> header = jdbcTemplate.query(
            "SELECT id, created_at FROM searches WHERE fingerprint = ? AND page_number = ?",
            rs -> {
                if (!rs.next()) {
                    return Optional.<SearchHeader>empty();
                }
                Timestamp createdAt = rs.getTimestamp("created_at");
                if (createdAt == null) {
                    throw new IllegalStateException("Persisted search missing created_at for " + key);
                }
                return Optional.of(new SearchHeader(rs.getObject("id", UUID.class), createdAt));
            },
            key.fingerprint(),
            key.pageNumber()
        );
        if (header.isEmpty()) {
            return Optional.empty();
        }
        List<RankedBook> books = jdbcTemplate.query(
            RANKED_BOOKS_SQL,
            (rs, rowNum) -> mapRankedBook(rs),
            header.get().id()
        );
        return Optional.of(new CachedSearch(header.get().id(), key, books, header.get().createdAt().toInstant()));
    }

    /**
     * Stores a generated page with its books, sections, editions and ranking.
     *
     * <p>Idempotent per key: when another writer already stored the page, nothing
     * is written and the existing page is returned.</p>
     *
     * @param commit generated page, books in rank order
     * @return the persisted page as subsequent readers will see it, flagged
     *         with whether this call created it
     */
    @Transactional
    public CacheWrite put(SearchCommit commit) {
        if (commit == null || commit.books().isEmpty()) {
            throw new IllegalArgumentException("commit with at least one book is required");
        }
        SearchKey key = commit.key();
        UUID searchId = IdGenerator.uuidV7();

        int inserted = jdbcTemplate.update(
            """
            INSERT INTO searches (id, fingerprint, page_number, page_size, user_id, language_id, model_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (fingerprint, page_number) DO NOTHING
            """,
            searchId,
            key.fingerprint(),
            key.pageNumber(),
            commit.pageSize(),
            commit.userId(),
            commit.language().id(),
            commit.modelId()
        );
        if (inserted == 0) {
            log.info("Search page {} already stored by another writer; returning existing result", key);
            CachedSearch existing = find(key).orElseThrow(() ->
                new IllegalStateException("Search page " + key + " conflicted but could not be read back"));
            return new CacheWrite(existing, false);
        }

        jdbcTemplate.update(
            "INSERT INTO search_params (search_id, free_text, genre_slug, tag_slugs) VALUES (?, ?, ?, CAST(? AS jsonb))",
            searchId,
            commit.freeText(),
            commit.genreSlug(),
            serializeJson(commit.tagSlugs())
        );

        int rank = 1;
        for (BookDraft draft : commit.books()) {
            UUID bookId = insertBook(draft, commit);
            UUID editionId = IdGenerator.uuidV7();
            jdbcTemplate.update(
                "INSERT INTO editions (id, book_id, language_id, model_id, created_at) VALUES (?, ?, ?, ?, NOW())",
                editionId,
                bookId,
                commit.language().id(),
                commit.modelId()
            );
            jdbcTemplate.update(
                "INSERT INTO search_books (search_id, rank, book_id, edition_id) VALUES (?, ?, ?, ?)",
                searchId,
                rank,
                bookId,
                editionId
            );
            rank++;
        }

        log.debug("Stored search page {} with {} books", key, commit.books().size());
        CachedSearch stored = find(key).orElseThrow(() ->
            new IllegalStateException("Search page " + key + " was written but could not be read back"));
        return new CacheWrite(stored, true);
    }

    private UUID insertBook(BookDraft draft, SearchCommit commit) {
        GeneratedBook book = draft.book();
        UUID bookId = IdGenerator.uuidV7();
        jdbcTemplate.update(
            """
            INSERT INTO books (id, title, summary, page_count, cover_prompt, author_id, primary_language_id, genre_slug, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, NOW())
            """,
            bookId,
            book.title(),
            book.summary(),
            book.pageCount(),
            book.coverPrompt(),
            draft.author().id(),
            commit.language().id(),
            commit.genreSlug()
        );
        List<Object[]> sectionRows = new ArrayList<>();
        int orderIndex = 0;
        for (BookSection section : book.sections()) {
            sectionRows.add(new Object[] {
                bookId, orderIndex++, section.title(), section.fromPage(), section.toPage(), section.summary()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO book_sections (book_id, order_index, title, from_page, to_page, summary) VALUES (?, ?, ?, ?, ?, ?)",
            sectionRows
        );
        return bookId;
    }

    private RankedBook mapRankedBook(ResultSet rs) throws SQLException {
        UUID bookId = rs.getObject("book_id", UUID.class);
        UUID authorId = rs.getObject("author_id", UUID.class);
        BookRecord book = new BookRecord(
            bookId,
            rs.getString("title"),
            rs.getString("summary"),
            rs.getInt("page_count"),
            rs.getString("cover_prompt"),
            rs.getString("cover_url"),
            deserializeSections(rs.getString("sections_json"), bookId),
            authorId,
            rs.getInt("primary_language_id")
        );
        AuthorProfile author = new AuthorProfile(
            authorId,
            rs.getString("pen_name"),
            rs.getString("style_prompt"),
            rs.getString("bio")
        );
        return new RankedBook(
            rs.getInt("rank"),
            book,
            author,
            rs.getObject("edition_id", UUID.class),
            rs.getInt("model_id"),
            rs.getString("language_code"),
            rs.getString("language_label")
        );
    }

    private List<BookSection> deserializeSections(String sectionsJson, UUID bookId) {
        if (sectionsJson == null || sectionsJson.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(sectionsJson, SECTION_LIST);
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to deserialize sections for book " + bookId, exception);
        }
    }

    private String serializeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to serialize search parameters", exception);
        }
    }

    private record SearchHeader(UUID id, Timestamp createdAt) {
    }
}
