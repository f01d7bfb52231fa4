package net.miragecodex.adapters.persistence;

import java.util.List;
import java.util.UUID;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.generation.GeneratedAuthor;
import net.miragecodex.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres adapter for authors.
 *
 * <p>Owns pen-name uniqueness: inserts rely on the {@code authors.pen_name}
 * unique constraint and retry with a random suffix on conflict.</p>
 */
@Repository
public class AuthorRepository {

    private static final Logger log = LoggerFactory.getLogger(AuthorRepository.class);

    static final int MAX_PEN_NAME_ATTEMPTS = 5;

    private static final RowMapper<AuthorProfile> AUTHOR_MAPPER = (rs, rowNum) -> new AuthorProfile(
        rs.getObject("id", UUID.class),
        rs.getString("pen_name"),
        rs.getString("style_prompt"),
        rs.getString("bio")
    );

    private final JdbcTemplate jdbcTemplate;

    public AuthorRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Random sample of authors generated for the genre or with at least one book in it.
     *
     * <p>Authors whose first page failed to persist have no books yet and are
     * found through {@code origin_genre_slug}.</p>
     */
    public List<AuthorProfile> findRandomByGenre(String genreSlug, int limit) {
        if (limit < 1) {
            return List.of();
        }
        return jdbcTemplate.query(
            """
            SELECT a.id, a.pen_name, a.style_prompt, a.bio
            FROM authors a
            WHERE a.origin_genre_slug = ?
               OR EXISTS (
                   SELECT 1 FROM books b WHERE b.author_id = a.id AND b.genre_slug = ?
               )
            ORDER BY random()
            LIMIT ?
            """,
            AUTHOR_MAPPER,
            genreSlug,
            genreSlug,
            limit
        );
    }

    /**
     * Persists a generated author under a pen name with a random base62 suffix.
     *
     * <p>A conflict on the unique pen name retries with a fresh suffix. Runs
     * outside the search transaction, so a later failure leaves the author in
     * place; {@code originGenreSlug} keeps it reachable for reuse.</p>
     *
     * @throws IllegalStateException when no unique pen name was found
     */
    public AuthorProfile insertWithUniquePenName(GeneratedAuthor author, String originGenreSlug) {
        String basePenName = author.penName().trim();
        for (int attempt = 1; attempt <= MAX_PEN_NAME_ATTEMPTS; attempt++) {
            String candidate = basePenName + " " + IdGenerator.penNameSuffix();
            UUID id = IdGenerator.uuidV7();
            int inserted = jdbcTemplate.update(
                """
                INSERT INTO authors (id, pen_name, style_prompt, bio, origin_genre_slug, created_at)
                VALUES (?, ?, ?, ?, ?, NOW())
                ON CONFLICT (pen_name) DO NOTHING
                """,
                id,
                candidate,
                author.stylePrompt(),
                author.bio(),
                originGenreSlug
            );
            if (inserted == 1) {
                return new AuthorProfile(id, candidate, author.stylePrompt(), author.bio());
            }
            log.debug("Pen name '{}' already taken (attempt {}/{})", candidate, attempt, MAX_PEN_NAME_ATTEMPTS);
        }
        throw new IllegalStateException("Could not find a unique pen name for '" + basePenName + "' after "
            + MAX_PEN_NAME_ATTEMPTS + " attempts");
    }
}
