package net.miragecodex.adapters.persistence;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.catalog.Tag;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Read-only lookups over the language, genre, tag and model catalog tables.
 */
@Repository
public class CatalogRepository {

    private static final RowMapper<Language> LANGUAGE_MAPPER = (rs, rowNum) ->
        new Language(rs.getInt("id"), rs.getString("code"), rs.getString("label"));

    private static final RowMapper<Genre> GENRE_MAPPER = (rs, rowNum) ->
        new Genre(rs.getString("slug"), rs.getString("label"), rs.getString("prompt_boost"));

    private static final RowMapper<Tag> TAG_MAPPER = (rs, rowNum) ->
        new Tag(rs.getString("slug"), rs.getString("label"), rs.getString("prompt_boost"));

    private static final RowMapper<GenerationModel> MODEL_MAPPER = (rs, rowNum) ->
        new GenerationModel(
            rs.getInt("id"),
            rs.getString("name"),
            rs.getString("domain_code"),
            rs.getObject("search_credits", Integer.class),
            rs.getObject("page_generation_credits", Integer.class)
        );

    private final JdbcTemplate jdbcTemplate;

    public CatalogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Language> findLanguageByCode(String code) {
        return jdbcTemplate.query(
            "SELECT id, code, label FROM languages WHERE code = ?",
            LANGUAGE_MAPPER,
            code
        ).stream().findFirst();
    }

    public List<Language> findAllLanguages() {
        return jdbcTemplate.query("SELECT id, code, label FROM languages ORDER BY code", LANGUAGE_MAPPER);
    }

    public Optional<Genre> findActiveGenre(String slug) {
        return jdbcTemplate.query(
            "SELECT slug, label, prompt_boost FROM genres WHERE slug = ? AND is_active = true",
            GENRE_MAPPER,
            slug
        ).stream().findFirst();
    }

    public List<Genre> findActiveGenres() {
        return jdbcTemplate.query(
            "SELECT slug, label, prompt_boost FROM genres WHERE is_active = true ORDER BY slug",
            GENRE_MAPPER
        );
    }

    /**
     * Returns the known tags among {@code slugs}; unknown slugs are silently absent.
     */
    public List<Tag> findTagsBySlugs(Collection<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(slugs.size(), "?"));
        return jdbcTemplate.query(
            "SELECT slug, label, prompt_boost FROM tags WHERE slug IN (" + placeholders + ") ORDER BY slug",
            TAG_MAPPER,
            slugs.toArray()
        );
    }

    public Optional<GenerationModel> findActiveModel(int modelId) {
        return jdbcTemplate.query(
            """
            SELECT id, name, domain_code, search_credits, page_generation_credits
            FROM models
            WHERE id = ? AND is_active = true
            """,
            MODEL_MAPPER,
            modelId
        ).stream().findFirst();
    }
}
