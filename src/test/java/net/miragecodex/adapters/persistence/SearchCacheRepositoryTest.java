package net.miragecodex.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.generation.GeneratedBook;
import net.miragecodex.domain.search.BookDraft;
import net.miragecodex.domain.search.CacheWrite;
import net.miragecodex.domain.search.CachedSearch;
import net.miragecodex.domain.search.SearchCommit;
import net.miragecodex.domain.search.SearchKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import tools.jackson.databind.ObjectMapper;

class SearchCacheRepositoryTest {

    private static final SearchKey KEY = new SearchKey("9".repeat(64), 1);
    private static final UUID STORED_ID = UUID.randomUUID();

    private JdbcTemplate jdbcTemplate;
    private SearchCacheRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        repository = new SearchCacheRepository(jdbcTemplate, new ObjectMapper());
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any())).thenReturn(List.of());
    }

    @Test
    void should_ReturnEmpty_When_NoSearchRowExists() {
        stubHeader(false);

        assertThat(repository.find(KEY)).isEmpty();
    }

    @Test
    void should_ReturnStoredPage_When_SearchRowExists() {
        stubHeader(true);

        Optional<CachedSearch> found = repository.find(KEY);

        assertThat(found).isPresent();
        assertThat(found.get().searchId()).isEqualTo(STORED_ID);
        assertThat(found.get().key()).isEqualTo(KEY);
    }

    @Test
    void should_WriteWholeGraph_When_KeyIsNew() {
        when(jdbcTemplate.update(contains("INSERT INTO searches"), any(), any(), any(), any(), any(), any(), any()))
            .thenReturn(1);
        stubHeader(true);

        CacheWrite write = repository.put(commit(3));

        assertThat(write.created()).isTrue();
        verify(jdbcTemplate).update(contains("INSERT INTO search_params"), any(), any(), any(), eq("[\"victorian\"]"));
        verify(jdbcTemplate, times(3))
            .update(contains("INSERT INTO books"), any(), any(), any(), any(), any(), any(), any(), any());
        verify(jdbcTemplate, times(3)).batchUpdate(contains("INSERT INTO book_sections"), anyList());
        verify(jdbcTemplate, times(3)).update(contains("INSERT INTO editions"), any(), any(), any(), any());
        verify(jdbcTemplate).update(contains("INSERT INTO search_books"), any(), eq(1), any(), any());
        verify(jdbcTemplate).update(contains("INSERT INTO search_books"), any(), eq(3), any(), any());
    }

    @Test
    void should_ReturnExistingPageWithoutWriting_When_KeyConflicts() {
        when(jdbcTemplate.update(contains("INSERT INTO searches"), any(), any(), any(), any(), any(), any(), any()))
            .thenReturn(0);
        stubHeader(true);

        CacheWrite write = repository.put(commit(3));

        assertThat(write.created()).isFalse();
        assertThat(write.result().searchId()).isEqualTo(STORED_ID);
        verify(jdbcTemplate, never())
            .update(contains("INSERT INTO books"), any(), any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    void should_RejectEmptyCommit_When_NoBooksGiven() {
        JdbcTemplate untouched = mock(JdbcTemplate.class);
        SearchCacheRepository emptyRepository = new SearchCacheRepository(untouched, new ObjectMapper());

        assertThatThrownBy(() -> emptyRepository.put(commit(0))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(untouched);
    }

    @SuppressWarnings("unchecked")
    private void stubHeader(boolean present) {
        when(jdbcTemplate.query(contains("FROM searches"), any(ResultSetExtractor.class), eq(KEY.fingerprint()),
            eq(KEY.pageNumber()))).thenAnswer(invocation -> {
                ResultSet resultSet = mock(ResultSet.class);
                when(resultSet.next()).thenReturn(present);
                when(resultSet.getObject("id", UUID.class)).thenReturn(STORED_ID);
                when(resultSet.getTimestamp("created_at")).thenReturn(Timestamp.from(Instant.now()));
                return ((ResultSetExtractor<Object>) invocation.getArgument(1)).extractData(resultSet);
            });
    }

    private static SearchCommit commit(int bookCount) {
        List<BookDraft> drafts = IntStream.range(0, bookCount)
            .mapToObj(i -> new BookDraft(
                new GeneratedBook("Book " + i, "Summary", 10, "Cover",
                    List.of(new BookSection("A", 1, 4, "a"), new BookSection("B", 5, 10, "b"))),
                new AuthorProfile(UUID.randomUUID(), "Author " + i, "style", "bio")))
            .toList();
        return new SearchCommit(KEY, "user-1", new Language(1, "en", "English"), "mystery", 1,
            "a detective", List.of("victorian"), 3, drafts);
    }
}
