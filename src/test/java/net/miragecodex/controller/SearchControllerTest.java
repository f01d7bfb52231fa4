package net.miragecodex.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.application.search.BookSearchUseCase;
import net.miragecodex.application.search.SearchPipelineException;
import net.miragecodex.application.search.SearchPipelineException.ErrorCode;
import net.miragecodex.controller.support.CurrentUserResolver;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.book.BookRecord;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.search.CachedSearch;
import net.miragecodex.domain.search.RankedBook;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.domain.search.SearchOutcome;
import net.miragecodex.domain.search.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

    @Mock
    private BookSearchUseCase searchUseCase;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SearchController controller = new SearchController(searchUseCase, new CurrentUserResolver("X-User-Id"));
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("POST /api/search returns a cached page to anonymous callers")
    void should_ReturnCachedPage_When_SearchHits() throws Exception {
        CachedSearch page = page();
        when(searchUseCase.search(any(), eq(Optional.empty()))).thenReturn(SearchOutcome.hit(page));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"freeText\":\"a detective in Victorian London\",\"modelId\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.searchId").value(page.searchId().toString()))
            .andExpect(jsonPath("$.cached").value(true))
            .andExpect(jsonPath("$.pageNumber").value(1))
            .andExpect(jsonPath("$.books[0].title").value("The Gaslight Ledger"))
            .andExpect(jsonPath("$.books[0].author.penName").value("Ada Quill"))
            .andExpect(jsonPath("$.books[0].languageCode").value("en"))
            .andExpect(jsonPath("$.books[0].sections[0].fromPage").value(1));
    }

    @Test
    void should_DefaultPageAndPassUser_When_HeaderPresent() throws Exception {
        when(searchUseCase.search(any(), eq(Optional.of("user-7")))).thenReturn(SearchOutcome.generated(page()));
        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);

        mockMvc.perform(post("/api/search")
                .header("X-User-Id", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"genreSlug\":\"mystery\",\"tagSlugs\":[\"victorian\"],\"modelId\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(false));

        verify(searchUseCase).search(request.capture(), eq(Optional.of("user-7")));
        assertThat(request.getValue().pageNumber()).isEqualTo(1);
        assertThat(request.getValue().tagSlugs()).containsExactly("victorian");
    }

    @Test
    void should_Return402_When_CreditsInsufficient() throws Exception {
        when(searchUseCase.search(any(), any())).thenThrow(
            new SearchPipelineException(ErrorCode.INSUFFICIENT_CREDITS, "Search requires 5 credits but only 2 are available"));

        mockMvc.perform(post("/api/search")
                .header("X-User-Id", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"freeText\":\"x\",\"modelId\":1}"))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_CREDITS"))
            .andExpect(jsonPath("$.message").value("Search requires 5 credits but only 2 are available"));
    }

    @Test
    void should_Return401_When_AnonymousMiss() throws Exception {
        when(searchUseCase.search(any(), any())).thenThrow(
            new SearchPipelineException(ErrorCode.AUTHENTICATION_REQUIRED, "Sign in to generate new results"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"freeText\":\"x\",\"modelId\":1}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("AUTHENTICATION_REQUIRED"));
    }

    @Test
    void should_HideInternalDetail_When_GenerationFails() throws Exception {
        when(searchUseCase.search(any(), any())).thenThrow(
            new SearchPipelineException(ErrorCode.GENERATION_FAILED, "Content generation failed: HTTP 429 rate limited"));

        mockMvc.perform(post("/api/search")
                .header("X-User-Id", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"freeText\":\"x\",\"modelId\":1}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("GENERATION_FAILED"))
            .andExpect(jsonPath("$.message").value("The search could not be completed"));
    }

    private static CachedSearch page() {
        AuthorProfile author = new AuthorProfile(UUID.randomUUID(), "Ada Quill", "Terse", "Writes on trains.");
        BookRecord book = new BookRecord(UUID.randomUUID(), "The Gaslight Ledger", "A clerk finds a body.", 12,
            "Fog and lamps", null, List.of(new BookSection("Fog", 1, 12, "All of it")), author.id(), 1);
        RankedBook ranked = new RankedBook(1, book, author, UUID.randomUUID(), 1, "en", "English");
        return new CachedSearch(UUID.randomUUID(), new SearchKey("a".repeat(64), 1), List.of(ranked), Instant.now());
    }
}
