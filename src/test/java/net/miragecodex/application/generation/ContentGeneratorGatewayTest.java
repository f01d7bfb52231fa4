package net.miragecodex.application.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.generation.FacetClassification;
import net.miragecodex.domain.generation.GeneratedAuthor;
import net.miragecodex.domain.generation.GeneratedBook;
import net.miragecodex.domain.generation.GenerationTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class ContentGeneratorGatewayTest {

    private static final GenerationTarget TARGET = GenerationTarget.platform("gpt-test");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StructuredGenerationClient client;
    private ContentGeneratorGateway gateway;

    @BeforeEach
    void setUp() {
        client = mock(StructuredGenerationClient.class);
        SearchGenerationProperties properties = new SearchGenerationProperties();
        properties.setGenerationBaseBackoff(Duration.ZERO);
        properties.setGenerationMaxAttempts(3);
        gateway = new ContentGeneratorGateway(client, properties);
    }

    @Test
    void should_ReturnAuthors_When_FirstAttemptSucceeds() {
        when(client.generate(any())).thenReturn(json(
            "{\"authors\":[{\"penName\":\"Ada Quill\",\"stylePrompt\":\"Terse\",\"bio\":\"Bio\"}]}"));

        List<GeneratedAuthor> authors = gateway.generateAuthors(authorContext(), 1);

        assertThat(authors).extracting(GeneratedAuthor::penName).containsExactly("Ada Quill");
        verify(client, times(1)).generate(any());
    }

    @Test
    void should_RetryAndSucceed_When_FirstResponseHasWrongCount() {
        when(client.generate(any()))
            .thenReturn(json("{\"books\":[]}"))
            .thenReturn(json(oneBookPayload()));

        List<GeneratedBook> books = gateway.generateBooks(bookContext(1));

        assertThat(books).hasSize(1);
        verify(client, times(2)).generate(any());
    }

    @Test
    void should_RetryTransportFailures_When_ProviderIsFlaky() {
        when(client.generate(any()))
            .thenThrow(new ContentGenerationException(ErrorCode.TRANSPORT_FAILED, "timeout"))
            .thenThrow(new ContentGenerationException(ErrorCode.TRANSPORT_FAILED, "timeout"))
            .thenReturn(json(oneBookPayload()));

        assertThat(gateway.generateBooks(bookContext(1))).hasSize(1);
        verify(client, times(3)).generate(any());
    }

    @Test
    void should_ThrowRetriesExhausted_When_EveryAttemptFails() {
        when(client.generate(any())).thenReturn(json("{\"books\":[]}"));

        assertThatThrownBy(() -> gateway.generateBooks(bookContext(1)))
            .isInstanceOfSatisfying(ContentGenerationException.class, exception -> {
                assertThat(exception.errorCode()).isEqualTo(ErrorCode.RETRIES_EXHAUSTED);
                assertThat(exception.getCause()).isInstanceOf(ContentGenerationException.class);
                assertThat(exception.getMessage()).contains("failed after 3 attempts");
            });
        verify(client, times(3)).generate(any());
    }

    @Test
    void should_NotRetry_When_GeneratorIsNotConfigured() {
        when(client.generate(any()))
            .thenThrow(new ContentGenerationException(ErrorCode.NOT_CONFIGURED, "no key"));

        assertThatThrownBy(() -> gateway.generateAuthors(authorContext(), 2))
            .isInstanceOfSatisfying(ContentGenerationException.class, exception ->
                assertThat(exception.errorCode()).isEqualTo(ErrorCode.NOT_CONFIGURED));
        verify(client, times(1)).generate(any());
    }

    @Test
    void should_PassTargetAndSchemaName_When_GeneratingBooks() {
        when(client.generate(any())).thenReturn(json(oneBookPayload()));
        ArgumentCaptor<StructuredGenerationRequest> captor = ArgumentCaptor.forClass(StructuredGenerationRequest.class);

        gateway.generateBooks(bookContext(1));

        verify(client).generate(captor.capture());
        StructuredGenerationRequest request = captor.getValue();
        assertThat(request.target()).isEqualTo(TARGET);
        assertThat(request.schemaName()).isEqualTo("books");
        assertThat(request.userPrompt()).contains("haunted lighthouse");
    }

    @Test
    void should_ClassifyInSingleAttempt_When_ResponseIsValid() {
        when(client.generate(any())).thenReturn(json("{\"genreSlug\":\"horror\",\"languageCode\":\"en\"}"));

        FacetClassification classification = gateway.classifyFacets(
            "haunted lighthouse",
            List.of(new Genre("horror", "Horror", null)),
            List.of(new Language(1, "en", "English")),
            TARGET
        );

        assertThat(classification.genreSlug()).isEqualTo("horror");
        verify(client, times(1)).generate(any());
    }

    @Test
    void should_ReturnPageText_When_ResponseHasContent() {
        when(client.generate(any())).thenReturn(json("{\"content\":\"The lamp guttered twice.\"}"));
        ArgumentCaptor<StructuredGenerationRequest> captor = ArgumentCaptor.forClass(StructuredGenerationRequest.class);

        String content = gateway.generatePage(pageContext("The keeper climbed the stairs."));

        assertThat(content).isEqualTo("The lamp guttered twice.");
        verify(client).generate(captor.capture());
        assertThat(captor.getValue().temperature()).isEqualTo(0.8);
        assertThat(captor.getValue().systemPrompt()).contains("page 2 of 8", "Ada Quill", "Current section: \"Night\"");
        assertThat(captor.getValue().userPrompt()).contains("Previous page:\nThe keeper climbed the stairs.");
    }

    @Test
    void should_RetryPage_When_ContentIsBlank() {
        when(client.generate(any()))
            .thenReturn(json("{\"content\":\"  \"}"))
            .thenReturn(json("{\"content\":\"Knocking again.\"}"));

        assertThat(gateway.generatePage(pageContext(null))).isEqualTo("Knocking again.");
        verify(client, times(2)).generate(any());
    }

    private PageGenerationContext pageContext(String previousPage) {
        return new PageGenerationContext(TARGET, "The Lamp Room", "A keeper hears knocking.", "Ada Quill", "Terse",
            "en", 2, 8, new BookSection("Night", 1, 8, "All of it."), previousPage);
    }

    private AuthorGenerationContext authorContext() {
        return new AuthorGenerationContext(TARGET, "horror", "Horror", "en", "haunted lighthouse");
    }

    private BookGenerationContext bookContext(int pageSize) {
        return new BookGenerationContext(TARGET, "haunted lighthouse", "Horror", List.of(), "en", 1, pageSize);
    }

    private static String oneBookPayload() {
        return """
            {"books":[{"title":"The Lamp Room","summary":"A keeper hears knocking.","pageCount":8,
              "bookCoverPrompt":"Lighthouse",
              "sections":[{"title":"Night","fromPage":1,"toPage":8,"summary":"All of it."}]}]}
            """;
    }

    private JsonNode json(String text) {
        return objectMapper.readTree(text);
    }
}
