package net.miragecodex.application.search;

import static net.miragecodex.application.search.SearchTestFixtures.ENGLISH;
import static net.miragecodex.application.search.SearchTestFixtures.MODEL;
import static net.miragecodex.application.search.SearchTestFixtures.MYSTERY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import net.miragecodex.adapters.persistence.CatalogRepository;
import net.miragecodex.application.generation.ContentGenerationException;
import net.miragecodex.application.generation.ContentGeneratorGateway;
import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.generation.FacetClassification;
import net.miragecodex.domain.generation.GenerationTarget;
import net.miragecodex.domain.search.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchFacetResolverTest {

    private static final Language FRENCH = new Language(2, "fr", "Français");
    private static final Genre FICTION = new Genre("fiction", "Fiction", null);

    private CatalogRepository catalogRepository;
    private ContentGeneratorGateway generatorGateway;
    private SearchFacetResolver resolver;

    @BeforeEach
    void setUp() {
        catalogRepository = mock(CatalogRepository.class);
        generatorGateway = mock(ContentGeneratorGateway.class);
        resolver = new SearchFacetResolver(catalogRepository, generatorGateway, new SearchGenerationProperties());
        when(catalogRepository.findActiveGenres()).thenReturn(List.of(MYSTERY, FICTION));
        when(catalogRepository.findAllLanguages()).thenReturn(List.of(ENGLISH, FRENCH));
        when(generatorGateway.isPlatformConfigured()).thenReturn(true);
    }

    @Test
    void should_UseDefaultsWithoutCallingGenerator_When_PlatformKeyIsMissing() {
        when(generatorGateway.isPlatformConfigured()).thenReturn(false);

        SearchRequest resolved = resolver.resolve(request("a detective", null, null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("fiction");
        assertThat(resolved.languageCode()).isEqualTo("en");
        verify(generatorGateway, never()).classifyFacets(anyString(), anyList(), anyList(), any());
    }

    @Test
    void should_KeepExplicitFacets_When_BothProvided() {
        SearchRequest resolved = resolver.resolve(request("a detective", " mystery ", "fr"), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("mystery");
        assertThat(resolved.languageCode()).isEqualTo("fr");
        verify(generatorGateway, never()).classifyFacets(anyString(), anyList(), anyList(), any());
    }

    @Test
    void should_ClassifyMissingFacets_When_FreeTextGiven() {
        when(generatorGateway.classifyFacets(eq("un détective à Londres"), anyList(), anyList(),
            eq(GenerationTarget.platform("gpt-test")))).thenReturn(new FacetClassification("mystery", "fr"));

        SearchRequest resolved = resolver.resolve(request("un détective à Londres", null, null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("mystery");
        assertThat(resolved.languageCode()).isEqualTo("fr");
    }

    @Test
    void should_KeepProvidedGenre_When_OnlyLanguageIsClassified() {
        when(generatorGateway.classifyFacets(anyString(), anyList(), anyList(), any()))
            .thenReturn(new FacetClassification("mystery", "fr"));

        SearchRequest resolved = resolver.resolve(request("a love story", "fiction", null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("fiction");
        assertThat(resolved.languageCode()).isEqualTo("fr");
    }

    @Test
    void should_FallBackToDefaults_When_ClassificationFails() {
        when(generatorGateway.classifyFacets(anyString(), anyList(), anyList(), any()))
            .thenThrow(new ContentGenerationException(ContentGenerationException.ErrorCode.TRANSPORT_FAILED, "timeout"));

        SearchRequest resolved = resolver.resolve(request("a detective", null, null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("fiction");
        assertThat(resolved.languageCode()).isEqualTo("en");
    }

    @Test
    void should_ReplaceOffCatalogAnswer_When_ClassifierInventsGenre() {
        when(generatorGateway.classifyFacets(anyString(), anyList(), anyList(), any()))
            .thenReturn(new FacetClassification("steampunk-noir", "fr"));

        SearchRequest resolved = resolver.resolve(request("brass detectives", null, null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("fiction");
        assertThat(resolved.languageCode()).isEqualTo("fr");
    }

    @Test
    void should_UseDefaultsWithoutClassifying_When_NoFreeText() {
        SearchRequest resolved = resolver.resolve(request(null, "mystery", null), MODEL);

        assertThat(resolved.genreSlug()).isEqualTo("mystery");
        assertThat(resolved.languageCode()).isEqualTo("en");
        verify(generatorGateway, never()).classifyFacets(anyString(), anyList(), anyList(), any());
    }

    private static SearchRequest request(String freeText, String genreSlug, String languageCode) {
        return new SearchRequest(freeText, languageCode, genreSlug, List.of(), MODEL.id(), 1, 3);
    }
}
