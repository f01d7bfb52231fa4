package net.miragecodex.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchGenerationPropertiesTest {

    @Test
    void should_AcceptDefaults_When_NothingConfigured() {
        SearchGenerationProperties properties = new SearchGenerationProperties();

        properties.validate();

        assertThat(properties.getPageSize()).isEqualTo(3);
        assertThat(properties.getPagesPerCredit()).isEqualTo(10);
        assertThat(properties.getGenerationBaseBackoff()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void should_RejectProbability_When_AboveOne() {
        SearchGenerationProperties properties = new SearchGenerationProperties();
        properties.setAuthorReuseProbability(1.2);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("author-reuse-probability");
    }

    @Test
    void should_RejectPagesPerCredit_When_Zero() {
        SearchGenerationProperties properties = new SearchGenerationProperties();
        properties.setPagesPerCredit(0);

        assertThatThrownBy(properties::validate).hasMessageContaining("pages-per-credit");
    }

    @Test
    void should_RejectFallbackGenre_When_Blank() {
        SearchGenerationProperties properties = new SearchGenerationProperties();
        properties.setFallbackGenreSlug(" ");

        assertThatThrownBy(properties::validate).hasMessageContaining("fallback-genre-slug");
    }
}
