package net.miragecodex.application.generation;

import static org.assertj.core.api.Assertions.assertThat;

import net.miragecodex.domain.generation.GenerationTarget;
import org.junit.jupiter.api.Test;

class GenerationPromptsTest {

    @Test
    void should_AskForRecipeLayout_When_TitleNamesACookbook() {
        assertThat(GenerationPrompts.pageFormatInstructions("The Lighthouse Cookbook")).contains("*Ingredients:*");
    }

    @Test
    void should_AskForStanzas_When_TitleNamesPoetry() {
        assertThat(GenerationPrompts.pageFormatInstructions("Collected Poems of the Tide")).contains("stanzas");
    }

    @Test
    void should_FallBackToNarrativeLayout_When_TitleIsPlain() {
        assertThat(GenerationPrompts.pageFormatInstructions("The Lamp Room")).contains("narrative page");
    }

    @Test
    void should_UseDefaultStyleAndOmitSection_When_AuthorAndSectionAreMissing() {
        PageGenerationContext context = new PageGenerationContext(GenerationTarget.platform("gpt-test"),
            "The Lamp Room", "A keeper hears knocking.", "Ada Quill", null, "fr", 1, 8, null, null);

        String systemPrompt = GenerationPrompts.pageSystemPrompt(context);

        assertThat(systemPrompt)
            .contains("Write in an engaging, narrative style.", "language code \"fr\"")
            .doesNotContain("Current section");
        assertThat(GenerationPrompts.pageUserPrompt(context)).isEqualTo("Write page 1.");
    }
}
