package net.miragecodex.application.generation;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import org.springframework.util.StringUtils;

/**
 * Prompt text for each generation kind.
 */
final class GenerationPrompts {

    private static final String AUTHORS_SHAPE = """
        Return ONLY strict JSON using this exact shape:
        {
          "authors": [
            { "penName": string, "stylePrompt": string, "bio": string }
          ]
        }
        """;

    private static final String BOOKS_SHAPE = """
        Return ONLY strict JSON using this exact shape:
        {
          "books": [
            {
              "title": string,
              "summary": string,
              "pageCount": integer,
              "bookCoverPrompt": string,
              "sections": [
                { "title": string, "fromPage": integer, "toPage": integer, "summary": string }
              ]
            }
          ]
        }
        """;

    private static final String CLASSIFICATION_SHAPE = """
        Return ONLY strict JSON using this exact shape:
        { "genreSlug": string, "languageCode": string, "reasoning": string }
        """;

    private static final String PAGE_SHAPE = """
        Return ONLY strict JSON using this exact shape:
        { "content": string }
        """;

    private GenerationPrompts() {
    }

    static String authorsSystemPrompt(AuthorGenerationContext context, int count) {
        return """
            You invent fictional authors for an imaginary library. None of them may be real people.

            Genre: %s
            Write every name and biography in language code "%s".

            Rules:
            - Exactly %d authors, each with a distinct voice that still fits the genre.
            - penName: memorable and plausible for the genre.
            - stylePrompt: one sentence describing how this author writes.
            - bio: 2-3 sentences of invented literary career.
            - No markdown, no prose outside JSON, no extra keys.

            %s""".formatted(context.genrePrompt(), context.languageCode(), count, AUTHORS_SHAPE);
    }

    static String authorsUserPrompt(AuthorGenerationContext context, int count) {
        StringBuilder prompt = new StringBuilder()
            .append("Generate exactly ").append(count).append(" authors for genre '")
            .append(context.genreSlug()).append("'.");
        if (StringUtils.hasText(context.freeText())) {
            prompt.append("\nReaders arrive searching for: \"").append(context.freeText()).append('"');
        }
        return prompt.toString();
    }

    static String booksSystemPrompt(BookGenerationContext context, int maxPagesPerBook) {
        int firstOrdinal = (context.pageNumber() - 1) * context.pageSize() + 1;
        int lastOrdinal = context.pageNumber() * context.pageSize();
        String tags = context.tagPrompts().isEmpty() ? "none" : String.join("; ", context.tagPrompts());
        return """
            You catalog an endless library of books that were never written.
            This is result page %d: produce catalog entries %d through %d for the reader's query.

            Genre: %s
            Tag influences: %s
            Write titles, summaries and sections in language code "%s".

            Rules:
            - Exactly %d books, all original and fictional. Do not name authors.
            - summary: 2-3 sentences that make a reader curious.
            - pageCount: realistic for the kind of book, between 1 and %d.
            - bookCoverPrompt: one sentence describing the cover art, mood and palette.
            - sections: ordered, matching the book's kind (chapters, recipes, essays, parts).
              The first section starts at page 1, each next section starts on the page after
              the previous one ends, and the last section ends at pageCount.
            - No markdown, no prose outside JSON, no extra keys.

            %s""".formatted(
                context.pageNumber(), firstOrdinal, lastOrdinal,
                context.genrePrompt(), tags, context.languageCode(),
                context.pageSize(), maxPagesPerBook, BOOKS_SHAPE);
    }

    static String booksUserPrompt(BookGenerationContext context) {
        String query = StringUtils.hasText(context.freeText())
            ? "Reader query: \"" + context.freeText() + "\"\n"
            : "";
        return query + "Generate exactly %d books for page %d.".formatted(context.pageSize(), context.pageNumber());
    }

    static String classificationSystemPrompt(List<Genre> genres, List<Language> languages) {
        String genreLines = genres.stream()
            .map(genre -> genre.slug() + ": " + genre.label())
            .collect(Collectors.joining("\n"));
        String languageLines = languages.stream()
            .map(language -> language.code() + ": " + language.label())
            .collect(Collectors.joining("\n"));
        return """
            You classify book search queries. Pick exactly one genre and one language
            from the lists below, using the slug or code verbatim.

            Genres:
            %s

            Languages:
            %s

            Rules:
            - Prefer the most specific genre the query implies.
            - The language is the one the reader wants the books in, which is usually the query's language.
            - reasoning: one short sentence.

            %s""".formatted(genreLines, languageLines, CLASSIFICATION_SHAPE);
    }

    static String classificationUserPrompt(String freeText) {
        return "Classify this query:\n\"" + freeText + "\"";
    }

    static String pageSystemPrompt(PageGenerationContext context) {
        String style = StringUtils.hasText(context.stylePrompt())
            ? context.stylePrompt()
            : "Write in an engaging, narrative style.";
        String section = context.section() == null
            ? ""
            : "Current section: \"%s\" - %s\n".formatted(context.section().title(), context.section().summary());
        return """
            You are %s, writing page %d of %d of your book "%s".

            Book summary: %s
            Author style: %s
            %sWrite in language code "%s".

            %s

            Rules:
            - Write only this page, roughly 250-400 words, continuing the narrative naturally.
            - content: the page text as markdown. No page number header.
            - No prose outside JSON, no extra keys.

            %s""".formatted(
                context.penName(), context.pageNumber(), context.pageCount(), context.title(),
                context.summary(), style, section, context.languageCode(),
                pageFormatInstructions(context.title()), PAGE_SHAPE);
    }

    static String pageUserPrompt(PageGenerationContext context) {
        if (StringUtils.hasText(context.previousPageContent())) {
            return "Previous page:\n" + context.previousPageContent()
                + "\n\nWrite page " + context.pageNumber() + ".";
        }
        return "Write page " + context.pageNumber() + ".";
    }

    /**
     * Markdown layout hints keyed off the kind of book its title suggests.
     */
    static String pageFormatInstructions(String title) {
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        if (lowerTitle.contains("cookbook") || lowerTitle.contains("recipe")) {
            return """
                Format as a cookbook page with recipes, using **Recipe Name**, *Ingredients:* and
                *Instructions:* headings.""";
        }
        if (lowerTitle.contains("poetry") || lowerTitle.contains("poem")) {
            return "Format as poetry with line breaks and blank lines between stanzas.";
        }
        if (lowerTitle.contains("manual") || lowerTitle.contains("guide") || lowerTitle.contains("academic")) {
            return """
                Format as a manual page with ## and ### headings, bullet lists, **bold** key terms and
                code blocks for examples where relevant.""";
        }
        return """
            Format as a narrative page with natural paragraph breaks, *italics* for thoughts,
            **bold** for important moments and proper dialogue punctuation.""";
    }
}
