package net.miragecodex.application.author;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import net.miragecodex.adapters.persistence.AuthorRepository;
import net.miragecodex.application.generation.AuthorGenerationContext;
import net.miragecodex.application.generation.ContentGeneratorGateway;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.generation.GeneratedAuthor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves exactly {@code count} authors for a page of new books, mixing reused
 * genre authors with freshly generated ones.
 *
 * <p>Generated authors are persisted immediately and outside the search
 * transaction. If the page later fails to persist they remain as orphans that a
 * future search of the genre can reuse.</p>
 */
@Service
public class AuthorPoolSelector {

    private static final Logger log = LoggerFactory.getLogger(AuthorPoolSelector.class);

    private final AuthorRepository authorRepository;
    private final ContentGeneratorGateway generatorGateway;
    private final AuthorReusePolicy reusePolicy;
    private final Random shuffleRandom;

    @Autowired
    public AuthorPoolSelector(AuthorRepository authorRepository,
                              ContentGeneratorGateway generatorGateway,
                              AuthorReusePolicy reusePolicy) {
        this(authorRepository, generatorGateway, reusePolicy, new Random());
    }

    AuthorPoolSelector(AuthorRepository authorRepository,
                       ContentGeneratorGateway generatorGateway,
                       AuthorReusePolicy reusePolicy,
                       Random shuffleRandom) {
        this.authorRepository = authorRepository;
        this.generatorGateway = generatorGateway;
        this.reusePolicy = reusePolicy;
        this.shuffleRandom = shuffleRandom;
    }

    /**
     * @return exactly {@code request.count()} authors in random order
     */
    public List<AuthorProfile> selectOrCreate(AuthorPoolRequest request) {
        int count = request.count();
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }

        List<AuthorProfile> authors = new ArrayList<>(count);
        if (reusePolicy.shouldAttemptReuse(request.genreSlug())) {
            List<AuthorProfile> existing = authorRepository.findRandomByGenre(request.genreSlug(), count);
            authors.addAll(existing.size() > count ? existing.subList(0, count) : existing);
        }
        int reused = authors.size();

        int shortfall = count - reused;
        if (shortfall > 0) {
            AuthorGenerationContext context = new AuthorGenerationContext(
                request.target(),
                request.genreSlug(),
                request.genrePrompt(),
                request.languageCode(),
                request.freeText()
            );
            for (GeneratedAuthor generated : generatorGateway.generateAuthors(context, shortfall)) {
                authors.add(authorRepository.insertWithUniquePenName(generated, request.genreSlug()));
            }
        }

        log.info("Resolved {} authors for genre {} ({} reused, {} generated)",
            authors.size(), request.genreSlug(), reused, shortfall);
        Collections.shuffle(authors, shuffleRandom);
        return List.copyOf(authors);
    }
}
