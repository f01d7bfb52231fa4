package net.miragecodex.application.author;

import java.util.Random;
import java.util.random.RandomGenerator;
import net.miragecodex.config.SearchGenerationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Attempts reuse with a fixed, configured probability per batch.
 */
@Component
public class ProbabilisticAuthorReusePolicy implements AuthorReusePolicy {

    private final double probability;
    private final RandomGenerator random;

    @Autowired
    public ProbabilisticAuthorReusePolicy(SearchGenerationProperties properties) {
        this(properties.getAuthorReuseProbability(), new Random());
    }

    ProbabilisticAuthorReusePolicy(double probability, RandomGenerator random) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be within [0, 1] but was " + probability);
        }
        this.probability = probability;
        this.random = random;
    }

    @Override
    public boolean shouldAttemptReuse(String genreSlug) {
        return random.nextDouble() < probability;
    }
}
