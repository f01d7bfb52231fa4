package net.miragecodex.application.author;

/**
 * Decides whether a batch should try existing authors before generating new ones.
 */
public interface AuthorReusePolicy {

    boolean shouldAttemptReuse(String genreSlug);
}
