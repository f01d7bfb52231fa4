package net.miragecodex.application.search;

/**
 * States of a search request. Failures before {@link #PERSISTING} leave no
 * ledger or cache side effects.
 */
enum PipelineStage {
    KEY_DERIVED,
    CACHE_CHECKED,
    AUTHORIZING,
    AUTHORS_RESOLVED,
    BOOKS_GENERATED,
    PERSISTING,
    SETTLING,
    DONE
}
