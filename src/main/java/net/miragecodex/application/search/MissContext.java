package net.miragecodex.application.search;

import java.util.List;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.catalog.Tag;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.domain.search.SearchRequest;

/**
 * Everything the commit pipeline needs for one cache miss, already resolved
 * against the catalog.
 */
record MissContext(SearchKey key,
                   SearchRequest request,
                   String userId,
                   Language language,
                   Genre genre,
                   List<Tag> tags,
                   GenerationModel model) {
}
