package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;

import java.util.List;
import java.util.Map;

/**
 * @param authors          canonical authors ordered by id
 * @param authorIdsByBook  canonical author ids per book record, in credit order
 */
public record AuthorResolution(
        List<CanonicalAuthor> authors,
        Map<SourceId, List<Long>> authorIdsByBook
) {

    public AuthorResolution {
        authors = List.copyOf(authors);
        authorIdsByBook = Map.copyOf(authorIdsByBook);
    }
}
