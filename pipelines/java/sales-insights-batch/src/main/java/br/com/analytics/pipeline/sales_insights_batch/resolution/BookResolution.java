package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;

import java.util.List;
import java.util.Map;

public record BookResolution(
        List<CanonicalBook> books,
        Map<SourceId, Long> bookIdBySourceId
) {

    public BookResolution {
        books = List.copyOf(books);
        bookIdBySourceId = Map.copyOf(bookIdBySourceId);
    }
}
