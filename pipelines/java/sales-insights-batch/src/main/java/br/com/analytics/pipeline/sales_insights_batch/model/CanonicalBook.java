package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

public record CanonicalBook(
        Long bookId,
        String title,
        List<Long> authorIds,
        String genre,
        String publisher,
        Integer publicationYear,
        SortedSet<SourceId> sourceIds
) {

    public CanonicalBook {
        authorIds = List.copyOf(authorIds);
        sourceIds = Collections.unmodifiableSortedSet(new TreeSet<>(sourceIds));
    }
}
