package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A deduplicated author. {@code sourceIds} are the book records that credit
 * this author.
 */
public record CanonicalAuthor(
        Long authorId,
        String name,
        SortedSet<SourceId> sourceIds
) {

    public CanonicalAuthor {
        sourceIds = Collections.unmodifiableSortedSet(new TreeSet<>(sourceIds));
    }
}
