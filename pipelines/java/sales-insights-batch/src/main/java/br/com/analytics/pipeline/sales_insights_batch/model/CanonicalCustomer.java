package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

public record CanonicalCustomer(
        Long customerId,
        String name,
        String email,
        String address,
        String phone,
        SortedSet<SourceId> sourceIds
) {

    public CanonicalCustomer {
        if (sourceIds.isEmpty()) {
            throw new IllegalArgumentException("Canonical customer " + customerId + " has no source ids");
        }
        sourceIds = Collections.unmodifiableSortedSet(new TreeSet<>(sourceIds));
    }
}
