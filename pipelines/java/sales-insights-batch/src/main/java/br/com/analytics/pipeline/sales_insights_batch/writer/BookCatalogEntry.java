package br.com.analytics.pipeline.sales_insights_batch.writer;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;

import java.util.List;

/**
 * A catalogue row: the canonical book with its authors' display names.
 */
public record BookCatalogEntry(
        CanonicalBook book,
        List<String> authorNames
) {

    public BookCatalogEntry {
        authorNames = List.copyOf(authorNames);
    }
}
