package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.List;

public record BookRecord(
        SourceId sourceId,
        String title,
        String titleKey,
        List<String> authors,
        String genre,
        String publisher,
        Integer publicationYear
) {

    public BookRecord {
        authors = List.copyOf(authors);
    }

    public BookRecord withCatalogDefaults(String defaultPublisher, Integer defaultYear) {
        return new BookRecord(sourceId, title, titleKey, authors, genre,
                publisher.isEmpty() ? defaultPublisher : publisher,
                publicationYear == null ? defaultYear : publicationYear);
    }
}
