package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.List;

public record NormalizedSource(
        SourceTag source,
        List<BookRecord> books,
        List<CustomerRecord> customers,
        List<TransactionRecord> transactions,
        List<NormalizationError> errors,
        long malformedRows
) {

    public NormalizedSource {
        books = List.copyOf(books);
        customers = List.copyOf(customers);
        transactions = List.copyOf(transactions);
        errors = List.copyOf(errors);
    }
}
