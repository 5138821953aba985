package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The canonical entity tables of one run plus the source id indexes the
 * transaction linker resolves references through.
 */
public record ResolvedEntities(
        List<CanonicalCustomer> customers,
        List<CanonicalAuthor> authors,
        List<CanonicalBook> books,
        Map<SourceId, Long> customerIdBySourceId,
        Map<SourceId, Long> bookIdBySourceId
) {

    public ResolvedEntities {
        customers = List.copyOf(customers);
        authors = List.copyOf(authors);
        books = List.copyOf(books);
        customerIdBySourceId = Map.copyOf(customerIdBySourceId);
        bookIdBySourceId = Map.copyOf(bookIdBySourceId);
    }

    public static ResolvedEntities of(List<CanonicalCustomer> customers, AuthorResolution authors, BookResolution books) {
        Map<SourceId, Long> customerIndex = new HashMap<>();
        customers.forEach(customer -> customer.sourceIds()
                .forEach(sourceId -> customerIndex.put(sourceId, customer.customerId())));
        return new ResolvedEntities(customers, authors.authors(), books.books(), customerIndex, books.bookIdBySourceId());
    }

    public Optional<Long> customerIdFor(SourceId sourceId) {
        return Optional.ofNullable(customerIdBySourceId.get(sourceId));
    }

    public Optional<Long> bookIdFor(SourceId sourceId) {
        return Optional.ofNullable(bookIdBySourceId.get(sourceId));
    }
}
