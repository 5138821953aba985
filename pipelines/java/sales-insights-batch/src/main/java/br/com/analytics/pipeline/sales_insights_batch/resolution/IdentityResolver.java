package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;

import java.util.List;

/**
 * Runs customer, author and book resolution over the records of all sources.
 */
public class IdentityResolver {

    private final CustomerIdentityResolver customerResolver;
    private final AuthorIdentityResolver authorResolver;
    private final BookCatalogResolver bookResolver;

    public IdentityResolver(CustomerIdentityResolver customerResolver,
                            AuthorIdentityResolver authorResolver,
                            BookCatalogResolver bookResolver) {
        this.customerResolver = customerResolver;
        this.authorResolver = authorResolver;
        this.bookResolver = bookResolver;
    }

    public ResolvedEntities resolve(List<CustomerRecord> customers, List<BookRecord> books) {
        List<CanonicalCustomer> canonicalCustomers = customerResolver.resolve(customers);
        AuthorResolution authors = authorResolver.resolve(books);
        BookResolution catalogue = bookResolver.resolve(books, authors.authorIdsByBook());
        return ResolvedEntities.of(canonicalCustomers, authors, catalogue);
    }
}
