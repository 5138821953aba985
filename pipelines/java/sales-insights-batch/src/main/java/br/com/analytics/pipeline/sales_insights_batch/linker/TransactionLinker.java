package br.com.analytics.pipeline.sales_insights_batch.linker;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkageFailure;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.UnresolvedLinkage;
import br.com.analytics.pipeline.sales_insights_batch.resolution.ResolvedEntities;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Points every transaction at its canonical customer and book. References
 * are source-local, so they are looked up as source ids of the transaction's
 * own source. Transactions that cannot be resolved are reported, not dropped
 * silently. The delivery method of a linked transaction is the address of
 * its canonical customer.
 */
public class TransactionLinker {

    private static final Logger log = LoggerFactory.getLogger(TransactionLinker.class);

    public LinkageResult link(List<TransactionRecord> transactions, ResolvedEntities entities) {
        List<LinkedTransaction> linked = new ArrayList<>();
        List<UnresolvedLinkage> unresolved = new ArrayList<>();
        Map<Long, CanonicalCustomer> customersById = new HashMap<>();
        entities.customers().forEach(customer -> customersById.put(customer.customerId(), customer));

        for (TransactionRecord transaction : transactions) {
            SourceId customerRef = SourceId.of(transaction.sourceId().source(), transaction.customerRef());
            Optional<Long> customerId = entities.customerIdFor(customerRef);
            if (customerId.isEmpty()) {
                unresolved.add(new UnresolvedLinkage(transaction.sourceId(), LinkageFailure.UNKNOWN_CUSTOMER,
                        "no canonical customer for " + customerRef));
                continue;
            }
            if (transaction.bookRef().isEmpty()) {
                unresolved.add(new UnresolvedLinkage(transaction.sourceId(), LinkageFailure.MISSING_BOOK_REFERENCE,
                        "transaction names no book"));
                continue;
            }
            SourceId bookRef = SourceId.of(transaction.sourceId().source(), transaction.bookRef());
            Optional<Long> bookId = entities.bookIdFor(bookRef);
            if (bookId.isEmpty()) {
                unresolved.add(new UnresolvedLinkage(transaction.sourceId(), LinkageFailure.UNKNOWN_BOOK,
                        "no catalogue entry for " + bookRef));
                continue;
            }
            linked.add(new LinkedTransaction(
                    transaction.sourceId(),
                    customerId.get(),
                    bookId.get(),
                    transaction.quantity(),
                    transaction.unitPrice(),
                    transaction.amount(),
                    transaction.transactionDate(),
                    deliveryMethod(customersById.get(customerId.get())),
                    transaction.currencyCode()
            ));
        }

        if (!unresolved.isEmpty()) {
            log.warn("{} of {} transactions could not be linked and are excluded from the metrics",
                    unresolved.size(), transactions.size());
        }
        log.info("Linked {} transactions", linked.size());
        return new LinkageResult(linked, unresolved);
    }

    private static String deliveryMethod(@Nullable CanonicalCustomer customer) {
        return customer == null || customer.address() == null ? "" : customer.address();
    }
}
