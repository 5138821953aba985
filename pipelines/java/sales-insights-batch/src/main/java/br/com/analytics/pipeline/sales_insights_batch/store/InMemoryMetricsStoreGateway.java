package br.com.analytics.pipeline.sales_insights_batch.store;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.SaveResult;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the last saved run in memory. Used when no database is configured
 * and in tests.
 */
public class InMemoryMetricsStoreGateway implements MetricsStoreGateway {

    private @Nullable StoredRun storedRun;
    private int saveCount;

    @Override
    public synchronized Optional<Fingerprint> loadExistingFingerprint() {
        return Optional.ofNullable(storedRun).map(StoredRun::fingerprint);
    }

    @Override
    public synchronized SaveResult saveRun(List<CanonicalCustomer> customers,
                                           List<CanonicalAuthor> authors,
                                           List<CanonicalBook> books,
                                           List<LinkedTransaction> transactions,
                                           DashboardMetrics metrics,
                                           Fingerprint fingerprint) {
        storedRun = new StoredRun(fingerprint, metrics, List.copyOf(customers), List.copyOf(authors),
                List.copyOf(books), List.copyOf(transactions));
        saveCount++;
        return new SaveResult(customers.size(), books.size(), transactions.size(), MetricsCodec.METRIC_KEYS.size());
    }

    @Override
    public synchronized Optional<DashboardMetrics> loadMetrics() {
        return Optional.ofNullable(storedRun).map(StoredRun::metrics);
    }

    public synchronized int saveCount() {
        return saveCount;
    }

    public synchronized List<CanonicalCustomer> storedCustomers() {
        return storedRun == null ? List.of() : storedRun.customers();
    }

    public synchronized List<LinkedTransaction> storedTransactions() {
        return storedRun == null ? List.of() : storedRun.transactions();
    }

    private record StoredRun(
            Fingerprint fingerprint,
            DashboardMetrics metrics,
            List<CanonicalCustomer> customers,
            List<CanonicalAuthor> authors,
            List<CanonicalBook> books,
            List<LinkedTransaction> transactions
    ) {
    }
}
