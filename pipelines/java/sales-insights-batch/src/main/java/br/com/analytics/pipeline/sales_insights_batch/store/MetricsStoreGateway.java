package br.com.analytics.pipeline.sales_insights_batch.store;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.SaveResult;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for the outputs of a pipeline run. The pipeline never talks to
 * storage except through this interface.
 */
public interface MetricsStoreGateway {

    /**
     * @return the input fingerprint of the last saved run, if any
     */
    Optional<Fingerprint> loadExistingFingerprint();

    /**
     * Replaces the stored run with this one. Either everything is saved or,
     * on failure, the previously stored run stays untouched.
     */
    SaveResult saveRun(List<CanonicalCustomer> customers,
                       List<CanonicalAuthor> authors,
                       List<CanonicalBook> books,
                       List<LinkedTransaction> transactions,
                       DashboardMetrics metrics,
                       Fingerprint fingerprint);

    Optional<DashboardMetrics> loadMetrics();
}
