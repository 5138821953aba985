package br.com.analytics.pipeline.sales_insights_batch.store;

import br.com.analytics.pipeline.sales_insights_batch.model.AnalyticsMetric;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.SaveResult;
import br.com.analytics.pipeline.sales_insights_batch.reader.AnalyticsMetricRowMapper;
import br.com.analytics.pipeline.sales_insights_batch.writer.AnalyticsMetricWriter;
import br.com.analytics.pipeline.sales_insights_batch.writer.BookCatalogEntry;
import br.com.analytics.pipeline.sales_insights_batch.writer.BookCatalogWriter;
import br.com.analytics.pipeline.sales_insights_batch.writer.CustomerProfileWriter;
import br.com.analytics.pipeline.sales_insights_batch.writer.TransactionRecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stores a run in the four dashboard tables. A save deletes the previous run
 * and inserts the new one inside a single transaction.
 */
public class JdbcMetricsStoreGateway implements MetricsStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(JdbcMetricsStoreGateway.class);

    private static final int WRITE_CHUNK_SIZE = 500;

    private static final String SQL_RUN_FINGERPRINT =
            "SELECT run_fingerprint FROM analytics_metrics WHERE metric_key = ?";

    private static final String SQL_ALL_METRICS =
            "SELECT metric_key AS metricKey, metric_value AS metricValue, " +
                    "run_fingerprint AS runFingerprint, run_timestamp AS runTimestamp " +
                    "FROM analytics_metrics ORDER BY metric_key";

    private static final List<String> SQL_CLEAR_RUN = List.of(
            "DELETE FROM analytics_metrics",
            "DELETE FROM transaction_records",
            "DELETE FROM book_catalog",
            "DELETE FROM customer_profiles");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final MetricsCodec metricsCodec;
    private final Clock clock;

    private final CustomerProfileWriter customerProfileWriter;
    private final BookCatalogWriter bookCatalogWriter;
    private final TransactionRecordWriter transactionRecordWriter;
    private final AnalyticsMetricWriter analyticsMetricWriter;

    public JdbcMetricsStoreGateway(DataSource dataSource, PlatformTransactionManager transactionManager,
                                   MetricsCodec metricsCodec, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsCodec = metricsCodec;
        this.clock = clock;
        this.customerProfileWriter = new CustomerProfileWriter(dataSource);
        this.bookCatalogWriter = new BookCatalogWriter(dataSource);
        this.transactionRecordWriter = new TransactionRecordWriter(dataSource);
        this.analyticsMetricWriter = new AnalyticsMetricWriter(dataSource);
    }

    @Override
    public Optional<Fingerprint> loadExistingFingerprint() {
        String storedFingerprint;
        try {
            storedFingerprint = jdbcTemplate.queryForObject(SQL_RUN_FINGERPRINT, String.class, MetricsCodec.RUN_SUMMARY);
        } catch (EmptyResultDataAccessException e) {
            storedFingerprint = null;
        }
        return Optional.ofNullable(storedFingerprint).map(Fingerprint::new);
    }

    @Override
    public SaveResult saveRun(List<CanonicalCustomer> customers,
                              List<CanonicalAuthor> authors,
                              List<CanonicalBook> books,
                              List<LinkedTransaction> transactions,
                              DashboardMetrics metrics,
                              Fingerprint fingerprint) {
        List<BookCatalogEntry> catalog = catalogEntries(authors, books);
        List<AnalyticsMetric> metricRows = metricsCodec.toRows(metrics, fingerprint, LocalDateTime.now(clock));

        SaveResult result;
        try {
            result = transactionTemplate.execute(status -> {
                SQL_CLEAR_RUN.forEach(jdbcTemplate::update);
                writeAll(customerProfileWriter, customers);
                writeAll(bookCatalogWriter, catalog);
                writeAll(transactionRecordWriter, transactions);
                writeAll(analyticsMetricWriter, metricRows);
                return new SaveResult(customers.size(), catalog.size(), transactions.size(), metricRows.size());
            });
        } catch (StoreWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreWriteException("Saving run " + fingerprint + " failed", e);
        }
        if (result == null) {
            throw new StoreWriteException("Saving run " + fingerprint + " returned no result", null);
        }
        log.info("Saved run {}: {} customer profiles, {} books, {} transactions, {} metrics.", fingerprint,
                result.customerProfiles(), result.bookCatalog(), result.transactionRecords(), result.analyticsMetrics());
        return result;
    }

    @Override
    public Optional<DashboardMetrics> loadMetrics() {
        List<AnalyticsMetric> rows = jdbcTemplate.query(SQL_ALL_METRICS, new AnalyticsMetricRowMapper());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return metricsCodec.fromRows(rows);
    }

    private static List<BookCatalogEntry> catalogEntries(List<CanonicalAuthor> authors, List<CanonicalBook> books) {
        Map<Long, String> authorNames = authors.stream()
                .collect(Collectors.toMap(CanonicalAuthor::authorId, CanonicalAuthor::name));
        Function<Long, String> nameOf = authorId -> authorNames.getOrDefault(authorId, String.valueOf(authorId));
        return books.stream()
                .map(book -> new BookCatalogEntry(book, book.authorIds().stream().map(nameOf).toList()))
                .toList();
    }

    private static <T> void writeAll(ItemWriter<T> writer, List<? extends T> items) {
        for (int from = 0; from < items.size(); from += WRITE_CHUNK_SIZE) {
            List<? extends T> slice = items.subList(from, Math.min(items.size(), from + WRITE_CHUNK_SIZE));
            try {
                writer.write(new Chunk<T>(List.copyOf(slice)));
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new StoreWriteException("Batch insert failed", e);
            }
        }
    }
}
