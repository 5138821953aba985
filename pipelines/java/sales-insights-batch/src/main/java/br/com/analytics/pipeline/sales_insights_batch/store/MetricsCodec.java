package br.com.analytics.pipeline.sales_insights_batch.store;

import br.com.analytics.pipeline.sales_insights_batch.model.AnalyticsMetric;
import br.com.analytics.pipeline.sales_insights_batch.model.AuthorPopularity;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;
import br.com.analytics.pipeline.sales_insights_batch.model.RevenueDay;
import br.com.analytics.pipeline.sales_insights_batch.model.RunSummary;
import br.com.analytics.pipeline.sales_insights_batch.model.TopCustomer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts dashboard metrics to and from {@code analytics_metrics} rows, one
 * JSON value per metric key.
 */
public class MetricsCodec {

    public static final String TOP_REVENUE_DAYS = "top_revenue_days";
    public static final String UNIQUE_CUSTOMER_COUNT = "unique_customer_count";
    public static final String CUSTOMER_SOURCE_RECORD_COUNT = "customer_source_record_count";
    public static final String UNIQUE_AUTHOR_COUNT = "unique_author_count";
    public static final String UNIQUE_AUTHOR_SET_COUNT = "unique_author_set_count";
    public static final String MOST_POPULAR_AUTHOR = "most_popular_author";
    public static final String TOP_CUSTOMER = "top_customer";
    public static final String TOTAL_REVENUE = "total_revenue";
    public static final String RUN_SUMMARY = "run_summary";

    static final List<String> METRIC_KEYS = List.of(TOP_REVENUE_DAYS, UNIQUE_CUSTOMER_COUNT,
            CUSTOMER_SOURCE_RECORD_COUNT, UNIQUE_AUTHOR_COUNT, UNIQUE_AUTHOR_SET_COUNT, MOST_POPULAR_AUTHOR,
            TOP_CUSTOMER, TOTAL_REVENUE, RUN_SUMMARY);

    private static final TypeReference<List<RevenueDay>> REVENUE_DAYS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public MetricsCodec() {
        this(new ObjectMapper());
    }

    public MetricsCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(DashboardMetrics metrics) {
        return write(metrics);
    }

    public List<AnalyticsMetric> toRows(DashboardMetrics metrics, Fingerprint fingerprint, LocalDateTime runTimestamp) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(TOP_REVENUE_DAYS, metrics.topRevenueDays());
        values.put(UNIQUE_CUSTOMER_COUNT, metrics.uniqueCustomerCount());
        values.put(CUSTOMER_SOURCE_RECORD_COUNT, metrics.customerSourceRecordCount());
        values.put(UNIQUE_AUTHOR_COUNT, metrics.uniqueAuthorCount());
        values.put(UNIQUE_AUTHOR_SET_COUNT, metrics.uniqueAuthorSetCount());
        values.put(MOST_POPULAR_AUTHOR, metrics.mostPopularAuthor());
        values.put(TOP_CUSTOMER, metrics.topCustomer());
        values.put(TOTAL_REVENUE, metrics.totalRevenue());
        values.put(RUN_SUMMARY, metrics.runSummary());
        return values.entrySet().stream()
                .map(entry -> new AnalyticsMetric(entry.getKey(), write(entry.getValue()), fingerprint.value(), runTimestamp))
                .toList();
    }

    /**
     * @return the metrics, or empty when any metric key is missing
     */
    public Optional<DashboardMetrics> fromRows(List<AnalyticsMetric> rows) {
        Map<String, String> values = rows.stream()
                .collect(Collectors.toMap(AnalyticsMetric::metricKey, AnalyticsMetric::metricValue,
                        (first, second) -> second));
        if (!values.keySet().containsAll(METRIC_KEYS)) {
            return Optional.empty();
        }
        return Optional.of(new DashboardMetrics(
                read(values.get(TOP_REVENUE_DAYS), REVENUE_DAYS),
                read(values.get(UNIQUE_CUSTOMER_COUNT), Long.class),
                read(values.get(CUSTOMER_SOURCE_RECORD_COUNT), Long.class),
                read(values.get(UNIQUE_AUTHOR_COUNT), Long.class),
                read(values.get(UNIQUE_AUTHOR_SET_COUNT), Long.class),
                read(values.get(MOST_POPULAR_AUTHOR), AuthorPopularity.class),
                read(values.get(TOP_CUSTOMER), TopCustomer.class),
                read(values.get(TOTAL_REVENUE), BigDecimal.class),
                read(values.get(RUN_SUMMARY), RunSummary.class)
        ));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metric value " + value, e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metric value is not valid JSON: " + json, e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metric value is not valid JSON: " + json, e);
        }
    }
}
