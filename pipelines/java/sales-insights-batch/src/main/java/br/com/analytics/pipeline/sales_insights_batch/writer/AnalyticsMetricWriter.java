package br.com.analytics.pipeline.sales_insights_batch.writer;

import br.com.analytics.pipeline.sales_insights_batch.model.AnalyticsMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;

public class AnalyticsMetricWriter implements ItemWriter<AnalyticsMetric> {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsMetricWriter.class);

    private static final String SQL_INSERT =
            "INSERT INTO analytics_metrics (metric_key, metric_value, run_fingerprint, run_timestamp) " +
                    "VALUES (:metricKey, :metricValue, :runFingerprint, :runTimestamp)";

    private final JdbcBatchItemWriter<AnalyticsMetric> delegateWriter;

    public AnalyticsMetricWriter(DataSource dataSource) {
        this.delegateWriter = JdbcWriters.namedParameterWriter(dataSource, SQL_INSERT, metric ->
                new MapSqlParameterSource()
                        .addValue("metricKey", metric.metricKey())
                        .addValue("metricValue", metric.metricValue())
                        .addValue("runFingerprint", metric.runFingerprint())
                        .addValue("runTimestamp", metric.runTimestamp()));
    }

    @Override
    public void write(Chunk<? extends AnalyticsMetric> chunk) throws Exception {
        if (chunk.isEmpty()) {
            return;
        }
        log.info("Writing {} analytics metrics ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
