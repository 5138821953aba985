package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.AnalyticsMetric;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

public class AnalyticsMetricRowMapper implements RowMapper<AnalyticsMetric> {

    @Override
    public AnalyticsMetric mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new AnalyticsMetric(
                resultSet.getString("metricKey"),
                resultSet.getString("metricValue"),
                resultSet.getString("runFingerprint"),
                resultSet.getObject("runTimestamp", LocalDateTime.class)
        );
    }
}
