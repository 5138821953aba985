package br.com.analytics.pipeline.sales_insights_batch.model;

import java.time.LocalDateTime;

public record AnalyticsMetric(
        String metricKey,
        String metricValue,
        String runFingerprint,
        LocalDateTime runTimestamp
) {
}
