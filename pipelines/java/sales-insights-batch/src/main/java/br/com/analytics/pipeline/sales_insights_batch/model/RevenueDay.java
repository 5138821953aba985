package br.com.analytics.pipeline.sales_insights_batch.model;

import java.math.BigDecimal;

public record RevenueDay(
        String date,
        BigDecimal revenue
) {
}
