package br.com.analytics.pipeline.sales_insights_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record DashboardMetrics(
        List<RevenueDay> topRevenueDays,
        long uniqueCustomerCount,
        long customerSourceRecordCount,
        long uniqueAuthorCount,
        long uniqueAuthorSetCount,
        @Nullable AuthorPopularity mostPopularAuthor,
        @Nullable TopCustomer topCustomer,
        BigDecimal totalRevenue,
        RunSummary runSummary
) {

    public DashboardMetrics {
        topRevenueDays = List.copyOf(topRevenueDays);
    }
}
