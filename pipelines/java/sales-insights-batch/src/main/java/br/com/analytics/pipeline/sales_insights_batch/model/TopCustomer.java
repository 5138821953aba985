package br.com.analytics.pipeline.sales_insights_batch.model;

import java.math.BigDecimal;
import java.util.List;

public record TopCustomer(
        Long customerId,
        String customerName,
        BigDecimal totalSpent,
        List<String> linkedIds
) {

    public TopCustomer {
        linkedIds = List.copyOf(linkedIds);
    }
}
