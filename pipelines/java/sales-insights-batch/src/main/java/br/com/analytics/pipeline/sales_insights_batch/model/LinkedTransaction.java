package br.com.analytics.pipeline.sales_insights_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record LinkedTransaction(
        SourceId sourceId,
        Long customerId,
        Long bookId,
        Integer quantity,
        BigDecimal unitPrice,
        BigDecimal amount,
        LocalDate transactionDate,
        String deliveryMethod,
        String currencyCode
) {
}
