package br.com.analytics.pipeline.sales_insights_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionRecord(
        SourceId sourceId,
        String customerRef,
        String bookRef,
        Integer quantity,
        BigDecimal unitPrice,
        BigDecimal amount,
        LocalDate transactionDate,
        String currencyCode
) {
}
