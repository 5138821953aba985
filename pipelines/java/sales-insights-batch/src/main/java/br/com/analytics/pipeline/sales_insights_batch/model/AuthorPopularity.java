package br.com.analytics.pipeline.sales_insights_batch.model;

public record AuthorPopularity(
        Long authorId,
        String authorName,
        long transactionCount,
        long booksSold
) {
}
