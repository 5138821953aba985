package br.com.analytics.pipeline.sales_insights_batch.model;

/**
 * How author mentions with the same normalized name are merged.
 */
public enum AuthorMatchMode {
    /** Same name plus a shared catalogue, book title or co-author. */
    NAME_AND_CONTEXT,
    /** Same name is enough. */
    NAME_ONLY
}
