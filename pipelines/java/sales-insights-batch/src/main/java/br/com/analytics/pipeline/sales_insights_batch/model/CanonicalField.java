package br.com.analytics.pipeline.sales_insights_batch.model;

/**
 * Fields a raw column can be mapped onto. Each source declares its own
 * raw column name to canonical field mapping per record kind.
 */
public enum CanonicalField {
    BOOK_ID,
    TITLE,
    AUTHORS,
    GENRE,
    PUBLISHER,
    PUBLICATION_YEAR,

    CUSTOMER_ID,
    NAME,
    ADDRESS,
    PHONE,
    EMAIL,

    ORDER_ID,
    CUSTOMER_REF,
    BOOK_REF,
    QUANTITY,
    UNIT_PRICE,
    ORDERED_AT
}
