package br.com.analytics.pipeline.sales_insights_batch.config;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalField;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where one source keeps its files and how its raw columns map onto
 * canonical fields. Unset values fall back to the layout shared by the
 * three webshop exports.
 */
public record SourceLayout(
        String directory,
        String booksFile,
        String customersFile,
        String transactionsFile,
        Map<String, CanonicalField> bookFields,
        Map<String, CanonicalField> customerFields,
        Map<String, CanonicalField> transactionFields
) {

    public SourceLayout {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("Source directory must be configured");
        }
        booksFile = booksFile == null ? "books.yaml" : booksFile;
        customersFile = customersFile == null ? "users.csv" : customersFile;
        transactionsFile = transactionsFile == null ? "orders.parquet" : transactionsFile;
        bookFields = copyOrDefault(bookFields, defaultBookFields());
        customerFields = copyOrDefault(customerFields, defaultCustomerFields());
        transactionFields = copyOrDefault(transactionFields, defaultTransactionFields());
    }

    public static SourceLayout standard(String directory) {
        return new SourceLayout(directory, null, null, null, null, null, null);
    }

    public Path directoryPath() {
        return Path.of(directory);
    }

    public Path fileFor(RecordKind kind) {
        return switch (kind) {
            case BOOK -> directoryPath().resolve(booksFile);
            case CUSTOMER -> directoryPath().resolve(customersFile);
            case TRANSACTION -> directoryPath().resolve(transactionsFile);
        };
    }

    /**
     * Projects a raw row onto canonical fields. Columns without a mapping are
     * dropped; mapped columns missing from the row are absent from the result.
     */
    public Map<CanonicalField, String> project(RecordKind kind, Map<String, String> rawFields) {
        Map<String, CanonicalField> mapping = switch (kind) {
            case BOOK -> bookFields;
            case CUSTOMER -> customerFields;
            case TRANSACTION -> transactionFields;
        };
        Map<CanonicalField, String> projected = new EnumMap<>(CanonicalField.class);
        rawFields.forEach((column, value) -> {
            CanonicalField field = mapping.get(column.trim());
            if (field != null && value != null) {
                projected.put(field, value);
            }
        });
        return projected;
    }

    private static Map<String, CanonicalField> copyOrDefault(Map<String, CanonicalField> configured,
                                                             Map<String, CanonicalField> fallback) {
        return Map.copyOf(configured == null || configured.isEmpty() ? fallback : configured);
    }

    private static Map<String, CanonicalField> defaultBookFields() {
        Map<String, CanonicalField> fields = new LinkedHashMap<>();
        fields.put("id", CanonicalField.BOOK_ID);
        fields.put("title", CanonicalField.TITLE);
        fields.put("author", CanonicalField.AUTHORS);
        fields.put("genre", CanonicalField.GENRE);
        fields.put("publisher", CanonicalField.PUBLISHER);
        fields.put("year", CanonicalField.PUBLICATION_YEAR);
        return fields;
    }

    private static Map<String, CanonicalField> defaultCustomerFields() {
        Map<String, CanonicalField> fields = new LinkedHashMap<>();
        fields.put("id", CanonicalField.CUSTOMER_ID);
        fields.put("name", CanonicalField.NAME);
        fields.put("address", CanonicalField.ADDRESS);
        fields.put("phone", CanonicalField.PHONE);
        fields.put("email", CanonicalField.EMAIL);
        return fields;
    }

    private static Map<String, CanonicalField> defaultTransactionFields() {
        Map<String, CanonicalField> fields = new LinkedHashMap<>();
        fields.put("id", CanonicalField.ORDER_ID);
        fields.put("user_id", CanonicalField.CUSTOMER_REF);
        fields.put("book_id", CanonicalField.BOOK_REF);
        fields.put("quantity", CanonicalField.QUANTITY);
        fields.put("unit_price", CanonicalField.UNIT_PRICE);
        fields.put("timestamp", CanonicalField.ORDERED_AT);
        return fields;
    }
}
