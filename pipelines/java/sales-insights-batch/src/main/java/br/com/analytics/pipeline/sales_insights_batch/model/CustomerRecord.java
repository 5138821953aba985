package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.stream.Stream;

/**
 * A customer as one source describes it. Display values keep the source's
 * spelling; the {@code *Key} values are the normalized comparison forms and
 * are empty when the field is missing.
 */
public record CustomerRecord(
        SourceId sourceId,
        String name,
        String nameKey,
        String email,
        String emailKey,
        String address,
        String addressKey,
        String phone,
        String phoneKey
) {

    public long completeness() {
        return Stream.of(name, email, address, phone).filter(value -> !value.isEmpty()).count();
    }

    public String key(CompositeMatchField field) {
        return switch (field) {
            case ADDRESS -> addressKey;
            case PHONE -> phoneKey;
        };
    }
}
