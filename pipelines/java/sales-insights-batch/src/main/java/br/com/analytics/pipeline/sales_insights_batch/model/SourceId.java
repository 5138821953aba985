package br.com.analytics.pipeline.sales_insights_batch.model;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Identifies a record by its origin: the source it came from and the key
 * that source uses for it. Rendered as {@code S1:c100}.
 */
public record SourceId(
        SourceTag source,
        String localKey
) implements Comparable<SourceId> {

    private static final Comparator<String> LOCAL_KEY_ORDER = (left, right) -> {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            int byValue = new BigInteger(left).compareTo(new BigInteger(right));
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    };

    private static final Comparator<SourceId> ORDER = Comparator
            .comparing(SourceId::source)
            .thenComparing(SourceId::localKey, LOCAL_KEY_ORDER);

    public SourceId {
        if (source == null || localKey == null || localKey.isBlank()) {
            throw new IllegalArgumentException("SourceId needs a source and a non-blank local key");
        }
    }

    public static SourceId of(SourceTag source, String localKey) {
        return new SourceId(source, localKey);
    }

    public static SourceId parse(String text) {
        int separator = text.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Not a source id: " + text);
        }
        return new SourceId(SourceTag.valueOf(text.substring(0, separator)), text.substring(separator + 1));
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    @Override
    public int compareTo(SourceId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return source.name() + ":" + localKey;
    }
}
