package br.com.analytics.pipeline.sales_insights_batch.processor;

import org.jspecify.annotations.Nullable;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text cleanup shared by the record processors. Display forms only get
 * trimmed and whitespace-collapsed; {@code *Key} forms are what records are
 * compared on.
 */
public final class FieldCleaners {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern QUOTED_WORD = Pattern.compile("'(\\w+)'");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[).\\s+]");
    private static final Pattern PHONE_AREA_CODE = Pattern.compile("\\((\\d+)--");
    private static final Pattern REPEATED_DASH = Pattern.compile("-{2,}");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern ADDRESS_PUNCTUATION = Pattern.compile("[.,#]");

    private FieldCleaners() {
    }

    public static String clean(@Nullable String value) {
        if (value == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(value.strip()).replaceAll(" ");
        return isNullMarker(collapsed) ? "" : collapsed;
    }

    /** The source-local key of a record, falling back to its position when the id column is blank. */
    public static String localKey(@Nullable String rawId, long lineNumber) {
        String id = clean(rawId);
        return id.isEmpty() ? "row-" + lineNumber : id;
    }

    public static String comparisonKey(@Nullable String value) {
        String cleaned = clean(value);
        return Normalizer.normalize(cleaned, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    }

    public static String emailKey(@Nullable String value) {
        return clean(value).toLowerCase(Locale.ROOT);
    }

    public static String addressKey(@Nullable String value) {
        String key = ADDRESS_PUNCTUATION.matcher(comparisonKey(value)).replaceAll(" ");
        return WHITESPACE.matcher(key).replaceAll(" ").strip();
    }

    /** Dash separated display form, e.g. {@code (555) 123.4567} becomes {@code 555-123-4567}. */
    public static String phoneDisplay(@Nullable String value) {
        String cleaned = clean(value);
        if (cleaned.isEmpty()) {
            return "";
        }
        String dashed = PHONE_SEPARATORS.matcher(cleaned).replaceAll("-");
        dashed = PHONE_AREA_CODE.matcher(dashed).replaceAll("$1-");
        dashed = REPEATED_DASH.matcher(dashed.replace("(", "")).replaceAll("-");
        return dashed.replaceAll("^-|-$", "");
    }

    public static String phoneKey(@Nullable String value) {
        return NON_DIGIT.matcher(clean(value)).replaceAll("");
    }

    public static String cleanTitle(@Nullable String value) {
        String title = QUOTED_WORD.matcher(clean(value)).replaceAll("$1");
        return title.replace("''", "'").replace('–', '-');
    }

    /** Splits a comma separated author list, dropping blanks and repeated names. */
    public static List<String> splitAuthors(@Nullable String value) {
        Set<String> seenKeys = new LinkedHashSet<>();
        List<String> authors = new ArrayList<>();
        for (String part : clean(value).split(",")) {
            String author = clean(part);
            if (!author.isEmpty() && seenKeys.add(comparisonKey(author))) {
                authors.add(author);
            }
        }
        return authors;
    }

    private static boolean isNullMarker(String value) {
        return value.equalsIgnoreCase("null") || value.equalsIgnoreCase("nan") || value.equalsIgnoreCase("none");
    }
}
