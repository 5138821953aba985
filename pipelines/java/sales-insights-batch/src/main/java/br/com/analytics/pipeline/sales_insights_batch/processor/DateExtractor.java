package br.com.analytics.pipeline.sales_insights_batch.processor;

import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a calendar date inside free-form order timestamps. Patterns are
 * tried in a fixed order and the first one yielding a valid date wins.
 */
public final class DateExtractor {

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private record DatePattern(Pattern pattern, Function<Matcher, LocalDate> toDate) {
    }

    private static final List<DatePattern> PATTERNS = List.of(
            // ISO
            new DatePattern(Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})"),
                    m -> LocalDate.of(group(m, 1), group(m, 2), group(m, 3))),
            // US, four digit year
            new DatePattern(Pattern.compile("(?<!\\d)(\\d{2})/(\\d{2})/(\\d{4})(?!\\d)"),
                    m -> LocalDate.of(group(m, 3), group(m, 1), group(m, 2))),
            // US, two digit year
            new DatePattern(Pattern.compile("(?<!\\d)(\\d{2})/(\\d{2})/(\\d{2})(?!\\d)"),
                    m -> LocalDate.of(2000 + group(m, 3), group(m, 1), group(m, 2))),
            // European
            new DatePattern(Pattern.compile("(?<!\\d)(\\d{1,2})\\.(\\d{2})\\.(\\d{4})(?!\\d)"),
                    m -> LocalDate.of(group(m, 3), group(m, 2), group(m, 1))),
            // 5-Mar-2024, 05-March-2024
            new DatePattern(Pattern.compile("(?<!\\d)(\\d{1,2})-([A-Za-z]+)-(\\d{4})(?!\\d)"),
                    m -> LocalDate.of(group(m, 3), month(m.group(2)), group(m, 1)))
    );

    private DateExtractor() {
    }

    public static Optional<LocalDate> extract(@Nullable String raw) {
        String text = FieldCleaners.clean(raw);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (DatePattern candidate : PATTERNS) {
            Matcher matcher = candidate.pattern().matcher(text);
            if (matcher.find()) {
                try {
                    return Optional.of(candidate.toDate().apply(matcher));
                } catch (DateTimeException e) {
                    // out of range day or month, try the next layout
                }
            }
        }
        return Optional.empty();
    }

    private static int group(Matcher matcher, int index) {
        return Integer.parseInt(matcher.group(index));
    }

    private static int month(String name) {
        String prefix = name.length() < 3 ? name : name.substring(0, 3);
        Integer month = MONTHS.get(prefix.toLowerCase(Locale.ROOT));
        if (month == null) {
            throw new DateTimeException("Unknown month " + name);
        }
        return month;
    }
}
