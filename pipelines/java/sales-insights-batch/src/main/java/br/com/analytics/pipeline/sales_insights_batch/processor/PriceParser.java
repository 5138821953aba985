package br.com.analytics.pipeline.sales_insights_batch.processor;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses unit prices as exported by the webshops ({@code $12.50},
 * {@code 12.50 USD}, {@code €9}, {@code 12$50¢}, {@code 9 EUR.}) into US
 * dollars at scale 2. Euro prices are converted at a configured rate.
 */
public class PriceParser {

    public static final String CURRENCY_CODE = "USD";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DOLLARS_AND_CENTS = Pattern.compile("(\\d+)\\$(\\d+)¢");
    private static final Pattern EUROS_AND_CENTS = Pattern.compile("(\\d+)€(\\d+)¢");
    private static final Pattern SYMBOLS = Pattern.compile("[$€]");
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private final BigDecimal eurToUsdRate;

    public PriceParser(BigDecimal eurToUsdRate) {
        this.eurToUsdRate = eurToUsdRate;
    }

    public Optional<BigDecimal> parseUsd(@Nullable String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String price = WHITESPACE.matcher(raw).replaceAll("")
                .replace("USD", "$")
                .replace("EUR", "€");
        if (price.endsWith(".")) {
            price = price.substring(0, price.length() - 1);
        }
        price = DOLLARS_AND_CENTS.matcher(price).replaceAll("\\$$1.$2");
        price = EUROS_AND_CENTS.matcher(price).replaceAll("€$1.$2");
        price = price.replace('¢', '.');

        boolean euros = price.contains("€");
        String digits = SYMBOLS.matcher(price).replaceAll("");
        if (!NUMBER.matcher(digits).matches()) {
            return Optional.empty();
        }
        BigDecimal amount = new BigDecimal(digits);
        if (euros) {
            amount = amount.multiply(eurToUsdRate);
        }
        return Optional.of(amount.setScale(2, RoundingMode.HALF_UP));
    }
}
