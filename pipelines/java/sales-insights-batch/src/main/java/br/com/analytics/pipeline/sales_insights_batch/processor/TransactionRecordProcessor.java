package br.com.analytics.pipeline.sales_insights_batch.processor;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalField;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.TransactionRecord;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;

public class TransactionRecordProcessor implements ItemProcessor<RawRow, TransactionRecord> {

    private final SourceLayout layout;
    private final PriceParser priceParser;

    public TransactionRecordProcessor(SourceLayout layout, PriceParser priceParser) {
        this.layout = layout;
        this.priceParser = priceParser;
    }

    @Override
    public TransactionRecord process(RawRow row) {
        Map<CanonicalField, String> fields = layout.project(RecordKind.TRANSACTION, row.fields());

        String customerRef = FieldCleaners.clean(fields.get(CanonicalField.CUSTOMER_REF));
        if (customerRef.isEmpty()) {
            throw new NormalizationException("customer reference is missing");
        }
        BigDecimal unitPrice = priceParser.parseUsd(fields.get(CanonicalField.UNIT_PRICE))
                .orElseThrow(() -> new NormalizationException(
                        "unparseable unit price '" + fields.get(CanonicalField.UNIT_PRICE) + "'"));
        int quantity = quantity(fields.get(CanonicalField.QUANTITY));
        LocalDate transactionDate = DateExtractor.extract(fields.get(CanonicalField.ORDERED_AT))
                .orElseThrow(() -> new NormalizationException(
                        "unparseable order date '" + fields.get(CanonicalField.ORDERED_AT) + "'"));

        return new TransactionRecord(
                SourceId.of(row.source(), FieldCleaners.localKey(fields.get(CanonicalField.ORDER_ID), row.lineNumber())),
                customerRef,
                FieldCleaners.clean(fields.get(CanonicalField.BOOK_REF)),
                quantity,
                unitPrice,
                unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP),
                transactionDate,
                PriceParser.CURRENCY_CODE
        );
    }

    private static int quantity(String raw) {
        String quantity = FieldCleaners.clean(raw);
        if (quantity.isEmpty()) {
            return 1;
        }
        try {
            int value = new BigDecimal(quantity).intValueExact();
            if (value <= 0) {
                throw new NormalizationException("non-positive quantity " + value);
            }
            return value;
        } catch (NumberFormatException | ArithmeticException e) {
            throw new NormalizationException("unparseable quantity '" + quantity + "'");
        }
    }
}
