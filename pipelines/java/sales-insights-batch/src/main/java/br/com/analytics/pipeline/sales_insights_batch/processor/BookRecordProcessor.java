package br.com.analytics.pipeline.sales_insights_batch.processor;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalField;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.math.BigDecimal;
import java.util.Map;

public class BookRecordProcessor implements ItemProcessor<RawRow, BookRecord> {

    private final SourceLayout layout;

    public BookRecordProcessor(SourceLayout layout) {
        this.layout = layout;
    }

    @Override
    public BookRecord process(RawRow row) {
        Map<CanonicalField, String> fields = layout.project(RecordKind.BOOK, row.fields());

        String title = FieldCleaners.cleanTitle(fields.get(CanonicalField.TITLE));
        if (title.isEmpty()) {
            throw new NormalizationException("book title is missing");
        }

        return new BookRecord(
                SourceId.of(row.source(), FieldCleaners.localKey(fields.get(CanonicalField.BOOK_ID), row.lineNumber())),
                title,
                FieldCleaners.comparisonKey(title),
                FieldCleaners.splitAuthors(fields.get(CanonicalField.AUTHORS)),
                FieldCleaners.clean(fields.get(CanonicalField.GENRE)),
                FieldCleaners.clean(fields.get(CanonicalField.PUBLISHER)),
                publicationYear(fields.get(CanonicalField.PUBLICATION_YEAR))
        );
    }

    /** Years that are not a whole positive int are left for the catalogue's median fill. */
    private static Integer publicationYear(String raw) {
        String year = FieldCleaners.clean(raw);
        if (year.isEmpty()) {
            return null;
        }
        try {
            int value = new BigDecimal(year).intValueExact();
            return value > 0 ? value : null;
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }
}
