package br.com.analytics.pipeline.sales_insights_batch.processor;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.NormalizationError;
import br.com.analytics.pipeline.sales_insights_batch.model.NormalizedSource;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import br.com.analytics.pipeline.sales_insights_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_insights_batch.reader.RawRowReader;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the raw rows of one source into typed source records. Rows whose
 * required fields do not parse are recorded as {@link NormalizationError}s
 * and left out; the run carries on.
 */
public class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private final Map<SourceTag, SourceLayout> layouts;
    private final PriceParser priceParser;

    public RecordNormalizer(Map<SourceTag, SourceLayout> layouts, PriceParser priceParser) {
        this.layouts = layouts;
        this.priceParser = priceParser;
    }

    public NormalizedSource normalize(SourceLoader loader) {
        SourceTag source = loader.source();
        SourceLayout layout = Objects.requireNonNull(layouts.get(source), "No layout configured for " + source);
        List<NormalizationError> errors = new ArrayList<>();

        Drained<BookRecord> books = drain(loader, RecordKind.BOOK, new BookRecordProcessor(layout)::process, errors);
        Drained<CustomerRecord> customers = drain(loader, RecordKind.CUSTOMER,
                new CustomerRecordProcessor(layout)::process, errors);
        Drained<TransactionRecord> transactions = drain(loader, RecordKind.TRANSACTION,
                new TransactionRecordProcessor(layout, priceParser)::process, errors);

        long malformedRows = books.skippedRows() + customers.skippedRows() + transactions.skippedRows();
        log.info("Source {} normalized: {} books, {} customers, {} transactions ({} malformed rows, {} normalization errors)",
                source, books.records().size(), customers.records().size(), transactions.records().size(),
                malformedRows, errors.size());

        return new NormalizedSource(source, fillCatalogDefaults(books.records()), customers.records(),
                transactions.records(), errors, malformedRows);
    }

    private <T> Drained<T> drain(SourceLoader loader, RecordKind kind, Function<RawRow, T> processor,
                                 List<NormalizationError> errors) {
        List<T> records = new ArrayList<>();
        try (RawRowReader reader = loader.open(kind)) {
            RawRow row;
            while ((row = reader.read()) != null) {
                try {
                    records.add(processor.apply(row));
                } catch (NormalizationException e) {
                    log.warn("Dropping {} row {} of source {}: {}", kind, row.lineNumber(), row.source(), e.getMessage());
                    errors.add(new NormalizationError(row.source(), kind, row.lineNumber(), row.fields(), e.getMessage()));
                }
            }
            return new Drained<>(records, reader.skippedRows());
        }
    }

    /**
     * Fills blank publishers with the source's most frequent publisher and
     * missing years with its median year.
     */
    private static List<BookRecord> fillCatalogDefaults(List<BookRecord> books) {
        String defaultPublisher = books.stream()
                .map(BookRecord::publisher)
                .filter(publisher -> !publisher.isEmpty())
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse("");

        List<Integer> years = books.stream()
                .map(BookRecord::publicationYear)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        Integer medianYear = years.isEmpty() ? null : years.get((years.size() - 1) / 2);

        return books.stream()
                .map(book -> book.withCatalogDefaults(defaultPublisher, medianYear))
                .toList();
    }

    private record Drained<T>(List<T> records, long skippedRows) {
    }
}
