package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads one source from its directory: books from YAML, customers from CSV
 * with a header row, orders from Parquet or from CSV with a header row
 * depending on the configured file name.
 */
public class SourceFileLoader implements SourceLoader {

    private final SourceTag source;
    private final SourceLayout layout;

    public SourceFileLoader(SourceTag source, SourceLayout layout) {
        this.source = source;
        this.layout = layout;
    }

    @Override
    public SourceTag source() {
        return source;
    }

    @Override
    public RawRowReader open(RecordKind kind) {
        Path directory = layout.directoryPath();
        if (!Files.isDirectory(directory) || !Files.isReadable(directory)) {
            throw new SourceUnavailableException(source, "directory " + directory + " is missing or unreadable");
        }
        Path file = layout.fileFor(kind);
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new SourceUnavailableException(source, "file " + file + " is missing or unreadable");
        }
        return new RawRowReader(source, kind, reader(kind, file));
    }

    private ItemStreamReader<RawRow> reader(RecordKind kind, Path file) {
        if (kind == RecordKind.BOOK) {
            return new BooksYamlItemReader(source, file);
        }
        if (kind == RecordKind.TRANSACTION && isParquet(file)) {
            return new ParquetOrdersItemReader(source, file);
        }
        return csvReader(kind, file);
    }

    private static boolean isParquet(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".parquet");
    }

    private FlatFileItemReader<RawRow> csvReader(RecordKind kind, Path file) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setStrict(true);

        return new FlatFileItemReaderBuilder<RawRow>()
                .name(source.name().toLowerCase() + "-" + kind.name().toLowerCase() + "-reader")
                .resource(new FileSystemResource(file))
                .encoding("UTF-8")
                .saveState(false)
                .linesToSkip(1)
                .skippedLinesCallback(header -> tokenizer.setNames(headerNames(header)))
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .lineMapper((line, lineNumber) -> toRawRow(kind, lineNumber, tokenizer.tokenize(line)))
                .build();
    }

    private RawRow toRawRow(RecordKind kind, long lineNumber, FieldSet fieldSet) {
        String[] names = fieldSet.getNames();
        String[] values = fieldSet.getValues();
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            fields.put(names[i], values[i]);
        }
        return new RawRow(source, kind, lineNumber, fields);
    }

    private static String[] headerNames(String header) {
        String withoutBom = header.startsWith("\uFEFF") ? header.substring(1) : header;
        return Arrays.stream(new DelimitedLineTokenizer().tokenize(withoutBom).getValues())
                .map(String::trim)
                .toArray(String[]::new);
    }
}
