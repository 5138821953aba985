package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.ParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads a YAML book catalogue: a top-level list whose entries are maps.
 * Ruby symbol keys such as {@code :title:} are rewritten to plain keys
 * before parsing. Entries that are not maps surface as {@link ParseException}.
 */
public class BooksYamlItemReader implements ItemStreamReader<RawRow> {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern SYMBOL_KEY = Pattern.compile(":(\\w+):");

    private final SourceTag source;
    private final Path file;

    private @Nullable Iterator<Object> entries;
    private long entryNumber;

    public BooksYamlItemReader(SourceTag source, Path file) {
        this.source = source;
        this.file = file;
    }

    @Override
    public void open(ExecutionContext executionContext) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ItemStreamException("Cannot read " + file, e);
        }
        String plainKeys = SYMBOL_KEY.matcher(content).replaceAll("$1:");
        Object document;
        try {
            document = YAML_MAPPER.readValue(plainKeys, Object.class);
        } catch (JsonProcessingException e) {
            throw new ItemStreamException("Invalid YAML in " + file, e);
        }
        if (document == null) {
            entries = List.of().iterator();
        } else if (document instanceof List<?> list) {
            entries = list.stream().map(Object.class::cast).iterator();
        } else {
            throw new ItemStreamException("Expected a list of books in " + file);
        }
        entryNumber = 0;
    }

    @Override
    public @Nullable RawRow read() {
        if (entries == null) {
            throw new IllegalStateException("Reader for " + file + " is not open");
        }
        if (!entries.hasNext()) {
            return null;
        }
        Object entry = entries.next();
        entryNumber++;
        if (!(entry instanceof Map<?, ?> map)) {
            throw new ParseException("Book entry " + entryNumber + " in " + file + " is not a mapping");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        map.forEach((key, value) -> fields.put(String.valueOf(key), asText(value)));
        return new RawRow(source, RecordKind.BOOK, entryNumber, fields);
    }

    @Override
    public void close() {
        entries = null;
    }

    private static String asText(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(BooksYamlItemReader::asText).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }
}
