package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemReader;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.ParseException;

/**
 * Pulls raw rows from a file reader, skipping and counting rows whose
 * structure cannot be parsed. Anything else that goes wrong while reading
 * makes the whole source unavailable.
 */
public class RawRowReader implements ItemReader<RawRow>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RawRowReader.class);

    private final SourceTag source;
    private final RecordKind kind;
    private final ItemStreamReader<RawRow> delegate;

    private boolean opened;
    private long rowsRead;
    private long skippedRows;

    public RawRowReader(SourceTag source, RecordKind kind, ItemStreamReader<RawRow> delegate) {
        this.source = source;
        this.kind = kind;
        this.delegate = delegate;
    }

    @Override
    public @Nullable RawRow read() {
        openIfNeeded();
        while (true) {
            try {
                RawRow row = delegate.read();
                if (row != null) {
                    rowsRead++;
                }
                return row;
            } catch (ParseException e) {
                skippedRows++;
                log.warn("Skipping malformed {} row in source {}: {}", kind, source, e.getMessage());
            } catch (Exception e) {
                throw new SourceUnavailableException(source, "failed reading " + kind + " rows", e);
            }
        }
    }

    public long rowsRead() {
        return rowsRead;
    }

    public long skippedRows() {
        return skippedRows;
    }

    @Override
    public void close() {
        if (opened) {
            delegate.close();
            opened = false;
        }
    }

    private void openIfNeeded() {
        if (opened) {
            return;
        }
        try {
            delegate.open(new ExecutionContext());
            opened = true;
        } catch (ItemStreamException e) {
            throw new SourceUnavailableException(source, "cannot open " + kind + " rows", e);
        }
    }
}
