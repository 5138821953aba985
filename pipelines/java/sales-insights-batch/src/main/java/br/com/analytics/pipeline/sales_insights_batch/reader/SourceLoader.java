package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;

/**
 * Reads the raw files of one source.
 */
public interface SourceLoader {

    SourceTag source();

    /**
     * Opens a fresh reader over the rows of the given kind. Every call starts
     * from the beginning of the underlying file.
     *
     * @throws SourceUnavailableException when the source location or file is missing or unreadable
     */
    RawRowReader open(RecordKind kind);
}
