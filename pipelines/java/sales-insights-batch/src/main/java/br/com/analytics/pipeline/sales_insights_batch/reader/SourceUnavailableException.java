package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;

/**
 * A whole source could not be read. Fatal for the run that hit it.
 */
public class SourceUnavailableException extends RuntimeException {

    private final SourceTag source;

    public SourceUnavailableException(SourceTag source, String reason) {
        super("Source " + source + " unavailable: " + reason);
        this.source = source;
    }

    public SourceUnavailableException(SourceTag source, String reason, Throwable cause) {
        super("Source " + source + " unavailable: " + reason, cause);
        this.source = source;
    }

    public SourceTag getSource() {
        return source;
    }
}
