package br.com.analytics.pipeline.sales_insights_batch.processor;

/**
 * A raw row whose required fields could not be turned into a source record.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }
}
