package br.com.analytics.pipeline.sales_insights_batch.run;

/**
 * A run could not complete for a reason other than an unavailable source,
 * for instance a timeout or an interrupted wait.
 */
public class InsightsRunException extends RuntimeException {

    public InsightsRunException(String message) {
        super(message);
    }

    public InsightsRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
