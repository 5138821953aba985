package br.com.analytics.pipeline.sales_insights_batch.store;

public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
