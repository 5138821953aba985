package br.com.analytics.pipeline.sales_insights_batch.model;

public record Fingerprint(String value) {

    @Override
    public String toString() {
        return value;
    }
}
