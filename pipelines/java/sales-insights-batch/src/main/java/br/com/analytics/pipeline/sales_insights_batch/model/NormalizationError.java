package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.Map;

public record NormalizationError(
        SourceTag source,
        RecordKind kind,
        long lineNumber,
        Map<String, String> row,
        String reason
) {

    public NormalizationError {
        row = Map.copyOf(row);
    }
}
