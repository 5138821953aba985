package br.com.analytics.pipeline.sales_insights_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawRow(
        SourceTag source,
        RecordKind kind,
        long lineNumber,
        Map<String, String> fields
) {

    public RawRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
