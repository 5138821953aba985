package br.com.analytics.pipeline.sales_insights_batch.linker;

import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.UnresolvedLinkage;

import java.util.List;

public record LinkageResult(
        List<LinkedTransaction> linked,
        List<UnresolvedLinkage> unresolved
) {

    public LinkageResult {
        linked = List.copyOf(linked);
        unresolved = List.copyOf(unresolved);
    }
}
