package br.com.analytics.pipeline.sales_insights_batch.run;

import br.com.analytics.pipeline.sales_insights_batch.linker.LinkageResult;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.NormalizedSource;
import br.com.analytics.pipeline.sales_insights_batch.resolution.ResolvedEntities;

import java.util.List;

public record PipelineRun(
        List<NormalizedSource> sources,
        ResolvedEntities entities,
        LinkageResult linkage,
        DashboardMetrics metrics
) {

    public PipelineRun {
        sources = List.copyOf(sources);
    }
}
