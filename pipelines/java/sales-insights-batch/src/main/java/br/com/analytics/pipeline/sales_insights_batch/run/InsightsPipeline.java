package br.com.analytics.pipeline.sales_insights_batch.run;

import br.com.analytics.pipeline.sales_insights_batch.aggregation.MetricsAggregator;
import br.com.analytics.pipeline.sales_insights_batch.linker.LinkageResult;
import br.com.analytics.pipeline.sales_insights_batch.linker.TransactionLinker;
import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.NormalizedSource;
import br.com.analytics.pipeline.sales_insights_batch.model.RunSummary;
import br.com.analytics.pipeline.sales_insights_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_insights_batch.processor.RecordNormalizer;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceLoader;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceUnavailableException;
import br.com.analytics.pipeline.sales_insights_batch.resolution.IdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.ResolvedEntities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * One full pass over the sources. Loading and normalization fork out per
 * source; resolution, linkage and aggregation start once all of them joined.
 */
public class InsightsPipeline {

    private static final Logger log = LoggerFactory.getLogger(InsightsPipeline.class);

    private final List<SourceLoader> loaders;
    private final RecordNormalizer normalizer;
    private final IdentityResolver identityResolver;
    private final TransactionLinker transactionLinker;
    private final MetricsAggregator metricsAggregator;
    private final Executor executor;
    private final Duration loadTimeout;

    public InsightsPipeline(List<SourceLoader> loaders,
                            RecordNormalizer normalizer,
                            IdentityResolver identityResolver,
                            TransactionLinker transactionLinker,
                            MetricsAggregator metricsAggregator,
                            Executor executor,
                            Duration loadTimeout) {
        this.loaders = loaders.stream().sorted(Comparator.comparing(SourceLoader::source)).toList();
        this.normalizer = normalizer;
        this.identityResolver = identityResolver;
        this.transactionLinker = transactionLinker;
        this.metricsAggregator = metricsAggregator;
        this.executor = executor;
        this.loadTimeout = loadTimeout;
    }

    /**
     * @throws SourceUnavailableException when any source cannot be read
     * @throws InsightsRunException       when loading times out or is interrupted
     */
    public PipelineRun run() {
        List<NormalizedSource> sources = loadSources();

        List<CustomerRecord> customers = flatten(sources, NormalizedSource::customers);
        List<BookRecord> books = flatten(sources, NormalizedSource::books);
        List<TransactionRecord> transactions = flatten(sources, NormalizedSource::transactions);

        ResolvedEntities entities = identityResolver.resolve(customers, books);
        LinkageResult linkage = transactionLinker.link(transactions, entities);

        RunSummary summary = new RunSummary(
                sources.stream().mapToLong(NormalizedSource::malformedRows).sum(),
                sources.stream().mapToLong(source -> source.errors().size()).sum(),
                linkage.unresolved().size());
        DashboardMetrics metrics = metricsAggregator.aggregate(entities, linkage,
                customers.stream().map(CustomerRecord::sourceId).toList(), summary);

        log.info("Run complete: {} customers -> {} canonical, {} authors, {} books, {} linked transactions, " +
                        "{} skipped rows, {} unresolved transactions",
                customers.size(), entities.customers().size(), entities.authors().size(), entities.books().size(),
                linkage.linked().size(), summary.skippedRecords(), summary.unresolvedLinkages());
        return new PipelineRun(sources, entities, linkage, metrics);
    }

    private List<NormalizedSource> loadSources() {
        CompletionService<NormalizedSource> completion = new ExecutorCompletionService<>(executor);
        List<Future<NormalizedSource>> tasks = loaders.stream()
                .map(loader -> completion.submit(() -> normalizer.normalize(loader)))
                .toList();
        long deadline = System.nanoTime() + loadTimeout.toNanos();
        try {
            for (int pending = tasks.size(); pending > 0; pending--) {
                Future<NormalizedSource> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    cancelAll(tasks);
                    throw new InsightsRunException("Loading sources did not finish within " + loadTimeout);
                }
                done.get();
            }
            List<NormalizedSource> sources = new ArrayList<>();
            for (Future<NormalizedSource> task : tasks) {
                sources.add(task.get());
            }
            return sources;
        } catch (ExecutionException e) {
            cancelAll(tasks);
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            cancelAll(tasks);
            Thread.currentThread().interrupt();
            throw new InsightsRunException("Interrupted while loading sources", e);
        }
    }

    /** Interrupts running loads and keeps queued ones from starting. */
    private static void cancelAll(List<Future<NormalizedSource>> tasks) {
        tasks.forEach(task -> task.cancel(true));
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new InsightsRunException("Loading sources failed", cause);
    }

    private static <T> List<T> flatten(List<NormalizedSource> sources, Function<NormalizedSource, List<T>> part) {
        return sources.stream().flatMap(source -> part.apply(source).stream()).toList();
    }
}
