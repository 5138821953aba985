package br.com.analytics.pipeline.sales_insights_batch.run;

import br.com.analytics.pipeline.sales_insights_batch.aggregation.MetricsAggregator;
import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.linker.TransactionLinker;
import br.com.analytics.pipeline.sales_insights_batch.model.AuthorMatchMode;
import br.com.analytics.pipeline.sales_insights_batch.model.CompositeMatchField;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import br.com.analytics.pipeline.sales_insights_batch.processor.PriceParser;
import br.com.analytics.pipeline.sales_insights_batch.processor.RecordNormalizer;
import br.com.analytics.pipeline.sales_insights_batch.reader.RawRowReader;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceFileLoader;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceLoader;
import br.com.analytics.pipeline.sales_insights_batch.resolution.AuthorIdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.BookCatalogResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.CustomerIdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.IdentityResolver;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class PipelineTestSupport {

    private PipelineTestSupport() {
    }

    static InsightsPipeline pipeline(Map<SourceTag, SourceLayout> layouts, List<SourceLoader> loaders, Executor executor) {
        return pipeline(layouts, loaders, executor, Duration.ofSeconds(30));
    }

    static InsightsPipeline pipeline(Map<SourceTag, SourceLayout> layouts, List<SourceLoader> loaders, Executor executor,
                                     Duration loadTimeout) {
        return new InsightsPipeline(
                loaders,
                new RecordNormalizer(layouts, new PriceParser(new BigDecimal("1.2"))),
                new IdentityResolver(
                        new CustomerIdentityResolver(List.of(CompositeMatchField.ADDRESS, CompositeMatchField.PHONE)),
                        new AuthorIdentityResolver(AuthorMatchMode.NAME_AND_CONTEXT),
                        new BookCatalogResolver()),
                new TransactionLinker(),
                new MetricsAggregator(),
                executor,
                loadTimeout);
    }

    static List<SourceLoader> fileLoaders(Map<SourceTag, SourceLayout> layouts) {
        return layouts.entrySet().stream()
                .map(entry -> (SourceLoader) new SourceFileLoader(entry.getKey(), entry.getValue()))
                .toList();
    }

    /**
     * Counts how often the wrapped loader opens a file.
     */
    static class CountingSourceLoader implements SourceLoader {

        private final SourceLoader delegate;
        private final AtomicInteger opens;

        CountingSourceLoader(SourceLoader delegate, AtomicInteger opens) {
            this.delegate = delegate;
            this.opens = opens;
        }

        @Override
        public SourceTag source() {
            return delegate.source();
        }

        @Override
        public RawRowReader open(RecordKind kind) {
            opens.incrementAndGet();
            return delegate.open(kind);
        }
    }

    /**
     * Holds every open until the gate is released and reports when the first
     * open was attempted.
     */
    static class GatedSourceLoader extends CountingSourceLoader {

        private final CountDownLatch started;
        private final CountDownLatch gate;

        GatedSourceLoader(SourceLoader delegate, AtomicInteger opens, CountDownLatch started, CountDownLatch gate) {
            super(delegate, opens);
            this.started = started;
            this.gate = gate;
        }

        @Override
        public RawRowReader open(RecordKind kind) {
            started.countDown();
            try {
                if (!gate.await(30, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Gate was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted at the gate", e);
            }
            return super.open(kind);
        }
    }

    /**
     * Blocks every open until interrupted and reports the interrupt.
     */
    static class StuckSourceLoader extends CountingSourceLoader {

        private final CountDownLatch interrupted;

        StuckSourceLoader(SourceLoader delegate, AtomicInteger opens, CountDownLatch interrupted) {
            super(delegate, opens);
            this.interrupted = interrupted;
        }

        @Override
        public RawRowReader open(RecordKind kind) {
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while stuck", e);
            }
            return super.open(kind);
        }
    }
}
