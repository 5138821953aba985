package br.com.analytics.pipeline.sales_insights_batch.config;

import br.com.analytics.pipeline.sales_insights_batch.aggregation.MetricsAggregator;
import br.com.analytics.pipeline.sales_insights_batch.linker.TransactionLinker;
import br.com.analytics.pipeline.sales_insights_batch.processor.PriceParser;
import br.com.analytics.pipeline.sales_insights_batch.processor.RecordNormalizer;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceFileLoader;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceLoader;
import br.com.analytics.pipeline.sales_insights_batch.resolution.AuthorIdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.BookCatalogResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.CustomerIdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.resolution.IdentityResolver;
import br.com.analytics.pipeline.sales_insights_batch.run.InsightsPipeline;
import br.com.analytics.pipeline.sales_insights_batch.run.PipelineRunCoordinator;
import br.com.analytics.pipeline.sales_insights_batch.run.SourceFingerprinter;
import br.com.analytics.pipeline.sales_insights_batch.store.InMemoryMetricsStoreGateway;
import br.com.analytics.pipeline.sales_insights_batch.store.JdbcMetricsStoreGateway;
import br.com.analytics.pipeline.sales_insights_batch.store.MetricsCodec;
import br.com.analytics.pipeline.sales_insights_batch.store.MetricsStoreGateway;
import br.com.analytics.pipeline.sales_insights_batch.tasklet.InsightsRunTasklet;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;

@Configuration
@EnableBatchProcessing
public class SalesInsightsBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final InsightsProperties properties;

    public SalesInsightsBatchConfig(JobRepository jobRepository,
                                    @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                                    InsightsProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public List<SourceLoader> sourceLoaders() {
        return properties.sources().entrySet().stream()
                .map(source -> (SourceLoader) new SourceFileLoader(source.getKey(), source.getValue()))
                .toList();
    }

    @Bean
    public RecordNormalizer recordNormalizer() {
        return new RecordNormalizer(properties.sources(), new PriceParser(properties.eurToUsdRate()));
    }

    @Bean
    public IdentityResolver identityResolver() {
        return new IdentityResolver(
                new CustomerIdentityResolver(properties.compositeMatchFields()),
                new AuthorIdentityResolver(properties.authorMatchMode()),
                new BookCatalogResolver());
    }

    @Bean
    public ThreadPoolTaskExecutor sourceLoadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.sources().size());
        executor.setMaxPoolSize(properties.sources().size());
        executor.setThreadNamePrefix("source-loader-");
        return executor;
    }

    @Bean
    public InsightsPipeline insightsPipeline(List<SourceLoader> sourceLoaders,
                                             RecordNormalizer recordNormalizer,
                                             IdentityResolver identityResolver,
                                             ThreadPoolTaskExecutor sourceLoadExecutor) {
        return new InsightsPipeline(sourceLoaders, recordNormalizer, identityResolver, new TransactionLinker(),
                new MetricsAggregator(), sourceLoadExecutor, properties.runTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "insights", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public MetricsStoreGateway jdbcMetricsStoreGateway(@Qualifier("appDataSource") DataSource appDataSource) {
        return new JdbcMetricsStoreGateway(appDataSource, transactionManager, new MetricsCodec(), Clock.systemDefaultZone());
    }

    @Bean
    @ConditionalOnProperty(prefix = "insights", name = "store", havingValue = "memory")
    public MetricsStoreGateway inMemoryMetricsStoreGateway() {
        return new InMemoryMetricsStoreGateway();
    }

    @Bean
    public PipelineRunCoordinator pipelineRunCoordinator(InsightsPipeline insightsPipeline,
                                                         MetricsStoreGateway metricsStoreGateway) {
        return new PipelineRunCoordinator(new SourceFingerprinter(properties.sources()), insightsPipeline,
                metricsStoreGateway, properties.runTimeout());
    }

    @Bean
    public Step insightsRunStep(PipelineRunCoordinator pipelineRunCoordinator) {
        return new StepBuilder("insightsRunStep", jobRepository)
                .tasklet(new InsightsRunTasklet(pipelineRunCoordinator), transactionManager)
                .build();
    }

    @Bean
    public Job salesInsightsJob(Step insightsRunStep) {
        return new JobBuilder("salesInsightsJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(insightsRunStep)
                .build();
    }
}
