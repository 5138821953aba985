package br.com.analytics.pipeline.sales_insights_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.batch.infrastructure.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    static final String SCHEMA_SCRIPT = "db/schema-insights.sql";

    @Autowired
    private Environment env;

    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("insights-app");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.app.driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty("spring.datasource.app.url"));
        dataSource.setUsername(env.getProperty("spring.datasource.app.username"));
        dataSource.setPassword(env.getProperty("spring.datasource.app.password"));
        return dataSource;
    }

    @Bean(name = "transactionManager")
    @ConditionalOnProperty(prefix = "insights", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public PlatformTransactionManager appTransactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Bean(name = "transactionManager")
    @ConditionalOnProperty(prefix = "insights", name = "store", havingValue = "memory")
    public PlatformTransactionManager resourcelessTransactionManager() {
        return new ResourcelessTransactionManager();
    }

    @Bean
    @ConditionalOnProperty(prefix = "insights", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public DataSourceInitializer insightsSchemaInitializer(@Qualifier("appDataSource") DataSource appDataSource) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(appDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)));
        return initializer;
    }
}
