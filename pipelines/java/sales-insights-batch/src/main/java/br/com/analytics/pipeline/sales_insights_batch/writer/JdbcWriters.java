package br.com.analytics.pipeline.sales_insights_batch.writer;

import org.springframework.batch.infrastructure.item.database.ItemSqlParameterSourceProvider;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;

import javax.sql.DataSource;
import java.util.Collection;
import java.util.stream.Collectors;

final class JdbcWriters {

    private JdbcWriters() {
    }

    static <T> JdbcBatchItemWriter<T> namedParameterWriter(DataSource dataSource, String sql,
                                                          ItemSqlParameterSourceProvider<T> parameters) {
        JdbcBatchItemWriter<T> writer = new JdbcBatchItemWriterBuilder<T>()
                .itemSqlParameterSourceProvider(parameters)
                .sql(sql)
                .dataSource(dataSource)
                .build();
        try {
            writer.afterPropertiesSet();
        } catch (Exception e) {
            throw new IllegalStateException("Invalid writer configuration for: " + sql, e);
        }
        return writer;
    }

    static String joined(Collection<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
