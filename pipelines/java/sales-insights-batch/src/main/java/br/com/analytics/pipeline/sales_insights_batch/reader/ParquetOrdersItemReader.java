package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads an orders file stored as Parquet through an in-memory DuckDB
 * connection. Every column comes back as text so the rows go through the
 * same normalization as CSV orders.
 */
public class ParquetOrdersItemReader implements ItemStreamReader<RawRow> {

    private static final String DUCKDB_DRIVER = "org.duckdb.DuckDBDriver";
    private static final String DUCKDB_URL = "jdbc:duckdb:";

    private final SourceTag source;
    private final Path file;

    private @Nullable SingleConnectionDataSource dataSource;
    private @Nullable JdbcCursorItemReader<RawRow> cursor;
    private long rowNumber;

    public ParquetOrdersItemReader(SourceTag source, Path file) {
        this.source = source;
        this.file = file;
    }

    @Override
    public void open(ExecutionContext executionContext) {
        SingleConnectionDataSource connection = new SingleConnectionDataSource(DUCKDB_URL, true);
        try {
            connection.setDriverClassName(DUCKDB_DRIVER);
        } catch (IllegalStateException e) {
            throw new ItemStreamException("DuckDB driver is not on the classpath", e);
        }
        JdbcCursorItemReader<RawRow> reader = new JdbcCursorItemReaderBuilder<RawRow>()
                .name(source.name().toLowerCase() + "-parquet-orders-reader")
                .dataSource(connection)
                .sql(query(file))
                .rowMapper((resultSet, rowNum) -> toRawRow(resultSet))
                .verifyCursorPosition(false)
                .saveState(false)
                .build();
        try {
            reader.open(executionContext);
        } catch (ItemStreamException e) {
            connection.destroy();
            throw e;
        }
        this.dataSource = connection;
        this.cursor = reader;
        this.rowNumber = 0;
    }

    @Override
    public @Nullable RawRow read() throws Exception {
        if (cursor == null) {
            throw new ItemStreamException("Reader for " + file + " was not opened");
        }
        return cursor.read();
    }

    @Override
    public void close() {
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
        if (dataSource != null) {
            dataSource.destroy();
            dataSource = null;
        }
    }

    static String query(Path file) {
        String path = file.toAbsolutePath().toString().replace("'", "''");
        return "SELECT * FROM read_parquet('" + path + "')";
    }

    private RawRow toRawRow(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        Map<String, String> fields = new LinkedHashMap<>();
        for (int column = 1; column <= metaData.getColumnCount(); column++) {
            fields.put(metaData.getColumnLabel(column), asText(resultSet.getObject(column)));
        }
        return new RawRow(source, RecordKind.TRANSACTION, ++rowNumber, fields);
    }

    private static String asText(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }
}
