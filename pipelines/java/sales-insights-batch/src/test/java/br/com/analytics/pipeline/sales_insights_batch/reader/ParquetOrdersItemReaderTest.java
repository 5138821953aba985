package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.SalesFixtures;
import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import br.com.analytics.pipeline.sales_insights_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_insights_batch.processor.PriceParser;
import br.com.analytics.pipeline.sales_insights_batch.processor.TransactionRecordProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParquetOrdersItemReader Tests")
class ParquetOrdersItemReaderTest {

    @TempDir
    Path tempDir;

    private static void writeOrdersParquet(Path file) throws Exception {
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE orders (id VARCHAR, user_id VARCHAR, book_id VARCHAR, " +
                    "quantity INTEGER, unit_price VARCHAR, \"timestamp\" TIMESTAMP)");
            stmt.execute("INSERT INTO orders VALUES " +
                    "('o1', 'c100', 'b1', 2, '$10.00', TIMESTAMP '2024-01-02 10:00:00'), " +
                    "('o2', 'c101', 'b2', NULL, 'EUR 10', TIMESTAMP '2024-01-03 00:00:00')");
            stmt.execute("COPY (SELECT * FROM orders ORDER BY id) TO '" + file.toAbsolutePath() + "' (FORMAT PARQUET)");
        }
    }

    private SourceLayout standardSource() throws Exception {
        Path directory = tempDir.resolve("DATA1");
        SalesFixtures.write(directory.resolve("books.yaml"), SalesFixtures.S1_BOOKS);
        SalesFixtures.write(directory.resolve("users.csv"), SalesFixtures.S1_USERS);
        writeOrdersParquet(directory.resolve("orders.parquet"));
        return SourceLayout.standard(directory.toString());
    }

    private static List<RawRow> readAll(RawRowReader reader) {
        List<RawRow> rows = new ArrayList<>();
        RawRow row;
        while ((row = reader.read()) != null) {
            rows.add(row);
        }
        return rows;
    }

    // ============================================================================
    // Reading
    // ============================================================================

    @Test
    @DisplayName("Should read the default orders.parquet file as text rows")
    void testOpen_StandardLayoutReadsParquet() throws Exception {
        SourceFileLoader loader = new SourceFileLoader(SourceTag.S1, standardSource());

        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(2, rows.size());
            RawRow first = rows.get(0);
            assertEquals(RecordKind.TRANSACTION, first.kind());
            assertEquals(1, first.lineNumber());
            assertEquals("o1", first.fields().get("id"));
            assertEquals("2", first.fields().get("quantity"));
            assertEquals("2024-01-02T10:00", first.fields().get("timestamp"));
            assertEquals("", rows.get(1).fields().get("quantity"));
            assertEquals(2, reader.rowsRead());
        }
    }

    @Test
    @DisplayName("Should normalize Parquet orders like CSV orders")
    void testProcess_ParquetRows() throws Exception {
        SourceLayout layout = standardSource();
        TransactionRecordProcessor processor = new TransactionRecordProcessor(layout, new PriceParser(new BigDecimal("1.2")));

        List<TransactionRecord> records = new ArrayList<>();
        try (RawRowReader reader = new SourceFileLoader(SourceTag.S1, layout).open(RecordKind.TRANSACTION)) {
            for (RawRow row : readAll(reader)) {
                records.add(processor.process(row));
            }
        }

        assertEquals(SourceId.parse("S1:o1"), records.get(0).sourceId());
        assertEquals(new BigDecimal("20.00"), records.get(0).amount());
        assertEquals(LocalDate.of(2024, 1, 2), records.get(0).transactionDate());
        assertEquals(1, records.get(1).quantity());
        assertEquals(new BigDecimal("12.00"), records.get(1).amount());
    }

    @Test
    @DisplayName("Should re-read the file on every open")
    void testOpen_Restartable() throws Exception {
        SourceFileLoader loader = new SourceFileLoader(SourceTag.S1, standardSource());

        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            assertEquals(2, readAll(reader).size());
        }
        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            assertEquals(2, readAll(reader).size());
        }
    }

    @Test
    @DisplayName("Should escape quotes in the file path")
    void testQuery_EscapesPath() {
        String query = ParquetOrdersItemReader.query(Path.of("/data/o'brien/orders.parquet"));

        assertTrue(query.endsWith("read_parquet('/data/o''brien/orders.parquet')"));
    }

    // ============================================================================
    // Unavailable sources
    // ============================================================================

    @Test
    @DisplayName("Should make the source unavailable when the file is not Parquet")
    void testRead_NotParquet() throws Exception {
        SourceLayout layout = standardSource();
        Files.writeString(layout.fileFor(RecordKind.TRANSACTION), "id,user_id\no1,c100\n");

        try (RawRowReader reader = new SourceFileLoader(SourceTag.S1, layout).open(RecordKind.TRANSACTION)) {
            SourceUnavailableException e = assertThrows(SourceUnavailableException.class, reader::read);
            assertEquals(SourceTag.S1, e.getSource());
        }
    }
}
