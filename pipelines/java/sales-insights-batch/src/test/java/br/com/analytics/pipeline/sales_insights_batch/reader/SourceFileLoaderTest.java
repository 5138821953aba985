package br.com.analytics.pipeline.sales_insights_batch.reader;

import br.com.analytics.pipeline.sales_insights_batch.SalesFixtures;
import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceFileLoader Tests")
class SourceFileLoaderTest {

    @TempDir
    Path tempDir;

    private static List<RawRow> readAll(RawRowReader reader) {
        List<RawRow> rows = new ArrayList<>();
        RawRow row;
        while ((row = reader.read()) != null) {
            rows.add(row);
        }
        return rows;
    }

    private SourceFileLoader loader(String books, String users, String orders) {
        SourceLayout layout = SalesFixtures.writeSource(tempDir.resolve("DATA1"), books, users, orders);
        return new SourceFileLoader(SourceTag.S1, layout);
    }

    // ============================================================================
    // CSV sources
    // ============================================================================

    @Test
    @DisplayName("Should name CSV fields after the header row")
    void testOpen_CsvHeader() {
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.CUSTOMER)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(2, rows.size());
            RawRow first = rows.get(0);
            assertEquals(SourceTag.S1, first.source());
            assertEquals(RecordKind.CUSTOMER, first.kind());
            assertEquals(2, first.lineNumber());
            assertEquals("c100", first.fields().get("id"));
            assertEquals("alice@example.com", first.fields().get("email"));
            assertEquals(2, reader.rowsRead());
        }
    }

    @Test
    @DisplayName("Should accept quoted fields spanning lines and a byte order mark")
    void testOpen_QuotedMultiLineField() {
        String users = "\uFEFFid,name,address,phone,email\n"
                + "c1,\"Smith, Alice\",\"1 Main St\nApt 2\",555-123-4567,alice@example.com\n"
                + "c2,Bob,2 Oak Ave,555-000-1111,bob@example.com\n";
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, users, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.CUSTOMER)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(2, rows.size());
            assertEquals("c1", rows.get(0).fields().get("id"));
            assertEquals("Smith, Alice", rows.get(0).fields().get("name"));
            assertEquals("1 Main St\nApt 2", rows.get(0).fields().get("address"));
            assertEquals("Bob", rows.get(1).fields().get("name"));
        }
    }

    @Test
    @DisplayName("Should skip and count rows with the wrong number of fields")
    void testRead_SkipsMalformedRows() {
        String orders = SalesFixtures.S1_ORDERS + "o4,c100\n" + "o5,c101,b1,1,$2.00,2024-01-07,standard\n";
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, SalesFixtures.S1_USERS, orders);

        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(4, rows.size());
            assertEquals("o5", rows.get(3).fields().get("id"));
            assertEquals(1, reader.skippedRows());
        }
    }

    @Test
    @DisplayName("Should read the files again on every open")
    void testOpen_Restartable() throws Exception {
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);
        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            assertEquals(3, readAll(reader).size());
        }

        Files.writeString(tempDir.resolve("DATA1").resolve("orders.csv"),
                "id,user_id,book_id,quantity,unit_price,timestamp,shipping\no9,c100,b1,1,$1.00,2024-02-01,standard\n");

        try (RawRowReader reader = loader.open(RecordKind.TRANSACTION)) {
            assertEquals(1, readAll(reader).size());
        }
    }

    // ============================================================================
    // YAML sources
    // ============================================================================

    @Test
    @DisplayName("Should read YAML books with symbol keys as plain keys")
    void testOpen_YamlSymbolKeys() {
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.BOOK)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(2, rows.size());
            assertEquals("b1", rows.get(0).fields().get("id"));
            assertEquals("The 'Great' Gatsby", rows.get(0).fields().get("title"));
            assertEquals("1925", rows.get(0).fields().get("year"));
            assertEquals("", rows.get(1).fields().get("publisher"));
        }
    }

    @Test
    @DisplayName("Should join YAML author lists and skip entries that are not mappings")
    void testRead_YamlListsAndMalformedEntries() {
        String books = """
                - id: 1
                  title: Good Omens
                  author: [Terry Pratchett, Neil Gaiman]
                - just a title
                - id: 2
                  title: Mort
                  author: Terry Pratchett
                """;
        SourceFileLoader loader = loader(books, SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.BOOK)) {
            List<RawRow> rows = readAll(reader);

            assertEquals(2, rows.size());
            assertEquals("Terry Pratchett, Neil Gaiman", rows.get(0).fields().get("author"));
            assertEquals(3, rows.get(1).lineNumber());
            assertEquals(1, reader.skippedRows());
        }
    }

    @Test
    @DisplayName("Should make the source unavailable when the YAML document is not a list")
    void testRead_YamlNotAList() {
        SourceFileLoader loader = loader("title: Lonely Book\n", SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.BOOK)) {
            SourceUnavailableException e = assertThrows(SourceUnavailableException.class, reader::read);
            assertEquals(SourceTag.S1, e.getSource());
        }
    }

    @Test
    @DisplayName("Should make the source unavailable when the YAML cannot be parsed")
    void testRead_YamlSyntaxError() {
        SourceFileLoader loader = loader("- id: 1\n  title: [unclosed\n", SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);

        try (RawRowReader reader = loader.open(RecordKind.BOOK)) {
            assertThrows(SourceUnavailableException.class, reader::read);
        }
    }

    // ============================================================================
    // Unavailable sources
    // ============================================================================

    @Test
    @DisplayName("Should fail fast when the source directory is missing")
    void testOpen_MissingDirectory() {
        SourceFileLoader loader = new SourceFileLoader(SourceTag.S2,
                SourceLayout.standard(tempDir.resolve("nowhere").toString()));

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> loader.open(RecordKind.CUSTOMER));
        assertEquals(SourceTag.S2, e.getSource());
    }

    @Test
    @DisplayName("Should fail fast when a source file is missing")
    void testOpen_MissingFile() throws Exception {
        SourceFileLoader loader = loader(SalesFixtures.S1_BOOKS, SalesFixtures.S1_USERS, SalesFixtures.S1_ORDERS);
        Files.delete(tempDir.resolve("DATA1").resolve("users.csv"));

        assertThrows(SourceUnavailableException.class, () -> loader.open(RecordKind.CUSTOMER));
    }
}
