package br.com.analytics.pipeline.sales_insights_batch.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;

public class BookCatalogWriter implements ItemWriter<BookCatalogEntry> {

    private static final Logger log = LoggerFactory.getLogger(BookCatalogWriter.class);

    private static final String SQL_INSERT =
            "INSERT INTO book_catalog (book_id, book_title, author_ids, authors, category, publisher_name, " +
                    "publication_year, linked_book_ids) " +
                    "VALUES (:bookId, :bookTitle, :authorIds, :authors, :category, :publisherName, " +
                    ":publicationYear, :linkedBookIds)";

    private final JdbcBatchItemWriter<BookCatalogEntry> delegateWriter;

    public BookCatalogWriter(DataSource dataSource) {
        this.delegateWriter = JdbcWriters.namedParameterWriter(dataSource, SQL_INSERT, entry ->
                new MapSqlParameterSource()
                        .addValue("bookId", entry.book().bookId())
                        .addValue("bookTitle", entry.book().title())
                        .addValue("authorIds", JdbcWriters.joined(entry.book().authorIds()))
                        .addValue("authors", String.join(", ", entry.authorNames()))
                        .addValue("category", entry.book().genre())
                        .addValue("publisherName", entry.book().publisher())
                        .addValue("publicationYear", entry.book().publicationYear())
                        .addValue("linkedBookIds", JdbcWriters.joined(entry.book().sourceIds())));
    }

    @Override
    public void write(Chunk<? extends BookCatalogEntry> chunk) throws Exception {
        if (chunk.isEmpty()) {
            return;
        }
        log.info("Writing {} book catalogue entries ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
