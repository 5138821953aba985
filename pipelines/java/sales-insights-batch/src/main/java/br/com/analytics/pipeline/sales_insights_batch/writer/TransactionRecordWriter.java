package br.com.analytics.pipeline.sales_insights_batch.writer;

import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;

public class TransactionRecordWriter implements ItemWriter<LinkedTransaction> {

    private static final Logger log = LoggerFactory.getLogger(TransactionRecordWriter.class);

    private static final String SQL_INSERT =
            "INSERT INTO transaction_records (transaction_id, customer_id, book_id, items_quantity, " +
                    "price_per_item, total_amount, transaction_date, delivery_method, source, currency_code) " +
                    "VALUES (:transactionId, :customerId, :bookId, :itemsQuantity, :pricePerItem, :totalAmount, " +
                    ":transactionDate, :deliveryMethod, :source, :currencyCode)";

    private final JdbcBatchItemWriter<LinkedTransaction> delegateWriter;

    public TransactionRecordWriter(DataSource dataSource) {
        this.delegateWriter = JdbcWriters.namedParameterWriter(dataSource, SQL_INSERT, transaction ->
                new MapSqlParameterSource()
                        .addValue("transactionId", transaction.sourceId().toString())
                        .addValue("customerId", transaction.customerId())
                        .addValue("bookId", transaction.bookId())
                        .addValue("itemsQuantity", transaction.quantity())
                        .addValue("pricePerItem", transaction.unitPrice())
                        .addValue("totalAmount", transaction.amount())
                        .addValue("transactionDate", transaction.transactionDate())
                        .addValue("deliveryMethod", transaction.deliveryMethod())
                        .addValue("source", transaction.sourceId().source().name())
                        .addValue("currencyCode", transaction.currencyCode()));
    }

    @Override
    public void write(Chunk<? extends LinkedTransaction> chunk) throws Exception {
        if (chunk.isEmpty()) {
            return;
        }
        log.info("Writing {} transaction records ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
