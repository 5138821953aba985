package br.com.analytics.pipeline.sales_insights_batch.writer;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;

public class CustomerProfileWriter implements ItemWriter<CanonicalCustomer> {

    private static final Logger log = LoggerFactory.getLogger(CustomerProfileWriter.class);

    private static final String SQL_INSERT =
            "INSERT INTO customer_profiles (customer_id, customer_name, delivery_address, contact_phone, " +
                    "email_address, linked_customer_ids) " +
                    "VALUES (:customerId, :customerName, :deliveryAddress, :contactPhone, :emailAddress, :linkedCustomerIds)";

    private final JdbcBatchItemWriter<CanonicalCustomer> delegateWriter;

    public CustomerProfileWriter(DataSource dataSource) {
        this.delegateWriter = JdbcWriters.namedParameterWriter(dataSource, SQL_INSERT, customer ->
                new MapSqlParameterSource()
                        .addValue("customerId", customer.customerId())
                        .addValue("customerName", customer.name())
                        .addValue("deliveryAddress", customer.address())
                        .addValue("contactPhone", customer.phone())
                        .addValue("emailAddress", customer.email())
                        .addValue("linkedCustomerIds", JdbcWriters.joined(customer.sourceIds())));
    }

    @Override
    public void write(Chunk<? extends CanonicalCustomer> chunk) throws Exception {
        if (chunk.isEmpty()) {
            return;
        }
        log.info("Writing {} customer profiles ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
