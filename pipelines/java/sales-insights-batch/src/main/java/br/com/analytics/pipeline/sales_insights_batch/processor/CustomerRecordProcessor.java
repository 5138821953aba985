package br.com.analytics.pipeline.sales_insights_batch.processor;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalField;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.RawRow;
import br.com.analytics.pipeline.sales_insights_batch.model.RecordKind;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.Map;

public class CustomerRecordProcessor implements ItemProcessor<RawRow, CustomerRecord> {

    private final SourceLayout layout;

    public CustomerRecordProcessor(SourceLayout layout) {
        this.layout = layout;
    }

    @Override
    public CustomerRecord process(RawRow row) {
        Map<CanonicalField, String> fields = layout.project(RecordKind.CUSTOMER, row.fields());

        String name = FieldCleaners.clean(fields.get(CanonicalField.NAME));
        if (name.isEmpty()) {
            throw new NormalizationException("customer name is missing");
        }
        String email = FieldCleaners.clean(fields.get(CanonicalField.EMAIL));
        String address = FieldCleaners.clean(fields.get(CanonicalField.ADDRESS));
        String rawPhone = fields.get(CanonicalField.PHONE);

        return new CustomerRecord(
                SourceId.of(row.source(), FieldCleaners.localKey(fields.get(CanonicalField.CUSTOMER_ID), row.lineNumber())),
                name,
                FieldCleaners.comparisonKey(name),
                email,
                FieldCleaners.emailKey(email),
                address,
                FieldCleaners.addressKey(address),
                FieldCleaners.phoneDisplay(rawPhone),
                FieldCleaners.phoneKey(rawPhone)
        );
    }
}
