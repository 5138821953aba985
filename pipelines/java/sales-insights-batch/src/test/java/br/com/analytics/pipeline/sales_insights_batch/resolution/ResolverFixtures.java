package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import br.com.analytics.pipeline.sales_insights_batch.processor.FieldCleaners;

import java.util.List;

final class ResolverFixtures {

    private ResolverFixtures() {
    }

    static CustomerRecord customer(SourceTag source, String id, String name, String email, String address, String phone) {
        return new CustomerRecord(
                SourceId.of(source, id),
                FieldCleaners.clean(name),
                FieldCleaners.comparisonKey(name),
                FieldCleaners.clean(email),
                FieldCleaners.emailKey(email),
                FieldCleaners.clean(address),
                FieldCleaners.addressKey(address),
                FieldCleaners.phoneDisplay(phone),
                FieldCleaners.phoneKey(phone));
    }

    static BookRecord book(SourceTag source, String id, String title, String... authors) {
        return new BookRecord(
                SourceId.of(source, id),
                title,
                FieldCleaners.comparisonKey(title),
                List.of(authors),
                "Fiction",
                "Penguin",
                2001);
    }
}
