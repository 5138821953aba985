package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.CompositeMatchField;
import br.com.analytics.pipeline.sales_insights_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Partitions customer records into canonical customers.
 * <p>
 * Two records are the same customer when
 * <ol>
 *     <li>their normalized emails are equal, or</li>
 *     <li>their normalized names are equal and the first configured
 *     corroborating field that both records carry (address, then phone by
 *     default) is equal too.</li>
 * </ol>
 * Equal names without a corroborating field are only counted as candidate
 * pairs. Matches are closed transitively through a {@link UnionFind}.
 */
public class CustomerIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(CustomerIdentityResolver.class);

    /** Most complete first, then source priority, then source id. */
    static final Comparator<CustomerRecord> PROFILE_PRECEDENCE = Comparator
            .comparingLong(CustomerRecord::completeness).reversed()
            .thenComparing(record -> record.sourceId().source())
            .thenComparing(CustomerRecord::sourceId);

    private final List<CompositeMatchField> compositeMatchFields;

    public CustomerIdentityResolver(List<CompositeMatchField> compositeMatchFields) {
        this.compositeMatchFields = List.copyOf(compositeMatchFields);
    }

    public List<CanonicalCustomer> resolve(List<CustomerRecord> records) {
        Map<SourceId, List<CustomerRecord>> bySourceId = new TreeMap<>();
        records.forEach(record -> bySourceId.computeIfAbsent(record.sourceId(), id -> new ArrayList<>()).add(record));

        UnionFind<SourceId> partitions = new UnionFind<>();
        partitions.addAll(bySourceId.keySet());

        int emailMerges = unionGroups(partitions, records, CustomerRecord::emailKey);
        int compositeMerges = 0;
        int nameOnlyCandidates = 0;
        for (List<CustomerRecord> sameName : groupBy(records, CustomerRecord::nameKey).values()) {
            for (int i = 0; i < sameName.size(); i++) {
                for (int j = i + 1; j < sameName.size(); j++) {
                    CustomerRecord left = sameName.get(i);
                    CustomerRecord right = sameName.get(j);
                    if (corroborated(left, right)) {
                        if (partitions.union(left.sourceId(), right.sourceId())) {
                            compositeMerges++;
                        }
                    } else if (!left.sourceId().equals(right.sourceId())) {
                        nameOnlyCandidates++;
                    }
                }
            }
        }
        log.debug("Customer matching: {} email merges, {} name+{} merges, {} name-only candidate pairs left apart",
                emailMerges, compositeMerges, compositeMatchFields, nameOnlyCandidates);

        List<CanonicalCustomer> customers = new ArrayList<>();
        long nextId = 1;
        for (SortedSet<SourceId> partition : partitions.partitions()) {
            List<CustomerRecord> members = new ArrayList<>();
            partition.forEach(id -> members.addAll(bySourceId.get(id)));
            customers.add(toCanonical(nextId++, partition, members));
        }
        log.info("Resolved {} customer records into {} canonical customers", records.size(), customers.size());
        return customers;
    }

    private boolean corroborated(CustomerRecord left, CustomerRecord right) {
        for (CompositeMatchField field : compositeMatchFields) {
            String leftValue = left.key(field);
            String rightValue = right.key(field);
            if (!leftValue.isEmpty() && !rightValue.isEmpty()) {
                return leftValue.equals(rightValue);
            }
        }
        return false;
    }

    private static CanonicalCustomer toCanonical(long customerId, SortedSet<SourceId> sourceIds,
                                                 List<CustomerRecord> members) {
        List<CustomerRecord> ordered = members.stream().sorted(PROFILE_PRECEDENCE).toList();
        return new CanonicalCustomer(
                customerId,
                firstNonBlank(ordered, CustomerRecord::name),
                firstNonBlank(ordered, CustomerRecord::email),
                firstNonBlank(ordered, CustomerRecord::address),
                firstNonBlank(ordered, CustomerRecord::phone),
                sourceIds
        );
    }

    static <R> String firstNonBlank(List<R> ordered, Function<R, String> field) {
        return ordered.stream().map(field).filter(value -> !value.isEmpty()).findFirst().orElse("");
    }

    static <R> Map<String, List<R>> groupBy(List<R> records, Function<R, String> key) {
        Map<String, List<R>> groups = new TreeMap<>();
        for (R record : records) {
            String value = key.apply(record);
            if (!value.isEmpty()) {
                groups.computeIfAbsent(value, k -> new ArrayList<>()).add(record);
            }
        }
        return groups;
    }

    private static int unionGroups(UnionFind<SourceId> partitions, List<CustomerRecord> records,
                                   Function<CustomerRecord, String> key) {
        int merges = 0;
        for (List<CustomerRecord> group : groupBy(records, key).values()) {
            SourceId first = group.get(0).sourceId();
            for (CustomerRecord other : group.subList(1, group.size())) {
                if (partitions.union(first, other.sourceId())) {
                    merges++;
                }
            }
        }
        return merges;
    }
}
