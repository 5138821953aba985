package br.com.analytics.pipeline.sales_insights_batch.aggregation;

import br.com.analytics.pipeline.sales_insights_batch.linker.LinkageResult;
import br.com.analytics.pipeline.sales_insights_batch.model.AuthorPopularity;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalCustomer;
import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.LinkedTransaction;
import br.com.analytics.pipeline.sales_insights_batch.model.RevenueDay;
import br.com.analytics.pipeline.sales_insights_batch.model.RunSummary;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.TopCustomer;
import br.com.analytics.pipeline.sales_insights_batch.resolution.ResolvedEntities;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the dashboard metrics in one pass over the linked transactions,
 * with lookups into the canonical tables.
 */
public class MetricsAggregator {

    public static final int TOP_REVENUE_DAYS = 5;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final Comparator<Map.Entry<LocalDate, BigDecimal>> REVENUE_DAY_ORDER =
            Map.Entry.<LocalDate, BigDecimal>comparingByValue().reversed()
                    .thenComparing(Map.Entry.<LocalDate, BigDecimal>comparingByKey());

    private static final Comparator<Tally> AUTHOR_ORDER = Comparator
            .comparingLong(Tally::transactions).reversed()
            .thenComparing(Tally::firstDate)
            .thenComparing(Tally::id);

    private static final Comparator<Tally> CUSTOMER_ORDER = Comparator
            .comparing(Tally::spent).reversed()
            .thenComparing(Tally::firstDate)
            .thenComparing(Tally::id);

    /**
     * @param customerSourceIds source ids of every normalized customer row; a repeated id counts once
     */
    public DashboardMetrics aggregate(ResolvedEntities entities, LinkageResult linkage,
                                      Collection<SourceId> customerSourceIds, RunSummary runSummary) {
        Map<Long, CanonicalBook> booksById = index(entities.books(), CanonicalBook::bookId);

        Map<LocalDate, BigDecimal> revenueByDay = new HashMap<>();
        Map<Long, Tally> authorTallies = new HashMap<>();
        Map<Long, Tally> customerTallies = new HashMap<>();
        BigDecimal totalRevenue = BigDecimal.ZERO;

        for (LinkedTransaction transaction : linkage.linked()) {
            LocalDate day = transaction.transactionDate();
            revenueByDay.merge(day, transaction.amount(), BigDecimal::add);
            totalRevenue = totalRevenue.add(transaction.amount());

            customerTallies.computeIfAbsent(transaction.customerId(), Tally::new).add(day, transaction);
            CanonicalBook book = booksById.get(transaction.bookId());
            for (Long authorId : book.authorIds()) {
                authorTallies.computeIfAbsent(authorId, Tally::new).add(day, transaction);
            }
        }

        List<RevenueDay> topDays = revenueByDay.entrySet().stream()
                .sorted(REVENUE_DAY_ORDER)
                .limit(TOP_REVENUE_DAYS)
                .map(entry -> new RevenueDay(DATE_FORMAT.format(entry.getKey()), money(entry.getValue())))
                .toList();

        return new DashboardMetrics(
                topDays,
                entities.customers().size(),
                new HashSet<>(customerSourceIds).size(),
                entities.authors().size(),
                distinctAuthorSets(entities.books()),
                mostPopularAuthor(authorTallies, index(entities.authors(), CanonicalAuthor::authorId)),
                topCustomer(customerTallies, index(entities.customers(), CanonicalCustomer::customerId)),
                money(totalRevenue),
                runSummary
        );
    }

    private static @Nullable AuthorPopularity mostPopularAuthor(Map<Long, Tally> tallies,
                                                               Map<Long, CanonicalAuthor> authors) {
        return tallies.values().stream()
                .min(AUTHOR_ORDER)
                .map(tally -> new AuthorPopularity(tally.id(), authors.get(tally.id()).name(),
                        tally.transactions(), tally.units()))
                .orElse(null);
    }

    private static @Nullable TopCustomer topCustomer(Map<Long, Tally> tallies, Map<Long, CanonicalCustomer> customers) {
        return tallies.values().stream()
                .min(CUSTOMER_ORDER)
                .map(tally -> {
                    CanonicalCustomer customer = customers.get(tally.id());
                    List<String> linkedIds = customer.sourceIds().stream().map(SourceId::toString).toList();
                    return new TopCustomer(customer.customerId(), customer.name(), money(tally.spent()), linkedIds);
                })
                .orElse(null);
    }

    private static long distinctAuthorSets(List<CanonicalBook> books) {
        Set<Set<Long>> authorSets = new HashSet<>();
        for (CanonicalBook book : books) {
            if (!book.authorIds().isEmpty()) {
                authorSets.add(new TreeSet<>(book.authorIds()));
            }
        }
        return authorSets.size();
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static <T> Map<Long, T> index(List<T> entities, Function<T, Long> id) {
        return entities.stream().collect(Collectors.toMap(id, Function.identity()));
    }

    /**
     * Running totals for one customer or author.
     */
    private static final class Tally {

        private final Long id;
        private long transactions;
        private long units;
        private BigDecimal spent = BigDecimal.ZERO;
        private @Nullable LocalDate firstDate;

        private Tally(Long id) {
            this.id = id;
        }

        void add(LocalDate day, LinkedTransaction transaction) {
            transactions++;
            units += transaction.quantity();
            spent = spent.add(transaction.amount());
            if (firstDate == null || day.isBefore(firstDate)) {
                firstDate = day;
            }
        }

        Long id() {
            return id;
        }

        long transactions() {
            return transactions;
        }

        long units() {
            return units;
        }

        BigDecimal spent() {
            return spent;
        }

        LocalDate firstDate() {
            return firstDate;
        }
    }
}
