package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Merges book records that carry the same normalized title and the same set
 * of canonical authors.
 */
public class BookCatalogResolver {

    private static final Logger log = LoggerFactory.getLogger(BookCatalogResolver.class);

    private static final Comparator<BookRecord> PROFILE_PRECEDENCE = Comparator
            .comparingLong(BookCatalogResolver::completeness).reversed()
            .thenComparing(book -> book.sourceId().source())
            .thenComparing(BookRecord::sourceId)
            .thenComparing(BookRecord::title);

    public BookResolution resolve(List<BookRecord> books, Map<SourceId, List<Long>> authorIdsByBook) {
        Map<SourceId, List<BookRecord>> bySourceId = new TreeMap<>();
        books.forEach(book -> bySourceId.computeIfAbsent(book.sourceId(), id -> new ArrayList<>()).add(book));

        UnionFind<SourceId> partitions = new UnionFind<>();
        partitions.addAll(bySourceId.keySet());

        Map<String, List<BookRecord>> byIdentity = CustomerIdentityResolver.groupBy(books,
                book -> book.titleKey() + "|" + new TreeSet<>(authorIdsByBook.getOrDefault(book.sourceId(), List.of())));
        for (List<BookRecord> sameBook : byIdentity.values()) {
            SourceId first = sameBook.get(0).sourceId();
            sameBook.forEach(book -> partitions.union(first, book.sourceId()));
        }

        List<CanonicalBook> canonicalBooks = new ArrayList<>();
        Map<SourceId, Long> bookIdBySourceId = new HashMap<>();
        long nextId = 1;
        for (SortedSet<SourceId> partition : partitions.partitions()) {
            long bookId = nextId++;
            List<BookRecord> members = partition.stream()
                    .flatMap(id -> bySourceId.get(id).stream())
                    .sorted(PROFILE_PRECEDENCE)
                    .toList();
            BookRecord best = members.get(0);
            canonicalBooks.add(new CanonicalBook(
                    bookId,
                    best.title(),
                    authorIdsByBook.getOrDefault(best.sourceId(), List.of()),
                    CustomerIdentityResolver.firstNonBlank(members, BookRecord::genre),
                    CustomerIdentityResolver.firstNonBlank(members, BookRecord::publisher),
                    members.stream().map(BookRecord::publicationYear).filter(Objects::nonNull).findFirst().orElse(null),
                    partition
            ));
            partition.forEach(id -> bookIdBySourceId.put(id, bookId));
        }

        log.info("Resolved {} book records into {} catalogue entries", books.size(), canonicalBooks.size());
        return new BookResolution(canonicalBooks, bookIdBySourceId);
    }

    private static long completeness(BookRecord book) {
        return Stream.of(book.genre(), book.publisher(), book.publicationYear() == null ? "" : "year")
                .filter(value -> !value.isEmpty())
                .count() + (book.authors().isEmpty() ? 0 : 1);
    }
}
