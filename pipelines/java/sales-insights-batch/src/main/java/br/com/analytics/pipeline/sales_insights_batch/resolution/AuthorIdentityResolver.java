package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.AuthorMatchMode;
import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.processor.FieldCleaners;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Partitions author credits into canonical authors. Authors carry no email
 * or address, so a name match needs context: in {@link AuthorMatchMode#NAME_AND_CONTEXT}
 * two same-name credits merge when they come from the same catalogue, sit
 * on books with the same title, or share a co-author.
 */
public class AuthorIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(AuthorIdentityResolver.class);

    private static final Comparator<AuthorMention> NAME_PRECEDENCE = Comparator
            .comparing((AuthorMention mention) -> mention.bookId().source())
            .thenComparing(AuthorMention::bookId);

    private final AuthorMatchMode matchMode;

    public AuthorIdentityResolver(AuthorMatchMode matchMode) {
        this.matchMode = matchMode;
    }

    public AuthorResolution resolve(List<BookRecord> books) {
        Map<AuthorMention.Key, AuthorMention> mentions = new TreeMap<>();
        for (BookRecord book : books) {
            List<String> nameKeys = book.authors().stream().map(FieldCleaners::comparisonKey).toList();
            for (int i = 0; i < book.authors().size(); i++) {
                String nameKey = nameKeys.get(i);
                Set<String> coAuthors = nameKeys.stream().filter(key -> !key.equals(nameKey)).collect(Collectors.toSet());
                AuthorMention mention = new AuthorMention(book.sourceId(), nameKey, book.authors().get(i),
                        Set.of(book.titleKey()), coAuthors);
                mentions.merge(mention.key(), mention, AuthorMention::mergedWith);
            }
        }

        UnionFind<AuthorMention.Key> partitions = new UnionFind<>();
        partitions.addAll(mentions.keySet());
        Map<String, List<AuthorMention>> byName = CustomerIdentityResolver.groupBy(
                new ArrayList<>(mentions.values()), AuthorMention::nameKey);
        for (List<AuthorMention> sameName : byName.values()) {
            for (int i = 0; i < sameName.size(); i++) {
                for (int j = i + 1; j < sameName.size(); j++) {
                    AuthorMention left = sameName.get(i);
                    AuthorMention right = sameName.get(j);
                    if (matchMode == AuthorMatchMode.NAME_ONLY || left.sharesContextWith(right)) {
                        partitions.union(left.key(), right.key());
                    }
                }
            }
        }

        List<CanonicalAuthor> authors = new ArrayList<>();
        Map<AuthorMention.Key, Long> authorIdByMention = new HashMap<>();
        long nextId = 1;
        for (SortedSet<AuthorMention.Key> partition : partitions.partitions()) {
            long authorId = nextId++;
            List<AuthorMention> members = partition.stream().map(mentions::get).sorted(NAME_PRECEDENCE).toList();
            SortedSet<SourceId> bookIds = new TreeSet<>();
            members.forEach(member -> {
                bookIds.add(member.bookId());
                authorIdByMention.put(member.key(), authorId);
            });
            authors.add(new CanonicalAuthor(authorId, members.get(0).displayName(), bookIds));
        }

        Map<SourceId, List<Long>> authorIdsByBook = new HashMap<>();
        for (BookRecord book : books) {
            Set<Long> ids = new LinkedHashSet<>();
            for (String author : book.authors()) {
                ids.add(authorIdByMention.get(new AuthorMention.Key(book.sourceId(), FieldCleaners.comparisonKey(author))));
            }
            authorIdsByBook.merge(book.sourceId(), List.copyOf(ids), (existing, added) -> {
                Set<Long> union = new LinkedHashSet<>(existing);
                union.addAll(added);
                return List.copyOf(union);
            });
        }

        log.info("Resolved {} author credits into {} canonical authors ({} mode)",
                mentions.size(), authors.size(), matchMode);
        return new AuthorResolution(authors, authorIdsByBook);
    }
}
