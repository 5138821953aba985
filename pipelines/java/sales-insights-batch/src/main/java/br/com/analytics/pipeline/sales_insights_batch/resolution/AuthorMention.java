package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One author credited on one book record. Author partitions are built over
 * mentions: every mention belongs to exactly one canonical author.
 * <p>
 * A source may list the same book id more than once. Those rows collapse into
 * one mention whose context is the union of their titles and co-authors, and
 * whose display name is the smallest spelling seen, so the result does not
 * depend on row order.
 */
record AuthorMention(
        SourceId bookId,
        String nameKey,
        String displayName,
        Set<String> titleKeys,
        Set<String> coAuthorKeys
) {

    record Key(SourceId bookId, String nameKey) implements Comparable<Key> {

        private static final Comparator<Key> ORDER = Comparator
                .comparing(Key::bookId)
                .thenComparing(Key::nameKey);

        @Override
        public int compareTo(Key other) {
            return ORDER.compare(this, other);
        }
    }

    AuthorMention {
        titleKeys = titleKeys.stream().filter(title -> !title.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        coAuthorKeys = Set.copyOf(coAuthorKeys);
    }

    Key key() {
        return new Key(bookId, nameKey);
    }

    AuthorMention mergedWith(AuthorMention duplicate) {
        Set<String> titles = new HashSet<>(titleKeys);
        titles.addAll(duplicate.titleKeys);
        Set<String> coAuthors = new HashSet<>(coAuthorKeys);
        coAuthors.addAll(duplicate.coAuthorKeys);
        String name = displayName.compareTo(duplicate.displayName) <= 0 ? displayName : duplicate.displayName;
        return new AuthorMention(bookId, nameKey, name, titles, coAuthors);
    }

    boolean sharesContextWith(AuthorMention other) {
        if (bookId.source() == other.bookId.source()) {
            return true;
        }
        if (!Collections.disjoint(titleKeys, other.titleKeys)) {
            return true;
        }
        return !Collections.disjoint(coAuthorKeys, other.coAuthorKeys);
    }
}
