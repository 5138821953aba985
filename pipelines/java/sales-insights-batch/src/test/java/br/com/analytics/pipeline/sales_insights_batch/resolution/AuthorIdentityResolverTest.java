package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.AuthorMatchMode;
import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalAuthor;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static br.com.analytics.pipeline.sales_insights_batch.resolution.ResolverFixtures.book;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuthorIdentityResolver Tests")
class AuthorIdentityResolverTest {

    private final AuthorIdentityResolver resolver = new AuthorIdentityResolver(AuthorMatchMode.NAME_AND_CONTEXT);

    private static List<BookRecord> catalogue() {
        return List.of(
                book(SourceTag.S1, "b1", "The Great Gatsby", "F. Scott Fitzgerald"),
                book(SourceTag.S1, "b2", "Good Omens", "Terry Pratchett", "Neil Gaiman"),
                book(SourceTag.S2, "7", "The Great Gatsby", "F. Scott Fitzgerald"),
                book(SourceTag.S3, "1", "Good Omens", "Neil Gaiman", "Terry Pratchett"),
                book(SourceTag.S3, "2", "Coraline", "neil gaiman"),
                book(SourceTag.S2, "8", "Gardening Basics", "John Smith"),
                book(SourceTag.S3, "3", "Deep Sea Fishing", "John Smith"));
    }

    @Test
    @DisplayName("Should merge same-name credits that share a title or a co-author")
    void testResolve_NameAndContext() {
        AuthorResolution resolution = resolver.resolve(catalogue());
        List<CanonicalAuthor> authors = resolution.authors();

        CanonicalAuthor fitzgerald = authors.get(0);
        assertEquals("F. Scott Fitzgerald", fitzgerald.name());
        assertEquals(List.of(SourceId.parse("S1:b1"), SourceId.parse("S2:7")), List.copyOf(fitzgerald.sourceIds()));

        CanonicalAuthor gaiman = authors.get(1);
        assertEquals("Neil Gaiman", gaiman.name());
        assertEquals(List.of(SourceId.parse("S1:b2"), SourceId.parse("S3:1"), SourceId.parse("S3:2")),
                List.copyOf(gaiman.sourceIds()));
    }

    @Test
    @DisplayName("Should keep same-name credits from unrelated catalogues apart")
    void testResolve_UnrelatedSameName() {
        List<CanonicalAuthor> smiths = resolver.resolve(catalogue()).authors().stream()
                .filter(author -> author.name().equals("John Smith"))
                .toList();

        assertEquals(2, smiths.size());
    }

    @Test
    @DisplayName("Should merge every same-name credit in name-only mode")
    void testResolve_NameOnly() {
        AuthorIdentityResolver nameOnly = new AuthorIdentityResolver(AuthorMatchMode.NAME_ONLY);

        List<CanonicalAuthor> smiths = nameOnly.resolve(catalogue()).authors().stream()
                .filter(author -> author.name().equals("John Smith"))
                .toList();

        assertEquals(1, smiths.size());
        assertEquals(2, smiths.get(0).sourceIds().size());
    }

    @Test
    @DisplayName("Should map every book record to its canonical author ids in credit order")
    void testResolve_AuthorIdsByBook() {
        AuthorResolution resolution = resolver.resolve(catalogue());

        assertEquals(List.of(1L), resolution.authorIdsByBook().get(SourceId.parse("S2:7")));
        assertEquals(List.of(3L, 2L), resolution.authorIdsByBook().get(SourceId.parse("S1:b2")));
        assertEquals(List.of(2L, 3L), resolution.authorIdsByBook().get(SourceId.parse("S3:1")));
    }

    @Test
    @DisplayName("Should resolve the same authors for any input order")
    void testResolve_OrderIndependent() {
        AuthorResolution expected = resolver.resolve(catalogue());
        Random random = new Random(7);
        for (int attempt = 0; attempt < 20; attempt++) {
            List<BookRecord> shuffled = new ArrayList<>(catalogue());
            Collections.shuffle(shuffled, random);
            AuthorResolution actual = resolver.resolve(shuffled);
            assertEquals(expected.authors(), actual.authors());
            assertEquals(expected.authorIdsByBook(), actual.authorIdsByBook());
        }
    }

    @Test
    @DisplayName("Should pool the context of a book id listed twice regardless of row order")
    void testResolve_DuplicateBookIdOrderIndependent() {
        BookRecord firstListing = book(SourceTag.S1, "b1", "Title A", "Jane Roe");
        BookRecord secondListing = book(SourceTag.S1, "b1", "Title B", "Jane Roe");
        BookRecord otherSource = book(SourceTag.S2, "9", "Title B", "Jane Roe");

        List<CanonicalAuthor> forward = resolver.resolve(List.of(firstListing, secondListing, otherSource)).authors();
        List<CanonicalAuthor> swapped = resolver.resolve(List.of(secondListing, firstListing, otherSource)).authors();

        assertEquals(1, forward.size());
        assertEquals(List.of(SourceId.parse("S1:b1"), SourceId.parse("S2:9")), List.copyOf(forward.get(0).sourceIds()));
        assertEquals(forward, swapped);
    }
}
