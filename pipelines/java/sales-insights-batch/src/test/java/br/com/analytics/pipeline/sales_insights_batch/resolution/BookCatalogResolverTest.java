package br.com.analytics.pipeline.sales_insights_batch.resolution;

import br.com.analytics.pipeline.sales_insights_batch.model.BookRecord;
import br.com.analytics.pipeline.sales_insights_batch.model.CanonicalBook;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceId;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static br.com.analytics.pipeline.sales_insights_batch.resolution.ResolverFixtures.book;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BookCatalogResolver Tests")
class BookCatalogResolverTest {

    private final BookCatalogResolver resolver = new BookCatalogResolver();

    @Test
    @DisplayName("Should merge books with the same title and the same authors")
    void testResolve_SameTitleSameAuthors() {
        BookRecord s1 = book(SourceTag.S1, "b2", "Good Omens", "Terry Pratchett", "Neil Gaiman");
        BookRecord s3 = new BookRecord(SourceId.parse("S3:1"), "GOOD OMENS", "good omens",
                List.of("Neil Gaiman", "Terry Pratchett"), "", "", null);
        Map<SourceId, List<Long>> authorIds = Map.of(s1.sourceId(), List.of(3L, 2L), s3.sourceId(), List.of(2L, 3L));

        BookResolution resolution = resolver.resolve(List.of(s3, s1), authorIds);

        assertEquals(1, resolution.books().size());
        CanonicalBook book = resolution.books().get(0);
        assertEquals(1L, book.bookId());
        assertEquals("Good Omens", book.title());
        assertEquals("Fiction", book.genre());
        assertEquals(2001, book.publicationYear());
        assertEquals(1L, resolution.bookIdBySourceId().get(SourceId.parse("S3:1")));
        assertEquals(1L, resolution.bookIdBySourceId().get(SourceId.parse("S1:b2")));
    }

    @Test
    @DisplayName("Should keep books with the same title but different authors apart")
    void testResolve_SameTitleDifferentAuthors() {
        BookRecord first = book(SourceTag.S1, "b1", "Collected Poems", "Sylvia Plath");
        BookRecord second = book(SourceTag.S2, "4", "Collected Poems", "Philip Larkin");
        Map<SourceId, List<Long>> authorIds = Map.of(first.sourceId(), List.of(1L), second.sourceId(), List.of(2L));

        BookResolution resolution = resolver.resolve(List.of(first, second), authorIds);

        assertEquals(2, resolution.books().size());
        assertNotEquals(resolution.bookIdBySourceId().get(first.sourceId()),
                resolution.bookIdBySourceId().get(second.sourceId()));
    }
}
