package com.corpussearch.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class PostingListTest {

    static Stream<Supplier<PostingList>> postingLists() {
        return Stream.of(InMemoryPostingList::new, CompressedPostingList::new);
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testAppendAndIterateInOrder(Supplier<PostingList> factory) {
        PostingList postingList = factory.get();
        postingList.appendPosting(new Posting(1, 2));
        postingList.appendPosting(new Posting(3, 1));
        postingList.appendPosting(new Posting(7, 4));

        assertEquals(3, postingList.size());
        assertEquals(List.of(new Posting(1, 2), new Posting(3, 1), new Posting(7, 4)), collect(postingList));
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testRejectNonIncreasingDocumentIds(Supplier<PostingList> factory) {
        PostingList postingList = factory.get();
        postingList.appendPosting(new Posting(5, 1));

        assertThrows(IllegalArgumentException.class, () -> postingList.appendPosting(new Posting(5, 1)));
        assertThrows(IllegalArgumentException.class, () -> postingList.appendPosting(new Posting(4, 1)));
        assertEquals(1, postingList.size());
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testRejectNullPosting(Supplier<PostingList> factory) {
        assertThrows(IllegalArgumentException.class, () -> factory.get().appendPosting(null));
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testFrozenListIsReadOnly(Supplier<PostingList> factory) {
        PostingList postingList = factory.get();
        postingList.appendPosting(new Posting(2, 3));
        postingList.appendPosting(new Posting(9, 1));

        PostingList frozen = postingList.freeze();

        assertSame(frozen, frozen.freeze());
        assertEquals(2, frozen.size());
        assertEquals(collect(postingList), collect(frozen));
        assertEquals(collect(frozen), collect(frozen));
        assertThrows(IllegalStateException.class, () -> frozen.appendPosting(new Posting(10, 1)));
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testEmptyListIteratorIsExhausted(Supplier<PostingList> factory) {
        PostingList postingList = factory.get();

        assertEquals(0, postingList.size());
        assertFalse(postingList.iterator().hasNext());
    }

    @ParameterizedTest
    @MethodSource("postingLists")
    void testIteratorsAreIndependent(Supplier<PostingList> factory) {
        PostingList postingList = factory.get();
        postingList.appendPosting(new Posting(0, 1));
        postingList.appendPosting(new Posting(2, 3));

        Iterator<Posting> first = postingList.iterator();
        first.next();
        Iterator<Posting> second = postingList.iterator();

        assertEquals(new Posting(2, 3), first.next());
        assertEquals(new Posting(0, 1), second.next());
    }

    @Test
    void testCompressedIteratorSeesPostingsAppendedBeforeCreation() {
        CompressedPostingList postingList = new CompressedPostingList();
        postingList.appendPosting(new Posting(1, 1));
        assertEquals(1, collect(postingList).size());

        postingList.appendPosting(new Posting(9, 2));
        assertEquals(List.of(new Posting(1, 1), new Posting(9, 2)), collect(postingList));
    }

    @Test
    void testPostingValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Posting(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Posting(0, 0));
    }

    private static List<Posting> collect(Iterable<Posting> postings) {
        List<Posting> result = new ArrayList<>();
        postings.forEach(result::add);
        return result;
    }
}
