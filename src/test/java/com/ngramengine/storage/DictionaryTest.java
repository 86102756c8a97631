package com.ngramengine.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class DictionaryTest {

    @Test
    void testResolveAssignsDenseStableIds() {
        DictionaryBuilder builder = new DictionaryBuilder();

        assertEquals(0, builder.resolveOrCreate("§§m"));
        assertEquals(1, builder.resolveOrCreate("§mu"));
        assertEquals(0, builder.resolveOrCreate("§§m"));
        assertEquals(2, builder.resolveOrCreate("mus"));
        assertEquals(3, builder.size());
    }

    @Test
    void testDocFrequencyCounting() {
        DictionaryBuilder builder = new DictionaryBuilder();
        int dimension = builder.resolveOrCreate("abc");

        assertEquals(0, builder.docFrequency(dimension));
        builder.incrementDocFrequency(dimension);
        builder.incrementDocFrequency(dimension);
        assertEquals(2, builder.docFrequency(dimension));
        assertThrows(IllegalArgumentException.class, () -> builder.incrementDocFrequency(5));
    }

    @Test
    void testGrowsBeyondInitialCapacity() {
        DictionaryBuilder builder = new DictionaryBuilder();
        for (int index = 0; index < 100; index++) {
            int dimension = builder.resolveOrCreate("g" + index);
            builder.incrementDocFrequency(dimension);
        }

        Dictionary dictionary = builder.build();
        assertEquals(100, dictionary.size());
        assertEquals(1, dictionary.docFrequency(99));
        assertEquals("g42", dictionary.gram(42));
    }

    @Test
    void testFrozenLookup() {
        DictionaryBuilder builder = new DictionaryBuilder();
        builder.resolveOrCreate("abc");
        int second = builder.resolveOrCreate("bcd");
        builder.incrementDocFrequency(second);

        Dictionary dictionary = builder.build();
        builder.resolveOrCreate("zzz");

        assertEquals(OptionalInt.of(1), dictionary.lookup("bcd"));
        assertEquals(OptionalInt.empty(), dictionary.lookup("zzz"));
        assertEquals(2, dictionary.size());
        assertEquals(1, dictionary.docFrequency(1));
        assertTrue(dictionary.contains(1));
        assertFalse(dictionary.contains(2));
        assertFalse(dictionary.contains(-1));
    }

    @Test
    void testRejectInvalidDictionary() {
        assertThrows(IllegalArgumentException.class, () -> new Dictionary(new String[] {"a"}, new int[0]));
        assertThrows(IllegalArgumentException.class, () -> new Dictionary(new String[] {"a", "a"}, new int[] {1, 1}));
        assertThrows(IllegalArgumentException.class, () -> new Dictionary(new String[] {"a"}, new int[] {-1}));
        assertThrows(IllegalArgumentException.class, () -> new DictionaryBuilder().resolveOrCreate(""));
    }
}
