package com.boardroom.sim.random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeededRandomSourceTest {

    @Nested
    @DisplayName("nextInt()")
    class NextIntTests {

        @Test
        @DisplayName("values stay within [min, max)")
        void withinRange() {
            SeededRandomSource rng = new SeededRandomSource(7L);
            for (int i = 0; i < 1_000; i++) {
                int v = rng.nextInt(-5, 6);
                assertTrue(v >= -5 && v < 6, "out of range: " + v);
            }
        }

        @Test
        @DisplayName("empty range returns min without failing")
        void emptyRange_returnsMin() {
            assertEquals(4, new SeededRandomSource(1L).nextInt(4, 4));
        }

        @Test
        @DisplayName("max < min → IllegalArgumentException")
        void invertedRange_throws() {
            assertThrows(IllegalArgumentException.class, () -> new SeededRandomSource(1L).nextInt(5, 4));
        }
    }

    @Test
    @DisplayName("Deterministic — same input always produces same output")
    void deterministic() {
        SeededRandomSource a = new SeededRandomSource(42L);
        SeededRandomSource b = new SeededRandomSource(42L);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextInt(0, 1000), b.nextInt(0, 1000));
        }
    }

    @Test
    @DisplayName("shuffle() keeps every element and is reproducible")
    void shuffle_isPermutationAndReproducible() {
        List<Integer> first = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8));
        List<Integer> second = new ArrayList<>(first);
        new SeededRandomSource(9L).shuffle(first);
        new SeededRandomSource(9L).shuffle(second);

        assertEquals(first, second);
        assertEquals(8, first.size());
        assertTrue(first.containsAll(List.of(1, 2, 3, 4, 5, 6, 7, 8)));
    }

    @Test
    @DisplayName("shuffle() swaps from the end using nextInt(0, i + 1)")
    void shuffle_followsFisherYatesOrder() {
        // i=2 → j=0 swaps a,c ; i=1 → j=1 keeps b
        List<String> list = new ArrayList<>(List.of("a", "b", "c"));
        ScriptedRandomSource.strict(0, 1).shuffle(list);
        assertEquals(List.of("c", "b", "a"), list);
    }
}
