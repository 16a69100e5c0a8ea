package org.Aayush.arclookup.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntItemMapTest {

    @Test
    @DisplayName("Unwritten ids read as the default, writes grow the map")
    void testDefaultsAndGrowth() {
        IntItemMap map = new IntItemMap(Digraph.INVALID);
        assertEquals(Digraph.INVALID, map.get(0));
        assertEquals(Digraph.INVALID, map.get(1_000));
        assertEquals(0, map.size());

        map.set(5, 42);
        assertEquals(6, map.size());
        assertEquals(42, map.get(5));
        assertEquals(Digraph.INVALID, map.get(4), "gap filled with the default");
        assertEquals(Digraph.INVALID, map.defaultValue());
    }

    @Test
    @DisplayName("Reset returns every slot to the default")
    void testReset() {
        IntItemMap map = new IntItemMap(7, 4);
        map.set(0, 1);
        map.set(3, 2);
        map.reset();
        assertEquals(0, map.size());
        assertEquals(7, map.get(0));
        assertEquals(7, map.get(3));
    }

    @Test
    @DisplayName("ensureSize backs ids without changing values")
    void testEnsureSize() {
        IntItemMap map = new IntItemMap(-3);
        map.set(1, 9);
        map.ensureSize(10);
        assertEquals(10, map.size());
        assertEquals(9, map.get(1));
        assertEquals(-3, map.get(9));
        map.ensureSize(2);
        assertEquals(10, map.size());
    }

    @Test
    @DisplayName("Negative ids and sizes are rejected")
    void testValidation() {
        IntItemMap map = new IntItemMap(0);
        assertThrows(IndexOutOfBoundsException.class, () -> map.set(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new IntItemMap(0, -1));
    }
}
