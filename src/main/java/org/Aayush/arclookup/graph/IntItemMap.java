package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Growable {@code item id -> int} storage with a default value.
 * <p>
 * Reads past the current capacity return {@link #defaultValue()} and writes grow the
 * backing list, so a map created for a graph keeps working after the graph hands out
 * new node or arc ids. Typical use is tree-link storage keyed by arc id, with
 * {@link Digraph#INVALID} as default.
 * <p>
 * <strong>Not thread-safe.</strong>
 */
public final class IntItemMap {

    private final IntArrayList values;
    @Getter
    @Accessors(fluent = true)
    private final int defaultValue;

    public IntItemMap(int defaultValue) {
        this(defaultValue, 0);
    }

    /**
     * @param defaultValue value reported for never-written ids.
     * @param expectedSize number of ids to reserve room for.
     */
    public IntItemMap(int defaultValue, int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be >= 0");
        }
        this.defaultValue = defaultValue;
        this.values = new IntArrayList(expectedSize);
    }

    /**
     * UNCHECKED for negative ids - caller passes live handles only.
     */
    public int get(int id) {
        assert id >= 0 : "negative id " + id;
        return id < values.size() ? values.getInt(id) : defaultValue;
    }

    public void set(int id, int value) {
        if (id < 0) {
            throw new IndexOutOfBoundsException("id must be >= 0: " + id);
        }
        ensureSize(id + 1);
        values.set(id, value);
    }

    /**
     * Grows the map so ids {@code [0, size)} are backed by storage.
     */
    public void ensureSize(int size) {
        int current = values.size();
        if (size <= current) {
            return;
        }
        values.ensureCapacity(size);
        for (int i = current; i < size; i++) {
            values.add(defaultValue);
        }
    }

    /**
     * Returns every slot to the default value.
     */
    public void reset() {
        values.clear();
    }

    /**
     * Number of backed ids; ids at or beyond this read as the default.
     */
    public int size() {
        return values.size();
    }
}
