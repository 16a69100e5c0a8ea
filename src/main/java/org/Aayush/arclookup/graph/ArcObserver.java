package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Receiver of arc-set change events published by an {@link ArcNotifier}.
 * <p>
 * Callbacks run synchronously on the mutating thread, exactly once per change and in
 * mutation order. Removal events are delivered while the removed arcs are still
 * readable, so {@code source}/{@code target} lookups on them stay valid inside
 * {@link #erase(int)}.
 */
public interface ArcObserver {

    /**
     * One arc was added.
     */
    void add(int arc);

    /**
     * Several arcs were added in one operation.
     */
    default void add(IntList arcs) {
        for (int i = 0; i < arcs.size(); i++) {
            add(arcs.getInt(i));
        }
    }

    /**
     * One arc is about to be removed.
     */
    void erase(int arc);

    /**
     * Several arcs are about to be removed in one operation.
     */
    default void erase(IntList arcs) {
        for (int i = 0; i < arcs.size(); i++) {
            erase(arcs.getInt(i));
        }
    }

    /**
     * The whole arc set was replaced; observers should rebuild from the current graph.
     */
    void build();

    /**
     * Every arc was removed.
     */
    void clear();
}
