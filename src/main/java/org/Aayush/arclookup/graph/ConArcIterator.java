package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterates over all arcs connecting one node pair, in the order {@link Digraph#findArc}
 * reports them.
 * <pre>{@code
 * IntIterator it = new ConArcIterator(g, u, v);
 * while (it.hasNext()) {
 *     int arc = it.nextInt();
 * }
 * }</pre>
 * The graph must not change while iterating.
 */
public final class ConArcIterator implements IntIterator {

    private final Digraph graph;
    private final int source;
    private final int target;
    private int next;

    public ConArcIterator(Digraph graph, int source, int target) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.source = source;
        this.target = target;
        this.next = graph.findArc(source, target, Digraph.INVALID);
    }

    @Override
    public boolean hasNext() {
        return next != Digraph.INVALID;
    }

    @Override
    public int nextInt() {
        if (next == Digraph.INVALID) {
            throw new NoSuchElementException("No more arcs from " + source + " to " + target);
        }
        int current = next;
        next = graph.findArc(source, target, current);
        return current;
    }
}
