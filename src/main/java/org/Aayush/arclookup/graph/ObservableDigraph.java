package org.Aayush.arclookup.graph;

/**
 * A {@link Digraph} that publishes arc-set changes through an {@link ArcNotifier}.
 * <p>
 * Indexes that must stay valid while the graph mutates require this capability at
 * compile time instead of probing the graph type at runtime.
 */
public interface ObservableDigraph extends Digraph {

    /**
     * Returns the channel on which every arc addition and removal of this graph is announced.
     */
    ArcNotifier arcNotifier();
}
