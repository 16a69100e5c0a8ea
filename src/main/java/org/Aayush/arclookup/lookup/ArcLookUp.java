package org.Aayush.arclookup.lookup;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.arclookup.graph.Digraph;
import org.Aayush.arclookup.graph.IntItemMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Static arc lookup between given endpoints.
 * <p>
 * Keeps one height-balanced binary search tree per node over its outgoing arcs, ordered
 * by target. {@link #lookup(int, int)} then answers "is there an arc from s to t" in
 * O(log d), where d is the out-degree of s, instead of scanning all d out-arcs.
 * <p>
 * <strong>Static:</strong> the trees are a snapshot. After the graph changes, call
 * {@link #refresh()}, or {@link #refresh(int)} for each node whose out-arcs changed, before
 * the next lookup. Stale lookups are not detected and may return wrong answers.
 * Use {@link DynArcLookUp} for graphs that change often, and {@link AllArcLookUp} to
 * enumerate parallel arcs.
 * <p>
 * <strong>Not thread-safe</strong> against a concurrent refresh.
 */
public class ArcLookUp {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArcLookUp.class);

    @Getter
    @Accessors(fluent = true)
    private final Digraph graph;

    // head[node] = tree root; left/right[arc] = children
    final IntItemMap head;
    final IntItemMap left;
    final IntItemMap right;

    private final IntArrayList scratch = new IntArrayList();

    /**
     * Builds the search trees. They remain valid until the graph changes.
     */
    public ArcLookUp(Digraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.head = new IntItemMap(Digraph.INVALID, graph.maxNodeId() + 1);
        this.left = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        this.right = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        buildAll();
    }

    /**
     * Rebuilds the tree of one node in O(d log d).
     */
    public void refresh(int node) {
        rebuildTree(node);
    }

    /**
     * Rebuilds every tree in O(m log D), D being the maximum out-degree.
     */
    public void refresh() {
        buildAll();
    }

    // Not overridable: the constructor runs it before subclass state exists.
    private void rebuildTree(int node) {
        int size = BalancedTreeBuilder.collectSorted(graph, node, scratch);
        if (size == 0) {
            head.set(node, Digraph.INVALID);
        } else {
            head.set(node, BalancedTreeBuilder.build(scratch.elements(), 0, size - 1, left, right, null));
        }
    }

    /**
     * Finds an arc from {@code s} to {@code t} in O(log d).
     * <p>
     * With parallel arcs, any one of them may be returned.
     *
     * @return an arc from {@code s} to {@code t}, or {@link Digraph#INVALID} if there is none.
     */
    public int lookup(int s, int t) {
        int a = head.get(s);
        while (a != Digraph.INVALID) {
            int target = graph.target(a);
            if (target == t) {
                return a;
            }
            a = t < target ? left.get(a) : right.get(a);
        }
        return Digraph.INVALID;
    }

    /**
     * Returns the tree of {@code node} in in-order (ascending target).
     */
    IntArrayList inorder(int node) {
        return BalancedTreeBuilder.inorder(head.get(node), left, right);
    }

    private void buildAll() {
        head.reset();
        int nodes = 0;
        for (int n = graph.firstNode(); n != Digraph.INVALID; n = graph.nextNode(n)) {
            rebuildTree(n);
            nodes++;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("built arc lookup trees nodes={} maxArcId={}", nodes, graph.maxArcId());
        }
    }
}
