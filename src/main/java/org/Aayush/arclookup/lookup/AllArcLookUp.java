package org.Aayush.arclookup.lookup;

import org.Aayush.arclookup.graph.Digraph;
import org.Aayush.arclookup.graph.IntItemMap;

/**
 * Static lookup of <em>all</em> arcs between given endpoints.
 * <p>
 * Same trees as {@link ArcLookUp}, plus a per-arc link to the next arc with the same
 * source and target. The first arc costs O(log d); every further one is O(1):
 * <pre>{@code
 * AllArcLookUp all = new AllArcLookUp(g);
 * int count = 0;
 * for (int a = all.lookup(u, v); a != Digraph.INVALID; a = all.lookup(u, v, a)) {
 *     count++;
 * }
 * }</pre>
 * <p>
 * <strong>Static:</strong> refresh after every graph change, exactly as for {@link ArcLookUp}.
 */
public class AllArcLookUp extends ArcLookUp {

    // next[arc] = following arc with the same target in in-order, or INVALID
    private final IntItemMap next;

    /**
     * Builds the search trees and the parallel-arc chains.
     */
    public AllArcLookUp(Digraph graph) {
        super(graph);
        this.next = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        linkAll();
    }

    @Override
    public void refresh(int node) {
        super.refresh(node);
        linkChains(head.get(node), Digraph.INVALID);
    }

    @Override
    public void refresh() {
        super.refresh();
        linkAll();
    }

    /**
     * Finds the first arc from {@code s} to {@code t} in O(log d).
     * <p>
     * "First" is the in-order leftmost one, so following {@link #lookup(int, int, int)}
     * from here reaches every parallel arc.
     *
     * @return the first arc from {@code s} to {@code t}, or {@link Digraph#INVALID}.
     */
    @Override
    public int lookup(int s, int t) {
        Digraph g = graph();
        int found = Digraph.INVALID;
        int a = head.get(s);
        while (a != Digraph.INVALID) {
            if (g.target(a) < t) {
                a = right.get(a);
            } else {
                if (g.target(a) == t) {
                    found = a;
                }
                a = left.get(a);
            }
        }
        return found;
    }

    /**
     * Finds the arc from {@code s} to {@code t} that follows {@code prev}.
     * <p>
     * With {@code prev == INVALID} this is {@link #lookup(int, int)}; otherwise it is an O(1)
     * chain step. {@code prev} must be an arc returned by an earlier lookup for the same
     * {@code (s, t)} since the last refresh; other values give undefined results.
     *
     * @return the next arc from {@code s} to {@code t}, or {@link Digraph#INVALID} if there
     * is no more.
     */
    public int lookup(int s, int t, int prev) {
        return prev == Digraph.INVALID ? lookup(s, t) : next.get(prev);
    }

    private void linkAll() {
        Digraph g = graph();
        for (int n = g.firstNode(); n != Digraph.INVALID; n = g.nextNode(n)) {
            linkChains(head.get(n), Digraph.INVALID);
        }
    }

    /**
     * Reverse in-order walk (right, self, left) carrying the last visited arc; each arc
     * links to the carried one when both share a target.
     *
     * @return the last visited arc of this subtree, or {@code carried} if it is empty.
     */
    private int linkChains(int root, int carried) {
        if (root == Digraph.INVALID) {
            return carried;
        }
        Digraph g = graph();
        int following = linkChains(right.get(root), carried);
        next.set(root, following != Digraph.INVALID && g.target(following) == g.target(root)
                ? following : Digraph.INVALID);
        return linkChains(left.get(root), root);
    }
}
