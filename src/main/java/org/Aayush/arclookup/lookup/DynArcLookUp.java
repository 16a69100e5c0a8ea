package org.Aayush.arclookup.lookup;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.arclookup.graph.ArcObserver;
import org.Aayush.arclookup.graph.Digraph;
import org.Aayush.arclookup.graph.IntItemMap;
import org.Aayush.arclookup.graph.ObservableDigraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Dynamic arc lookup between given endpoints.
 * <p>
 * Finds an arc from a given source to a given target in amortized O(log d), d being the
 * out-degree of the source, on a graph that keeps changing. Every node owns a
 * self-adjusting binary search tree (Sleator-Tarjan splay tree) over its outgoing arcs,
 * ordered by target. The index listens on the graph's {@link ObservableDigraph#arcNotifier()}
 * and updates the trees on every arc addition and removal, so no refresh is needed.
 * <p>
 * All parallel arcs between two nodes can be listed with {@link #findFirst(int, int)} and
 * {@link #findNext(int, int, int)}.
 * <p>
 * Tree invariant: in-order traversal of a node's tree is non-decreasing by target. Newly
 * inserted arcs with a target equal to a visited arc's target always descend right; the
 * successor walk of {@code findNext} depends on equal targets staying contiguous in-order.
 * <p>
 * <strong>Usage Warning:</strong> queries restructure the trees (the accessed arc is splayed
 * to the root), so even lookups need exclusive access. Not thread-safe.
 * <p>
 * The index must not outlive its graph. {@link #close()} detaches it from the notifier;
 * a closed index keeps answering from its last state, which goes stale on the next change.
 */
public final class DynArcLookUp implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DynArcLookUp.class);

    @Getter
    @Accessors(fluent = true)
    private final ObservableDigraph graph;

    private final IntItemMap head;
    private final IntItemMap parent;
    private final IntItemMap left;
    private final IntItemMap right;

    private final IntArrayList scratch = new IntArrayList();
    private final ArcObserver observer = new TreeMaintainer();
    private boolean closed;

    /**
     * Builds balanced trees from the current arc set in O(m log D), D being the maximum
     * out-degree, then subscribes to arc changes.
     */
    public DynArcLookUp(ObservableDigraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.head = new IntItemMap(Digraph.INVALID, graph.maxNodeId() + 1);
        this.parent = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        this.left = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        this.right = new IntItemMap(Digraph.INVALID, graph.maxArcId() + 1);
        refresh();
        graph.arcNotifier().attach(observer);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("attached dynamic arc lookup nodes={} arcs={}", graph.nodeNum(), graph.arcNum());
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Finds an arc from {@code s} to {@code t} in amortized O(log d).
     * <p>
     * With parallel arcs, any one of them may be returned. The found arc (or, on a miss,
     * the last visited one) is splayed to the root of the tree.
     *
     * @return an arc from {@code s} to {@code t}, or {@link Digraph#INVALID} if there is none.
     */
    public int lookup(int s, int t) {
        int a = head.get(s);
        if (a == Digraph.INVALID) {
            return Digraph.INVALID;
        }
        while (true) {
            int target = graph.target(a);
            if (target == t) {
                splay(a);
                return a;
            } else if (t < target) {
                if (left.get(a) == Digraph.INVALID) {
                    splay(a);
                    return Digraph.INVALID;
                }
                a = left.get(a);
            } else {
                if (right.get(a) == Digraph.INVALID) {
                    splay(a);
                    return Digraph.INVALID;
                }
                a = right.get(a);
            }
        }
    }

    /**
     * Finds the first arc from {@code s} to {@code t} in amortized O(log d).
     * <p>
     * "First" is the leftmost in tree order, so {@link #findNext(int, int, int)} started
     * here visits every parallel arc exactly once.
     *
     * @return the first arc from {@code s} to {@code t}, or {@link Digraph#INVALID}.
     */
    public int findFirst(int s, int t) {
        int a = head.get(s);
        if (a == Digraph.INVALID) {
            return Digraph.INVALID;
        }
        int found = Digraph.INVALID;
        while (true) {
            if (graph.target(a) < t) {
                if (right.get(a) == Digraph.INVALID) {
                    splay(a);
                    return found;
                }
                a = right.get(a);
            } else {
                if (graph.target(a) == t) {
                    found = a;
                }
                if (left.get(a) == Digraph.INVALID) {
                    splay(a);
                    return found;
                }
                a = left.get(a);
            }
        }
    }

    /**
     * Finds the arc from {@code s} to {@code t} following {@code prev} in tree order.
     * <p>
     * {@code prev} must be the result of the previous {@link #findFirst} or {@code findNext}
     * call for the same {@code (s, t)}. Otherwise the amortized O(log d) bound no longer
     * holds and, if {@code prev} does not run from {@code s} to {@code t}, the result is
     * undefined. Neither case is detected.
     *
     * @return the next arc from {@code s} to {@code t}, or {@link Digraph#INVALID} if there
     * is no more.
     */
    public int findNext(int s, int t, int prev) {
        if (prev == Digraph.INVALID) {
            return Digraph.INVALID;
        }
        int a = prev;
        if (right.get(a) != Digraph.INVALID) {
            a = right.get(a);
            while (left.get(a) != Digraph.INVALID) {
                a = left.get(a);
            }
        } else {
            while (parent.get(a) != Digraph.INVALID && right.get(parent.get(a)) == a) {
                a = parent.get(a);
            }
            if (parent.get(a) == Digraph.INVALID) {
                return Digraph.INVALID;
            }
            a = parent.get(a);
        }
        splay(a);
        return graph.target(a) == t ? a : Digraph.INVALID;
    }

    /**
     * Detaches from the graph's notifier. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        graph.arcNotifier().detach(observer);
        closed = true;
        LOGGER.debug("detached dynamic arc lookup");
    }

    public boolean isClosed() {
        return closed;
    }

    // ========================================================================
    // TREE MAINTENANCE
    // ========================================================================

    private void refresh() {
        head.reset();
        for (int n = graph.firstNode(); n != Digraph.INVALID; n = graph.nextNode(n)) {
            int size = BalancedTreeBuilder.collectSorted(graph, n, scratch);
            if (size == 0) {
                head.set(n, Digraph.INVALID);
            } else {
                int root = BalancedTreeBuilder.build(scratch.elements(), 0, size - 1, left, right, parent);
                head.set(n, root);
                parent.set(root, Digraph.INVALID);
            }
        }
    }

    /**
     * Ordered insertion (equal targets go right), then splays the new arc to the root.
     */
    void insert(int arc) {
        int s = graph.source(arc);
        int t = graph.target(arc);
        left.set(arc, Digraph.INVALID);
        right.set(arc, Digraph.INVALID);

        int e = head.get(s);
        if (e == Digraph.INVALID) {
            head.set(s, arc);
            parent.set(arc, Digraph.INVALID);
            return;
        }
        while (true) {
            if (t < graph.target(e)) {
                if (left.get(e) == Digraph.INVALID) {
                    left.set(e, arc);
                    parent.set(arc, e);
                    splay(arc);
                    return;
                }
                e = left.get(e);
            } else {
                if (right.get(e) == Digraph.INVALID) {
                    right.set(e, arc);
                    parent.set(arc, e);
                    splay(arc);
                    return;
                }
                e = right.get(e);
            }
        }
    }

    /**
     * Unlinks an arc from its source's tree. With two children the in-order predecessor
     * takes the removed arc's place; if the predecessor was taken from deeper down, its old
     * parent is splayed.
     */
    void remove(int arc) {
        int l = left.get(arc);
        int r = right.get(arc);
        int p = parent.get(arc);
        if (l == Digraph.INVALID) {
            if (r != Digraph.INVALID) {
                parent.set(r, p);
            }
            replaceChild(p, arc, r);
        } else if (r == Digraph.INVALID) {
            parent.set(l, p);
            replaceChild(p, arc, l);
        } else {
            int e = l;
            if (right.get(e) != Digraph.INVALID) {
                e = right.get(e);
                while (right.get(e) != Digraph.INVALID) {
                    e = right.get(e);
                }
                int s = parent.get(e);
                int el = left.get(e);
                right.set(s, el);
                if (el != Digraph.INVALID) {
                    parent.set(el, s);
                }

                left.set(e, l);
                parent.set(l, e);
                right.set(e, r);
                parent.set(r, e);
                parent.set(e, p);
                replaceChild(p, arc, e);
                splay(s);
            } else {
                right.set(e, r);
                parent.set(r, e);
                parent.set(e, p);
                replaceChild(p, arc, e);
            }
        }
    }

    /**
     * Points {@code p}'s link to {@code oldChild} at {@code newChild}; with no parent,
     * {@code newChild} becomes the tree root of {@code oldChild}'s source.
     */
    private void replaceChild(int p, int oldChild, int newChild) {
        if (p == Digraph.INVALID) {
            head.set(graph.source(oldChild), newChild);
        } else if (left.get(p) == oldChild) {
            left.set(p, newChild);
        } else {
            right.set(p, newChild);
        }
    }

    /**
     * Rotates left child {@code v} above its parent.
     */
    private void rotateRight(int v) {
        int w = parent.get(v);
        int pw = parent.get(w);
        parent.set(v, pw);
        parent.set(w, v);
        left.set(w, right.get(v));
        right.set(v, w);
        if (pw != Digraph.INVALID) {
            if (right.get(pw) == w) {
                right.set(pw, v);
            } else {
                left.set(pw, v);
            }
        }
        if (left.get(w) != Digraph.INVALID) {
            parent.set(left.get(w), w);
        }
    }

    /**
     * Rotates right child {@code v} above its parent.
     */
    private void rotateLeft(int v) {
        int w = parent.get(v);
        int pw = parent.get(w);
        parent.set(v, pw);
        parent.set(w, v);
        right.set(w, left.get(v));
        left.set(v, w);
        if (pw != Digraph.INVALID) {
            if (left.get(pw) == w) {
                left.set(pw, v);
            } else {
                right.set(pw, v);
            }
        }
        if (right.get(w) != Digraph.INVALID) {
            parent.set(right.get(w), w);
        }
    }

    /**
     * Moves {@code v} to the root of its tree by zig, zig-zig and zig-zag steps.
     */
    private void splay(int v) {
        while (parent.get(v) != Digraph.INVALID) {
            int p = parent.get(v);
            int g = parent.get(p);
            if (v == left.get(p)) {
                if (g == Digraph.INVALID) {
                    rotateRight(v);
                } else if (p == left.get(g)) {
                    rotateRight(p);
                    rotateRight(v);
                } else {
                    rotateRight(v);
                    rotateLeft(v);
                }
            } else {
                if (g == Digraph.INVALID) {
                    rotateLeft(v);
                } else if (p == left.get(g)) {
                    rotateLeft(v);
                    rotateRight(v);
                } else {
                    rotateLeft(p);
                    rotateLeft(v);
                }
            }
        }
        head.set(graph.source(v), v);
    }

    // ========================================================================
    // INSPECTION (tests)
    // ========================================================================

    /**
     * Returns the tree of {@code node} in in-order (non-decreasing target).
     */
    IntArrayList inorder(int node) {
        return BalancedTreeBuilder.inorder(head.get(node), left, right);
    }

    int root(int node) {
        return head.get(node);
    }

    /**
     * Checks that every child's parent link points back at its parent and the root has none.
     */
    boolean linksConsistent(int node) {
        int root = head.get(node);
        if (root == Digraph.INVALID) {
            return true;
        }
        if (parent.get(root) != Digraph.INVALID) {
            return false;
        }
        IntArrayList arcs = inorder(node);
        for (int i = 0; i < arcs.size(); i++) {
            int a = arcs.getInt(i);
            int l = left.get(a);
            int r = right.get(a);
            if (l != Digraph.INVALID && parent.get(l) != a) {
                return false;
            }
            if (r != Digraph.INVALID && parent.get(r) != a) {
                return false;
            }
            if (graph.source(a) != node) {
                return false;
            }
        }
        return true;
    }

    /**
     * Relays graph events into tree updates.
     */
    private final class TreeMaintainer implements ArcObserver {

        @Override
        public void add(int arc) {
            insert(arc);
        }

        @Override
        public void erase(int arc) {
            remove(arc);
        }

        @Override
        public void build() {
            refresh();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("rebuilt dynamic arc lookup nodes={} arcs={}", graph.nodeNum(), graph.arcNum());
            }
        }

        @Override
        public void clear() {
            head.reset();
            LOGGER.debug("cleared dynamic arc lookup");
        }
    }
}
