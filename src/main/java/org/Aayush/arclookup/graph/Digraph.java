package org.Aayush.arclookup.graph;

/**
 * Read contract of a directed multigraph with dense integer handles.
 * <p>
 * Nodes and arcs are identified by non-negative {@code int} ids. The sentinel
 * {@link #INVALID} stands for "no item" everywhere a handle is returned or accepted.
 * Node ids double as the total order used for target comparisons: node {@code a}
 * sorts before node {@code b} iff {@code a < b}.
 * <p>
 * Iteration is cursor based and allocation free:
 * <pre>{@code
 * for (int a = g.firstOut(n); a != Digraph.INVALID; a = g.nextOut(a)) { ... }
 * }</pre>
 * <p>
 * The counting and search methods ship with linear default implementations.
 * Implementations that can answer them faster override them, so callers always get
 * the cheapest strategy the concrete graph supports without inspecting its type.
 */
public interface Digraph {

    /**
     * "No item" sentinel for node and arc handles.
     */
    int INVALID = -1;

    // ========================================================================
    // ITERATION
    // ========================================================================

    int firstNode();

    int nextNode(int node);

    int firstArc();

    int nextArc(int arc);

    /**
     * Returns the first outgoing arc of {@code node}, or {@link #INVALID}.
     */
    int firstOut(int node);

    int nextOut(int arc);

    /**
     * Returns the first incoming arc of {@code node}, or {@link #INVALID}.
     */
    int firstIn(int node);

    int nextIn(int arc);

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    int source(int arc);

    int target(int arc);

    boolean validNode(int node);

    boolean validArc(int arc);

    /**
     * Largest node id ever handed out, or {@code -1} for a graph that never had nodes.
     */
    int maxNodeId();

    /**
     * Largest arc id ever handed out, or {@code -1} for a graph that never had arcs.
     */
    int maxArcId();

    // ========================================================================
    // CAPABILITIES (linear defaults)
    // ========================================================================

    /**
     * Number of live nodes. O(n) unless overridden.
     */
    default int nodeNum() {
        int count = 0;
        for (int n = firstNode(); n != INVALID; n = nextNode(n)) {
            count++;
        }
        return count;
    }

    /**
     * Number of live arcs. O(m) unless overridden.
     */
    default int arcNum() {
        int count = 0;
        for (int a = firstArc(); a != INVALID; a = nextArc(a)) {
            count++;
        }
        return count;
    }

    default int outDegree(int node) {
        int count = 0;
        for (int a = firstOut(node); a != INVALID; a = nextOut(a)) {
            count++;
        }
        return count;
    }

    default int inDegree(int node) {
        int count = 0;
        for (int a = firstIn(node); a != INVALID; a = nextIn(a)) {
            count++;
        }
        return count;
    }

    /**
     * Finds an arc from {@code u} to {@code v}.
     * <p>
     * If {@code prev} is {@link #INVALID} the scan starts at the first outgoing arc of
     * {@code u}; otherwise it continues after {@code prev}, which must be an arc from
     * {@code u} returned by an earlier call. Repeated calls therefore enumerate every
     * arc from {@code u} to {@code v} exactly once:
     * <pre>{@code
     * for (int a = g.findArc(u, v, INVALID); a != INVALID; a = g.findArc(u, v, a)) { ... }
     * }</pre>
     * O(out-degree of u) unless overridden.
     *
     * @return the next matching arc, or {@link #INVALID} when there is none.
     */
    default int findArc(int u, int v, int prev) {
        int a = prev == INVALID ? firstOut(u) : nextOut(prev);
        while (a != INVALID && target(a) != v) {
            a = nextOut(a);
        }
        return a;
    }
}
