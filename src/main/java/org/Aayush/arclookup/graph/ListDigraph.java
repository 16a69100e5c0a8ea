package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.StandardException;

import java.util.Objects;

/**
 * Mutable directed multigraph backed by doubly linked adjacency lists.
 * <p>
 * Layout follows a Structure-of-Arrays scheme: every node and arc attribute lives in its
 * own primitive list indexed by id. Erased ids go to a free list and are handed out
 * again (most recently freed first), so ids stay dense under churn.
 * <p>
 * Features:
 * - O(1) node/arc insertion and arc removal.
 * - O(degree) node removal (all incident arcs are removed with it).
 * - O(1) {@link #nodeNum()} / {@link #arcNum()}.
 * - New arcs are prepended to the out-list of their source and the in-list of their target.
 * - Every arc-set change is published on {@link #arcNotifier()}.
 * <p>
 * <strong>Not thread-safe.</strong>
 */
public class ListDigraph implements ObservableDigraph {

    // ========================================================================
    // NODE STORAGE (SoA)
    // ========================================================================
    private final BooleanArrayList nodeAlive;
    private final IntArrayList nodePrev;
    private final IntArrayList nodeNext;
    private final IntArrayList nodeFirstOut;
    private final IntArrayList nodeFirstIn;
    private final IntArrayList freeNodes;
    private int firstNodeId = INVALID;
    private int nodeCount;

    // ========================================================================
    // ARC STORAGE (SoA)
    // ========================================================================
    private final BooleanArrayList arcAlive;
    private final IntArrayList arcSource;
    private final IntArrayList arcTarget;
    private final IntArrayList arcPrevOut;
    private final IntArrayList arcNextOut;
    private final IntArrayList arcPrevIn;
    private final IntArrayList arcNextIn;
    private final IntArrayList freeArcs;
    private int arcCount;

    private final ArcNotifier arcNotifier = new ArcNotifier();

    public ListDigraph() {
        this(DigraphConfig.defaults());
    }

    public ListDigraph(DigraphConfig config) {
        Objects.requireNonNull(config, "config").validate();
        int n = config.getExpectedNodes();
        int m = config.getExpectedArcs();
        this.nodeAlive = new BooleanArrayList(n);
        this.nodePrev = new IntArrayList(n);
        this.nodeNext = new IntArrayList(n);
        this.nodeFirstOut = new IntArrayList(n);
        this.nodeFirstIn = new IntArrayList(n);
        this.freeNodes = new IntArrayList();
        this.arcAlive = new BooleanArrayList(m);
        this.arcSource = new IntArrayList(m);
        this.arcTarget = new IntArrayList(m);
        this.arcPrevOut = new IntArrayList(m);
        this.arcNextOut = new IntArrayList(m);
        this.arcPrevIn = new IntArrayList(m);
        this.arcNextIn = new IntArrayList(m);
        this.freeArcs = new IntArrayList();
    }

    /**
     * Raised when a handle does not name a live node or arc of this graph.
     */
    @StandardException
    public static class InvalidItemException extends RuntimeException {
    }

    // ========================================================================
    // MUTATION
    // ========================================================================

    /**
     * Adds a node and returns its id. Nodes carry no arcs, so no event is published.
     */
    public int addNode() {
        int node;
        if (!freeNodes.isEmpty()) {
            node = freeNodes.popInt();
            nodeAlive.set(node, true);
            nodeFirstOut.set(node, INVALID);
            nodeFirstIn.set(node, INVALID);
        } else {
            node = nodeAlive.size();
            nodeAlive.add(true);
            nodePrev.add(INVALID);
            nodeNext.add(INVALID);
            nodeFirstOut.add(INVALID);
            nodeFirstIn.add(INVALID);
        }
        nodePrev.set(node, INVALID);
        nodeNext.set(node, firstNodeId);
        if (firstNodeId != INVALID) {
            nodePrev.set(firstNodeId, node);
        }
        firstNodeId = node;
        nodeCount++;
        return node;
    }

    /**
     * Adds an arc from {@code source} to {@code target} and publishes an arc-added event.
     *
     * @throws InvalidItemException if either endpoint is not a live node.
     */
    public int addArc(int source, int target) {
        requireNode(source);
        requireNode(target);
        int arc = linkArc(source, target);
        arcNotifier.notifyAdd(arc);
        return arc;
    }

    /**
     * Adds {@code sources.size()} arcs, arc {@code i} running from {@code sources[i]} to
     * {@code targets[i]}, and publishes one batch arc-added event.
     *
     * @return ids of the new arcs, in input order.
     * @throws IllegalArgumentException if the lists differ in length.
     * @throws InvalidItemException if any endpoint is not a live node; nothing is added then.
     */
    public IntList addArcs(IntList sources, IntList targets) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");
        if (sources.size() != targets.size()) {
            throw new IllegalArgumentException(
                    "sources and targets differ in length: " + sources.size() + " vs " + targets.size());
        }
        for (int i = 0; i < sources.size(); i++) {
            requireNode(sources.getInt(i));
            requireNode(targets.getInt(i));
        }
        IntArrayList added = new IntArrayList(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            added.add(linkArc(sources.getInt(i), targets.getInt(i)));
        }
        if (!added.isEmpty()) {
            arcNotifier.notifyAdd(added);
        }
        return added;
    }

    /**
     * Removes one arc. The arc-removed event fires while the arc is still linked.
     *
     * @throws InvalidItemException if {@code arc} is not live.
     */
    public void erase(int arc) {
        requireArc(arc);
        arcNotifier.notifyErase(arc);
        unlinkArc(arc);
    }

    /**
     * Removes a node with all its incident arcs. The incident arcs are announced in one
     * batch arc-removed event (a loop is listed once) before anything is unlinked.
     *
     * @throws InvalidItemException if {@code node} is not live.
     */
    public void eraseNode(int node) {
        requireNode(node);
        IntArrayList incident = new IntArrayList();
        for (int a = firstOut(node); a != INVALID; a = nextOut(a)) {
            incident.add(a);
        }
        for (int a = firstIn(node); a != INVALID; a = nextIn(a)) {
            if (source(a) != node) {
                incident.add(a);
            }
        }
        if (!incident.isEmpty()) {
            arcNotifier.notifyErase(incident);
            for (int i = 0; i < incident.size(); i++) {
                unlinkArc(incident.getInt(i));
            }
        }

        int prev = nodePrev.getInt(node);
        int next = nodeNext.getInt(node);
        if (prev != INVALID) {
            nodeNext.set(prev, next);
        } else {
            firstNodeId = next;
        }
        if (next != INVALID) {
            nodePrev.set(next, prev);
        }
        nodeAlive.set(node, false);
        freeNodes.push(node);
        nodeCount--;
    }

    /**
     * Removes every node and arc and publishes a clear event. Ids restart from zero.
     */
    public void clear() {
        arcNotifier.notifyClear();
        resetStorage();
    }

    /**
     * Replaces the whole graph with {@code nodeCount} nodes (ids {@code 0..nodeCount-1})
     * and arcs {@code i: sources[i] -> targets[i]} (ids {@code 0..m-1}), then publishes a
     * single build event. No per-arc events are sent.
     *
     * @throws IllegalArgumentException on negative node count, length mismatch or
     * endpoints outside {@code [0, nodeCount)}; the graph is left untouched then.
     */
    public void rebuild(int nodeCount, int[] sources, int[] targets) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be >= 0");
        }
        if (sources.length != targets.length) {
            throw new IllegalArgumentException(
                    "sources and targets differ in length: " + sources.length + " vs " + targets.length);
        }
        for (int i = 0; i < sources.length; i++) {
            if (sources[i] < 0 || sources[i] >= nodeCount || targets[i] < 0 || targets[i] >= nodeCount) {
                throw new IllegalArgumentException(
                        "Arc " + i + " endpoint out of range [0, " + nodeCount + "): "
                                + sources[i] + " -> " + targets[i]);
            }
        }

        resetStorage();
        // Free lists are empty after the reset, so ids come out as 0..nodeCount-1.
        for (int i = 0; i < nodeCount; i++) {
            addNode();
        }
        for (int i = 0; i < sources.length; i++) {
            linkArc(sources[i], targets[i]);
        }
        arcNotifier.notifyBuild();
    }

    // ========================================================================
    // ITERATION
    // ========================================================================

    @Override
    public int firstNode() {
        return firstNodeId;
    }

    @Override
    public int nextNode(int node) {
        return nodeNext.getInt(node);
    }

    @Override
    public int firstArc() {
        for (int n = firstNodeId; n != INVALID; n = nodeNext.getInt(n)) {
            int a = nodeFirstOut.getInt(n);
            if (a != INVALID) {
                return a;
            }
        }
        return INVALID;
    }

    @Override
    public int nextArc(int arc) {
        int a = arcNextOut.getInt(arc);
        if (a != INVALID) {
            return a;
        }
        for (int n = nodeNext.getInt(arcSource.getInt(arc)); n != INVALID; n = nodeNext.getInt(n)) {
            a = nodeFirstOut.getInt(n);
            if (a != INVALID) {
                return a;
            }
        }
        return INVALID;
    }

    @Override
    public int firstOut(int node) {
        return nodeFirstOut.getInt(node);
    }

    @Override
    public int nextOut(int arc) {
        return arcNextOut.getInt(arc);
    }

    @Override
    public int firstIn(int node) {
        return nodeFirstIn.getInt(node);
    }

    @Override
    public int nextIn(int arc) {
        return arcNextIn.getInt(arc);
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /**
     * UNCHECKED - caller must pass a live (or just-erased) arc.
     */
    @Override
    public int source(int arc) {
        assert arc >= 0 && arc < arcSource.size() : "Arc " + arc + " out of bounds";
        return arcSource.getInt(arc);
    }

    /**
     * UNCHECKED - caller must pass a live (or just-erased) arc.
     */
    @Override
    public int target(int arc) {
        assert arc >= 0 && arc < arcTarget.size() : "Arc " + arc + " out of bounds";
        return arcTarget.getInt(arc);
    }

    @Override
    public boolean validNode(int node) {
        return node >= 0 && node < nodeAlive.size() && nodeAlive.getBoolean(node);
    }

    @Override
    public boolean validArc(int arc) {
        return arc >= 0 && arc < arcAlive.size() && arcAlive.getBoolean(arc);
    }

    @Override
    public int maxNodeId() {
        return nodeAlive.size() - 1;
    }

    @Override
    public int maxArcId() {
        return arcAlive.size() - 1;
    }

    @Override
    public int nodeNum() {
        return nodeCount;
    }

    @Override
    public int arcNum() {
        return arcCount;
    }

    @Override
    public ArcNotifier arcNotifier() {
        return arcNotifier;
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private void requireNode(int node) {
        if (!validNode(node)) {
            throw new InvalidItemException("Not a live node: " + node);
        }
    }

    private void requireArc(int arc) {
        if (!validArc(arc)) {
            throw new InvalidItemException("Not a live arc: " + arc);
        }
    }

    private int linkArc(int source, int target) {
        int arc;
        if (!freeArcs.isEmpty()) {
            arc = freeArcs.popInt();
            arcAlive.set(arc, true);
            arcSource.set(arc, source);
            arcTarget.set(arc, target);
        } else {
            arc = arcAlive.size();
            arcAlive.add(true);
            arcSource.add(source);
            arcTarget.add(target);
            arcPrevOut.add(INVALID);
            arcNextOut.add(INVALID);
            arcPrevIn.add(INVALID);
            arcNextIn.add(INVALID);
        }

        int headOut = nodeFirstOut.getInt(source);
        arcPrevOut.set(arc, INVALID);
        arcNextOut.set(arc, headOut);
        if (headOut != INVALID) {
            arcPrevOut.set(headOut, arc);
        }
        nodeFirstOut.set(source, arc);

        int headIn = nodeFirstIn.getInt(target);
        arcPrevIn.set(arc, INVALID);
        arcNextIn.set(arc, headIn);
        if (headIn != INVALID) {
            arcPrevIn.set(headIn, arc);
        }
        nodeFirstIn.set(target, arc);

        arcCount++;
        return arc;
    }

    private void unlinkArc(int arc) {
        int prevOut = arcPrevOut.getInt(arc);
        int nextOut = arcNextOut.getInt(arc);
        if (prevOut != INVALID) {
            arcNextOut.set(prevOut, nextOut);
        } else {
            nodeFirstOut.set(arcSource.getInt(arc), nextOut);
        }
        if (nextOut != INVALID) {
            arcPrevOut.set(nextOut, prevOut);
        }

        int prevIn = arcPrevIn.getInt(arc);
        int nextIn = arcNextIn.getInt(arc);
        if (prevIn != INVALID) {
            arcNextIn.set(prevIn, nextIn);
        } else {
            nodeFirstIn.set(arcTarget.getInt(arc), nextIn);
        }
        if (nextIn != INVALID) {
            arcPrevIn.set(nextIn, prevIn);
        }

        arcAlive.set(arc, false);
        freeArcs.push(arc);
        arcCount--;
    }

    private void resetStorage() {
        nodeAlive.clear();
        nodePrev.clear();
        nodeNext.clear();
        nodeFirstOut.clear();
        nodeFirstIn.clear();
        freeNodes.clear();
        firstNodeId = INVALID;
        nodeCount = 0;

        arcAlive.clear();
        arcSource.clear();
        arcTarget.clear();
        arcPrevOut.clear();
        arcNextOut.clear();
        arcPrevIn.clear();
        arcNextIn.clear();
        freeArcs.clear();
        arcCount = 0;
    }
}
