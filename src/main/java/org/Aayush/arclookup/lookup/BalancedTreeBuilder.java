package org.Aayush.arclookup.lookup;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Aayush.arclookup.graph.Digraph;
import org.Aayush.arclookup.graph.IntItemMap;

/**
 * Median-split construction of per-node arc search trees.
 * <p>
 * The out-arcs of a node are stably sorted by target and the tree is built by making
 * the middle element the root of every range, which bounds the height by
 * {@code ceil(log2(d + 1))} regardless of insertion history. Arcs sharing a target end up
 * contiguous in-order, but the median split may place some of them in the left subtree of
 * an equal-target root.
 */
final class BalancedTreeBuilder {

    private BalancedTreeBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Collects the out-arcs of {@code node} into {@code scratch}, stably sorted by target.
     *
     * @return the number of collected arcs.
     */
    static int collectSorted(Digraph graph, int node, IntArrayList scratch) {
        scratch.clear();
        for (int a = graph.firstOut(node); a != Digraph.INVALID; a = graph.nextOut(a)) {
            scratch.add(a);
        }
        int size = scratch.size();
        if (size > 1) {
            IntArrays.mergeSort(scratch.elements(), 0, size,
                    (a, b) -> Integer.compare(graph.target(a), graph.target(b)));
        }
        return size;
    }

    /**
     * Links {@code sorted[from..to]} (inclusive) into a balanced tree.
     *
     * @param parent parent-link storage, or {@code null} when the tree keeps no parent links.
     * @return the root arc; its parent link is left for the caller to set.
     */
    static int build(int[] sorted, int from, int to,
                     IntItemMap left, IntItemMap right, IntItemMap parent) {
        int mid = (from + to) >>> 1;
        int root = sorted[mid];
        if (from < mid) {
            int child = build(sorted, from, mid - 1, left, right, parent);
            left.set(root, child);
            if (parent != null) {
                parent.set(child, root);
            }
        } else {
            left.set(root, Digraph.INVALID);
        }
        if (mid < to) {
            int child = build(sorted, mid + 1, to, left, right, parent);
            right.set(root, child);
            if (parent != null) {
                parent.set(child, root);
            }
        } else {
            right.set(root, Digraph.INVALID);
        }
        return root;
    }

    /**
     * Returns the arcs of the tree rooted at {@code root} in in-order.
     */
    static IntArrayList inorder(int root, IntItemMap left, IntItemMap right) {
        IntArrayList out = new IntArrayList();
        IntArrayList stack = new IntArrayList();
        int a = root;
        while (a != Digraph.INVALID || !stack.isEmpty()) {
            while (a != Digraph.INVALID) {
                stack.push(a);
                a = left.get(a);
            }
            a = stack.popInt();
            out.add(a);
            a = right.get(a);
        }
        return out;
    }
}
