package org.Aayush.arclookup.lookup;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.arclookup.graph.ListDigraph;
import org.Aayush.arclookup.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.Aayush.arclookup.graph.Digraph.INVALID;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("All-Arc Lookup Tests")
class AllArcLookUpTest {

    private static IntArrayList chain(AllArcLookUp index, int s, int t) {
        IntArrayList out = new IntArrayList();
        for (int a = index.lookup(s, t); a != INVALID; a = index.lookup(s, t, a)) {
            out.add(a);
            if (out.size() > 10_000) {
                fail("chain does not terminate for " + s + " -> " + t);
            }
        }
        return out;
    }

    @Nested
    @DisplayName("1. Chains")
    class Chains {

        @Test
        @DisplayName("Example scenario enumerates both parallel arcs, then stops")
        void testExampleScenario() {
            GraphFixtures.Example ex = GraphFixtures.example();
            AllArcLookUp index = new AllArcLookUp(ex.graph());

            assertEquals(IntArrayList.of(ex.a1(), ex.a2()),
                    GraphFixtures.sorted(chain(index, ex.a(), ex.b())));
            assertEquals(IntArrayList.of(ex.a3()), chain(index, ex.a(), ex.c()));
            assertEquals(IntArrayList.of(ex.a4()), chain(index, ex.b(), ex.c()));
            assertTrue(chain(index, ex.b(), ex.a()).isEmpty());
        }

        @Test
        @DisplayName("First arc is the in-order leftmost one and prev == INVALID restarts")
        void testFirstIsLeftmost() {
            GraphFixtures.Example ex = GraphFixtures.example();
            AllArcLookUp index = new AllArcLookUp(ex.graph());
            int first = index.lookup(ex.a(), ex.b());
            assertEquals(index.inorder(ex.a()).getInt(0), first);
            assertEquals(first, index.lookup(ex.a(), ex.b(), INVALID));
        }

        @Test
        @DisplayName("Chain order follows in-order positions")
        void testChainOrderMatchesInorder() {
            ListDigraph g = GraphFixtures.randomGraph(new Random(3), 3, 90);
            AllArcLookUp index = new AllArcLookUp(g);
            for (int s = 0; s < 3; s++) {
                IntArrayList inorder = index.inorder(s);
                for (int t = 0; t < 3; t++) {
                    IntArrayList expected = new IntArrayList();
                    for (int i = 0; i < inorder.size(); i++) {
                        if (g.target(inorder.getInt(i)) == t) {
                            expected.add(inorder.getInt(i));
                        }
                    }
                    assertEquals(expected, chain(index, s, t));
                }
            }
        }

        @Test
        @DisplayName("Every pair of a dense random multigraph matches the oracle")
        void testAllPairs() {
            ListDigraph g = GraphFixtures.randomGraph(new Random(17), 7, 500);
            AllArcLookUp index = new AllArcLookUp(g);
            for (int s = 0; s < 7; s++) {
                for (int t = 0; t < 7; t++) {
                    IntArrayList visited = chain(index, s, t);
                    for (int i = 0; i < visited.size(); i++) {
                        assertEquals(s, g.source(visited.getInt(i)));
                        assertEquals(t, g.target(visited.getInt(i)));
                    }
                    assertEquals(GraphFixtures.oracle(g, s, t), GraphFixtures.sorted(visited));
                }
            }
        }
    }

    @Nested
    @DisplayName("2. Refresh")
    class Refresh {

        @Test
        @DisplayName("Full refresh discovers parallel arcs added behind the index's back")
        void testRefreshAfterParallelInsertions() {
            GraphFixtures.Example ex = GraphFixtures.example();
            ListDigraph g = ex.graph();
            AllArcLookUp index = new AllArcLookUp(g);
            for (int k = 0; k < 25; k++) {
                g.addArc(ex.a(), ex.b());
            }
            assertEquals(2, chain(index, ex.a(), ex.b()).size(), "stale until refreshed");

            index.refresh();
            IntArrayList visited = chain(index, ex.a(), ex.b());
            assertEquals(27, visited.size());
            assertEquals(GraphFixtures.oracle(g, ex.a(), ex.b()), GraphFixtures.sorted(visited));
        }

        @Test
        @DisplayName("Single-node refresh rebuilds that node's chains only")
        void testRefreshNode() {
            GraphFixtures.Example ex = GraphFixtures.example();
            ListDigraph g = ex.graph();
            AllArcLookUp index = new AllArcLookUp(g);
            int extraBc = g.addArc(ex.b(), ex.c());
            int extraAb = g.addArc(ex.a(), ex.b());

            index.refresh(ex.b());
            assertEquals(IntArrayList.of(ex.a4(), extraBc), GraphFixtures.sorted(chain(index, ex.b(), ex.c())));
            assertEquals(2, chain(index, ex.a(), ex.b()).size());

            index.refresh(ex.a());
            assertEquals(IntArrayList.of(ex.a1(), ex.a2(), extraAb),
                    GraphFixtures.sorted(chain(index, ex.a(), ex.b())));
        }

        @Test
        @DisplayName("Refresh after removals drops removed arcs from the chains")
        void testRefreshAfterRemoval() {
            GraphFixtures.Example ex = GraphFixtures.example();
            ListDigraph g = ex.graph();
            AllArcLookUp index = new AllArcLookUp(g);
            g.erase(ex.a1());
            index.refresh();
            assertEquals(IntArrayList.of(ex.a2()), chain(index, ex.a(), ex.b()));
        }
    }
}
