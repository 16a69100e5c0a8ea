package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArcNotifierTest {

    /**
     * Logs single-item callbacks only, so batch events show through the default loops.
     */
    private static final class TaggedObserver implements ArcObserver {
        private final String tag;
        private final List<String> log;

        TaggedObserver(String tag, List<String> log) {
            this.tag = tag;
            this.log = log;
        }

        @Override
        public void add(int arc) {
            log.add(tag + ":add" + arc);
        }

        @Override
        public void erase(int arc) {
            log.add(tag + ":erase" + arc);
        }

        @Override
        public void build() {
            log.add(tag + ":build");
        }

        @Override
        public void clear() {
            log.add(tag + ":clear");
        }
    }

    @Test
    @DisplayName("Observers are called in attach order; batches fall back to per-arc callbacks")
    void testDeliveryOrder() {
        List<String> log = new ArrayList<>();
        ArcNotifier notifier = new ArcNotifier();
        notifier.attach(new TaggedObserver("x", log));
        notifier.attach(new TaggedObserver("y", log));

        notifier.notifyAdd(3);
        notifier.notifyErase(IntArrayList.of(4, 5));
        notifier.notifyBuild();
        notifier.notifyClear();
        notifier.notifyAdd((IntList) IntArrayList.of(6));
        notifier.notifyErase(7);

        assertEquals(List.of(
                "x:add3", "y:add3",
                "x:erase4", "x:erase5", "y:erase4", "y:erase5",
                "x:build", "y:build",
                "x:clear", "y:clear",
                "x:add6", "y:add6",
                "x:erase7", "y:erase7"
        ), log);
    }

    @Test
    @DisplayName("Double attach is rejected and detach stops delivery")
    void testAttachDetach() {
        List<String> log = new ArrayList<>();
        ArcNotifier notifier = new ArcNotifier();
        TaggedObserver observer = new TaggedObserver("x", log);

        notifier.attach(observer);
        assertTrue(notifier.isAttached(observer));
        assertThrows(IllegalStateException.class, () -> notifier.attach(observer));
        assertThrows(NullPointerException.class, () -> notifier.attach(null));

        assertTrue(notifier.detach(observer));
        assertFalse(notifier.detach(observer));
        assertEquals(0, notifier.observerCount());
        notifier.notifyAdd(1);
        assertTrue(log.isEmpty());
    }
}
