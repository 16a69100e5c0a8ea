package org.Aayush.arclookup.graph;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synchronous event channel for arc-set changes of one graph.
 * <p>
 * Observers are notified in attach order. The notifier holds strong references to its
 * observers until they {@link #detach(ArcObserver) detach}; an observer that outlives its
 * interest must detach or it keeps receiving events.
 * <p>
 * <strong>Not thread-safe.</strong> Events are expected on the thread that mutates the graph.
 */
public final class ArcNotifier {

    private final List<ArcObserver> observers = new ArrayList<>();

    /**
     * Subscribes an observer.
     *
     * @throws IllegalStateException if the observer is already attached.
     */
    public void attach(ArcObserver observer) {
        Objects.requireNonNull(observer, "observer");
        if (isAttached(observer)) {
            throw new IllegalStateException("Observer already attached: " + observer);
        }
        observers.add(observer);
    }

    /**
     * Unsubscribes an observer.
     *
     * @return true if the observer was attached.
     */
    public boolean detach(ArcObserver observer) {
        for (int i = 0; i < observers.size(); i++) {
            if (observers.get(i) == observer) {
                observers.remove(i);
                return true;
            }
        }
        return false;
    }

    public boolean isAttached(ArcObserver observer) {
        for (ArcObserver o : observers) {
            if (o == observer) {
                return true;
            }
        }
        return false;
    }

    public int observerCount() {
        return observers.size();
    }

    // ========================================================================
    // PUBLISHING (called by the owning graph)
    // ========================================================================

    public void notifyAdd(int arc) {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).add(arc);
        }
    }

    public void notifyAdd(IntList arcs) {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).add(arcs);
        }
    }

    public void notifyErase(int arc) {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).erase(arc);
        }
    }

    public void notifyErase(IntList arcs) {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).erase(arcs);
        }
    }

    public void notifyBuild() {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).build();
        }
    }

    public void notifyClear() {
        for (int i = 0; i < observers.size(); i++) {
            observers.get(i).clear();
        }
    }
}
