package util;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Work queue over a fixed universe of elements that always yields the pending
 * element appearing earliest in a given order (e.g. the reverse postorder of a
 * control-flow graph). Adding an element that is already pending has no
 * effect.
 *
 * @param <T>
 *            type of queue elements
 */
public class WorkQueue<T> {

    /**
     * Position of each element of the universe in the order
     */
    private final Map<T, Integer> rank = new HashMap<>();
    /**
     * Pending elements by rank
     */
    private final TreeMap<Integer, T> pending = new TreeMap<>();

    /**
     * @param order
     *            every element that may be added, in the order they should be
     *            polled when pending together
     */
    public WorkQueue(List<T> order) {
        for (T t : order) {
            if (!rank.containsKey(t)) {
                rank.put(t, rank.size());
            }
        }
    }

    /**
     * Mark the element pending
     *
     * @param n
     *            element to add
     * @return true if the element was not already pending
     * @throws IllegalArgumentException
     *             if the element is not in the order this queue was created
     *             with
     */
    public boolean add(T n) {
        Integer r = rank.get(n);
        if (r == null) {
            throw new IllegalArgumentException(n + " is not in the order of this work queue");
        }
        return pending.put(r, n) == null;
    }

    /**
     * @return the pending element earliest in the order, or null if nothing is
     *         pending
     */
    public T poll() {
        Map.Entry<Integer, T> first = pending.pollFirstEntry();
        return first == null ? null : first.getValue();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public boolean contains(T n) {
        Integer r = rank.get(n);
        return r != null && pending.containsKey(r);
    }

    public int size() {
        return pending.size();
    }

    @Override
    public String toString() {
        return pending.values().toString();
    }
}
