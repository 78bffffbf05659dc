package util.indexed;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.ibm.wala.util.intset.MutableMapping;

/**
 * Append-only mapping from values to dense integer indices. Every state of one
 * analysis shares a single domain so that the indices stored in {@link IndexSet}s
 * and {@link IndexMatrix}es built over it remain comparable.
 *
 * @param <T>
 *            type of the interned values
 */
public class IndexedDomain<T> implements Iterable<T> {

    /**
     * Underlying WALA mapping, values are never removed
     */
    private final MutableMapping<T> mapping = MutableMapping.make();

    /**
     * Create an empty domain
     */
    public IndexedDomain() {
    }

    /**
     * Create a domain containing the given values in iteration order
     *
     * @param values
     *            initial values
     */
    public IndexedDomain(Iterable<? extends T> values) {
        for (T v : values) {
            intern(v);
        }
    }

    /**
     * Get the index for the given value, adding the value if it has not been
     * seen before
     *
     * @param value
     *            value to intern
     * @return the unique index of the value in this domain
     */
    public int intern(T value) {
        assert value != null : "Cannot intern null";
        int i = mapping.getMappedIndex(value);
        if (i >= 0) {
            return i;
        }
        return mapping.add(value);
    }

    /**
     * Get the index of a value that must already have been interned
     *
     * @param value
     *            value to look up
     * @return index of the value
     * @throws IllegalArgumentException
     *             if the value was never interned
     */
    public int index(T value) {
        int i = mapping.getMappedIndex(value);
        if (i < 0) {
            throw new IllegalArgumentException("No index for " + value + " in domain of size " + size());
        }
        return i;
    }

    /**
     * Whether the value has been interned
     *
     * @param value
     *            value to check
     * @return true if the value has an index in this domain
     */
    public boolean contains(T value) {
        return mapping.getMappedIndex(value) >= 0;
    }

    /**
     * Get the value for the given index
     *
     * @param index
     *            index into this domain
     * @return the value with that index
     */
    public T value(int index) {
        if (index < 0 || index >= size()) {
            throw new IllegalArgumentException("Index " + index + " out of range for domain of size " + size());
        }
        return mapping.getMappedObject(index);
    }

    /**
     * @return number of values in the domain
     */
    public int size() {
        return mapping.getSize();
    }

    /**
     * @return snapshot of the values of this domain in index order
     */
    public List<T> values() {
        List<T> l = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            l.add(mapping.getMappedObject(i));
        }
        return l;
    }

    @Override
    public Iterator<T> iterator() {
        return values().iterator();
    }

    @Override
    public String toString() {
        return values().toString();
    }
}
