package util.indexed;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Set of values drawn from one {@link IndexedDomain}, stored as a set of
 * indices. Small sets are kept sparse and switch to a dense bit vector once
 * their size passes {@link #DENSE_THRESHOLD}. A set never switches back.
 *
 * @param <T>
 *            type of the elements
 */
public class IndexSet<T> implements Iterable<T> {

    /**
     * Sets larger than this are stored as bit vectors
     */
    public static final int DENSE_THRESHOLD = 32;

    /**
     * Domain the indices are drawn from
     */
    private final IndexedDomain<T> domain;
    /**
     * Either a {@link MutableSparseIntSet} or a {@link BitVectorIntSet}
     */
    private MutableIntSet set;

    /**
     * Create an empty set over the given domain
     *
     * @param domain
     *            domain of the elements
     */
    public IndexSet(IndexedDomain<T> domain) {
        this.domain = domain;
        this.set = MutableSparseIntSet.makeEmpty();
    }

    /**
     * Create a set over the given domain containing the given elements
     *
     * @param domain
     *            domain of the elements
     * @param elements
     *            elements to intern and add
     */
    public IndexSet(IndexedDomain<T> domain, Collection<? extends T> elements) {
        this(domain);
        for (T e : elements) {
            insert(e);
        }
    }

    private IndexSet(IndexedDomain<T> domain, MutableIntSet set) {
        this.domain = domain;
        this.set = set;
    }

    /**
     * @return the domain of this set
     */
    public IndexedDomain<T> getDomain() {
        return domain;
    }

    /**
     * @return true if the set is stored as a dense bit vector
     */
    public boolean isDense() {
        return set instanceof BitVectorIntSet;
    }

    private void densifyIfNeeded(int expectedSize) {
        if (!isDense() && expectedSize > DENSE_THRESHOLD) {
            set = new BitVectorIntSet(set);
        }
    }

    /**
     * Add an element, interning it in the domain if necessary
     *
     * @param element
     *            element to add
     * @return true if the set changed
     */
    public boolean insert(T element) {
        return insertIndex(domain.intern(element));
    }

    /**
     * Add an index of the domain
     *
     * @param index
     *            index to add
     * @return true if the set changed
     */
    public boolean insertIndex(int index) {
        densifyIfNeeded(set.size() + 1);
        return set.add(index);
    }

    /**
     * @param element
     *            element to check
     * @return true if the element is in the set
     */
    public boolean contains(T element) {
        return domain.contains(element) && set.contains(domain.index(element));
    }

    /**
     * @param index
     *            index to check
     * @return true if the index is in the set
     */
    public boolean containsIndex(int index) {
        return set.contains(index);
    }

    /**
     * @param element
     *            element to remove
     * @return true if the set changed
     */
    public boolean remove(T element) {
        if (!domain.contains(element)) {
            return false;
        }
        return set.remove(domain.index(element));
    }

    /**
     * Add every element of that set to this one
     *
     * @param that
     *            set to union in
     * @return true if this set changed
     */
    public boolean union(IndexSet<T> that) {
        assert that.domain == this.domain : "Sets over different domains";
        if (that.set.isEmpty()) {
            return false;
        }
        densifyIfNeeded(set.size() + that.set.size());
        return set.addAll(that.set);
    }

    /**
     * Keep only the elements also contained in that set
     *
     * @param that
     *            set to intersect with
     * @return true if this set changed
     */
    public boolean intersect(IndexSet<T> that) {
        assert that.domain == this.domain : "Sets over different domains";
        int before = set.size();
        if (this.isDense() == that.isDense()) {
            set.intersectWith(that.set);
        }
        else {
            removeEach(set, difference(this.set, that.set));
        }
        return set.size() != before;
    }

    /**
     * Remove every element of that set from this one
     *
     * @param that
     *            set to subtract
     * @return true if this set changed
     */
    public boolean subtract(IndexSet<T> that) {
        assert that.domain == this.domain : "Sets over different domains";
        int before = set.size();
        if (set.size() <= that.set.size()) {
            // iterate over the smaller side
            MutableIntSet common = MutableSparseIntSet.makeEmpty();
            for (IntIterator iter = set.intIterator(); iter.hasNext();) {
                int i = iter.next();
                if (that.set.contains(i)) {
                    common.add(i);
                }
            }
            removeEach(set, common);
        }
        else {
            removeEach(set, that.set);
        }
        return set.size() != before;
    }

    private static void removeEach(MutableIntSet target, IntSet toRemove) {
        for (IntIterator iter = toRemove.intIterator(); iter.hasNext();) {
            target.remove(iter.next());
        }
    }

    /**
     * Elements of a that are not in b
     */
    private static MutableIntSet difference(IntSet a, IntSet b) {
        MutableIntSet d = MutableSparseIntSet.makeEmpty();
        for (IntIterator iter = a.intIterator(); iter.hasNext();) {
            int i = iter.next();
            if (!b.contains(i)) {
                d.add(i);
            }
        }
        return d;
    }

    /**
     * @param that
     *            set to compare to
     * @return true if every element of that set is also in this one
     */
    public boolean isSuperset(IndexSet<T> that) {
        if (that.set.size() > this.set.size()) {
            return false;
        }
        if (this.isDense() == that.isDense()) {
            return that.set.isSubset(this.set);
        }
        for (IntIterator iter = that.set.intIterator(); iter.hasNext();) {
            if (!set.contains(iter.next())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return number of elements
     */
    public int size() {
        return set.size();
    }

    /**
     * @return true if there are no elements
     */
    public boolean isEmpty() {
        return set.isEmpty();
    }

    /**
     * @return a fresh set with the same elements and representation
     */
    public IndexSet<T> copy() {
        MutableIntSet s = isDense() ? new BitVectorIntSet(set) : MutableSparseIntSet.make(set);
        return new IndexSet<>(domain, s);
    }

    /**
     * @return the indices of the elements in ascending order
     */
    public List<Integer> indices() {
        List<Integer> l = new ArrayList<>(set.size());
        for (IntIterator iter = set.intIterator(); iter.hasNext();) {
            l.add(iter.next());
        }
        Collections.sort(l);
        return l;
    }

    /**
     * @return the elements in ascending index order
     */
    public List<T> elements() {
        List<T> l = new ArrayList<>(set.size());
        for (int i : indices()) {
            l.add(domain.value(i));
        }
        return l;
    }

    @Override
    public Iterator<T> iterator() {
        return elements().iterator();
    }

    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IndexSet)) {
            return false;
        }
        IndexSet<T> other = (IndexSet<T>) obj;
        return domain == other.domain && size() == other.size() && isSuperset(other);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (IntIterator iter = set.intIterator(); iter.hasNext();) {
            h += iter.next();
        }
        return h;
    }

    @Override
    public String toString() {
        return elements().toString();
    }
}
