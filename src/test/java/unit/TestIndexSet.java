package unit;

import java.util.Arrays;

import junit.framework.TestCase;
import util.indexed.IndexSet;
import util.indexed.IndexedDomain;

public class TestIndexSet extends TestCase {

    private static IndexedDomain<Integer> domain(int size) {
        IndexedDomain<Integer> d = new IndexedDomain<>();
        for (int i = 0; i < size; i++) {
            d.intern(i);
        }
        return d;
    }

    public void testInternIsIdempotent() {
        IndexedDomain<String> d = new IndexedDomain<>();
        int a = d.intern("a");
        int b = d.intern("b");
        assertEquals(a, d.intern("a"));
        assertFalse(a == b);
        assertEquals("b", d.value(b));
        assertEquals(2, d.size());
    }

    public void testIndexOfUnknownValue() {
        IndexedDomain<String> d = new IndexedDomain<>();
        d.intern("a");
        try {
            d.index("missing");
        }
        catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public void testInsertReportsChange() {
        IndexSet<Integer> s = new IndexSet<>(domain(4));
        assertTrue(s.insert(1));
        assertFalse(s.insert(1));
        assertTrue(s.contains(1));
        assertFalse(s.contains(2));
        assertEquals(1, s.size());
    }

    public void testBecomesDensePastThreshold() {
        IndexedDomain<Integer> d = domain(100);
        IndexSet<Integer> s = new IndexSet<>(d);
        for (int i = 0; i < IndexSet.DENSE_THRESHOLD; i++) {
            s.insert(i);
        }
        assertFalse(s.isDense());
        s.insert(IndexSet.DENSE_THRESHOLD);
        assertTrue(s.isDense());
        assertEquals(IndexSet.DENSE_THRESHOLD + 1, s.size());
        for (int i = 0; i <= IndexSet.DENSE_THRESHOLD; i++) {
            assertTrue(s.contains(i));
        }
    }

    public void testUnion() {
        IndexedDomain<Integer> d = domain(10);
        IndexSet<Integer> a = new IndexSet<>(d, Arrays.asList(1, 2));
        IndexSet<Integer> b = new IndexSet<>(d, Arrays.asList(2, 3));
        assertTrue(a.union(b));
        assertEquals(Arrays.asList(1, 2, 3), a.elements());
        assertFalse(a.union(b));
        assertFalse(a.union(new IndexSet<>(d)));
    }

    public void testIntersectAcrossRepresentations() {
        IndexedDomain<Integer> d = domain(100);
        IndexSet<Integer> dense = new IndexSet<>(d);
        for (int i = 0; i < 50; i++) {
            dense.insert(i);
        }
        assertTrue(dense.isDense());
        IndexSet<Integer> sparse = new IndexSet<>(d, Arrays.asList(3, 60, 7));

        IndexSet<Integer> a = dense.copy();
        assertTrue(a.intersect(sparse));
        assertEquals(Arrays.asList(3, 7), a.elements());

        IndexSet<Integer> b = sparse.copy();
        assertTrue(b.intersect(dense));
        assertEquals(Arrays.asList(3, 7), b.elements());
        assertFalse(b.intersect(dense));
    }

    public void testSubtract() {
        IndexedDomain<Integer> d = domain(100);
        IndexSet<Integer> dense = new IndexSet<>(d);
        for (int i = 0; i < 40; i++) {
            dense.insert(i);
        }
        IndexSet<Integer> small = new IndexSet<>(d, Arrays.asList(0, 39, 80));

        IndexSet<Integer> a = dense.copy();
        assertTrue(a.subtract(small));
        assertEquals(38, a.size());
        assertFalse(a.contains(0));
        assertFalse(a.contains(39));

        IndexSet<Integer> b = small.copy();
        assertTrue(b.subtract(dense));
        assertEquals(Arrays.asList(80), b.elements());
        assertFalse(b.subtract(dense));
    }

    public void testIsSuperset() {
        IndexedDomain<Integer> d = domain(100);
        IndexSet<Integer> big = new IndexSet<>(d);
        for (int i = 0; i < 40; i++) {
            big.insert(i);
        }
        IndexSet<Integer> small = new IndexSet<>(d, Arrays.asList(5, 6));
        assertTrue(big.isSuperset(small));
        assertFalse(small.isSuperset(big));
        assertTrue(small.isSuperset(new IndexSet<>(d)));
        small.insert(70);
        assertFalse(big.isSuperset(small));
    }

    public void testEqualityIgnoresRepresentation() {
        IndexedDomain<Integer> d = domain(100);
        IndexSet<Integer> dense = new IndexSet<>(d);
        for (int i = 0; i < 40; i++) {
            dense.insert(i);
        }
        IndexSet<Integer> other = new IndexSet<>(d);
        for (int i = 39; i >= 0; i--) {
            other.insert(i);
        }
        IndexSet<Integer> keep = new IndexSet<>(d, Arrays.asList(1, 2));
        assertEquals(dense, other);
        assertEquals(dense.hashCode(), other.hashCode());
        dense.intersect(keep);
        assertEquals(keep, dense);
    }

    public void testCopyIsIndependent() {
        IndexSet<Integer> s = new IndexSet<>(domain(4), Arrays.asList(1));
        IndexSet<Integer> c = s.copy();
        c.insert(2);
        assertFalse(s.contains(2));
        assertTrue(s.remove(1));
        assertTrue(c.contains(1));
    }
}
