package unit;

import java.util.Arrays;

import junit.framework.TestCase;
import util.indexed.IndexMatrix;
import util.indexed.IndexSet;
import util.indexed.IndexedDomain;

public class TestIndexMatrix extends TestCase {

    private IndexedDomain<String> rows;
    private IndexedDomain<Integer> columns;

    @Override
    protected void setUp() {
        rows = new IndexedDomain<>(Arrays.asList("x", "y", "z"));
        columns = new IndexedDomain<>(Arrays.asList(0, 1, 2, 3));
    }

    public void testMissingRowIsEmpty() {
        IndexMatrix<String, Integer> m = new IndexMatrix<>(rows, columns);
        assertTrue(m.rowSet("x").isEmpty());
        assertTrue(m.rowSet("never interned").isEmpty());
        assertTrue(m.isEmpty());
        assertTrue(m.rows().isEmpty());
    }

    public void testInsertAndUnionIntoRow() {
        IndexMatrix<String, Integer> m = new IndexMatrix<>(rows, columns);
        assertTrue(m.insert("x", 1));
        assertFalse(m.insert("x", 1));
        IndexSet<Integer> s = new IndexSet<>(columns, Arrays.asList(1, 2));
        assertTrue(m.unionIntoRow("x", s));
        assertFalse(m.unionIntoRow("x", s));
        assertFalse(m.unionIntoRow("y", new IndexSet<>(columns)));
        assertEquals(Arrays.asList(1, 2), m.rowSet("x").elements());
        assertEquals(Arrays.asList("x"), m.rows());
    }

    public void testUnionIntoRowCopiesTheSet() {
        IndexMatrix<String, Integer> m = new IndexMatrix<>(rows, columns);
        IndexSet<Integer> s = new IndexSet<>(columns, Arrays.asList(0));
        m.unionIntoRow("y", s);
        s.insert(3);
        assertFalse(m.rowSet("y").contains(3));
    }

    public void testClearRow() {
        IndexMatrix<String, Integer> m = new IndexMatrix<>(rows, columns);
        m.insert("z", 0);
        assertTrue(m.clearRow("z"));
        assertFalse(m.clearRow("z"));
        assertTrue(m.rowSet("z").isEmpty());
        assertEquals(new IndexMatrix<>(rows, columns), m);
    }

    public void testJoinIsMonotoneAndIdempotent() {
        IndexMatrix<String, Integer> a = new IndexMatrix<>(rows, columns);
        a.insert("x", 0);
        IndexMatrix<String, Integer> b = new IndexMatrix<>(rows, columns);
        b.insert("x", 1);
        b.insert("y", 2);

        IndexMatrix<String, Integer> before = a.copy();
        assertTrue(a.join(b));
        assertTrue(before.leq(a));
        assertTrue(b.leq(a));
        assertFalse(a.leq(b));
        assertEquals(Arrays.asList(0, 1), a.rowSet("x").elements());

        IndexMatrix<String, Integer> again = a.copy();
        assertFalse(again.join(b));
        assertFalse(again.join(again.copy()));
        assertEquals(a, again);
    }

    public void testCopyIsDeep() {
        IndexMatrix<String, Integer> a = new IndexMatrix<>(rows, columns);
        a.insert("x", 0);
        IndexMatrix<String, Integer> c = a.copy();
        c.insert("x", 3);
        assertFalse(a.rowSet("x").contains(3));
        assertFalse(a.equals(c));
    }
}
