package util.indexed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Relation from rows to sets of columns. Rows and columns are interned in their
 * own {@link IndexedDomain}s. Empty rows are never stored, so two matrices are
 * equal if and only if they relate the same pairs.
 *
 * @param <R>
 *            row type
 * @param <C>
 *            column type
 */
public class IndexMatrix<R, C> {

    private final IndexedDomain<R> rowDomain;
    private final IndexedDomain<C> columnDomain;
    /**
     * Row index to non-empty column set
     */
    private final TreeMap<Integer, IndexSet<C>> matrix;

    /**
     * Create an empty relation
     *
     * @param rowDomain
     *            domain of the rows
     * @param columnDomain
     *            domain of the columns
     */
    public IndexMatrix(IndexedDomain<R> rowDomain, IndexedDomain<C> columnDomain) {
        this.rowDomain = rowDomain;
        this.columnDomain = columnDomain;
        this.matrix = new TreeMap<>();
    }

    public IndexedDomain<R> getRowDomain() {
        return rowDomain;
    }

    public IndexedDomain<C> getColumnDomain() {
        return columnDomain;
    }

    /**
     * Relate the row to the column
     *
     * @param row
     *            row value
     * @param column
     *            column value
     * @return true if the relation changed
     */
    public boolean insert(R row, C column) {
        int r = rowDomain.intern(row);
        IndexSet<C> s = matrix.get(r);
        if (s == null) {
            s = new IndexSet<>(columnDomain);
            matrix.put(r, s);
        }
        return s.insert(column);
    }

    /**
     * Relate the row to every column of the given set
     *
     * @param row
     *            row value
     * @param columns
     *            columns to add
     * @return true if the relation changed
     */
    public boolean unionIntoRow(R row, IndexSet<C> columns) {
        if (columns.isEmpty()) {
            return false;
        }
        int r = rowDomain.intern(row);
        IndexSet<C> s = matrix.get(r);
        if (s == null) {
            matrix.put(r, columns.copy());
            return true;
        }
        return s.union(columns);
    }

    /**
     * Remove every column related to the row
     *
     * @param row
     *            row to clear
     * @return true if the relation changed
     */
    public boolean clearRow(R row) {
        if (!rowDomain.contains(row)) {
            return false;
        }
        return matrix.remove(rowDomain.index(row)) != null;
    }

    /**
     * Get the columns related to a row. The returned set must not be modified.
     *
     * @param row
     *            row value
     * @return the (possibly empty) set of columns for the row
     */
    public IndexSet<C> rowSet(R row) {
        IndexSet<C> s = rowDomain.contains(row) ? matrix.get(rowDomain.index(row)) : null;
        if (s == null) {
            return new IndexSet<>(columnDomain);
        }
        return s;
    }

    /**
     * @return the rows that have at least one column, in index order
     */
    public List<R> rows() {
        List<R> l = new ArrayList<>(matrix.size());
        for (Integer r : matrix.keySet()) {
            l.add(rowDomain.value(r));
        }
        return Collections.unmodifiableList(l);
    }

    /**
     * Union every row of that matrix into this one
     *
     * @param that
     *            matrix over the same domains
     * @return true if this matrix changed
     */
    public boolean join(IndexMatrix<R, C> that) {
        assert that.rowDomain == rowDomain && that.columnDomain == columnDomain : "Matrices over different domains";
        boolean changed = false;
        for (Map.Entry<Integer, IndexSet<C>> e : that.matrix.entrySet()) {
            IndexSet<C> s = matrix.get(e.getKey());
            if (s == null) {
                matrix.put(e.getKey(), e.getValue().copy());
                changed = true;
            }
            else {
                changed |= s.union(e.getValue());
            }
        }
        return changed;
    }

    /**
     * @param that
     *            matrix to compare to
     * @return true if every pair of this relation is also in that one
     */
    public boolean leq(IndexMatrix<R, C> that) {
        for (Map.Entry<Integer, IndexSet<C>> e : matrix.entrySet()) {
            IndexSet<C> s = that.matrix.get(e.getKey());
            if (s == null || !s.isSuperset(e.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if no row has a column
     */
    public boolean isEmpty() {
        return matrix.isEmpty();
    }

    /**
     * @return deep copy sharing the domains
     */
    public IndexMatrix<R, C> copy() {
        IndexMatrix<R, C> m = new IndexMatrix<>(rowDomain, columnDomain);
        for (Map.Entry<Integer, IndexSet<C>> e : matrix.entrySet()) {
            m.matrix.put(e.getKey(), e.getValue().copy());
        }
        return m;
    }

    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IndexMatrix)) {
            return false;
        }
        IndexMatrix<R, C> other = (IndexMatrix<R, C>) obj;
        return matrix.equals(other.matrix);
    }

    @Override
    public int hashCode() {
        return matrix.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        Iterator<Map.Entry<Integer, IndexSet<C>>> iter = matrix.entrySet().iterator();
        while (iter.hasNext()) {
            Map.Entry<Integer, IndexSet<C>> e = iter.next();
            sb.append(rowDomain.value(e.getKey())).append(" -> ").append(e.getValue());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append("}").toString();
    }
}
