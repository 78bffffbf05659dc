package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Memory location descriptor: a root local plus a projection path. Local 0 is
 * the return place, locals 1 to n are the formal parameters. Places are
 * immutable and compared structurally.
 * <p>
 * The string form is postfix: <code>_1.*.0</code> is field 0 of the value
 * referenced by local 1, <code>_2[_3]</code> indexes local 2 by local 3 and
 * <code>_4@1.0</code> is field 0 of variant 1 of local 4.
 */
public final class Place {

    private final int local;
    private final List<ProjectionElem> projection;
    private final int memoizedHashCode;

    private Place(int local, List<ProjectionElem> projection) {
        if (local < 0) {
            throw new IllegalArgumentException("Negative local " + local);
        }
        this.local = local;
        this.projection = projection;
        this.memoizedHashCode = 31 * local + projection.hashCode();
    }

    /**
     * @param local
     *            local index
     * @return the place denoting the whole local
     */
    public static Place local(int local) {
        return new Place(local, Collections.<ProjectionElem> emptyList());
    }

    /**
     * @param local
     *            local index
     * @param projection
     *            projection path
     * @return the place
     */
    public static Place make(int local, List<ProjectionElem> projection) {
        return new Place(local, Collections.unmodifiableList(new ArrayList<>(projection)));
    }

    /**
     * Parse the postfix string form of a place
     *
     * @param s
     *            string such as <code>_1.*.0</code>
     * @return the place
     */
    public static Place parse(String s) {
        if (s == null || !s.startsWith("_")) {
            throw new IllegalArgumentException("Malformed place \"" + s + "\"");
        }
        int i = 1;
        int start = i;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        if (i == start) {
            throw new IllegalArgumentException("Malformed place \"" + s + "\"");
        }
        int local = Integer.parseInt(s.substring(start, i));
        List<ProjectionElem> proj = new ArrayList<>();
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '.' && i + 1 < s.length() && s.charAt(i + 1) == '*') {
                proj.add(ProjectionElem.deref());
                i += 2;
                continue;
            }
            int j = i + 1;
            if (c == '[') {
                int close = s.indexOf(']', i);
                if (close < 0 || i + 1 >= close || s.charAt(i + 1) != '_') {
                    throw new IllegalArgumentException("Malformed index in place \"" + s + "\"");
                }
                proj.add(ProjectionElem.index(Integer.parseInt(s.substring(i + 2, close))));
                i = close + 1;
                continue;
            }
            while (j < s.length() && Character.isDigit(s.charAt(j))) {
                j++;
            }
            if (j == i + 1) {
                throw new IllegalArgumentException("Malformed projection at " + i + " in place \"" + s + "\"");
            }
            int n = Integer.parseInt(s.substring(i + 1, j));
            if (c == '.') {
                proj.add(ProjectionElem.field(n));
            }
            else if (c == '@') {
                proj.add(ProjectionElem.downcast(n));
            }
            else {
                throw new IllegalArgumentException("Malformed projection at " + i + " in place \"" + s + "\"");
            }
            i = j;
        }
        return make(local, proj);
    }

    public int getLocal() {
        return local;
    }

    public List<ProjectionElem> getProjection() {
        return projection;
    }

    /**
     * @return true if this is a whole local with no projection
     */
    public boolean isLocal() {
        return projection.isEmpty();
    }

    /**
     * @param elem
     *            step to append
     * @return the place extended by one step
     */
    public Place project(ProjectionElem elem) {
        List<ProjectionElem> l = new ArrayList<>(projection.size() + 1);
        l.addAll(projection);
        l.add(elem);
        return new Place(local, Collections.unmodifiableList(l));
    }

    public Place field(int index) {
        return project(ProjectionElem.field(index));
    }

    public Place deref() {
        return project(ProjectionElem.deref());
    }

    public Place index(int indexLocal) {
        return project(ProjectionElem.index(indexLocal));
    }

    public Place downcast(int variant) {
        return project(ProjectionElem.downcast(variant));
    }

    /**
     * @param length
     *            number of projection steps to keep
     * @return the prefix of this place with the given projection length
     */
    public Place truncate(int length) {
        if (length == projection.size()) {
            return this;
        }
        return new Place(local, Collections.unmodifiableList(new ArrayList<>(projection.subList(0, length))));
    }

    /**
     * @return true if the projection goes through a dereference
     */
    public boolean isIndirect() {
        for (ProjectionElem e : projection) {
            if (e.getKind() == ProjectionElem.Kind.DEREF) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param other
     *            place to compare to
     * @return true if other has the same local and starts with this projection
     */
    public boolean isPrefixOf(Place other) {
        if (other.local != local || other.projection.size() < projection.size()) {
            return false;
        }
        return other.projection.subList(0, projection.size()).equals(projection);
    }

    /**
     * @return every prefix of this place from the bare local up to this place
     */
    public List<Place> prefixes() {
        List<Place> l = new ArrayList<>(projection.size() + 1);
        for (int i = 0; i <= projection.size(); i++) {
            l.add(truncate(i));
        }
        return l;
    }

    /**
     * @param newLocal
     *            replacement root
     * @return this projection applied to a different local
     */
    public Place withLocal(int newLocal) {
        return new Place(newLocal, projection);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Place)) {
            return false;
        }
        Place other = (Place) obj;
        return local == other.local && projection.equals(other.projection);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("_").append(local);
        for (ProjectionElem e : projection) {
            sb.append(e);
        }
        return sb.toString();
    }
}
