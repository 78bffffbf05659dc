package analysis.dataflow.interprocedural.pdg;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;

import analysis.ir.Location;
import analysis.ir.ProcedureId;

/**
 * Immutable stack of call sites, most recent first, with operations that keep
 * it below a maximum number of elements
 */
public final class CallContext implements Iterable<CallContext.Site> {

    /**
     * A call site: the calling procedure and the location of the call
     */
    public static final class Site {
        private final ProcedureId caller;
        private final Location location;

        public Site(ProcedureId caller, Location location) {
            this.caller = caller;
            this.location = location;
        }

        public ProcedureId getCaller() {
            return caller;
        }

        public Location getLocation() {
            return location;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Site)) {
                return false;
            }
            Site other = (Site) obj;
            return caller.equals(other.caller) && location.equals(other.location);
        }

        @Override
        public int hashCode() {
            return 31 * caller.hashCode() + location.hashCode();
        }

        @Override
        public String toString() {
            return caller + "@" + location;
        }
    }

    private static final Site[] EMPTY_ARRAY = {};

    /**
     * Singleton empty stack
     */
    private static final CallContext EMPTY = new CallContext(EMPTY_ARRAY);

    private final Site[] elements;
    private final int memoizedHashCode;

    private CallContext(Site[] elements) {
        this.elements = elements;
        this.memoizedHashCode = Arrays.hashCode(elements);
    }

    /**
     * Get a stack with no elements
     *
     * @return empty stack
     */
    public static CallContext empty() {
        return EMPTY;
    }

    /**
     * Add the site to the top of the stack, dropping the least recent sites if
     * necessary to get the correct depth
     *
     * @param site
     *            call site to push
     * @param depth
     *            maximum number of elements in the result
     * @return new stack with at most <code>depth</code> elements
     */
    public CallContext push(Site site, int depth) {
        if (depth <= 0) {
            return EMPTY;
        }
        Site[] newElements = new Site[Math.min(elements.length + 1, depth)];
        newElements[0] = site;
        System.arraycopy(elements, 0, newElements, 1, newElements.length - 1);
        return new CallContext(newElements);
    }

    /**
     * Remove the least recently pushed sites so that the size is at most
     * <code>depth</code>
     *
     * @param depth
     *            maximum size of the stack
     * @return this if it is small enough, otherwise a new stack with the
     *         <code>depth</code> most recent sites
     */
    public CallContext truncate(int depth) {
        if (depth >= elements.length) {
            return this;
        }
        return new CallContext(Arrays.copyOf(elements, Math.max(depth, 0)));
    }

    public int size() {
        return elements.length;
    }

    @Override
    public Iterator<Site> iterator() {
        return Collections.unmodifiableList(Arrays.asList(elements)).iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CallContext)) {
            return false;
        }
        return Arrays.equals(elements, ((CallContext) obj).elements);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        return Arrays.toString(elements);
    }
}
