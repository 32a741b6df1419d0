package symtab.scalar;

import symtab.hir.PrintTools;
import symtab.hir.VName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
* Snapshot of the facts known about variables at a program point: for each
* variable, the depth at which it was bound and its lower and upper bound
* (either may be absent). The simplifier uses the bounds to decide
* comparisons and the depths to order symbols for elimination.
* <p>
* Subclasses may answer {@link #get}, {@link #contains} and {@link #size}
* from a structure of their own instead of recorded facts.
*/
public class RangeContext {

    /** Context without any facts. */
    public static final RangeContext EMPTY = new RangeContext();

    private final Map<VName, Bounds> ranges;

    /** Constructs an empty context. */
    public RangeContext() {
        ranges = new LinkedHashMap<VName, Bounds>();
    }

    /**
    * Records the facts about a variable.
    * @param name the variable name.
    * @param depth the binding depth.
    * @param lower the lower bound, or null.
    * @param upper the upper bound, or null.
    */
    public void put(VName name, int depth, ScalExp lower, ScalExp upper) {
        if (this == EMPTY) {
            throw new UnsupportedOperationException("shared empty context");
        }
        ranges.put(name, new Bounds(depth, lower, upper));
    }

    /** Returns the facts about the given variable, or null. */
    public Bounds get(VName name) {
        return ranges.get(name);
    }

    /** Checks if the context knows the given variable. */
    public boolean contains(VName name) {
        return ranges.containsKey(name);
    }

    public int size() {
        return ranges.size();
    }

    @Override
    public String toString() {
        return "[" + PrintTools.mapToString(ranges, ", ") + "]";
    }

    /**
    * Binding depth and bounds of one variable.
    */
    public static final class Bounds {

        private final int depth;

        private final ScalExp lower;

        private final ScalExp upper;

        public Bounds(int depth, ScalExp lower, ScalExp upper) {
            this.depth = depth;
            this.lower = lower;
            this.upper = upper;
        }

        public int getDepth() {
            return depth;
        }

        public ScalExp getLower() {
            return lower;
        }

        public ScalExp getUpper() {
            return upper;
        }

        /** Checks if at least one bound is known. */
        public boolean isBounded() {
            return (lower != null || upper != null);
        }

        @Override
        public String toString() {
            return "(" + depth + ", " + ((lower == null) ? "-inf" : lower) +
                    ", " + ((upper == null) ? "+inf" : upper) + ")";
        }
    }
}
