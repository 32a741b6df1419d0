package symtab.analysis;

import symtab.hir.VName;
import symtab.scalar.ScalExp;

import java.util.Map;

/**
* Symbolic value range of a variable. Either bound may be absent, which means
* nothing is known in that direction.
*/
public final class Range {

    /** Range without any known bound */
    public static final Range UNKNOWN = new Range(null, null);

    private final ScalExp lower;

    private final ScalExp upper;

    /**
    * Constructs a range.
    * @param lower the lower bound, or null.
    * @param upper the upper bound, or null.
    */
    public Range(ScalExp lower, ScalExp upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /** Returns the lower bound, or null if unknown. */
    public ScalExp getLower() {
        return lower;
    }

    /** Returns the upper bound, or null if unknown. */
    public ScalExp getUpper() {
        return upper;
    }

    /** Checks if neither bound is known. */
    public boolean isUnknown() {
        return (lower == null && upper == null);
    }

    public Range withLower(ScalExp lower) {
        return new Range(lower, upper);
    }

    public Range withUpper(ScalExp upper) {
        return new Range(lower, upper);
    }

    /** Returns the range with both bounds renamed. */
    public Range substituteNames(Map<VName, VName> substs) {
        if (isUnknown()) {
            return this;
        }
        return new Range((lower == null) ? null : lower.substituteNames(substs),
                         (upper == null) ? null : upper.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Range)) {
            return false;
        }
        Range other = (Range)o;
        return (Entry.equal(lower, other.lower) &&
                Entry.equal(upper, other.upper));
    }

    @Override
    public int hashCode() {
        return 31 * ((lower == null) ? 0 : lower.hashCode()) +
                ((upper == null) ? 0 : upper.hashCode());
    }

    @Override
    public String toString() {
        return "[" + ((lower == null) ? "-INF" : lower.toString()) + ":" +
                ((upper == null) ? "+INF" : upper.toString()) + "]";
    }
}
