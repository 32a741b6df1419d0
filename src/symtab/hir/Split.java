package symtab.hir;

import java.util.Map;

/**
* Split of an array at a given row into two arrays. The size of the second
* part is kept alongside the split point.
*/
public final class Split extends Exp {

    private final SubExp n;

    private final Ident array;

    private final SubExp rest;

    public Split(SubExp n, Ident array, SubExp rest) {
        super(array.getLocation());
        this.n = n;
        this.array = array;
        this.rest = rest;
    }

    /** Returns the size of the first part. */
    public SubExp getSplitPoint() {
        return n;
    }

    public Ident getArray() {
        return array;
    }

    /** Returns the size of the second part. */
    public SubExp getRestSize() {
        return rest;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Split(n.substituteNames(substs),
                         array.substituteNames(substs),
                         rest.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Split)) {
            return false;
        }
        Split other = (Split)o;
        return (n.equals(other.n) && array.equals(other.array) &&
                rest.equals(other.rest));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * n.hashCode() + array.hashCode()) + rest.hashCode();
    }

    @Override
    public String toString() {
        return "split(" + n + ", " + array + ")";
    }
}
