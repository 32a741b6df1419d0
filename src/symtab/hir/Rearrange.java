package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Permutation of the dimensions of an array. */
public final class Rearrange extends Exp {

    private final List<Integer> perm;

    private final Ident array;

    public Rearrange(List<Integer> perm, Ident array) {
        super(array.getLocation());
        this.perm = Collections.unmodifiableList(new ArrayList<Integer>(perm));
        this.array = array;
    }

    public List<Integer> getPermutation() {
        return perm;
    }

    public Ident getArray() {
        return array;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Rearrange(perm, array.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Rearrange)) {
            return false;
        }
        Rearrange other = (Rearrange)o;
        return (perm.equals(other.perm) && array.equals(other.array));
    }

    @Override
    public int hashCode() {
        return 31 * perm.hashCode() + array.hashCode();
    }

    @Override
    public String toString() {
        return "rearrange(" + perm + ", " + array + ")";
    }
}
