package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Indexing of an array variable, one index per leading dimension. */
public final class Index extends Exp {

    private final Ident array;

    private final List<SubExp> indices;

    public Index(Ident array, List<SubExp> indices, SrcLoc loc) {
        super(loc);
        this.array = array;
        this.indices = Collections.unmodifiableList(
                new ArrayList<SubExp>(indices));
    }

    public Index(Ident array, List<SubExp> indices) {
        this(array, indices, array.getLocation());
    }

    public Ident getArray() {
        return array;
    }

    public List<SubExp> getIndices() {
        return indices;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Index(array.substituteNames(substs),
                         SubExp.substituteNames(indices, substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Index)) {
            return false;
        }
        Index other = (Index)o;
        return (array.equals(other.array) && indices.equals(other.indices));
    }

    @Override
    public int hashCode() {
        return 31 * array.hashCode() + indices.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        sb.append(array);
        for (SubExp index : indices) {
            sb.append("[").append(index).append("]");
        }
        return sb.toString();
    }
}
