package symtab.hir;

import java.util.Map;

/** Index generator: the array {@code [0, 1, ..., n-1]}. */
public final class Iota extends Exp {

    private final SubExp n;

    public Iota(SubExp n) {
        super(n.getLocation());
        this.n = n;
    }

    /** Returns the number of generated indices. */
    public SubExp getBound() {
        return n;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Iota(n.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Iota && n.equals(((Iota)o).n));
    }

    @Override
    public int hashCode() {
        return 23 + n.hashCode();
    }

    @Override
    public String toString() {
        return "iota(" + n + ")";
    }
}
