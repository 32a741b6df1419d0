package symtab.hir;

import java.util.Map;

/** Array of {@code n} copies of a value. */
public final class Replicate extends Exp {

    private final SubExp n;

    private final SubExp value;

    public Replicate(SubExp n, SubExp value) {
        super(value.getLocation());
        this.n = n;
        this.value = value;
    }

    public SubExp getCount() {
        return n;
    }

    public SubExp getValue() {
        return value;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Replicate(n.substituteNames(substs),
                             value.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Replicate)) {
            return false;
        }
        Replicate other = (Replicate)o;
        return (n.equals(other.n) && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return 31 * n.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "replicate(" + n + ", " + value + ")";
    }
}
