package symtab.hir;

import java.util.Map;

/** Arithmetic negation. */
public final class Negate extends Exp {

    private final SubExp se;

    public Negate(SubExp se) {
        super(se.getLocation());
        this.se = se;
    }

    public SubExp getSubExp() {
        return se;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Negate(se.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Negate && se.equals(((Negate)o).se));
    }

    @Override
    public int hashCode() {
        return 19 + se.hashCode();
    }

    @Override
    public String toString() {
        return "-" + se;
    }
}
