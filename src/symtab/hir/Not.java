package symtab.hir;

import java.util.Map;

/** Logical negation. */
public final class Not extends Exp {

    private final SubExp se;

    public Not(SubExp se) {
        super(se.getLocation());
        this.se = se;
    }

    public SubExp getSubExp() {
        return se;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Not(se.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Not && se.equals(((Not)o).se));
    }

    @Override
    public int hashCode() {
        return 17 + se.hashCode();
    }

    @Override
    public String toString() {
        return "!" + se;
    }
}
