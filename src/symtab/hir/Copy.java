package symtab.hir;

import java.util.Map;

/** Fresh copy of a value. */
public final class Copy extends Exp {

    private final SubExp se;

    public Copy(SubExp se) {
        super(se.getLocation());
        this.se = se;
    }

    public SubExp getSubExp() {
        return se;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Copy(se.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Copy && se.equals(((Copy)o).se));
    }

    @Override
    public int hashCode() {
        return 29 + se.hashCode();
    }

    @Override
    public String toString() {
        return "copy(" + se + ")";
    }
}
