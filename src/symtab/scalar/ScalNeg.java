package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Arithmetic negation. */
public final class ScalNeg extends ScalExp {

    private final ScalExp e;

    public ScalNeg(ScalExp e) {
        this.e = e;
    }

    public ScalExp getExpression() {
        return e;
    }

    @Override
    public BasicType getType() {
        return e.getType();
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        return new ScalNeg(e.substituteNames(substs));
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        e.collectSymbols(ret);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ScalNeg && e.equals(((ScalNeg)o).e));
    }

    @Override
    public int hashCode() {
        return 37 + e.hashCode();
    }

    @Override
    public String toString() {
        return "-" + e;
    }
}
