package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Logical negation. */
public final class ScalNot extends ScalExp {

    private final ScalExp e;

    public ScalNot(ScalExp e) {
        this.e = e;
    }

    public ScalExp getExpression() {
        return e;
    }

    @Override
    public BasicType getType() {
        return BasicType.BOOL;
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        return new ScalNot(e.substituteNames(substs));
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        e.collectSymbols(ret);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ScalNot && e.equals(((ScalNot)o).e));
    }

    @Override
    public int hashCode() {
        return 41 + e.hashCode();
    }

    @Override
    public String toString() {
        return "!" + e;
    }
}
