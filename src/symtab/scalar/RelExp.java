package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Relational expression of the form {@code e < 0} or {@code e <= 0}. */
public final class RelExp extends ScalExp {

    private final RelOp0 op;

    private final ScalExp e;

    public RelExp(RelOp0 op, ScalExp e) {
        if (op == null || e == null) {
            throw new IllegalArgumentException("incomplete relation");
        }
        this.op = op;
        this.e = e;
    }

    public RelOp0 getOperator() {
        return op;
    }

    /** Returns the expression compared against zero. */
    public ScalExp getExpression() {
        return e;
    }

    @Override
    public BasicType getType() {
        return BasicType.BOOL;
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        return new RelExp(op, e.substituteNames(substs));
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        e.collectSymbols(ret);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RelExp)) {
            return false;
        }
        RelExp other = (RelExp)o;
        return (op == other.op && e.equals(other.e));
    }

    @Override
    public int hashCode() {
        return 31 * op.hashCode() + e.hashCode();
    }

    @Override
    public String toString() {
        return "(" + e + " " + op + " 0)";
    }
}
