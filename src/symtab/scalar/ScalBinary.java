package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Binary arithmetic or logical operation. */
public final class ScalBinary extends ScalExp {

    private final ScalOperator op;

    private final ScalExp lhs;

    private final ScalExp rhs;

    public ScalBinary(ScalOperator op, ScalExp lhs, ScalExp rhs) {
        if (op == null || lhs == null || rhs == null) {
            throw new IllegalArgumentException("incomplete operation");
        }
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public ScalOperator getOperator() {
        return op;
    }

    public ScalExp getLHS() {
        return lhs;
    }

    public ScalExp getRHS() {
        return rhs;
    }

    @Override
    public BasicType getType() {
        return (op.isLogical()) ? BasicType.BOOL : lhs.getType();
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        return new ScalBinary(op, lhs.substituteNames(substs),
                              rhs.substituteNames(substs));
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        lhs.collectSymbols(ret);
        rhs.collectSymbols(ret);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ScalBinary)) {
            return false;
        }
        ScalBinary other = (ScalBinary)o;
        return (op == other.op && lhs.equals(other.lhs) &&
                rhs.equals(other.rhs));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * op.hashCode() + lhs.hashCode()) + rhs.hashCode();
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + op + " " + rhs + ")";
    }
}
