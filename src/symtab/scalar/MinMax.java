package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.PrintTools;
import symtab.hir.VName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* Minimum or maximum of a list of integer expressions. Bounds combined from
* several facts are kept in this form instead of being evaluated, since the
* operands are in general not constants.
*/
public final class MinMax extends ScalExp {

    // MIN:true, MAX:false
    private final boolean ismin;

    private final List<ScalExp> operands;

    /**
    * Constructs a min/max expression.
    * @param ismin true for MIN, false for MAX.
    * @param operands the non-empty list of operands.
    */
    public MinMax(boolean ismin, List<ScalExp> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("min/max without operands");
        }
        this.ismin = ismin;
        this.operands = Collections.unmodifiableList(
                new ArrayList<ScalExp>(operands));
    }

    /** Returns true if this is a MIN expression. */
    public boolean isMin() {
        return ismin;
    }

    public List<ScalExp> getOperands() {
        return operands;
    }

    @Override
    public BasicType getType() {
        return operands.get(0).getType();
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        List<ScalExp> renamed = new ArrayList<ScalExp>(operands.size());
        for (ScalExp operand : operands) {
            renamed.add(operand.substituteNames(substs));
        }
        return new MinMax(ismin, renamed);
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        for (ScalExp operand : operands) {
            operand.collectSymbols(ret);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MinMax)) {
            return false;
        }
        MinMax other = (MinMax)o;
        return (ismin == other.ismin && operands.equals(other.operands));
    }

    @Override
    public int hashCode() {
        return 31 * operands.hashCode() + ((ismin) ? 1 : 0);
    }

    @Override
    public String toString() {
        return ((ismin) ? "MIN(" : "MAX(") +
                PrintTools.listToString(operands, ", ") + ")";
    }
}
