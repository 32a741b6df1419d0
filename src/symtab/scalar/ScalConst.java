package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.BasicValue;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Constant scalar. */
public final class ScalConst extends ScalExp {

    private final BasicValue value;

    public ScalConst(BasicValue value) {
        if (value == null) {
            throw new IllegalArgumentException("null value");
        }
        this.value = value;
    }

    public BasicValue getValue() {
        return value;
    }

    @Override
    public BasicType getType() {
        return value.getBasicType();
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        return this;
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ScalConst && value.equals(((ScalConst)o).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
