package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;

/** Reference to a scalar variable. */
public final class ScalId extends ScalExp {

    private final Ident ident;

    public ScalId(Ident ident) {
        if (ident == null || ident.getType().isArray()) {
            throw new IllegalArgumentException("not a scalar variable: " +
                                               ident);
        }
        this.ident = ident;
    }

    public Ident getIdent() {
        return ident;
    }

    @Override
    public BasicType getType() {
        return ident.getType().getBasicType();
    }

    @Override
    public ScalExp substituteNames(Map<VName, VName> substs) {
        Ident renamed = ident.substituteNames(substs);
        return (renamed == ident) ? this : new ScalId(renamed);
    }

    @Override
    protected void collectSymbols(Set<Ident> ret) {
        ret.add(ident);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof ScalId && ident.equals(((ScalId)o).ident));
    }

    @Override
    public int hashCode() {
        return ident.hashCode();
    }

    @Override
    public String toString() {
        return ident.toString();
    }
}
