package symtab.hir;

import java.util.Map;

/** Operand that refers to a variable. */
public final class Var extends SubExp {

    private final Ident ident;

    public Var(Ident ident) {
        if (ident == null) {
            throw new IllegalArgumentException("null identifier");
        }
        this.ident = ident;
    }

    public Ident getIdent() {
        return ident;
    }

    /** Returns the name of the referenced variable. */
    public VName getName() {
        return ident.getName();
    }

    @Override
    public Type getType() {
        return ident.getType();
    }

    @Override
    public SrcLoc getLocation() {
        return ident.getLocation();
    }

    @Override
    public SubExp substituteNames(Map<VName, VName> substs) {
        Ident renamed = ident.substituteNames(substs);
        return (renamed == ident) ? this : new Var(renamed);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Var && ident.equals(((Var)o).ident));
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
