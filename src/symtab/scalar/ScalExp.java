package symtab.scalar;

import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.VName;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
* Symbolic scalar expression used for range and bound reasoning. The family of
* subclasses is closed: {@link ScalConst}, {@link ScalId}, {@link ScalNeg},
* {@link ScalNot}, {@link ScalBinary}, {@link MinMax} and {@link RelExp}.
* Scalar expressions are immutable and compare structurally.
*/
public abstract class ScalExp {

    protected ScalExp() {
    }

    /** Returns the basic type of the value the expression denotes. */
    public abstract BasicType getType();

    /**
    * Returns a copy of the expression with identifiers renamed by the given
    * mapping.
    * @param substs the renaming.
    * @return the renamed expression.
    */
    public abstract ScalExp substituteNames(Map<VName, VName> substs);

    /**
    * Adds the identifiers referenced by this expression to the given set.
    * @param ret the set being populated.
    */
    protected abstract void collectSymbols(Set<Ident> ret);

    /**
    * Returns the set of identifiers referenced by the expression, ordered by
    * name.
    * @return the set of identifiers.
    */
    public Set<Ident> getSymbols() {
        Set<Ident> ret = new TreeSet<Ident>();
        collectSymbols(ret);
        return ret;
    }

    /**
    * Checks if the expression references the given name.
    * @param name the name to look for.
    * @return true if the name occurs in the expression.
    */
    public boolean containsSymbol(VName name) {
        for (Ident id : getSymbols()) {
            if (id.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
