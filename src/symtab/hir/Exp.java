package symtab.hir;

import java.util.Map;

/**
* Base class of the expressions that appear on the right-hand side of a
* {@link Binding}. Expressions are immutable; every transformation returns a
* new object.
*/
public abstract class Exp {

    protected final SrcLoc loc;

    protected Exp(SrcLoc loc) {
        if (loc == null) {
            throw new IllegalArgumentException("null location");
        }
        this.loc = loc;
    }

    /** Returns the source location of the expression. */
    public SrcLoc getLocation() {
        return loc;
    }

    /**
    * Returns a copy of the expression with names renamed by the given
    * mapping. Names bound inside the expression (lambda and loop
    * parameters) are renamed too if they appear in the mapping.
    * @param substs the renaming.
    * @return the renamed expression.
    */
    public abstract Exp substituteNames(Map<VName, VName> substs);
}
