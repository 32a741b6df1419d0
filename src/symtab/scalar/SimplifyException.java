package symtab.scalar;

import symtab.hir.SrcLoc;

/**
* Thrown when a symbolic simplification or decomposition cannot be carried
* out, e.g., the expression is ill-typed, a constant division by zero is
* found, integer arithmetic overflows, or the rewrite budget is exhausted.
*/
public class SimplifyException extends Exception {

    private static final long serialVersionUID = 1L;

    private final SrcLoc loc;

    public SimplifyException(String message, SrcLoc loc) {
        super(message + " at " + loc);
        this.loc = loc;
    }

    /** Returns the location of the construct being simplified. */
    public SrcLoc getLocation() {
        return loc;
    }
}
