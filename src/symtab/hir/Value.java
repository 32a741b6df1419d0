package symtab.hir;

/**
* Compile-time constant value.
*/
public abstract class Value {

    protected Value() {
    }

    /** Returns the type of the value. */
    public abstract Type getType();
}
