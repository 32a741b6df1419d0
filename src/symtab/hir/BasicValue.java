package symtab.hir;

/**
* Constant of a scalar type.
*/
public abstract class BasicValue extends Value {

    protected BasicValue() {
    }

    /** Returns the basic type of the constant. */
    public abstract BasicType getBasicType();

    @Override
    public Type getType() {
        return Type.basic(getBasicType());
    }
}
