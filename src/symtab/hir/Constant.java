package symtab.hir;

import java.util.Map;

/** Operand that is a compile-time constant. */
public final class Constant extends SubExp {

    private final Value value;

    private final SrcLoc loc;

    public Constant(Value value) {
        this(value, SrcLoc.NONE);
    }

    public Constant(Value value, SrcLoc loc) {
        if (value == null || loc == null) {
            throw new IllegalArgumentException("incomplete constant");
        }
        this.value = value;
        this.loc = loc;
    }

    /** Returns the integer constant operand of the given value. */
    public static Constant intConst(long value) {
        return new Constant(new IntValue(value));
    }

    public Value getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return value.getType();
    }

    @Override
    public SrcLoc getLocation() {
        return loc;
    }

    @Override
    public SubExp substituteNames(Map<VName, VName> substs) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Constant && value.equals(((Constant)o).value));
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
