package symtab.hir;

/** Integer constant. */
public final class IntValue extends BasicValue {

    private final long value;

    public IntValue(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public BasicType getBasicType() {
        return BasicType.INT;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof IntValue && ((IntValue)o).value == value);
    }

    @Override
    public int hashCode() {
        return (int)(value ^ (value >>> 32));
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
