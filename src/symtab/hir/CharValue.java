package symtab.hir;

/** Character constant. */
public final class CharValue extends BasicValue {

    private final char value;

    public CharValue(char value) {
        this.value = value;
    }

    public char getValue() {
        return value;
    }

    @Override
    public BasicType getBasicType() {
        return BasicType.CHAR;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof CharValue && ((CharValue)o).value == value);
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
