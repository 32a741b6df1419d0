package symtab.hir;

/** Boolean constant. */
public final class LogValue extends BasicValue {

    public static final LogValue TRUE = new LogValue(true);

    public static final LogValue FALSE = new LogValue(false);

    private final boolean value;

    private LogValue(boolean value) {
        this.value = value;
    }

    /** Returns the boolean constant of the given value. */
    public static LogValue valueOf(boolean value) {
        return (value) ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public BasicType getBasicType() {
        return BasicType.BOOL;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof LogValue && ((LogValue)o).value == value);
    }

    @Override
    public int hashCode() {
        return (value) ? 1231 : 1237;
    }

    @Override
    public String toString() {
        return (value) ? "True" : "False";
    }
}
