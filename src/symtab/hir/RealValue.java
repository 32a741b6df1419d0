package symtab.hir;

/** Floating-point constant. */
public final class RealValue extends BasicValue {

    private final double value;

    public RealValue(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public BasicType getBasicType() {
        return BasicType.REAL;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof RealValue &&
                Double.compare(((RealValue)o).value, value) == 0);
    }

    @Override
    public int hashCode() {
        return Double.valueOf(value).hashCode();
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
