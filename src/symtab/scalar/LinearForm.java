package symtab.scalar;

/**
* Decomposition {@code coefficient * sym + remainder} of an expression, where
* neither part refers to {@code sym}.
*/
public final class LinearForm {

    private final ScalExp coefficient;

    private final ScalExp remainder;

    public LinearForm(ScalExp coefficient, ScalExp remainder) {
        this.coefficient = coefficient;
        this.remainder = remainder;
    }

    public ScalExp getCoefficient() {
        return coefficient;
    }

    public ScalExp getRemainder() {
        return remainder;
    }

    @Override
    public String toString() {
        return coefficient + "*sym + " + remainder;
    }
}
