package symtab.scalar;

/**
* Comparison of an expression against zero.
*/
public enum RelOp0 {
    /** {@code e < 0} */
    LTH0("<"),
    /** {@code e <= 0} */
    LEQ0("<=");

    private final String symbol;

    RelOp0(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
