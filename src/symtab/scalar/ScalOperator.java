package symtab.scalar;

/**
* Operators of {@link ScalBinary} expressions.
*/
public enum ScalOperator {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    POW("**"),
    LOG_AND("&&"),
    LOG_OR("||");

    private final String symbol;

    ScalOperator(String symbol) {
        this.symbol = symbol;
    }

    /** Checks if the operator is a logical connective. */
    public boolean isLogical() {
        return (this == LOG_AND || this == LOG_OR);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
