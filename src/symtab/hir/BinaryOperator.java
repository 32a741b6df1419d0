package symtab.hir;

/**
* Infix operators of {@link BinOp} expressions.
*/
public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    MOD("%"),
    POW("**"),
    LESS("<"),
    LEQ("<="),
    EQUAL("=="),
    LOG_AND("&&"),
    LOG_OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
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
