package symtab.scalar;

import symtab.hir.Ident;
import symtab.hir.IntValue;
import symtab.hir.LogValue;

import java.util.Arrays;

/**
* Static constructors for scalar expressions. None of these methods
* simplifies; they build the node as written, except for the integer
* constant folding documented on {@link #minus(ScalExp, ScalExp)}.
*/
public final class ScalTools {

    /** Integer constant 0 */
    public static final ScalExp zero = intValue(0);

    /** Integer constant 1 */
    public static final ScalExp one = intValue(1);

    private ScalTools() {
    }

    /** Returns the integer constant of the given value. */
    public static ScalConst intValue(long value) {
        return new ScalConst(new IntValue(value));
    }

    /** Returns the boolean constant of the given value. */
    public static ScalConst logValue(boolean value) {
        return new ScalConst(LogValue.valueOf(value));
    }

    /** Returns a reference to the given identifier. */
    public static ScalId id(Ident ident) {
        return new ScalId(ident);
    }

    /**
    * Returns the integer value of a constant expression.
    * @param e the expression.
    * @return the value, or null if {@code e} is not an integer constant.
    */
    public static Long getIntValue(ScalExp e) {
        if (e instanceof ScalConst &&
            ((ScalConst)e).getValue() instanceof IntValue) {
            return ((IntValue)((ScalConst)e).getValue()).getValue();
        }
        return null;
    }

    /**
    * Returns the boolean value of a constant expression.
    * @param e the expression.
    * @return the value, or null if {@code e} is not a boolean constant.
    */
    public static Boolean getLogValue(ScalExp e) {
        if (e instanceof ScalConst &&
            ((ScalConst)e).getValue() instanceof LogValue) {
            return ((LogValue)((ScalConst)e).getValue()).getValue();
        }
        return null;
    }

    public static ScalExp plus(ScalExp e1, ScalExp e2) {
        return new ScalBinary(ScalOperator.PLUS, e1, e2);
    }

    /**
    * Returns {@code e1 - e2}. Two integer constants are folded into their
    * difference; anything else is kept as written.
    */
    public static ScalExp minus(ScalExp e1, ScalExp e2) {
        Long v1 = getIntValue(e1), v2 = getIntValue(e2);
        if (v1 != null && v2 != null) {
            long diff = v1 - v2;
            // Keep the node on overflow.
            if (((v1 ^ v2) & (v1 ^ diff)) >= 0) {
                return intValue(diff);
            }
        }
        return new ScalBinary(ScalOperator.MINUS, e1, e2);
    }

    public static ScalExp times(ScalExp e1, ScalExp e2) {
        return new ScalBinary(ScalOperator.TIMES, e1, e2);
    }

    public static ScalExp divide(ScalExp e1, ScalExp e2) {
        return new ScalBinary(ScalOperator.DIVIDE, e1, e2);
    }

    public static ScalExp neg(ScalExp e) {
        return new ScalNeg(e);
    }

    public static ScalExp not(ScalExp e) {
        return new ScalNot(e);
    }

    public static ScalExp and(ScalExp e1, ScalExp e2) {
        return new ScalBinary(ScalOperator.LOG_AND, e1, e2);
    }

    public static ScalExp or(ScalExp e1, ScalExp e2) {
        return new ScalBinary(ScalOperator.LOG_OR, e1, e2);
    }

    /** Returns {@code e < 0}. */
    public static ScalExp lth0(ScalExp e) {
        return new RelExp(RelOp0.LTH0, e);
    }

    /** Returns {@code e <= 0}. */
    public static ScalExp leq0(ScalExp e) {
        return new RelExp(RelOp0.LEQ0, e);
    }

    public static ScalExp min(ScalExp... operands) {
        return new MinMax(true, Arrays.asList(operands));
    }

    public static ScalExp max(ScalExp... operands) {
        return new MinMax(false, Arrays.asList(operands));
    }
}
