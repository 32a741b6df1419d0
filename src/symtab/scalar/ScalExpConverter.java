package symtab.scalar;

import symtab.hir.*;

/**
* Translates program expressions into scalar expressions. Only integer and
* boolean scalar expressions have a translation; other expressions, such as
* function calls, array operations, or the modulo operator, translate to null.
*/
public final class ScalExpConverter {

    private ScalExpConverter() {
    }

    /**
    * Translates an expression into its scalar form.
    * @param lookup resolves variables to their scalar forms, or null to treat
    *   every variable as an opaque symbol.
    * @param e the expression.
    * @return the scalar form, or null if the expression has no translation.
    */
    public static ScalExp toScalExp(ScalExpLookup lookup, Exp e) {
        if (e instanceof SubExpression) {
            return subExpToScalExp(lookup, ((SubExpression)e).getSubExp());
        } else if (e instanceof BinOp) {
            return binOpToScalExp(lookup, (BinOp)e);
        } else if (e instanceof Not) {
            ScalExp x = subExpToScalExp(lookup, ((Not)e).getSubExp());
            if (x == null || x.getType() != BasicType.BOOL) {
                return null;
            }
            return ScalTools.not(x);
        } else if (e instanceof Negate) {
            ScalExp x = subExpToScalExp(lookup, ((Negate)e).getSubExp());
            if (x == null || x.getType() != BasicType.INT) {
                return null;
            }
            return ScalTools.neg(x);
        }
        return null;
    }

    /**
    * Translates a sub-expression without consulting any bindings.
    * @param se the sub-expression.
    * @return the scalar form, or null if there is none.
    */
    public static ScalExp subExpToScalExp(SubExp se) {
        return subExpToScalExp(null, se);
    }

    /**
    * Translates a sub-expression. A variable is replaced by the scalar form
    * the lookup returns for it; a variable the lookup does not know becomes a
    * symbol if it has integer or boolean scalar type.
    * @param lookup the variable lookup, or null.
    * @param se the sub-expression.
    * @return the scalar form, or null if there is none.
    */
    public static ScalExp subExpToScalExp(ScalExpLookup lookup, SubExp se) {
        if (se instanceof Var) {
            Ident ident = ((Var)se).getIdent();
            if (lookup != null) {
                ScalExp bound = lookup.lookupScalExp(ident.getName());
                if (bound != null) {
                    return bound;
                }
            }
            if (isIntOrBool(ident.getType())) {
                return new ScalId(ident);
            }
            return null;
        } else if (se instanceof Constant) {
            Value value = ((Constant)se).getValue();
            if (value instanceof BasicValue) {
                return new ScalConst((BasicValue)value);
            }
        }
        return null;
    }

    private static ScalExp binOpToScalExp(ScalExpLookup lookup, BinOp e) {
        ScalExp x = subExpToScalExp(lookup, e.getLHS());
        ScalExp y = subExpToScalExp(lookup, e.getRHS());
        if (x == null || y == null) {
            return null;
        }
        BasicType operand_type = x.getType();
        if (operand_type != y.getType()) {
            return null;
        }
        switch (e.getOperator()) {
        case PLUS:
            return arith(ScalOperator.PLUS, x, y);
        case MINUS:
            return arith(ScalOperator.MINUS, x, y);
        case TIMES:
            return arith(ScalOperator.TIMES, x, y);
        case DIVIDE:
            return arith(ScalOperator.DIVIDE, x, y);
        case POW:
            return arith(ScalOperator.POW, x, y);
        case LESS:
            if (operand_type != BasicType.INT) {
                return null;
            }
            return ScalTools.lth0(ScalTools.minus(x, y));
        case LEQ:
            if (operand_type != BasicType.INT) {
                return null;
            }
            return ScalTools.leq0(ScalTools.minus(x, y));
        case EQUAL:
            // x == y holds iff x - y <= 0 and y - x <= 0.
            if (operand_type == BasicType.INT) {
                return ScalTools.and(ScalTools.leq0(ScalTools.minus(x, y)),
                                     ScalTools.leq0(ScalTools.minus(y, x)));
            }
            return null;
        case LOG_AND:
            if (operand_type != BasicType.BOOL) {
                return null;
            }
            return ScalTools.and(x, y);
        case LOG_OR:
            if (operand_type != BasicType.BOOL) {
                return null;
            }
            return ScalTools.or(x, y);
        default:
            return null;
        }
    }

    private static ScalExp arith(ScalOperator op, ScalExp x, ScalExp y) {
        if (x.getType() != BasicType.INT) {
            return null;
        }
        return new ScalBinary(op, x, y);
    }

    private static boolean isIntOrBool(Type type) {
        return (type.isBasic(BasicType.INT) || type.isBasic(BasicType.BOOL));
    }
}
