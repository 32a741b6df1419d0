package symtab.hir;

import java.util.Map;

/** Scalar binary operation. */
public final class BinOp extends Exp {

    private final BinaryOperator op;

    private final SubExp x;

    private final SubExp y;

    private final BasicType type;

    /**
    * Constructs a binary operation.
    * @param op the operator.
    * @param x the left operand.
    * @param y the right operand.
    * @param type the result type.
    * @param loc the source location.
    */
    public BinOp(BinaryOperator op, SubExp x, SubExp y, BasicType type,
                 SrcLoc loc) {
        super(loc);
        this.op = op;
        this.x = x;
        this.y = y;
        this.type = type;
    }

    public BinOp(BinaryOperator op, SubExp x, SubExp y, BasicType type) {
        this(op, x, y, type, x.getLocation());
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public SubExp getLHS() {
        return x;
    }

    public SubExp getRHS() {
        return y;
    }

    /** Returns the type of the result. */
    public BasicType getType() {
        return type;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new BinOp(op, x.substituteNames(substs),
                         y.substituteNames(substs), type, loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinOp)) {
            return false;
        }
        BinOp other = (BinOp)o;
        return (op == other.op && type == other.type &&
                x.equals(other.x) && y.equals(other.y));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * op.hashCode() + x.hashCode()) + y.hashCode();
    }

    @Override
    public String toString() {
        return x + " " + op + " " + y;
    }
}
