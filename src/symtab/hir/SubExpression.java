package symtab.hir;

import java.util.Map;

/** Expression that just passes an operand through. */
public final class SubExpression extends Exp {

    private final SubExp se;

    public SubExpression(SubExp se) {
        super(se.getLocation());
        this.se = se;
    }

    public SubExp getSubExp() {
        return se;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new SubExpression(se.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof SubExpression &&
                se.equals(((SubExpression)o).se));
    }

    @Override
    public int hashCode() {
        return se.hashCode();
    }

    @Override
    public String toString() {
        return se.toString();
    }
}
