package symtab.hir;

import java.util.Map;

/** Two-way conditional whose branches are bodies. */
public final class If extends Exp {

    private final SubExp cond;

    private final Body then_body;

    private final Body else_body;

    public If(SubExp cond, Body then_body, Body else_body, SrcLoc loc) {
        super(loc);
        this.cond = cond;
        this.then_body = then_body;
        this.else_body = else_body;
    }

    public If(SubExp cond, Body then_body, Body else_body) {
        this(cond, then_body, else_body, cond.getLocation());
    }

    public SubExp getCondition() {
        return cond;
    }

    public Body getThenBody() {
        return then_body;
    }

    public Body getElseBody() {
        return else_body;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new If(cond.substituteNames(substs),
                      then_body.substituteNames(substs),
                      else_body.substituteNames(substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof If)) {
            return false;
        }
        If other = (If)o;
        return (cond.equals(other.cond) &&
                then_body.equals(other.then_body) &&
                else_body.equals(other.else_body));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * cond.hashCode() + then_body.hashCode()) +
                else_body.hashCode();
    }

    @Override
    public String toString() {
        return "if " + cond + " then " + then_body + " else " + else_body;
    }
}
