package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Sequential loop. The loop variable runs from 0 to {@code bound-1}; the merge
* parameters carry values from one iteration to the next and start out as the
* given initial values.
*/
public final class DoLoop extends Exp {

    private final List<Ident> merge_params;

    private final List<SubExp> merge_inits;

    private final Ident loop_var;

    private final SubExp bound;

    private final Body body;

    public DoLoop(List<Ident> merge_params, List<SubExp> merge_inits,
                  Ident loop_var, SubExp bound, Body body, SrcLoc loc) {
        super(loc);
        if (merge_params.size() != merge_inits.size()) {
            throw new IllegalArgumentException(
                    "merge parameters and initial values differ in number");
        }
        this.merge_params = Collections.unmodifiableList(
                new ArrayList<Ident>(merge_params));
        this.merge_inits = Collections.unmodifiableList(
                new ArrayList<SubExp>(merge_inits));
        this.loop_var = loop_var;
        this.bound = bound;
        this.body = body;
    }

    public DoLoop(List<Ident> merge_params, List<SubExp> merge_inits,
                  Ident loop_var, SubExp bound, Body body) {
        this(merge_params, merge_inits, loop_var, bound, body,
             loop_var.getLocation());
    }

    public List<Ident> getMergeParams() {
        return merge_params;
    }

    public List<SubExp> getMergeInits() {
        return merge_inits;
    }

    public Ident getLoopVar() {
        return loop_var;
    }

    public SubExp getBound() {
        return bound;
    }

    public Body getBody() {
        return body;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        List<Ident> params = new ArrayList<Ident>(merge_params.size());
        for (Ident param : merge_params) {
            params.add(param.substituteNames(substs));
        }
        return new DoLoop(params, SubExp.substituteNames(merge_inits, substs),
                          loop_var.substituteNames(substs),
                          bound.substituteNames(substs),
                          body.substituteNames(substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DoLoop)) {
            return false;
        }
        DoLoop other = (DoLoop)o;
        return (merge_params.equals(other.merge_params) &&
                merge_inits.equals(other.merge_inits) &&
                loop_var.equals(other.loop_var) &&
                bound.equals(other.bound) && body.equals(other.body));
    }

    @Override
    public int hashCode() {
        int h = merge_params.hashCode();
        h = 31 * h + loop_var.hashCode();
        h = 31 * h + bound.hashCode();
        return 31 * h + body.hashCode();
    }

    @Override
    public String toString() {
        return "loop (" + PrintTools.listToString(merge_params, ", ") +
                ") for " + loop_var + " < " + bound + " do " + body;
    }
}
