package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Selection of the rows of the input arrays for which the predicate lambda
* holds. A filter binds one more name than it has inputs: the first is the
* size of the result, the rest are the filtered arrays.
*/
public final class Filter extends Exp {

    private final Lambda lambda;

    private final List<SubExp> inputs;

    public Filter(Lambda lambda, List<SubExp> inputs, SrcLoc loc) {
        super(loc);
        this.lambda = lambda;
        this.inputs = Collections.unmodifiableList(
                new ArrayList<SubExp>(inputs));
    }

    public Filter(Lambda lambda, List<SubExp> inputs) {
        this(lambda, inputs, SrcLoc.NONE);
    }

    public Lambda getLambda() {
        return lambda;
    }

    public List<SubExp> getInputs() {
        return inputs;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Filter(lambda.substituteNames(substs),
                          SubExp.substituteNames(inputs, substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Filter)) {
            return false;
        }
        Filter other = (Filter)o;
        return (lambda.equals(other.lambda) && inputs.equals(other.inputs));
    }

    @Override
    public int hashCode() {
        return 31 * lambda.hashCode() + inputs.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "filter(" + lambda + ", " +
                PrintTools.listToString(inputs, ", ") + ")";
    }
}
