package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Elementwise application of a lambda to the rows of the input arrays. The
* lambda has one parameter per input array.
*/
public final class ArrayMap extends Exp {

    private final Lambda lambda;

    private final List<SubExp> inputs;

    public ArrayMap(Lambda lambda, List<SubExp> inputs, SrcLoc loc) {
        super(loc);
        this.lambda = lambda;
        this.inputs = Collections.unmodifiableList(
                new ArrayList<SubExp>(inputs));
    }

    public ArrayMap(Lambda lambda, List<SubExp> inputs) {
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
        return new ArrayMap(lambda.substituteNames(substs),
                            SubExp.substituteNames(inputs, substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ArrayMap)) {
            return false;
        }
        ArrayMap other = (ArrayMap)o;
        return (lambda.equals(other.lambda) && inputs.equals(other.inputs));
    }

    @Override
    public int hashCode() {
        return 31 * lambda.hashCode() + inputs.hashCode();
    }

    @Override
    public String toString() {
        return "map(" + lambda + ", " +
                PrintTools.listToString(inputs, ", ") + ")";
    }
}
