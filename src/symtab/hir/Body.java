package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Sequence of bindings followed by the operands that form its result.
*/
public final class Body {

    private final List<Binding> bindings;

    private final List<SubExp> result;

    public Body(List<Binding> bindings, List<SubExp> result) {
        this.bindings = Collections.unmodifiableList(
                new ArrayList<Binding>(bindings));
        this.result = Collections.unmodifiableList(
                new ArrayList<SubExp>(result));
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public List<SubExp> getResult() {
        return result;
    }

    public Body substituteNames(Map<VName, VName> substs) {
        List<Binding> renamed = new ArrayList<Binding>(bindings.size());
        for (Binding b : bindings) {
            renamed.add(b.substituteNames(substs));
        }
        return new Body(renamed, SubExp.substituteNames(result, substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Body)) {
            return false;
        }
        Body other = (Body)o;
        return (bindings.equals(other.bindings) &&
                result.equals(other.result));
    }

    @Override
    public int hashCode() {
        return 31 * bindings.hashCode() + result.hashCode();
    }

    @Override
    public String toString() {
        return "{ " + PrintTools.listToString(bindings, "; ") + " in " +
                PrintTools.listToString(result, ", ") + " }";
    }
}
