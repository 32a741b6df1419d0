package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Let-binding of one or more names to the results of an expression.
*/
public final class Binding {

    private final List<Ident> pattern;

    private final Exp exp;

    public Binding(List<Ident> pattern, Exp exp) {
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("empty binding pattern");
        }
        this.pattern = Collections.unmodifiableList(
                new ArrayList<Ident>(pattern));
        this.exp = exp;
    }

    /** Constructs a single-name binding. */
    public Binding(Ident name, Exp exp) {
        this(Collections.singletonList(name), exp);
    }

    /** Returns the bound identifiers, in result order. */
    public List<Ident> getPattern() {
        return pattern;
    }

    public Exp getExp() {
        return exp;
    }

    public Binding substituteNames(Map<VName, VName> substs) {
        List<Ident> renamed = new ArrayList<Ident>(pattern.size());
        for (Ident id : pattern) {
            renamed.add(id.substituteNames(substs));
        }
        return new Binding(renamed, exp.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Binding)) {
            return false;
        }
        Binding other = (Binding)o;
        return (pattern.equals(other.pattern) && exp.equals(other.exp));
    }

    @Override
    public int hashCode() {
        return 31 * pattern.hashCode() + exp.hashCode();
    }

    @Override
    public String toString() {
        return "let " + PrintTools.listToString(pattern, ", ") + " = " + exp;
    }
}
