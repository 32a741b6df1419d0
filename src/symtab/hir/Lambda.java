package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Anonymous function used by second-order array operations. */
public final class Lambda {

    private final List<Ident> params;

    private final Body body;

    public Lambda(List<Ident> params, Body body) {
        this.params = Collections.unmodifiableList(
                new ArrayList<Ident>(params));
        this.body = body;
    }

    public List<Ident> getParams() {
        return params;
    }

    public Body getBody() {
        return body;
    }

    public Lambda substituteNames(Map<VName, VName> substs) {
        List<Ident> renamed = new ArrayList<Ident>(params.size());
        for (Ident param : params) {
            renamed.add(param.substituteNames(substs));
        }
        return new Lambda(renamed, body.substituteNames(substs));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Lambda)) {
            return false;
        }
        Lambda other = (Lambda)o;
        return (params.equals(other.params) && body.equals(other.body));
    }

    @Override
    public int hashCode() {
        return 31 * params.hashCode() + body.hashCode();
    }

    @Override
    public String toString() {
        return "fn (" + PrintTools.listToString(params, ", ") + ") => " + body;
    }
}
