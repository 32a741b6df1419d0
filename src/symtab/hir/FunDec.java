package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Function definition. */
public final class FunDec {

    private final String name;

    private final List<Ident> params;

    private final Body body;

    private final SrcLoc loc;

    public FunDec(String name, List<Ident> params, Body body, SrcLoc loc) {
        this.name = name;
        this.params = Collections.unmodifiableList(
                new ArrayList<Ident>(params));
        this.body = body;
        this.loc = loc;
    }

    public FunDec(String name, List<Ident> params, Body body) {
        this(name, params, body, SrcLoc.NONE);
    }

    public String getName() {
        return name;
    }

    public List<Ident> getParams() {
        return params;
    }

    public Body getBody() {
        return body;
    }

    public SrcLoc getLocation() {
        return loc;
    }

    @Override
    public String toString() {
        return "fun " + name + "(" + PrintTools.listToString(params, ", ") +
                ") = " + body;
    }
}
