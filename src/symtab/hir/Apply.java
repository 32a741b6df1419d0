package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Call of a named function. Function calls are opaque to the symbolic
* analyses.
*/
public final class Apply extends Exp {

    private final String fname;

    private final List<SubExp> args;

    private final Type ret_type;

    public Apply(String fname, List<SubExp> args, Type ret_type, SrcLoc loc) {
        super(loc);
        this.fname = fname;
        this.args = Collections.unmodifiableList(new ArrayList<SubExp>(args));
        this.ret_type = ret_type;
    }

    public Apply(String fname, List<SubExp> args, Type ret_type) {
        this(fname, args, ret_type, SrcLoc.NONE);
    }

    public String getName() {
        return fname;
    }

    public List<SubExp> getArguments() {
        return args;
    }

    public Type getReturnType() {
        return ret_type;
    }

    @Override
    public Exp substituteNames(Map<VName, VName> substs) {
        return new Apply(fname, SubExp.substituteNames(args, substs),
                         ret_type.substituteNames(substs), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Apply)) {
            return false;
        }
        Apply other = (Apply)o;
        return (fname.equals(other.fname) && args.equals(other.args));
    }

    @Override
    public int hashCode() {
        return 31 * fname.hashCode() + args.hashCode();
    }

    @Override
    public String toString() {
        return fname + "(" + PrintTools.listToString(args, ", ") + ")";
    }
}
