package symtab.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
* Atomic operand of an expression: either a {@link Var} or a
* {@link Constant}.
*/
public abstract class SubExp {

    protected SubExp() {
    }

    /** Returns the type of the operand. */
    public abstract Type getType();

    /** Returns the source location of the operand. */
    public abstract SrcLoc getLocation();

    /**
    * Returns a copy of the operand with names renamed by the given mapping.
    * @param substs the renaming.
    * @return the renamed operand, possibly this object itself.
    */
    public abstract SubExp substituteNames(Map<VName, VName> substs);

    /**
    * Renames every operand in the list.
    * @param ses the operands.
    * @param substs the renaming.
    * @return the list of renamed operands.
    */
    public static List<SubExp>
            substituteNames(List<SubExp> ses, Map<VName, VName> substs) {
        List<SubExp> ret = new ArrayList<SubExp>(ses.size());
        for (SubExp se : ses) {
            ret.add(se.substituteNames(substs));
        }
        return ret;
    }
}
