package symtab.scalar;

import symtab.hir.VName;

/**
* Callback that resolves a variable to the scalar expression it is bound to.
*/
public interface ScalExpLookup {

    /**
    * Returns the scalar form of the variable with the given name.
    * @param name the variable name.
    * @return the scalar form, or null if none is known.
    */
    ScalExp lookupScalExp(VName name);
}
