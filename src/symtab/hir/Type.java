package symtab.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Type of a value: a basic element type together with the sizes of the array
* dimensions, outermost first. A type without dimensions is a scalar type.
* Dimension sizes are sub-expressions, so they may be variables bound
* elsewhere in the program.
*/
public final class Type {

    private final BasicType elem;

    private final List<SubExp> dims;

    private Type(BasicType elem, List<SubExp> dims) {
        if (elem == null) {
            throw new IllegalArgumentException("null element type");
        }
        this.elem = elem;
        this.dims = Collections.unmodifiableList(new ArrayList<SubExp>(dims));
    }

    /**
    * Returns the scalar type of the specified basic type.
    * @param elem the basic type.
    * @return the scalar type.
    */
    public static Type basic(BasicType elem) {
        return new Type(elem, Collections.<SubExp>emptyList());
    }

    /**
    * Returns the array type with the given element type and dimensions.
    * @param elem the element type.
    * @param dims the dimension sizes, outermost first.
    * @return the array type.
    */
    public static Type array(BasicType elem, SubExp... dims) {
        return new Type(elem, Arrays.asList(dims));
    }

    /**
    * Returns the array type with the given element type and dimensions.
    * @param elem the element type.
    * @param dims the dimension sizes, outermost first.
    * @return the array type.
    */
    public static Type array(BasicType elem, List<SubExp> dims) {
        return new Type(elem, dims);
    }

    /** Returns the element type. */
    public BasicType getBasicType() {
        return elem;
    }

    /** Returns the dimension sizes, outermost first. */
    public List<SubExp> arrayDims() {
        return dims;
    }

    /** Checks if this is a scalar type of the given basic type. */
    public boolean isBasic(BasicType type) {
        return (dims.isEmpty() && elem == type);
    }

    /** Checks if this is an array type. */
    public boolean isArray() {
        return !dims.isEmpty();
    }

    /**
    * Returns a copy of this type with names in the dimensions renamed.
    * @param substs the renaming.
    * @return the renamed type.
    */
    public Type substituteNames(Map<VName, VName> substs) {
        if (dims.isEmpty()) {
            return this;
        }
        return new Type(elem, SubExp.substituteNames(dims, substs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Type)) {
            return false;
        }
        Type other = (Type)o;
        return (elem == other.elem && dims.equals(other.dims));
    }

    @Override
    public int hashCode() {
        return 31 * elem.hashCode() + dims.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(16);
        for (SubExp dim : dims) {
            sb.append("[").append(dim).append("]");
        }
        sb.append(elem);
        return sb.toString();
    }
}
