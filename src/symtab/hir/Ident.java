package symtab.hir;

import java.util.Map;

/**
* A typed occurrence of a variable name. Identifiers compare equal when their
* names are equal; the type and location are attributes of the name.
*/
public final class Ident implements Comparable<Ident> {

    private final VName name;

    private final Type type;

    private final SrcLoc loc;

    /**
    * Constructs an identifier with an unknown source location.
    * @param name the variable name.
    * @param type the type of the variable.
    */
    public Ident(VName name, Type type) {
        this(name, type, SrcLoc.NONE);
    }

    /**
    * Constructs an identifier.
    * @param name the variable name.
    * @param type the type of the variable.
    * @param loc the source location.
    */
    public Ident(VName name, Type type, SrcLoc loc) {
        if (name == null || type == null || loc == null) {
            throw new IllegalArgumentException("incomplete identifier");
        }
        this.name = name;
        this.type = type;
        this.loc = loc;
    }

    public VName getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public SrcLoc getLocation() {
        return loc;
    }

    /**
    * Returns the identifier renamed according to the given mapping; the
    * names in the type are renamed as well.
    * @param substs the renaming.
    * @return the renamed identifier.
    */
    public Ident substituteNames(Map<VName, VName> substs) {
        VName to = substs.get(name);
        Type renamed = type.substituteNames(substs);
        if (to == null && renamed == type) {
            return this;
        }
        return new Ident((to == null) ? name : to, renamed, loc);
    }

    public int compareTo(Ident other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Ident && name.equals(((Ident)o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name.toString();
    }
}
