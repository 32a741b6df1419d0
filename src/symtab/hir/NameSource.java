package symtab.hir;

/**
* Supplier of fresh {@link VName}s. Every name handed out by a name source
* has a tag that no earlier name from the same source has.
*/
public class NameSource {

    private int counter;

    /** Constructs a name source starting from tag 0. */
    public NameSource() {
        this(0);
    }

    /**
    * Constructs a name source starting from the given tag; used when names
    * up to {@code start - 1} are already taken.
    * @param start the first tag to hand out.
    */
    public NameSource(int start) {
        counter = start;
    }

    /**
    * Returns a fresh name with the specified base string.
    * @param base the base string.
    * @return the new name.
    */
    public VName newName(String base) {
        return new VName(base, counter++);
    }

    /**
    * Returns a fresh name that shares the base string of the given one.
    * @param name the original name.
    * @return the new name.
    */
    public VName newName(VName name) {
        return newName(name.getBaseName());
    }

    /**
    * Returns a fresh identifier of the specified type.
    * @param base the base string of the new name.
    * @param type the type of the identifier.
    * @return the new identifier.
    */
    public Ident newIdent(String base, Type type) {
        return new Ident(newName(base), type);
    }
}
