package symtab.hir;

/**
* Element types of scalars and arrays.
*/
public enum BasicType {
    INT("int"),
    REAL("real"),
    BOOL("bool"),
    CHAR("char"),
    CERT("cert");

    private final String name;

    BasicType(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
