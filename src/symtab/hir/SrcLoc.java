package symtab.hir;

/**
* Position of a construct in the source program. Locations are carried along
* the IR only for diagnostics; they never take part in equality of the nodes
* that hold them.
*/
public final class SrcLoc {

    /** Location used when the origin of a construct is unknown. */
    public static final SrcLoc NONE = new SrcLoc("<unknown>", 0, 0);

    private final String file;

    private final int line;

    private final int column;

    /**
    * Constructs a source location.
    * @param file the source file name.
    * @param line the line number, starting from 1.
    * @param column the column number, starting from 1.
    */
    public SrcLoc(String file, int line, int column) {
        if (file == null) {
            throw new IllegalArgumentException("null file name");
        }
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SrcLoc)) {
            return false;
        }
        SrcLoc other = (SrcLoc)o;
        return (line == other.line && column == other.column &&
                file.equals(other.file));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * file.hashCode() + line) + column;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
