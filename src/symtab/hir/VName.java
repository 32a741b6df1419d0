package symtab.hir;

/**
* Globally unique name of a program variable. A name consists of a base
* string, which is what the programmer wrote, and an integer tag that makes
* the name unique within a program. Two names are equal only if both parts
* are equal; the base string alone carries no identity.
*/
public final class VName implements Comparable<VName> {

    private final String base;

    private final int tag;

    /**
    * Constructs a name from its base string and tag. Fresh names should
    * normally be obtained from a {@link NameSource}.
    * @param base the base string.
    * @param tag the unique tag.
    */
    public VName(String base, int tag) {
        if (base == null) {
            throw new IllegalArgumentException("null base name");
        }
        this.base = base;
        this.tag = tag;
    }

    /** Returns the base string of the name. */
    public String getBaseName() {
        return base;
    }

    /** Returns the unique tag of the name. */
    public int getTag() {
        return tag;
    }

    public int compareTo(VName other) {
        if (tag != other.tag) {
            return (tag < other.tag) ? -1 : 1;
        }
        return base.compareTo(other.base);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VName)) {
            return false;
        }
        VName other = (VName)o;
        return (tag == other.tag && base.equals(other.base));
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + tag;
    }

    @Override
    public String toString() {
        return base + "_" + tag;
    }
}
