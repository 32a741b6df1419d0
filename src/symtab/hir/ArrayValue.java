package symtab.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Constant array. The row type is kept explicitly so that empty arrays still
* have a well-defined type.
*/
public final class ArrayValue extends Value {

    private final List<Value> elements;

    private final Type row_type;

    /**
    * Constructs an array constant.
    * @param elements the rows of the array.
    * @param row_type the type of each row.
    */
    public ArrayValue(List<Value> elements, Type row_type) {
        this.elements = Collections.unmodifiableList(
                new ArrayList<Value>(elements));
        this.row_type = row_type;
    }

    public List<Value> getElements() {
        return elements;
    }

    public Type getRowType() {
        return row_type;
    }

    @Override
    public Type getType() {
        List<SubExp> dims = new ArrayList<SubExp>(row_type.arrayDims().size()+1);
        dims.add(new Constant(new IntValue(elements.size())));
        dims.addAll(row_type.arrayDims());
        return Type.array(row_type.getBasicType(), dims);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ArrayValue)) {
            return false;
        }
        ArrayValue other = (ArrayValue)o;
        return (elements.equals(other.elements) &&
                row_type.equals(other.row_type));
    }

    @Override
    public int hashCode() {
        return 31 * elements.hashCode() + row_type.hashCode();
    }

    @Override
    public String toString() {
        return "[" + PrintTools.listToString(elements, ", ") + "]";
    }
}
