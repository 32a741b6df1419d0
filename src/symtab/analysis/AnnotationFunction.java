package symtab.analysis;

/**
* Computes the user annotation stored in each entry of a {@link SymbolTable}.
* The function is applied once, when the entry is inserted, and sees the entry
* with its final depth.
*
* @param <A> the annotation type.
*/
public interface AnnotationFunction<A> {

    /** Annotation function for tables that carry no annotation. */
    AnnotationFunction<Void> NONE = new AnnotationFunction<Void>() {
        public Void annotate(Entry<?> entry) {
            return null;
        }
    };

    /**
    * Returns the annotation of the given entry.
    * @param entry the entry being inserted.
    * @return the annotation.
    */
    A annotate(Entry<?> entry);
}
