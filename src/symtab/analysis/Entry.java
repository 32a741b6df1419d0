package symtab.analysis;

import symtab.hir.Exp;
import symtab.hir.SubExp;
import symtab.hir.SubExpression;
import symtab.hir.VName;
import symtab.scalar.ScalExp;

import java.util.Map;

/**
* Row of a {@link SymbolTable}: what is known about one variable. Entries are
* immutable; the {@code with} methods return modified copies.
*
* @param <A> the type of the user annotation.
*/
public final class Entry<A> {

    private final Exp exp;

    private final ScalExp scal_exp;

    private final Range range;

    private final boolean loop_variable;

    private final int depth;

    private final A annotation;

    /**
    * Constructs an entry.
    *
    * @param exp the defining expression, or null.
    * @param scal_exp the scalar form of the defining expression, or null.
    * @param range the value range.
    * @param loop_variable true if the variable is a loop or lambda variable.
    * @param depth the loop depth at which the variable is bound.
    * @param annotation the user annotation.
    */
    public Entry(Exp exp, ScalExp scal_exp, Range range, boolean loop_variable,
                 int depth, A annotation) {
        this.exp = exp;
        this.scal_exp = scal_exp;
        this.range = (range == null) ? Range.UNKNOWN : range;
        this.loop_variable = loop_variable;
        this.depth = depth;
        this.annotation = annotation;
    }

    /** Returns an entry that knows nothing about its variable. */
    public static <A> Entry<A> unknown() {
        return new Entry<A>(null, null, Range.UNKNOWN, false, 0, null);
    }

    /** Returns the defining expression, or null. */
    public Exp getExp() {
        return exp;
    }

    /**
    * Returns the defining sub-expression if the variable is bound directly to
    * a sub-expression.
    */
    public SubExp getSubExp() {
        if (exp instanceof SubExpression) {
            return ((SubExpression)exp).getSubExp();
        }
        return null;
    }

    /** Returns the scalar form of the defining expression, or null. */
    public ScalExp getScalExp() {
        return scal_exp;
    }

    public Range getRange() {
        return range;
    }

    /** Checks if the variable is a loop variable or a lambda parameter. */
    public boolean isLoopVariable() {
        return loop_variable;
    }

    /** Returns the loop depth at which the variable was bound. */
    public int getDepth() {
        return depth;
    }

    public A getAnnotation() {
        return annotation;
    }

    public Entry<A> withRange(Range range) {
        return new Entry<A>(exp, scal_exp, range, loop_variable, depth,
                            annotation);
    }

    public Entry<A> withDepth(int depth) {
        return new Entry<A>(exp, scal_exp, range, loop_variable, depth,
                            annotation);
    }

    public <B> Entry<B> withAnnotation(B annotation) {
        return new Entry<B>(exp, scal_exp, range, loop_variable, depth,
                            annotation);
    }

    /**
    * Returns a copy of the entry with variables renamed in its expression,
    * scalar form and range. The annotation is kept as is.
    *
    * @param substs the renaming.
    * @return the renamed entry.
    */
    public Entry<A> substituteNames(Map<VName, VName> substs) {
        return new Entry<A>(
                (exp == null) ? null : exp.substituteNames(substs),
                (scal_exp == null) ? null : scal_exp.substituteNames(substs),
                range.substituteNames(substs), loop_variable, depth,
                annotation);
    }

    static boolean equal(Object o1, Object o2) {
        return (o1 == null) ? (o2 == null) : o1.equals(o2);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Entry)) {
            return false;
        }
        Entry<?> other = (Entry<?>)o;
        return (loop_variable == other.loop_variable &&
                depth == other.depth && range.equals(other.range) &&
                equal(exp, other.exp) && equal(scal_exp, other.scal_exp) &&
                equal(annotation, other.annotation));
    }

    @Override
    public int hashCode() {
        int ret = range.hashCode();
        ret = 31 * ret + ((exp == null) ? 0 : exp.hashCode());
        ret = 31 * ret + depth;
        return 31 * ret + ((loop_variable) ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("{exp=").append(exp);
        sb.append(", scal=").append(scal_exp);
        sb.append(", range=").append(range);
        sb.append(", depth=").append(depth);
        if (loop_variable) {
            sb.append(", loop");
        }
        if (annotation != null) {
            sb.append(", ").append(annotation);
        }
        return sb.append("}").toString();
    }
}
