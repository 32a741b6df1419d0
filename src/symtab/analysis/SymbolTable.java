package symtab.analysis;

import symtab.hir.*;
import symtab.scalar.RangeContext;
import symtab.scalar.ScalExp;
import symtab.scalar.ScalExpConverter;
import symtab.scalar.ScalExpLookup;
import symtab.scalar.ScalTools;

import java.util.*;

/**
* Scoped symbol table of a forward traversal. For every variable bound so far
* the table keeps an {@link Entry}: the defining expression, its scalar form
* when one exists, a symbolic value range, the loop depth of the binding, and
* a user annotation computed by the table's {@link AnnotationFunction}.
* <p>
* Tables are persistent. Every operation that adds or refines information
* returns a new table and leaves the receiver untouched, so a table refined
* for one branch of a conditional never affects the table of the other branch
* or of the enclosing scope. Entries are never removed; only their ranges are
* tightened, and only by merging: a new upper bound is combined with the old
* one as a minimum, a new lower bound as a maximum.
* <p>
* Tables may be shared between threads. Refinement and simplification read
* the {@code range}, {@code simplify-steps} and {@code dnf-terms} options of
* {@link symtab.exec.Driver}, which are global; changing them while
* traversals run on other threads is not supported.
*
* @param <A> the type of the user annotation.
*/
public final class SymbolTable<A> implements ScalExpLookup {

    private final int depth;

    private final BindingMap<Entry<A>> bindings;

    private final AnnotationFunction<A> annotation_fn;

    private SymbolTable(int depth, BindingMap<Entry<A>> bindings,
                        AnnotationFunction<A> annotation_fn) {
        this.depth = depth;
        this.bindings = bindings;
        this.annotation_fn = annotation_fn;
    }

    /**
    * Returns an empty table at depth 0.
    *
    * @param annotation_fn the function that annotates inserted entries.
    * @return the empty table.
    */
    public static <A> SymbolTable<A> empty(AnnotationFunction<A> annotation_fn) {
        if (annotation_fn == null) {
            throw new IllegalArgumentException("null annotation function");
        }
        return new SymbolTable<A>(0, BindingMap.<Entry<A>>empty(),
                                  annotation_fn);
    }

    /** Returns the table for the body of a loop nested in this scope. */
    public SymbolTable<A> deepen() {
        return new SymbolTable<A>(depth + 1, bindings, annotation_fn);
    }

    /** Returns the current loop depth. */
    public int depth() {
        return depth;
    }

    /** Returns a snapshot of all entries in order of insertion. */
    public Map<VName, Entry<A>> getBindings() {
        return Collections.unmodifiableMap(bindings.toMap());
    }

    public AnnotationFunction<A> getAnnotationFunction() {
        return annotation_fn;
    }

    /*==================================================================*/
    /* Lookup                                                           */
    /*==================================================================*/

    /**
    * Returns the entry of the given variable.
    * @param name the variable name.
    * @return the entry, or null if the variable is unknown.
    */
    public Entry<A> lookup(VName name) {
        return bindings.get(name);
    }

    /** Returns the defining expression of the variable, or null. */
    public Exp lookupExp(VName name) {
        Entry<A> entry = lookup(name);
        return (entry == null) ? null : entry.getExp();
    }

    /**
    * Returns the sub-expression the variable is bound to, or null if the
    * variable is not bound directly to a sub-expression.
    */
    public SubExp lookupSubExp(VName name) {
        Entry<A> entry = lookup(name);
        return (entry == null) ? null : entry.getSubExp();
    }

    /** Returns the scalar form of the variable's definition, or null. */
    public ScalExp lookupScalExp(VName name) {
        Entry<A> entry = lookup(name);
        return (entry == null) ? null : entry.getScalExp();
    }

    /** Returns the constant the variable is bound to, or null. */
    public Value lookupValue(VName name) {
        SubExp se = lookupSubExp(name);
        if (se instanceof Constant) {
            return ((Constant)se).getValue();
        }
        return null;
    }

    /** Returns the variable the given variable is an alias of, or null. */
    public VName lookupVar(VName name) {
        SubExp se = lookupSubExp(name);
        if (se instanceof Var) {
            return ((Var)se).getName();
        }
        return null;
    }

    /**
    * Returns the value range of the variable; unknown variables have the
    * unknown range.
    */
    public Range lookupRange(VName name) {
        Entry<A> entry = lookup(name);
        return (entry == null) ? Range.UNKNOWN : entry.getRange();
    }

    /**
    * Selects the loop variables among the given names, innermost first.
    * Variables bound at the same depth keep their relative order reversed,
    * and unknown names are dropped.
    *
    * @param free the names to be filtered.
    * @return the loop variables by non-increasing binding depth.
    */
    public List<VName> enclosingLoopVars(Collection<VName> free) {
        List<VName> ret = new ArrayList<VName>();
        for (VName name : free) {
            Entry<A> entry = lookup(name);
            if (entry != null && entry.isLoopVariable()) {
                ret.add(name);
            }
        }
        // Stable ascending sort, then reversed.
        Collections.sort(ret, new Comparator<VName>() {
            public int compare(VName n1, VName n2) {
                int d1 = lookup(n1).getDepth(), d2 = lookup(n2).getDepth();
                return (d1 < d2) ? -1 : ((d1 == d2) ? 0 : 1);
            }
        });
        Collections.reverse(ret);
        return ret;
    }

    /**
    * Returns the bounds handed to the simplifier: the depth and the bounds
    * of every variable in the table. The context is a read-only view of this
    * table and costs nothing to create.
    */
    public RangeContext getRangeContext() {
        return new RangeContext() {
            @Override
            public void put(VName name, int depth, ScalExp lower,
                            ScalExp upper) {
                throw new UnsupportedOperationException(
                        "read-only table context");
            }

            @Override
            public RangeContext.Bounds get(VName name) {
                Entry<A> entry = lookup(name);
                if (entry == null) {
                    return null;
                }
                return new RangeContext.Bounds(entry.getDepth(),
                        entry.getRange().getLower(),
                        entry.getRange().getUpper());
            }

            @Override
            public boolean contains(VName name) {
                return bindings.containsKey(name);
            }

            @Override
            public int size() {
                return bindings.size();
            }

            @Override
            public String toString() {
                return "[" + PrintTools.mapToString(bindings.toMap(), ", ") +
                        "]";
            }
        };
    }

    /*==================================================================*/
    /* Insertion                                                        */
    /*==================================================================*/

    /**
    * Computes the entries that {@link #insertBinding} adds for a binding, one
    * per name of the pattern, before depth stamping and annotation.
    *
    * @param binding the binding.
    * @return the entries by name, in pattern order.
    */
    public Map<VName, Entry<A>> bindingEntries(Binding binding) {
        List<Ident> pattern = binding.getPattern();
        Exp e = binding.getExp();
        List<Entry<A>> entries = new ArrayList<Entry<A>>();
        if (pattern.size() == 1) {
            ScalExp scal_exp = ScalExpConverter.toScalExp(this, e);
            entries.add(new Entry<A>(e, scal_exp, shapeRange(e), false, depth,
                                     null));
        } else if (e instanceof Filter) {
            // The size of the result, then one array per input.
            entries.add(Entry.<A>unknown());
            for (SubExp input : ((Filter)e).getInputs()) {
                Range range = (input instanceof Var) ?
                        lookupRange(((Var)input).getName()) : Range.UNKNOWN;
                entries.add(Entry.<A>unknown().withRange(range));
            }
        } else {
            for (int i = 0; i < pattern.size(); i++) {
                entries.add(Entry.<A>unknown());
            }
        }
        // Surplus names or surplus entries are dropped.
        Map<VName, Entry<A>> ret = new LinkedHashMap<VName, Entry<A>>();
        for (int i = 0; i < pattern.size() && i < entries.size(); i++) {
            ret.put(pattern.get(i).getName(), entries.get(i));
        }
        return ret;
    }

    // Value range of a single-name binding, by the shape of the expression.
    private Range shapeRange(Exp e) {
        if (e instanceof SubExpression) {
            return subExpRange(((SubExpression)e).getSubExp());
        } else if (e instanceof Iota) {
            ScalExp bound = ScalExpConverter.subExpToScalExp(
                    this, ((Iota)e).getBound());
            return new Range(ScalTools.zero, minusOne(bound));
        } else if (e instanceof Replicate) {
            return subExpRange(((Replicate)e).getValue());
        } else if (e instanceof Rearrange) {
            return lookupRange(((Rearrange)e).getArray().getName());
        } else if (e instanceof Split) {
            return lookupRange(((Split)e).getArray().getName());
        } else if (e instanceof Copy) {
            return subExpRange(((Copy)e).getSubExp());
        } else if (e instanceof Index) {
            return lookupRange(((Index)e).getArray().getName());
        }
        return Range.UNKNOWN;
    }

    private Range subExpRange(SubExp se) {
        if (se instanceof Var) {
            return lookupRange(((Var)se).getName());
        }
        Value value = ((Constant)se).getValue();
        if (value instanceof BasicValue) {
            ScalExp e = ScalExpConverter.subExpToScalExp(se);
            return new Range(e, e);
        }
        return Range.UNKNOWN;
    }

    private static ScalExp minusOne(ScalExp e) {
        return (e == null) ? null : ScalTools.minus(e, ScalTools.one);
    }

    /**
    * Inserts the entries of a binding.
    *
    * @param binding the binding.
    * @return the extended table.
    */
    public SymbolTable<A> insertBinding(Binding binding) {
        return insertEntries(annotate(bindingEntries(binding)));
    }

    /**
    * Inserts the entries of a binding, annotating them with {@code fn}
    * instead of the table's own annotation function. The returned table
    * keeps using its own function for later insertions.
    *
    * @param fn the annotation function for this binding.
    * @param binding the binding.
    * @return the extended table.
    */
    public SymbolTable<A> insertBindingWith(AnnotationFunction<A> fn,
                                            Binding binding) {
        SymbolTable<A> with_fn = new SymbolTable<A>(depth, bindings, fn);
        return new SymbolTable<A>(depth,
                with_fn.insertBinding(binding).bindings, annotation_fn);
    }

    /**
    * Inserts entries as they are, except that each is stamped with the
    * current depth. Annotations already on the entries are kept.
    *
    * @param entries the entries by name.
    * @return the extended table.
    */
    public SymbolTable<A> insertEntries(Map<VName, Entry<A>> entries) {
        Map<VName, Entry<A>> stamped = new LinkedHashMap<VName, Entry<A>>();
        for (Map.Entry<VName, Entry<A>> e : entries.entrySet()) {
            stamped.put(e.getKey(), e.getValue().withDepth(depth));
        }
        return new SymbolTable<A>(depth, bindings.putAll(stamped),
                                  annotation_fn);
    }

    // Stamps new entries with the current depth and annotates them.
    private Map<VName, Entry<A>> annotate(Map<VName, Entry<A>> entries) {
        Map<VName, Entry<A>> ret = new LinkedHashMap<VName, Entry<A>>();
        for (Map.Entry<VName, Entry<A>> e : entries.entrySet()) {
            Entry<A> entry = e.getValue().withDepth(depth);
            ret.put(e.getKey(),
                    entry.withAnnotation(annotation_fn.annotate(entry)));
        }
        return ret;
    }

    private SymbolTable<A> insertEntry(VName name, Entry<A> entry) {
        return insertEntries(annotate(Collections.singletonMap(name, entry)));
    }

    private SymbolTable<A> insertParameter(Ident param, Range range) {
        SymbolTable<A> ret = insertEntry(param.getName(),
                new Entry<A>(null, null, range, true, depth, null));
        // Array sizes are never negative.
        for (SubExp dim : param.getType().arrayDims()) {
            if (dim instanceof Var) {
                ret = ret.isAtLeast(((Var)dim).getName(), 0);
            }
        }
        return ret;
    }

    /**
    * Inserts a function or lambda parameter with an unknown range. Variables
    * that occur as array sizes in the parameter's type are asserted to be
    * non-negative.
    *
    * @param param the parameter.
    * @return the extended table.
    */
    public SymbolTable<A> insertParameter(Ident param) {
        return insertParameter(param, Range.UNKNOWN);
    }

    /**
    * Inserts a lambda parameter that ranges over the rows of
    * {@code array}. The parameter takes the range of the array, and the
    * outer size of the array, if it is a variable, is asserted to be at least
    * one.
    *
    * @param param the parameter.
    * @param array the array the parameter is drawn from.
    * @return the extended table.
    */
    public SymbolTable<A> insertArrayParameter(Ident param, SubExp array) {
        SymbolTable<A> ret = insertParameter(param, subExpRange(array));
        List<SubExp> dims = array.getType().arrayDims();
        if (!dims.isEmpty() && dims.get(0) instanceof Var) {
            ret = ret.isAtLeast(((Var)dims.get(0)).getName(), 1);
        }
        return ret;
    }

    /**
    * Inserts a loop variable counting from zero up to {@code bound - 1}.
    *
    * @param name the loop variable.
    * @param bound the number of iterations.
    * @return the extended table.
    */
    public SymbolTable<A> insertLoopVariable(VName name, SubExp bound) {
        ScalExp n = ScalExpConverter.toScalExp(this, new SubExpression(bound));
        Range range = new Range(ScalTools.zero, minusOne(n));
        return insertEntry(name,
                           new Entry<A>(null, null, range, true, depth, null));
    }

    /*==================================================================*/
    /* Bounds                                                           */
    /*==================================================================*/

    /**
    * Combines {@code bound} with the upper bound of the variable as a
    * minimum. Unknown variables are left alone.
    *
    * @param name the variable.
    * @param bound the new upper bound.
    * @return the refined table.
    */
    public SymbolTable<A> setUpperBound(VName name, ScalExp bound) {
        Entry<A> entry = lookup(name);
        if (entry == null) {
            return this;
        }
        Range range = entry.getRange();
        ScalExp upper = (range.getUpper() == null) ? bound :
                ScalTools.min(range.getUpper(), bound);
        return replace(name, entry.withRange(range.withUpper(upper)));
    }

    /**
    * Combines {@code bound} with the lower bound of the variable as a
    * maximum. Unknown variables are left alone.
    *
    * @param name the variable.
    * @param bound the new lower bound.
    * @return the refined table.
    */
    public SymbolTable<A> setLowerBound(VName name, ScalExp bound) {
        Entry<A> entry = lookup(name);
        if (entry == null) {
            return this;
        }
        Range range = entry.getRange();
        ScalExp lower = (range.getLower() == null) ? bound :
                ScalTools.max(range.getLower(), bound);
        return replace(name, entry.withRange(range.withLower(lower)));
    }

    /** Asserts that the variable is at least {@code k}. */
    public SymbolTable<A> isAtLeast(VName name, long k) {
        return setLowerBound(name, ScalTools.intValue(k));
    }

    // Replaces an entry as is, keeping its depth and annotation.
    private SymbolTable<A> replace(VName name, Entry<A> entry) {
        return new SymbolTable<A>(depth, bindings.put(name, entry),
                                  annotation_fn);
    }

    /**
    * Returns the table refined for one branch of a conditional.
    *
    * @param is_true true for the branch taken when {@code cond} holds.
    * @param cond the branch condition.
    * @return the refined table, or this table if the condition has no
    *   scalar form.
    */
    public SymbolTable<A> updateBounds(boolean is_true, SubExp cond) {
        ScalExp scal_cond =
                ScalExpConverter.toScalExp(this, new SubExpression(cond));
        if (scal_cond == null) {
            return this;
        }
        return updateBounds(is_true, scal_cond, cond.getLocation());
    }

    /**
    * Returns the table refined for one branch of a conditional whose scalar
    * form is already known.
    *
    * @param is_true true for the branch taken when {@code cond} holds.
    * @param cond the boolean scalar condition.
    * @param loc the location of the condition.
    * @return the refined table.
    */
    public SymbolTable<A> updateBounds(boolean is_true, ScalExp cond,
                                       SrcLoc loc) {
        ScalExp holds = (is_true) ? cond : ScalTools.not(cond);
        return RangeRefinement.refine(this, holds, loc);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SymbolTable)) {
            return false;
        }
        SymbolTable<?> other = (SymbolTable<?>)o;
        return (depth == other.depth && bindings.equals(other.bindings));
    }

    @Override
    public int hashCode() {
        return 31 * bindings.hashCode() + depth;
    }

    @Override
    public String toString() {
        return "SymbolTable(depth=" + depth + ", " +
                PrintTools.mapToString(bindings.toMap(), ", ") + ")";
    }
}
