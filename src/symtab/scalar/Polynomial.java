package symtab.scalar;

import symtab.hir.VName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
* Integer polynomial with constant coefficients, the normal form the
* simplifier uses for integer expressions. The variables of a polynomial are
* atoms: variable references, or expressions the simplifier cannot expand
* further (inexact divisions, min/max, non-constant powers). Terms with a zero
* coefficient are never stored. Coefficient arithmetic is exact and throws
* {@link ArithmeticException} on overflow.
*/
final class Polynomial {

    private static final Comparator<ScalExp> atom_order =
            new Comparator<ScalExp>() {
        public int compare(ScalExp e1, ScalExp e2) {
            return e1.toString().compareTo(e2.toString());
        }
    };

    // monomial -> coefficient
    private final TreeMap<Monomial, Long> terms;

    private Polynomial(TreeMap<Monomial, Long> terms) {
        this.terms = terms;
    }

    /** Returns the constant polynomial of the given value. */
    static Polynomial constant(long value) {
        TreeMap<Monomial, Long> terms = new TreeMap<Monomial, Long>();
        if (value != 0) {
            terms.put(Monomial.UNIT, value);
        }
        return new Polynomial(terms);
    }

    /** Returns the polynomial consisting of the single atom {@code e}. */
    static Polynomial atom(ScalExp e) {
        TreeMap<Monomial, Long> terms = new TreeMap<Monomial, Long>();
        terms.put(new Monomial(Collections.singletonList(e)), 1L);
        return new Polynomial(terms);
    }

    /** Returns the number of terms. */
    int size() {
        return terms.size();
    }

    boolean isConstant() {
        return (terms.isEmpty() ||
                (terms.size() == 1 && terms.containsKey(Monomial.UNIT)));
    }

    /** Returns the coefficient of the constant term. */
    long getConstant() {
        Long ret = terms.get(Monomial.UNIT);
        return (ret == null) ? 0 : ret;
    }

    Polynomial add(Polynomial other) {
        TreeMap<Monomial, Long> ret = new TreeMap<Monomial, Long>(terms);
        for (Map.Entry<Monomial, Long> term : other.terms.entrySet()) {
            addTerm(ret, term.getKey(), term.getValue());
        }
        return new Polynomial(ret);
    }

    Polynomial negate() {
        return scale(-1);
    }

    Polynomial scale(long factor) {
        TreeMap<Monomial, Long> ret = new TreeMap<Monomial, Long>();
        if (factor != 0) {
            for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
                ret.put(term.getKey(),
                        Math.multiplyExact(term.getValue(), factor));
            }
        }
        return new Polynomial(ret);
    }

    Polynomial multiply(Polynomial other) {
        TreeMap<Monomial, Long> ret = new TreeMap<Monomial, Long>();
        for (Map.Entry<Monomial, Long> t1 : terms.entrySet()) {
            for (Map.Entry<Monomial, Long> t2 : other.terms.entrySet()) {
                addTerm(ret, t1.getKey().times(t2.getKey()),
                        Math.multiplyExact(t1.getValue(), t2.getValue()));
            }
        }
        return new Polynomial(ret);
    }

    /** Checks if every coefficient is a multiple of {@code divisor}. */
    boolean isDivisibleBy(long divisor) {
        for (long coef : terms.values()) {
            if (coef % divisor != 0) {
                return false;
            }
        }
        return true;
    }

    /**
    * Divides every coefficient by {@code divisor}, which must divide all of
    * them and must not be -1 or 0.
    */
    Polynomial divideExact(long divisor) {
        TreeMap<Monomial, Long> ret = new TreeMap<Monomial, Long>();
        for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
            ret.put(term.getKey(), term.getValue() / divisor);
        }
        return new Polynomial(ret);
    }

    /**
    * Returns the constant coefficient {@code c} such that this polynomial is
    * {@code c*sym + r} with {@code r} free of {@code sym}.
    * @param sym the symbol.
    * @return the coefficient, or null if {@code sym} does not occur, occurs
    *   non-linearly, inside an atom, or with a symbolic coefficient.
    */
    Long constantCoefficient(VName sym) {
        Long ret = null;
        for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
            Monomial m = term.getKey();
            if (m.hidesSymbol(sym)) {
                return null;
            }
            int count = m.count(sym);
            if (count == 0) {
                continue;
            }
            if (count > 1 || m.degree() > 1) {
                return null;
            }
            ret = term.getValue();
        }
        return ret;
    }

    /**
    * Splits this polynomial into {@code a*sym + b}.
    * @param sym the symbol.
    * @return the pair {a, b}, or null if the polynomial is not linear in
    *   {@code sym}.
    */
    Polynomial[] linearForm(VName sym) {
        TreeMap<Monomial, Long> a = new TreeMap<Monomial, Long>();
        TreeMap<Monomial, Long> b = new TreeMap<Monomial, Long>();
        for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
            Monomial m = term.getKey();
            if (m.hidesSymbol(sym)) {
                return null;
            }
            int count = m.count(sym);
            if (count > 1) {
                return null;
            } else if (count == 1) {
                addTerm(a, m.without(sym), term.getValue());
            } else {
                addTerm(b, m, term.getValue());
            }
        }
        return new Polynomial[] {new Polynomial(a), new Polynomial(b)};
    }

    /**
    * Replaces every occurrence of {@code sym} by {@code q}.
    * @return the result, or null if {@code sym} occurs inside an atom.
    */
    Polynomial substitute(VName sym, Polynomial q) {
        Polynomial ret = constant(0);
        for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
            Monomial m = term.getKey();
            if (m.hidesSymbol(sym)) {
                return null;
            }
            TreeMap<Monomial, Long> rest = new TreeMap<Monomial, Long>();
            rest.put(m.without(sym), term.getValue());
            Polynomial t = new Polynomial(rest);
            for (int i = m.count(sym); i > 0; i--) {
                t = t.multiply(q);
            }
            ret = ret.add(t);
        }
        return ret;
    }

    /**
    * Converts the polynomial back to a scalar expression: higher-degree terms
    * first, the constant term last, negative coefficients written as
    * subtractions.
    */
    ScalExp toScalExp() {
        ScalExp ret = null;
        for (Map.Entry<Monomial, Long> term : terms.entrySet()) {
            Monomial m = term.getKey();
            long coef = term.getValue();
            if (ret == null) {
                if (coef == -1 && m.degree() > 0) {
                    ret = ScalTools.neg(m.toScalExp());
                } else {
                    ret = termToScalExp(m, coef);
                }
            } else if (coef < 0) {
                ret = new ScalBinary(ScalOperator.MINUS, ret,
                        termToScalExp(m, Math.negateExact(coef)));
            } else {
                ret = ScalTools.plus(ret, termToScalExp(m, coef));
            }
        }
        return (ret == null) ? ScalTools.intValue(0) : ret;
    }

    private static ScalExp termToScalExp(Monomial m, long coef) {
        if (m.degree() == 0) {
            return ScalTools.intValue(coef);
        } else if (coef == 1) {
            return m.toScalExp();
        } else {
            return ScalTools.times(ScalTools.intValue(coef), m.toScalExp());
        }
    }

    private static void
            addTerm(TreeMap<Monomial, Long> terms, Monomial m, long coef) {
        Long old = terms.get(m);
        long sum = (old == null) ? coef : Math.addExact(old, coef);
        if (sum == 0) {
            terms.remove(m);
        } else {
            terms.put(m, sum);
        }
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Polynomial &&
                terms.equals(((Polynomial)o).terms));
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return toScalExp().toString();
    }

    /**
    * Product of atoms, kept sorted so that equal products compare equal.
    * Monomials are ordered by descending degree, then by their printed form.
    */
    static final class Monomial implements Comparable<Monomial> {

        static final Monomial UNIT =
                new Monomial(Collections.<ScalExp>emptyList());

        private final List<ScalExp> atoms;

        private final String key;

        Monomial(List<ScalExp> atoms) {
            List<ScalExp> sorted = new ArrayList<ScalExp>(atoms);
            Collections.sort(sorted, atom_order);
            this.atoms = Collections.unmodifiableList(sorted);
            StringBuilder sb = new StringBuilder();
            for (ScalExp atom : sorted) {
                sb.append(atom).append('*');
            }
            key = sb.toString();
        }

        int degree() {
            return atoms.size();
        }

        Monomial times(Monomial other) {
            if (other.atoms.isEmpty()) {
                return this;
            } else if (atoms.isEmpty()) {
                return other;
            }
            List<ScalExp> product = new ArrayList<ScalExp>(atoms);
            product.addAll(other.atoms);
            return new Monomial(product);
        }

        /** Counts the occurrences of {@code sym} as a factor. */
        int count(VName sym) {
            int ret = 0;
            for (ScalExp atom : atoms) {
                if (isSymbol(atom, sym)) {
                    ret++;
                }
            }
            return ret;
        }

        /** Checks if {@code sym} occurs inside a compound atom. */
        boolean hidesSymbol(VName sym) {
            for (ScalExp atom : atoms) {
                if (!(atom instanceof ScalId) && atom.containsSymbol(sym)) {
                    return true;
                }
            }
            return false;
        }

        Monomial without(VName sym) {
            List<ScalExp> rest = new ArrayList<ScalExp>(atoms.size());
            for (ScalExp atom : atoms) {
                if (!isSymbol(atom, sym)) {
                    rest.add(atom);
                }
            }
            return (rest.size() == atoms.size()) ? this : new Monomial(rest);
        }

        ScalExp toScalExp() {
            ScalExp ret = null;
            for (ScalExp atom : atoms) {
                ret = (ret == null) ? atom : ScalTools.times(ret, atom);
            }
            return (ret == null) ? ScalTools.intValue(1) : ret;
        }

        private static boolean isSymbol(ScalExp atom, VName sym) {
            return (atom instanceof ScalId &&
                    ((ScalId)atom).getIdent().getName().equals(sym));
        }

        public int compareTo(Monomial other) {
            if (atoms.size() != other.atoms.size()) {
                return (atoms.size() > other.atoms.size()) ? -1 : 1;
            }
            return key.compareTo(other.key);
        }

        @Override
        public boolean equals(Object o) {
            return (o instanceof Monomial && key.equals(((Monomial)o).key));
        }

        @Override
        public int hashCode() {
            return key.hashCode();
        }

        @Override
        public String toString() {
            return key;
        }
    }
}
