package symtab.scalar;

import symtab.exec.Driver;
import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.IntValue;
import symtab.hir.PrintTools;
import symtab.hir.RealValue;
import symtab.hir.SrcLoc;
import symtab.hir.VName;

import java.util.*;

/**
* Algebraic simplifier for scalar expressions.
* <p>
* Integer expressions are normalized to a sum of products with constant
* coefficients. Constants are folded, division by a constant is carried out
* when it is exact (or when both operands are constants, with floor
* semantics), and small constant powers are expanded. Operands of min/max
* expressions are flattened and their constant operands folded; a min/max with
* a single remaining operand collapses to that operand.
* <p>
* Boolean expressions are normalized to disjunctive normal form by pushing
* negations inward and distributing conjunctions over disjunctions. Negated
* comparisons against zero are rewritten with integer semantics, and
* comparisons whose outcome follows from the bounds in the range context are
* replaced by their truth value.
* <p>
* Every public entry point is given a fresh rewrite budget taken from the
* {@code simplify-steps} and {@code dnf-terms} options; running out of budget
* fails the call with a {@link SimplifyException}.
*/
public final class AlgSimplify {

    private static final String tag = "[AlgSimplify]";

    /** Maximum nesting of bound substitutions when deciding a comparison */
    private static final int MAX_BOUND_DEPTH = 8;

    /** Maximum number of bound substitutions tried for one comparison */
    private static final int MAX_BOUND_STEPS = 256;

    /** Largest symbolic power expanded into a product */
    private static final int MAX_EXPONENT = 4;

    private final SrcLoc loc;

    private final RangeContext ranges;

    private final int max_steps;

    private final int max_terms;

    private int steps;

    // Bound search state of the comparison being decided
    private int bound_steps;

    private Map<List<Object>, Long> bound_memo;

    private AlgSimplify(SrcLoc loc, RangeContext ranges) {
        this.loc = (loc == null) ? SrcLoc.NONE : loc;
        this.ranges = (ranges == null) ? RangeContext.EMPTY : ranges;
        max_steps = Driver.getIntOptionValue("simplify-steps", 4096);
        max_terms = Driver.getIntOptionValue("dnf-terms", 64);
        steps = 0;
    }

    /**
    * Simplifies a scalar expression under the given range context.
    *
    * @param e the expression to be simplified.
    * @param loc the source location reported on failure.
    * @param ranges the known bounds of variables.
    * @return the simplified expression.
    * @throws SimplifyException if the expression cannot be simplified.
    */
    public static ScalExp simplify(ScalExp e, SrcLoc loc, RangeContext ranges)
            throws SimplifyException {
        if (e == null) {
            throw new IllegalArgumentException("null expression");
        }
        AlgSimplify simplifier = new AlgSimplify(loc, ranges);
        ScalExp ret;
        try {
            ret = simplifier.simplify(e);
        } catch (ArithmeticException ex) {
            throw new SimplifyException("integer overflow", simplifier.loc);
        }
        PrintTools.printlnStatus(4, tag, e, "=>", ret);
        return ret;
    }

    /**
    * Checks if a boolean expression is known to hold under the given range
    * context, i.e., it simplifies to the constant true.
    *
    * @param cond the condition.
    * @param loc the source location reported on failure.
    * @param ranges the known bounds of variables.
    * @return true if the condition is proved.
    * @throws SimplifyException if the condition cannot be simplified.
    */
    public static boolean isTrue(ScalExp cond, SrcLoc loc, RangeContext ranges)
            throws SimplifyException {
        ScalExp simplified = simplify(cond, loc, ranges);
        return Boolean.TRUE.equals(ScalTools.getLogValue(simplified));
    }

    /**
    * Picks the integer symbol of {@code e} that should be eliminated first:
    * the one bound at the greatest depth, and among those the most recently
    * created one. Only symbols known to the range context are considered.
    *
    * @param ranges the range context.
    * @param excluded names that must not be picked.
    * @param e the expression.
    * @return the symbol, or null if there is no candidate.
    */
    public static Ident
            pickSymToElim(RangeContext ranges, Set<VName> excluded, ScalExp e) {
        Ident ret = null;
        int ret_depth = 0;
        for (Ident id : e.getSymbols()) {
            VName name = id.getName();
            if (!id.getType().isBasic(BasicType.INT) ||
                excluded.contains(name) || !ranges.contains(name)) {
                continue;
            }
            int depth = ranges.get(name).getDepth();
            if (ret == null || depth > ret_depth || (depth == ret_depth &&
                    name.getTag() > ret.getName().getTag())) {
                ret = id;
                ret_depth = depth;
            }
        }
        return ret;
    }

    /**
    * Decomposes {@code e} into {@code a*sym + b} where neither {@code a} nor
    * {@code b} refers to {@code sym}. Both parts are returned simplified.
    *
    * @param sym the symbol.
    * @param e the integer expression.
    * @param loc the source location reported on failure.
    * @param ranges the known bounds of variables.
    * @return the linear form, or null if {@code e} is not linear in
    *   {@code sym}.
    * @throws SimplifyException if {@code e} cannot be normalized.
    */
    public static LinearForm linFormScalE(Ident sym, ScalExp e, SrcLoc loc,
            RangeContext ranges) throws SimplifyException {
        AlgSimplify simplifier = new AlgSimplify(loc, ranges);
        try {
            Polynomial[] form =
                    simplifier.toPolynomial(e).linearForm(sym.getName());
            if (form == null) {
                return null;
            }
            return new LinearForm(form[0].toScalExp(), form[1].toScalExp());
        } catch (ArithmeticException ex) {
            throw new SimplifyException("integer overflow", simplifier.loc);
        }
    }

    private void step(int count) throws SimplifyException {
        steps += count;
        if (steps > max_steps) {
            throw new SimplifyException(
                    "gave up after " + max_steps + " rewrite steps", loc);
        }
    }

    private ScalExp simplify(ScalExp e) throws SimplifyException {
        step(1);
        switch (e.getType()) {
        case INT:
            return toPolynomial(e).toScalExp();
        case BOOL:
            return fromDNF(toDNF(e, false));
        default:
            return foldConstants(e);
        }
    }

    /*==================================================================*/
    /* Integer arithmetic                                               */
    /*==================================================================*/

    private Polynomial toPolynomial(ScalExp e) throws SimplifyException {
        step(1);
        if (e.getType() != BasicType.INT) {
            throw new SimplifyException("not an integer expression: " + e,
                                        loc);
        }
        if (e instanceof ScalConst) {
            return Polynomial.constant(
                    ((IntValue)((ScalConst)e).getValue()).getValue());
        } else if (e instanceof ScalId) {
            return Polynomial.atom(e);
        } else if (e instanceof ScalNeg) {
            return toPolynomial(((ScalNeg)e).getExpression()).negate();
        } else if (e instanceof ScalBinary) {
            return binaryToPolynomial((ScalBinary)e);
        } else if (e instanceof MinMax) {
            return minMaxToPolynomial((MinMax)e);
        }
        throw new SimplifyException("unexpected integer expression: " + e,
                                    loc);
    }

    private Polynomial binaryToPolynomial(ScalBinary e)
            throws SimplifyException {
        Polynomial x = toPolynomial(e.getLHS());
        Polynomial y = toPolynomial(e.getRHS());
        switch (e.getOperator()) {
        case PLUS:
            return x.add(y);
        case MINUS:
            return x.add(y.negate());
        case TIMES:
            step(x.size() * y.size());
            return x.multiply(y);
        case DIVIDE:
            return divide(x, y);
        case POW:
            return power(x, y);
        default:
            throw new SimplifyException("logical operator in " + e, loc);
        }
    }

    private Polynomial divide(Polynomial x, Polynomial y)
            throws SimplifyException {
        if (!y.isConstant()) {
            return Polynomial.atom(
                    ScalTools.divide(x.toScalExp(), y.toScalExp()));
        }
        long divisor = y.getConstant();
        if (divisor == 0) {
            throw new SimplifyException("division by zero", loc);
        } else if (divisor == 1) {
            return x;
        } else if (divisor == -1) {
            return x.negate();
        } else if (x.isConstant()) {
            return Polynomial.constant(Math.floorDiv(x.getConstant(), divisor));
        } else if (x.isDivisibleBy(divisor)) {
            return x.divideExact(divisor);
        }
        return Polynomial.atom(ScalTools.divide(x.toScalExp(),
                                                ScalTools.intValue(divisor)));
    }

    private Polynomial power(Polynomial x, Polynomial y)
            throws SimplifyException {
        long exponent = y.getConstant();
        if (!y.isConstant() || exponent < 0 ||
            (!x.isConstant() && exponent > MAX_EXPONENT)) {
            return Polynomial.atom(new ScalBinary(ScalOperator.POW,
                    x.toScalExp(), y.toScalExp()));
        }
        if (x.isConstant()) {
            return Polynomial.constant(intPower(x.getConstant(), exponent));
        }
        Polynomial ret = Polynomial.constant(1);
        for (long i = 0; i < exponent; i++) {
            step(ret.size() * x.size());
            ret = ret.multiply(x);
        }
        return ret;
    }

    private static long intPower(long base, long exponent) {
        if (base == 0) {
            return (exponent == 0) ? 1 : 0;
        } else if (base == 1) {
            return 1;
        } else if (base == -1) {
            return (exponent % 2 == 0) ? 1 : -1;
        }
        // Overflows within 64 iterations for any other base.
        long ret = 1;
        for (long i = 0; i < exponent; i++) {
            ret = Math.multiplyExact(ret, base);
        }
        return ret;
    }

    private Polynomial minMaxToPolynomial(MinMax e) throws SimplifyException {
        boolean ismin = e.isMin();
        List<ScalExp> operands = new ArrayList<ScalExp>();
        Long folded = null;
        for (ScalExp operand : e.getOperands()) {
            ScalExp simplified = toPolynomial(operand).toScalExp();
            List<ScalExp> flattened;
            if (simplified instanceof MinMax &&
                ((MinMax)simplified).isMin() == ismin) {
                flattened = ((MinMax)simplified).getOperands();
            } else {
                flattened = Collections.singletonList(simplified);
            }
            for (ScalExp flat : flattened) {
                Long value = ScalTools.getIntValue(flat);
                if (value == null) {
                    if (!operands.contains(flat)) {
                        operands.add(flat);
                    }
                } else if (folded == null) {
                    folded = value;
                } else {
                    folded = (ismin) ? Math.min(folded, value) :
                                       Math.max(folded, value);
                }
            }
        }
        if (folded != null) {
            operands.add(ScalTools.intValue(folded));
        }
        if (operands.size() == 1) {
            return toPolynomial(operands.get(0));
        }
        return Polynomial.atom(new MinMax(ismin, operands));
    }

    /*==================================================================*/
    /* Comparisons against zero                                         */
    /*==================================================================*/

    /**
    * Decides {@code p op 0} from the bounds in the range context.
    * @return the outcome, or null if it does not follow from the bounds.
    */
    private Boolean decide(RelOp0 op, Polynomial p) {
        // The search has its own budget and leaves the rewrite budget as is.
        int saved_steps = steps;
        bound_steps = 0;
        bound_memo = new HashMap<List<Object>, Long>();
        Long hi, lo;
        try {
            hi = boundOf(p, true, MAX_BOUND_DEPTH);
            lo = boundOf(p, false, MAX_BOUND_DEPTH);
        } catch (SimplifyException ex) {
            PrintTools.printlnStatus(4, tag, "undecided", p, ":",
                                     ex.getMessage());
            return null;
        } catch (ArithmeticException ex) {
            PrintTools.printlnStatus(4, tag, "undecided", p, ": overflow");
            return null;
        } finally {
            steps = saved_steps;
            bound_memo = null;
        }
        if (op == RelOp0.LTH0) {
            if (hi != null && hi < 0) {
                return Boolean.TRUE;
            } else if (lo != null && lo >= 0) {
                return Boolean.FALSE;
            }
        } else {
            if (hi != null && hi <= 0) {
                return Boolean.TRUE;
            } else if (lo != null && lo > 0) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
    * Computes a constant upper (or lower) bound of {@code p} by replacing
    * its symbols with their bounds, innermost symbols first. A symbol with a
    * positive coefficient is replaced by its upper bound when an upper bound
    * is wanted, and by its lower bound otherwise. Gives up with null once
    * the search budget of the comparison is spent.
    */
    private Long boundOf(Polynomial p, boolean upper, int depth)
            throws SimplifyException {
        if (p.isConstant()) {
            return p.getConstant();
        } else if (depth == 0 || ++bound_steps > MAX_BOUND_STEPS) {
            return null;
        }
        List<Object> key = Arrays.<Object>asList(p, upper, depth);
        if (bound_memo.containsKey(key)) {
            return bound_memo.get(key);
        }
        Long ret = searchBound(p, upper, depth);
        bound_memo.put(key, ret);
        return ret;
    }

    private Long searchBound(Polynomial p, boolean upper, int depth)
            throws SimplifyException {
        ScalExp e = p.toScalExp();
        Set<VName> tried = new HashSet<VName>();
        Ident sym;
        while ((sym = pickSymToElim(ranges, tried, e)) != null) {
            VName name = sym.getName();
            tried.add(name);
            Long coef = p.constantCoefficient(name);
            if (coef == null) {
                continue;
            }
            boolean want_upper = ((coef > 0) == upper);
            RangeContext.Bounds bounds = ranges.get(name);
            ScalExp sym_bound =
                    (want_upper) ? bounds.getUpper() : bounds.getLower();
            if (sym_bound == null) {
                continue;
            }
            Long best = null;
            for (ScalExp choice : boundChoices(sym_bound, want_upper)) {
                if (choice.containsSymbol(name)) {
                    continue;
                }
                Polynomial substituted =
                        p.substitute(name, toPolynomial(choice));
                if (substituted == null) {
                    continue;
                }
                Long value = boundOf(substituted, upper, depth - 1);
                if (value != null && (best == null ||
                        ((upper) ? value < best : value > best))) {
                    best = value;
                }
            }
            if (best != null) {
                return best;
            }
        }
        return null;
    }

    // Each operand of a min is an upper bound, each operand of a max a lower
    // bound.
    private static List<ScalExp> boundChoices(ScalExp bound, boolean upper) {
        if (bound instanceof MinMax && ((MinMax)bound).isMin() == upper) {
            return ((MinMax)bound).getOperands();
        }
        return Collections.singletonList(bound);
    }

    /*==================================================================*/
    /* Disjunctive normal form                                          */
    /*==================================================================*/

    private List<Set<ScalExp>> toDNF(ScalExp e, boolean negated)
            throws SimplifyException {
        step(1);
        if (e.getType() != BasicType.BOOL) {
            throw new SimplifyException("not a boolean expression: " + e, loc);
        }
        if (e instanceof ScalConst) {
            return constantDNF(ScalTools.getLogValue(e) != negated);
        } else if (e instanceof ScalId) {
            return literalDNF((negated) ? ScalTools.not(e) : e);
        } else if (e instanceof ScalNot) {
            return toDNF(((ScalNot)e).getExpression(), !negated);
        } else if (e instanceof RelExp) {
            return relationToDNF((RelExp)e, negated);
        } else if (e instanceof ScalBinary &&
                   ((ScalBinary)e).getOperator().isLogical()) {
            ScalBinary b = (ScalBinary)e;
            List<Set<ScalExp>> x = toDNF(b.getLHS(), negated);
            List<Set<ScalExp>> y = toDNF(b.getRHS(), negated);
            // De Morgan
            boolean conjunction =
                    ((b.getOperator() == ScalOperator.LOG_AND) != negated);
            return (conjunction) ? product(x, y) : union(x, y);
        }
        throw new SimplifyException("unexpected boolean expression: " + e,
                                    loc);
    }

    private List<Set<ScalExp>> relationToDNF(RelExp e, boolean negated)
            throws SimplifyException {
        Polynomial p = toPolynomial(e.getExpression());
        RelOp0 op = e.getOperator();
        if (negated) {
            // !(p < 0) is -p <= 0 and !(p <= 0) is -p < 0
            p = p.negate();
            op = (op == RelOp0.LTH0) ? RelOp0.LEQ0 : RelOp0.LTH0;
        }
        Boolean decided = decide(op, p);
        if (decided != null) {
            return constantDNF(decided);
        }
        return literalDNF(new RelExp(op, p.toScalExp()));
    }

    private static List<Set<ScalExp>> constantDNF(boolean value) {
        List<Set<ScalExp>> ret = new ArrayList<Set<ScalExp>>();
        if (value) {
            ret.add(new LinkedHashSet<ScalExp>());
        }
        return ret;
    }

    private static List<Set<ScalExp>> literalDNF(ScalExp literal) {
        List<Set<ScalExp>> ret = new ArrayList<Set<ScalExp>>();
        Set<ScalExp> conj = new LinkedHashSet<ScalExp>();
        conj.add(literal);
        ret.add(conj);
        return ret;
    }

    private List<Set<ScalExp>>
            product(List<Set<ScalExp>> x, List<Set<ScalExp>> y)
            throws SimplifyException {
        List<Set<ScalExp>> ret = new ArrayList<Set<ScalExp>>();
        for (Set<ScalExp> c1 : x) {
            for (Set<ScalExp> c2 : y) {
                step(1);
                Set<ScalExp> conj = new LinkedHashSet<ScalExp>(c1);
                conj.addAll(c2);
                if (!isContradictory(conj) && !ret.contains(conj)) {
                    ret.add(conj);
                    checkTerms(ret);
                }
            }
        }
        return ret;
    }

    private List<Set<ScalExp>>
            union(List<Set<ScalExp>> x, List<Set<ScalExp>> y)
            throws SimplifyException {
        List<Set<ScalExp>> ret = new ArrayList<Set<ScalExp>>(x);
        for (Set<ScalExp> conj : y) {
            if (!ret.contains(conj)) {
                ret.add(conj);
            }
        }
        for (Set<ScalExp> conj : ret) {
            if (conj.isEmpty()) {
                return constantDNF(true);
            }
        }
        checkTerms(ret);
        return ret;
    }

    private void checkTerms(List<Set<ScalExp>> dnf) throws SimplifyException {
        if (dnf.size() > max_terms) {
            throw new SimplifyException(
                    "more than " + max_terms + " disjuncts", loc);
        }
    }

    // A conjunction containing a literal and its negation.
    private boolean isContradictory(Set<ScalExp> conj)
            throws SimplifyException {
        for (ScalExp literal : conj) {
            if (conj.contains(negateLiteral(literal))) {
                return true;
            }
        }
        return false;
    }

    private ScalExp negateLiteral(ScalExp literal) throws SimplifyException {
        if (literal instanceof ScalNot) {
            return ((ScalNot)literal).getExpression();
        } else if (literal instanceof RelExp) {
            RelExp rel = (RelExp)literal;
            RelOp0 op = (rel.getOperator() == RelOp0.LTH0) ?
                    RelOp0.LEQ0 : RelOp0.LTH0;
            return new RelExp(op,
                    toPolynomial(rel.getExpression()).negate().toScalExp());
        }
        return ScalTools.not(literal);
    }

    private static ScalExp fromDNF(List<Set<ScalExp>> dnf) {
        ScalExp ret = null;
        for (Set<ScalExp> conj : dnf) {
            if (conj.isEmpty()) {
                return ScalTools.logValue(true);
            }
            ScalExp c = null;
            for (ScalExp literal : conj) {
                c = (c == null) ? literal : ScalTools.and(c, literal);
            }
            ret = (ret == null) ? c : ScalTools.or(ret, c);
        }
        return (ret == null) ? ScalTools.logValue(false) : ret;
    }

    /*==================================================================*/
    /* Other basic types                                                */
    /*==================================================================*/

    // Folds arithmetic on floating-point constants; other nodes are kept.
    private ScalExp foldConstants(ScalExp e) throws SimplifyException {
        step(1);
        if (e instanceof ScalNeg) {
            ScalExp x = foldConstants(((ScalNeg)e).getExpression());
            Double v = realValue(x);
            return (v == null) ? new ScalNeg(x) : realConst(-v);
        } else if (e instanceof ScalBinary) {
            ScalBinary b = (ScalBinary)e;
            ScalExp x = foldConstants(b.getLHS());
            ScalExp y = foldConstants(b.getRHS());
            Double v1 = realValue(x), v2 = realValue(y);
            if (v1 != null && v2 != null) {
                switch (b.getOperator()) {
                case PLUS:
                    return realConst(v1 + v2);
                case MINUS:
                    return realConst(v1 - v2);
                case TIMES:
                    return realConst(v1 * v2);
                case DIVIDE:
                    return realConst(v1 / v2);
                case POW:
                    return realConst(Math.pow(v1, v2));
                default:
                    break;
                }
            }
            return new ScalBinary(b.getOperator(), x, y);
        }
        return e;
    }

    private static Double realValue(ScalExp e) {
        if (e instanceof ScalConst &&
            ((ScalConst)e).getValue() instanceof RealValue) {
            return ((RealValue)((ScalConst)e).getValue()).getValue();
        }
        return null;
    }

    private static ScalExp realConst(double value) {
        return new ScalConst(new RealValue(value));
    }
}
