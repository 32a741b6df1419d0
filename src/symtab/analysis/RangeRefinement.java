package symtab.analysis;

import symtab.exec.Driver;
import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.PrintTools;
import symtab.hir.SrcLoc;
import symtab.hir.VName;
import symtab.scalar.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Tightens the value ranges of a symbol table with a condition known to hold.
* <p>
* The negation of the condition is normalized to a disjunction. Since the
* condition holds, every disjunct is false, and the negation of each
* comparison disjunct {@code e < 0} or {@code e <= 0} is a fact of the form
* {@code f <= 0}. Each fact is solved for its innermost variable {@code x}:
* if {@code f = -x + b} then {@code b} is a lower bound of {@code x}, and if
* {@code f = x + b} then {@code -b} is an upper bound. Facts with any other
* coefficient, or that cannot be simplified, are dropped. The new bounds are
* merged into the table with {@link SymbolTable#setUpperBound} and
* {@link SymbolTable#setLowerBound}.
*/
final class RangeRefinement {

    private static final String tag = "[RangeRefinement]";

    private RangeRefinement() {
    }

    /**
    * Returns the table refined with the condition {@code cond}.
    *
    * @param table the table valid before the condition is known.
    * @param cond the boolean condition known to hold.
    * @param loc the location of the condition.
    * @return the refined table, or {@code table} if nothing can be derived.
    */
    static <A> SymbolTable<A> refine(SymbolTable<A> table, ScalExp cond,
                                     SrcLoc loc) {
        if (Driver.getIntOptionValue("range", 1) == 0) {
            return table;
        }
        RangeContext ranges = table.getRangeContext();
        ScalExp negation;
        try {
            negation = AlgSimplify.simplify(ScalTools.not(cond), loc, ranges);
        } catch (SimplifyException ex) {
            PrintTools.printlnStatus(3, tag, "no refinement from", cond + ":",
                                     ex.getMessage());
            return table;
        }
        List<NewBound> bounds = new ArrayList<NewBound>();
        for (ScalExp fact : getNotFactorsLEQ0(negation, loc, ranges)) {
            NewBound bound = solveLEQ0(fact, loc, ranges);
            if (bound != null) {
                bounds.add(bound);
            }
        }
        SymbolTable<A> ret = table;
        for (NewBound bound : bounds) {
            if (bound.is_upper) {
                ret = ret.setUpperBound(bound.sym.getName(), bound.bound);
            } else {
                ret = ret.setLowerBound(bound.sym.getName(), bound.bound);
            }
        }
        PrintTools.printlnStatus(2, tag, cond, "=>", bounds);
        return ret;
    }

    /**
    * Collects the negations of the comparison disjuncts of {@code e}, each
    * in the form {@code f <= 0} and represented by the simplified {@code f}.
    * Disjuncts that are not integer comparisons are skipped.
    */
    private static List<ScalExp>
            getNotFactorsLEQ0(ScalExp e, SrcLoc loc, RangeContext ranges) {
        List<ScalExp> ret = new ArrayList<ScalExp>();
        collectNotFactors(e, loc, ranges, ret);
        return ret;
    }

    private static void collectNotFactors(ScalExp e, SrcLoc loc,
            RangeContext ranges, List<ScalExp> ret) {
        if (e instanceof ScalBinary &&
            ((ScalBinary)e).getOperator() == ScalOperator.LOG_OR) {
            collectNotFactors(((ScalBinary)e).getLHS(), loc, ranges, ret);
            collectNotFactors(((ScalBinary)e).getRHS(), loc, ranges, ret);
        } else if (e instanceof RelExp) {
            RelExp rel = (RelExp)e;
            if (rel.getExpression().getType() != BasicType.INT) {
                return;
            }
            // !(f < 0) is 0 - f <= 0 and !(f <= 0) is 1 - f <= 0
            long c = (rel.getOperator() == RelOp0.LTH0) ? 0 : 1;
            ScalExp fact = ScalTools.minus(ScalTools.intValue(c),
                                           rel.getExpression());
            try {
                ret.add(AlgSimplify.simplify(fact, loc, ranges));
            } catch (SimplifyException ex) {
                PrintTools.printlnStatus(3, tag, "dropping fact", fact + ":",
                                         ex.getMessage());
            }
        }
    }

    /**
    * Solves {@code fact <= 0} for the innermost variable of {@code fact}.
    * @return the derived bound, or null if none.
    */
    private static NewBound
            solveLEQ0(ScalExp fact, SrcLoc loc, RangeContext ranges) {
        Ident sym = AlgSimplify.pickSymToElim(ranges,
                Collections.<VName>emptySet(), fact);
        if (sym == null) {
            return null;
        }
        try {
            LinearForm form = AlgSimplify.linFormScalE(sym, fact, loc, ranges);
            if (form == null) {
                return null;
            }
            Long a = ScalTools.getIntValue(form.getCoefficient());
            if (a == null) {
                return null;
            } else if (a == -1) {
                return new NewBound(sym, false, form.getRemainder());
            } else if (a == 1) {
                ScalExp upper = AlgSimplify.simplify(
                        ScalTools.neg(form.getRemainder()), loc, ranges);
                return new NewBound(sym, true, upper);
            }
        } catch (SimplifyException ex) {
            PrintTools.printlnStatus(3, tag, "cannot solve", fact, "for", sym,
                                     ":", ex.getMessage());
        }
        return null;
    }

    private static final class NewBound {

        private final Ident sym;

        private final boolean is_upper;

        private final ScalExp bound;

        NewBound(Ident sym, boolean is_upper, ScalExp bound) {
            this.sym = sym;
            this.is_upper = is_upper;
            this.bound = bound;
        }

        @Override
        public String toString() {
            return sym + ((is_upper) ? "<=" : ">=") + bound;
        }
    }
}
