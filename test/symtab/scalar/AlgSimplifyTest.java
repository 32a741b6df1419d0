package symtab.scalar;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import symtab.exec.Driver;
import symtab.hir.BasicType;
import symtab.hir.Ident;
import symtab.hir.NameSource;
import symtab.hir.SrcLoc;
import symtab.hir.Type;
import symtab.hir.VName;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;
import static symtab.scalar.ScalTools.*;

public class AlgSimplifyTest {

    private Ident n, m, i, a, b;
    private ScalExp N, M, I, A, B;

    @Before
    public void setUp() {
        NameSource names = new NameSource();
        n = names.newIdent("n", Type.basic(BasicType.INT));
        m = names.newIdent("m", Type.basic(BasicType.INT));
        i = names.newIdent("i", Type.basic(BasicType.INT));
        a = names.newIdent("a", Type.basic(BasicType.BOOL));
        b = names.newIdent("b", Type.basic(BasicType.BOOL));
        N = id(n);
        M = id(m);
        I = id(i);
        A = id(a);
        B = id(b);
    }

    @After
    public void tearDown() {
        Driver.setOptionValue("simplify-steps", "4096");
        Driver.setOptionValue("dnf-terms", "64");
    }

    private static ScalExp simplify(ScalExp e) throws SimplifyException {
        return AlgSimplify.simplify(e, SrcLoc.NONE, RangeContext.EMPTY);
    }

    // i in [0, n-1] bound inside a loop, n known only by name.
    private RangeContext loopContext() {
        RangeContext ranges = new RangeContext();
        ranges.put(n.getName(), 0, null, null);
        ranges.put(i.getName(), 1, zero, minus(N, one));
        return ranges;
    }

    @Test
    public void testConstantFolding() throws SimplifyException {
        assertEquals(intValue(14),
                simplify(plus(intValue(2), times(intValue(3), intValue(4)))));
        assertEquals(intValue(1), simplify(minus(plus(N, one), N)));
        assertEquals(intValue(0), simplify(plus(N, neg(N))));
    }

    @Test
    public void testCanonicalForm() throws SimplifyException {
        assertEquals(new ScalBinary(ScalOperator.MINUS, N, intValue(10)),
                     simplify(minus(N, intValue(10))));
        assertEquals(neg(N), simplify(minus(zero, N)));
        assertEquals(simplify(plus(N, M)), simplify(plus(M, N)));
        assertEquals(simplify(times(plus(N, one), plus(N, one))),
                     simplify(plus(plus(times(N, N), times(intValue(2), N)),
                                   one)));
    }

    @Test
    public void testDivision() throws SimplifyException {
        assertEquals(intValue(-4), simplify(divide(intValue(-7), intValue(2))));
        assertEquals(plus(N, intValue(2)),
                simplify(divide(plus(times(intValue(2), N), intValue(4)),
                                intValue(2))));
        ScalExp inexact = simplify(divide(N, intValue(2)));
        assertEquals(divide(N, intValue(2)), inexact);
    }

    @Test(expected = SimplifyException.class)
    public void testDivisionByZero() throws SimplifyException {
        simplify(divide(N, zero));
    }

    @Test(expected = SimplifyException.class)
    public void testOverflow() throws SimplifyException {
        simplify(times(intValue(Long.MAX_VALUE), intValue(2)));
    }

    @Test
    public void testPower() throws SimplifyException {
        ScalExp square = new ScalBinary(ScalOperator.POW, N, intValue(2));
        assertEquals(simplify(times(N, N)), simplify(square));
        assertEquals(intValue(1024), simplify(
                new ScalBinary(ScalOperator.POW, intValue(2), intValue(10))));
    }

    @Test
    public void testMinMax() throws SimplifyException {
        assertEquals(new MinMax(true, Arrays.asList(N, one)),
                     simplify(min(intValue(3), N, one)));
        assertEquals(N, simplify(min(N, N)));
        assertEquals(new MinMax(true, Arrays.asList(N, intValue(3))),
                     simplify(min(min(N, intValue(5)), intValue(3))));
        assertEquals(intValue(7), simplify(max(intValue(7), intValue(2))));
        // Not evaluated when the operands are symbolic.
        assertTrue(simplify(max(N, M)) instanceof MinMax);
    }

    @Test
    public void testDeMorgan() throws SimplifyException {
        assertEquals(or(not(A), not(B)), simplify(not(and(A, B))));
        assertEquals(and(not(A), not(B)), simplify(not(or(A, B))));
        assertEquals(A, simplify(not(not(A))));
    }

    @Test
    public void testDistribution() throws SimplifyException {
        ScalExp c = lth0(N);
        ScalExp dnf = simplify(and(or(A, B), c));
        assertEquals(or(and(A, new RelExp(RelOp0.LTH0, N)),
                        and(B, new RelExp(RelOp0.LTH0, N))), dnf);
    }

    @Test
    public void testNegatedComparison() throws SimplifyException {
        assertEquals(new RelExp(RelOp0.LEQ0, neg(N)), simplify(not(lth0(N))));
        assertEquals(new RelExp(RelOp0.LTH0, neg(N)), simplify(not(leq0(N))));
    }

    @Test
    public void testContradiction() throws SimplifyException {
        assertEquals(logValue(false), simplify(and(lth0(N), not(lth0(N)))));
        assertEquals(logValue(false), simplify(and(A, not(A))));
    }

    @Test
    public void testDecideFromConstantBounds() throws SimplifyException {
        RangeContext ranges = new RangeContext();
        ranges.put(n.getName(), 0, zero, intValue(9));
        assertTrue(AlgSimplify.isTrue(lth0(minus(N, intValue(10))),
                                      SrcLoc.NONE, ranges));
        assertEquals(logValue(false), AlgSimplify.simplify(
                lth0(N), SrcLoc.NONE, ranges));
        assertFalse(AlgSimplify.isTrue(lth0(minus(N, intValue(5))),
                                       SrcLoc.NONE, ranges));
    }

    @Test
    public void testDecideFromSymbolicBounds() throws SimplifyException {
        RangeContext ranges = loopContext();
        assertTrue(AlgSimplify.isTrue(lth0(minus(I, N)), SrcLoc.NONE, ranges));
        assertTrue(AlgSimplify.isTrue(leq0(neg(I)), SrcLoc.NONE, ranges));
        assertFalse(AlgSimplify.isTrue(lth0(minus(I, minus(N, one))),
                                       SrcLoc.NONE, ranges));
    }

    @Test
    public void testDecideWithMinUpperBound() throws SimplifyException {
        RangeContext ranges = new RangeContext();
        ranges.put(n.getName(), 0, null, min(N, intValue(10)));
        ranges.put(m.getName(), 0, null, min(M, intValue(20)));
        // n <= min(n, 10) only helps through its constant operand.
        assertTrue(AlgSimplify.isTrue(leq0(minus(N, intValue(10))),
                                      SrcLoc.NONE, ranges));
        assertTrue(AlgSimplify.isTrue(lth0(minus(plus(N, M), intValue(31))),
                                      SrcLoc.NONE, ranges));
    }

    @Test
    public void testPickSymToElim() {
        RangeContext ranges = loopContext();
        Set<VName> none = Collections.<VName>emptySet();
        assertEquals(i, AlgSimplify.pickSymToElim(ranges, none, plus(N, I)));
        Set<VName> excluded = new HashSet<VName>();
        excluded.add(i.getName());
        assertEquals(n, AlgSimplify.pickSymToElim(ranges, excluded,
                                                  plus(N, I)));
        assertNull(AlgSimplify.pickSymToElim(ranges, none, M));
        assertNull(AlgSimplify.pickSymToElim(ranges, none, intValue(3)));
    }

    @Test
    public void testPickSymToElimPrefersNewestName() {
        RangeContext ranges = new RangeContext();
        ranges.put(n.getName(), 0, null, null);
        ranges.put(m.getName(), 0, null, null);
        assertEquals(m, AlgSimplify.pickSymToElim(ranges,
                Collections.<VName>emptySet(), plus(N, M)));
    }

    @Test
    public void testLinearForm() throws SimplifyException {
        ScalExp e = plus(times(intValue(3), I), minus(N, intValue(2)));
        LinearForm form = AlgSimplify.linFormScalE(i, e, SrcLoc.NONE,
                                                   RangeContext.EMPTY);
        assertNotNull(form);
        assertEquals(intValue(3), form.getCoefficient());
        assertEquals(minus(N, intValue(2)), form.getRemainder());

        form = AlgSimplify.linFormScalE(i, times(N, I), SrcLoc.NONE,
                                        RangeContext.EMPTY);
        assertEquals(N, form.getCoefficient());
        assertEquals(zero, form.getRemainder());
    }

    @Test
    public void testNonLinearForm() throws SimplifyException {
        assertNull(AlgSimplify.linFormScalE(i, times(I, I), SrcLoc.NONE,
                                            RangeContext.EMPTY));
        assertNull(AlgSimplify.linFormScalE(i, divide(I, N), SrcLoc.NONE,
                                            RangeContext.EMPTY));
        assertNull(AlgSimplify.linFormScalE(i, max(I, zero), SrcLoc.NONE,
                                            RangeContext.EMPTY));
    }

    @Test(expected = SimplifyException.class)
    public void testStepBudget() throws SimplifyException {
        Driver.setOptionValue("simplify-steps", "5");
        simplify(plus(plus(N, M), plus(I, plus(N, M))));
    }

    @Test(expected = SimplifyException.class)
    public void testTermBudget() throws SimplifyException {
        Driver.setOptionValue("dnf-terms", "3");
        ScalExp x = or(lth0(N), lth0(M));
        ScalExp y = or(lth0(I), A);
        simplify(and(x, y));
    }

    @Test(expected = SimplifyException.class)
    public void testIllTyped() throws SimplifyException {
        simplify(plus(A, B));
    }
}
