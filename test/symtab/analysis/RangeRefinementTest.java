package symtab.analysis;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import symtab.exec.Driver;
import symtab.hir.*;
import symtab.scalar.AlgSimplify;
import symtab.scalar.RangeContext;
import symtab.scalar.ScalExp;
import symtab.scalar.ScalId;
import symtab.scalar.SimplifyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static symtab.scalar.ScalTools.*;

public class RangeRefinementTest {

    private NameSource names;
    private Ident n, m;
    private ScalExp N, M;
    private SymbolTable<Void> table;

    @Before
    public void setUp() {
        names = new NameSource();
        n = names.newIdent("n", Type.basic(BasicType.INT));
        m = names.newIdent("m", Type.basic(BasicType.INT));
        N = new ScalId(n);
        M = new ScalId(m);
        table = SymbolTable.empty(AnnotationFunction.NONE)
                .insertParameter(n).insertParameter(m);
    }

    @After
    public void tearDown() {
        Driver.setOptionValue("range", "1");
    }

    // Binds a fresh boolean variable to x op y and returns it.
    private Var compare(BinaryOperator op, SubExp x, SubExp y) {
        Ident c = names.newIdent("c", Type.basic(BasicType.BOOL));
        table = table.insertBinding(new Binding(c,
                new BinOp(op, x, y, BasicType.BOOL)));
        return new Var(c);
    }

    private static ScalExp simplified(ScalExp e) throws SimplifyException {
        return AlgSimplify.simplify(e, SrcLoc.NONE, RangeContext.EMPTY);
    }

    @Test
    public void testUpperBoundFromTrueBranch() {
        Var c = compare(BinaryOperator.LEQ, new Var(n), Constant.intConst(10));
        SymbolTable<Void> refined = table.updateBounds(true, c);
        assertEquals(intValue(10), refined.lookupRange(n.getName()).getUpper());
        assertNull(refined.lookupRange(n.getName()).getLower());
        // The table of the enclosing scope is untouched.
        assertEquals(Range.UNKNOWN, table.lookupRange(n.getName()));
    }

    @Test
    public void testLowerBoundFromFalseBranch() {
        Var c = compare(BinaryOperator.LESS, new Var(n), Constant.intConst(0));
        SymbolTable<Void> refined = table.updateBounds(false, c);
        assertEquals(intValue(0), refined.lookupRange(n.getName()).getLower());
        assertNull(refined.lookupRange(n.getName()).getUpper());
    }

    @Test
    public void testScalarCondition() {
        SymbolTable<Void> refined = table.updateBounds(true,
                leq0(minus(N, intValue(10))), SrcLoc.NONE);
        assertEquals(intValue(10), refined.lookupRange(n.getName()).getUpper());
    }

    @Test
    public void testStrictComparison() {
        // n < m gives n <= m - 1
        Var c = compare(BinaryOperator.LESS, new Var(m), new Var(n));
        SymbolTable<Void> refined = table.updateBounds(true, c);
        // m is the newer name, so it is solved for.
        assertEquals(minus(N, intValue(1)),
                     refined.lookupRange(m.getName()).getUpper());
        assertEquals(Range.UNKNOWN, refined.lookupRange(n.getName()));
    }

    @Test
    public void testConjunction() {
        SymbolTable<Void> refined = table.updateBounds(true,
                and(leq0(minus(N, intValue(10))), leq0(neg(N))), SrcLoc.NONE);
        Range r = refined.lookupRange(n.getName());
        assertEquals(intValue(0), r.getLower());
        assertEquals(intValue(10), r.getUpper());
    }

    @Test
    public void testDisjunctionGivesNothing() {
        SymbolTable<Void> refined = table.updateBounds(true,
                or(lth0(N), lth0(M)), SrcLoc.NONE);
        assertEquals(table, refined);
        refined = table.updateBounds(false,
                and(lth0(N), lth0(M)), SrcLoc.NONE);
        assertEquals(table, refined);
    }

    @Test
    public void testNonUnitCoefficientGivesNothing() {
        SymbolTable<Void> refined = table.updateBounds(true,
                leq0(minus(times(intValue(2), N), intValue(10))), SrcLoc.NONE);
        assertEquals(table, refined);
    }

    @Test
    public void testUntranslatableCondition() {
        Ident c = names.newIdent("c", Type.basic(BasicType.BOOL));
        Exp call = new Apply("p", Collections.<SubExp>singletonList(
                new Var(n)), Type.basic(BasicType.BOOL));
        table = table.insertBinding(new Binding(c, call));
        assertEquals(table, table.updateBounds(true, new Var(c)));
        assertEquals(table, table.updateBounds(false, new Var(c)));
        Ident arr = names.newIdent("arr",
                Type.array(BasicType.BOOL, Constant.intConst(2)));
        assertSame(table, table.updateBounds(true, new Var(arr)));
    }

    @Test
    public void testBoundsAreMerged() throws SimplifyException {
        table = table.setUpperBound(n.getName(), intValue(20))
                .setLowerBound(n.getName(), intValue(5));
        Var c = compare(BinaryOperator.LEQ, new Var(n), Constant.intConst(10));
        SymbolTable<Void> refined = table.updateBounds(true, c);
        ScalExp upper = refined.lookupRange(n.getName()).getUpper();
        assertEquals(min(intValue(20), intValue(10)), upper);
        assertEquals(intValue(10), simplified(upper));
        assertEquals(intValue(5), refined.lookupRange(n.getName()).getLower());
    }

    @Test
    public void testRefinementNeverWidens() throws SimplifyException {
        table = table.setUpperBound(n.getName(), intValue(3));
        Var c = compare(BinaryOperator.LEQ, new Var(n), Constant.intConst(10));
        SymbolTable<Void> refined = table.updateBounds(true, c);
        ScalExp upper = refined.lookupRange(n.getName()).getUpper();
        // n <= 10 already follows from n <= 3.
        assertEquals(intValue(3), simplified(upper));
    }

    @Test
    public void testLoopVariableBound() {
        Ident i = names.newIdent("i", Type.basic(BasicType.INT));
        table = table.deepen().insertLoopVariable(i.getName(), new Var(n));
        Var c = compare(BinaryOperator.LESS, new Var(i), Constant.intConst(5));
        SymbolTable<Void> refined = table.updateBounds(true, c);
        assertEquals(min(minus(N, one), intValue(4)),
                     refined.lookupRange(i.getName()).getUpper());
        assertEquals(zero, refined.lookupRange(i.getName()).getLower());
    }

    @Test
    public void testEqualityGivesBothBounds() {
        Var c = compare(BinaryOperator.EQUAL, new Var(n), Constant.intConst(4));
        Range r = table.updateBounds(true, c).lookupRange(n.getName());
        assertEquals(intValue(4), r.getLower());
        assertEquals(intValue(4), r.getUpper());
    }

    @Test
    public void testRefinementCanBeDisabled() {
        Driver.setOptionValue("range", "0");
        Var c = compare(BinaryOperator.LEQ, new Var(n), Constant.intConst(10));
        assertSame(table, table.updateBounds(true, c));
    }

    // Six nested loops, each counting up to the variable of the loop around
    // it, under the condition i_1 + ... + i_6 <= 3.
    @Test
    public void testDeepLoopNest() throws SimplifyException {
        SubExp bound = new Var(n);
        List<Ident> vars = new ArrayList<Ident>();
        for (int k = 0; k < 6; k++) {
            Ident i = names.newIdent("i", Type.basic(BasicType.INT));
            table = table.deepen().insertLoopVariable(i.getName(), bound);
            bound = new Var(i);
            vars.add(i);
        }
        ScalExp outer = new ScalId(vars.get(0));
        for (int k = 1; k < 5; k++) {
            outer = plus(outer, new ScalId(vars.get(k)));
        }
        ScalExp inner = new ScalId(vars.get(5));
        SymbolTable<Void> refined = table.updateBounds(true,
                leq0(minus(plus(outer, inner), intValue(3))), SrcLoc.NONE);

        assertNotSame(table, refined);
        VName name = vars.get(5).getName();
        assertEquals(min(table.lookupRange(name).getUpper(),
                         simplified(minus(intValue(3), outer))),
                     refined.lookupRange(name).getUpper());
    }
}
