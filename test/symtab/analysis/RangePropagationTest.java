package symtab.analysis;

import org.junit.Before;
import org.junit.Test;
import symtab.hir.*;
import symtab.scalar.ScalId;
import symtab.scalar.ScalTools;

import java.util.*;

import static org.junit.Assert.*;

public class RangePropagationTest {

    private NameSource names;
    private Ident n, k, a;

    // Bindings of interest in the test program
    private Binding loop_index, out_of_bounds, guarded_index, unguarded_index,
            lambda_index;

    private Program program;

    @Before
    public void setUp() {
        names = new NameSource();
        n = intIdent("n");
        k = intIdent("k");
        a = names.newIdent("a", Type.array(BasicType.INT, new Var(n)));
        program = new Program(Arrays.asList(new FunDec("f",
                Arrays.asList(n, a, k), buildBody())));
    }

    private Ident intIdent(String base) {
        return names.newIdent(base, Type.basic(BasicType.INT));
    }

    private Ident boolIdent(String base) {
        return names.newIdent(base, Type.basic(BasicType.BOOL));
    }

    private Binding index(Ident result, Ident array, SubExp i) {
        return new Binding(result,
                           new Index(array, Arrays.asList(i)));
    }

    private static Body body(Binding... bindings) {
        return new Body(Arrays.asList(bindings),
                        Collections.<SubExp>emptyList());
    }

    // f(n, a: [n]int, k) =
    //   res = loop (acc = 0) for i < n do x = a[i]
    //   y = a[n]
    //   c = 0 <= k && k < n
    //   r = if c then z = a[k] else w = a[k]
    //   idx = iota(n)
    //   mapped = map (\j -> v = a[j]) idx
    private Body buildBody() {
        Ident i = intIdent("i");
        loop_index = index(intIdent("x"), a, new Var(i));
        Ident acc = intIdent("acc");
        Binding loop = new Binding(intIdent("res"),
                new DoLoop(Arrays.asList(acc),
                           Arrays.<SubExp>asList(Constant.intConst(0)), i,
                           new Var(n), new Body(Arrays.asList(loop_index),
                           Arrays.<SubExp>asList(new Var(acc)))));

        out_of_bounds = index(intIdent("y"), a, new Var(n));

        Ident c1 = boolIdent("c1");
        Ident c2 = boolIdent("c2");
        Ident c = boolIdent("c");
        Binding lower = new Binding(c1, new BinOp(BinaryOperator.LEQ,
                Constant.intConst(0), new Var(k), BasicType.BOOL));
        Binding upper = new Binding(c2, new BinOp(BinaryOperator.LESS,
                new Var(k), new Var(n), BasicType.BOOL));
        Binding both = new Binding(c, new BinOp(BinaryOperator.LOG_AND,
                new Var(c1), new Var(c2), BasicType.BOOL));
        guarded_index = index(intIdent("z"), a, new Var(k));
        unguarded_index = index(intIdent("w"), a, new Var(k));
        Binding branch = new Binding(intIdent("r"),
                new If(new Var(c), body(guarded_index),
                       body(unguarded_index)));

        Ident idx = names.newIdent("idx",
                Type.array(BasicType.INT, new Var(n)));
        Binding iota = new Binding(idx, new Iota(new Var(n)));
        Ident j = intIdent("j");
        lambda_index = index(intIdent("v"), a, new Var(j));
        Ident mapped = names.newIdent("mapped",
                Type.array(BasicType.INT, new Var(n)));
        Binding map = new Binding(mapped, new ArrayMap(
                new Lambda(Arrays.asList(j), body(lambda_index)),
                Arrays.<SubExp>asList(new Var(idx))));

        return body(loop, out_of_bounds, lower, upper, both, branch, iota,
                    map);
    }

    private RangePropagation runPass() {
        RangePropagation pass = new RangePropagation(program);
        AnalysisPass.run(pass);
        return pass;
    }

    @Test
    public void testSafeIndexings() {
        RangePropagation pass = runPass();
        assertEquals(Arrays.asList(loop_index, guarded_index, lambda_index),
                     pass.getSafeIndexings());
    }

    @Test
    public void testTablesPerBinding() {
        RangePropagation pass = runPass();
        assertEquals(12, pass.getBindings().size());

        SymbolTable<Void> in_loop = pass.getTable(loop_index);
        assertEquals(1, in_loop.depth());
        assertEquals(ScalTools.zero,
                     in_loop.lookupRange(n.getName()).getLower());

        SymbolTable<Void> guarded = pass.getTable(guarded_index);
        Range r = guarded.lookupRange(k.getName());
        assertEquals(ScalTools.zero, r.getLower());
        assertEquals(ScalTools.minus(new ScalId(n), ScalTools.one),
                     r.getUpper());

        SymbolTable<Void> unguarded = pass.getTable(unguarded_index);
        assertEquals(Range.UNKNOWN, unguarded.lookupRange(k.getName()));
    }

    @Test
    public void testUnknownBinding() {
        RangePropagation pass = runPass();
        Binding other = index(intIdent("u"), a, Constant.intConst(0));
        assertNull(pass.getTable(other));
    }

    @Test
    public void testRerunResetsResults() {
        RangePropagation pass = runPass();
        pass.start();
        assertEquals(3, pass.getSafeIndexings().size());
        assertEquals("[RangePropagation]", pass.getPassName());
    }

    @Test
    public void testConstantIndexIntoConstantSize() {
        Ident b = names.newIdent("b",
                Type.array(BasicType.INT, Constant.intConst(4)));
        Binding inside = index(intIdent("p"), b, Constant.intConst(3));
        Binding outside = index(intIdent("q"), b, Constant.intConst(4));
        Program small = new Program(Arrays.asList(new FunDec("g",
                Arrays.asList(b), body(inside, outside))));
        RangePropagation pass = new RangePropagation(small);
        AnalysisPass.run(pass);
        assertEquals(Arrays.asList(inside), pass.getSafeIndexings());
    }
}
