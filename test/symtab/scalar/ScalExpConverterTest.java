package symtab.scalar;

import org.junit.Before;
import org.junit.Test;
import symtab.hir.*;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class ScalExpConverterTest {

    private Ident x, y, p, arr;
    private Var X, Y, P;

    @Before
    public void setUp() {
        NameSource names = new NameSource();
        x = names.newIdent("x", Type.basic(BasicType.INT));
        y = names.newIdent("y", Type.basic(BasicType.INT));
        p = names.newIdent("p", Type.basic(BasicType.BOOL));
        arr = names.newIdent("arr",
                Type.array(BasicType.INT, Constant.intConst(10)));
        X = new Var(x);
        Y = new Var(y);
        P = new Var(p);
    }

    private static ScalExp convert(Exp e) {
        return ScalExpConverter.toScalExp(null, e);
    }

    @Test
    public void testOperands() {
        assertEquals(new ScalId(x), convert(new SubExpression(X)));
        assertEquals(ScalTools.intValue(4),
                     convert(new SubExpression(Constant.intConst(4))));
        assertNull(convert(new SubExpression(new Var(arr))));
    }

    @Test
    public void testArithmetic() {
        Exp sum = new BinOp(BinaryOperator.PLUS, X, Y, BasicType.INT);
        assertEquals(ScalTools.plus(new ScalId(x), new ScalId(y)),
                     convert(sum));
        Exp mod = new BinOp(BinaryOperator.MOD, X, Y, BasicType.INT);
        assertNull(convert(mod));
        Exp negate = new Negate(X);
        assertEquals(new ScalNeg(new ScalId(x)), convert(negate));
    }

    @Test
    public void testComparisons() {
        ScalExp diff = new ScalBinary(ScalOperator.MINUS, new ScalId(x),
                                      new ScalId(y));
        assertEquals(new RelExp(RelOp0.LTH0, diff), convert(
                new BinOp(BinaryOperator.LESS, X, Y, BasicType.BOOL)));
        assertEquals(new RelExp(RelOp0.LEQ0, diff), convert(
                new BinOp(BinaryOperator.LEQ, X, Y, BasicType.BOOL)));
        ScalExp eq = convert(
                new BinOp(BinaryOperator.EQUAL, X, Y, BasicType.BOOL));
        assertTrue(eq instanceof ScalBinary);
        assertEquals(ScalOperator.LOG_AND, ((ScalBinary)eq).getOperator());
    }

    @Test
    public void testLogic() {
        assertEquals(new ScalNot(new ScalId(p)), convert(new Not(P)));
        assertEquals(ScalTools.or(new ScalId(p), ScalTools.logValue(true)),
                convert(new BinOp(BinaryOperator.LOG_OR, P,
                                  new Constant(LogValue.TRUE),
                                  BasicType.BOOL)));
        // Logical operators on integers have no scalar form.
        assertNull(convert(
                new BinOp(BinaryOperator.LOG_AND, X, Y, BasicType.BOOL)));
    }

    @Test
    public void testUntranslatable() {
        Exp call = new Apply("f", Collections.<SubExp>singletonList(X),
                             Type.basic(BasicType.INT));
        assertNull(convert(call));
        Exp real = new BinOp(BinaryOperator.PLUS,
                             new Constant(new RealValue(1.0)),
                             new Constant(new RealValue(2.0)),
                             BasicType.REAL);
        assertNull(convert(real));
        Exp index = new Index(arr, Arrays.<SubExp>asList(X));
        assertNull(convert(index));
    }

    @Test
    public void testLookupInlinesDefinitions() {
        final ScalExp def = ScalTools.plus(new ScalId(y), ScalTools.one);
        ScalExpLookup lookup = new ScalExpLookup() {
            public ScalExp lookupScalExp(VName name) {
                return (name.equals(x.getName())) ? def : null;
            }
        };
        Exp e = new BinOp(BinaryOperator.TIMES, X, Y, BasicType.INT);
        assertEquals(ScalTools.times(def, new ScalId(y)),
                     ScalExpConverter.toScalExp(lookup, e));
    }
}
