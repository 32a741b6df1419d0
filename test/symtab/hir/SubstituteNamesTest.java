package symtab.hir;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class SubstituteNamesTest {

    private final NameSource names = new NameSource();

    private Ident intIdent(String base) {
        return names.newIdent(base, Type.basic(BasicType.INT));
    }

    @Test
    public void testFreshNames() {
        VName x = names.newName("x");
        VName y = names.newName(x);
        assertEquals("x", y.getBaseName());
        assertFalse(x.equals(y));
        assertTrue(x.compareTo(y) < 0);
    }

    @Test
    public void testBindingRenamed() {
        Ident n = intIdent("n");
        Ident a = names.newIdent("a", Type.array(BasicType.INT, new Var(n)));
        Ident i = intIdent("i");
        Ident x = intIdent("x");
        Binding b = new Binding(x, new Index(a, Arrays.<SubExp>asList(new Var(i))));

        VName j = names.newName("j");
        Map<VName, VName> substs = new HashMap<VName, VName>();
        substs.put(i.getName(), j);
        Binding renamed = b.substituteNames(substs);

        Index index = (Index)renamed.getExp();
        assertEquals(j, ((Var)index.getIndices().get(0)).getName());
        assertEquals(a, index.getArray());
        assertEquals(x, renamed.getPattern().get(0));
    }

    @Test
    public void testUnmentionedNamesUnchanged() {
        Ident i = intIdent("i");
        SubExp e = new Var(i);
        assertEquals(e, e.substituteNames(Collections.<VName, VName>emptyMap()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyPatternRejected() {
        new Binding(Collections.<Ident>emptyList(), new Iota(Constant.intConst(3)));
    }
}
