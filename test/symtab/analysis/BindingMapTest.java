package symtab.analysis;

import org.junit.Test;
import symtab.hir.NameSource;
import symtab.hir.VName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class BindingMapTest {

    private final NameSource names = new NameSource();

    @Test
    public void testVersionsAreIndependent() {
        VName x = names.newName("x");
        BindingMap<String> m0 = BindingMap.empty();
        BindingMap<String> m1 = m0.put(x, "one");
        BindingMap<String> m2 = m1.put(x, "two");
        assertNull(m0.get(x));
        assertEquals("one", m1.get(x));
        assertEquals("two", m2.get(x));
        assertEquals(1, m2.size());
    }

    @Test
    public void testLongChains() {
        List<VName> keys = new ArrayList<VName>();
        List<BindingMap<Integer>> versions =
                new ArrayList<BindingMap<Integer>>();
        BindingMap<Integer> m = BindingMap.empty();
        for (int i = 0; i < 30; i++) {
            VName key = names.newName("v");
            keys.add(key);
            m = m.put(key, i);
            versions.add(m);
        }
        for (int i = 0; i < versions.size(); i++) {
            BindingMap<Integer> version = versions.get(i);
            assertEquals(i + 1, version.size());
            assertEquals(i + 1, version.toMap().size());
            assertEquals(Integer.valueOf(i), version.get(keys.get(i)));
            if (i + 1 < keys.size()) {
                assertFalse(version.containsKey(keys.get(i + 1)));
            }
        }
        assertEquals(keys, new ArrayList<VName>(m.toMap().keySet()));
    }

    @Test
    public void testPutAll() {
        VName x = names.newName("x");
        VName y = names.newName("y");
        Map<VName, String> updates = new LinkedHashMap<VName, String>();
        updates.put(x, "a");
        updates.put(y, "b");
        BindingMap<String> m = BindingMap.<String>empty().put(x, "old")
                .putAll(updates);
        assertEquals(2, m.size());
        assertEquals("a", m.get(x));
        assertSame(m, m.putAll(new LinkedHashMap<VName, String>()));
        assertEquals(m, BindingMap.<String>empty().putAll(updates));
    }

    @Test
    public void testInsertionOrderIsNotNameOrder() {
        List<VName> keys = new ArrayList<VName>();
        for (int i = 0; i < 1000; i++) {
            keys.add(names.newName("v"));
        }
        List<VName> inserted = new ArrayList<VName>(keys);
        Collections.reverse(inserted);
        BindingMap<Integer> m = BindingMap.empty();
        for (int i = 0; i < inserted.size(); i++) {
            m = m.put(inserted.get(i), i);
        }
        assertEquals(1000, m.size());
        assertEquals(inserted, new ArrayList<VName>(m.toMap().keySet()));
        for (int i = 0; i < inserted.size(); i++) {
            assertEquals(Integer.valueOf(i), m.get(inserted.get(i)));
        }
        // A replaced value keeps the position of its name.
        BindingMap<Integer> replaced = m.put(inserted.get(0), -1);
        assertEquals(inserted,
                     new ArrayList<VName>(replaced.toMap().keySet()));
        assertEquals(Integer.valueOf(0), m.get(inserted.get(0)));
        assertEquals(Integer.valueOf(-1), replaced.get(inserted.get(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullValue() {
        BindingMap.<String>empty().put(names.newName("x"), null);
    }
}
