package symtab.analysis;

import symtab.hir.VName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* Persistent map from variable names to table entries, kept as a balanced
* (AVL) search tree ordered by name. An update copies only the nodes on the
* path to the updated name and shares the rest of the tree with the map it
* was applied to, so every earlier version stays valid and an update or a
* lookup costs a logarithmic number of steps.
* <p>
* Every name also remembers when it was first inserted, which gives the
* iteration order of {@link #toMap}.
*
* @param <V> the value type.
*/
final class BindingMap<V> {

    private final Node<V> root;

    // Insertion stamp of the next new name
    private final long next_seq;

    private BindingMap(Node<V> root, long next_seq) {
        this.root = root;
        this.next_seq = next_seq;
    }

    /** Returns the empty map. */
    static <V> BindingMap<V> empty() {
        return new BindingMap<V>(null, 0);
    }

    /** Returns the value of the given name, or null. */
    V get(VName name) {
        Node<V> node = root;
        while (node != null) {
            int cmp = name.compareTo(node.key);
            if (cmp == 0) {
                return node.value;
            }
            node = (cmp < 0) ? node.left : node.right;
        }
        return null;
    }

    boolean containsKey(VName name) {
        return (get(name) != null);
    }

    int size() {
        return size(root);
    }

    /** Returns the map extended with the single given binding. */
    BindingMap<V> put(VName name, V value) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("null binding " + name + "=" +
                                               value);
        }
        return new BindingMap<V>(insert(root, name, value, next_seq),
                                 next_seq + 1);
    }

    /**
    * Returns the map extended with the given bindings; the bindings replace
    * earlier values of the same names.
    */
    BindingMap<V> putAll(Map<VName, V> updates) {
        if (updates.isEmpty()) {
            return this;
        }
        for (Map.Entry<VName, V> update : updates.entrySet()) {
            if (update.getKey() == null || update.getValue() == null) {
                throw new IllegalArgumentException("null binding " + update);
            }
        }
        Node<V> ret = root;
        long seq = next_seq;
        for (Map.Entry<VName, V> update : updates.entrySet()) {
            ret = insert(ret, update.getKey(), update.getValue(), seq++);
        }
        return new BindingMap<V>(ret, seq);
    }

    /**
    * Returns a fresh mutable map holding the current value of every name, in
    * order of first insertion.
    */
    Map<VName, V> toMap() {
        List<Node<V>> nodes = new ArrayList<Node<V>>(size());
        collect(root, nodes);
        Collections.sort(nodes, new Comparator<Node<V>>() {
            public int compare(Node<V> n1, Node<V> n2) {
                return (n1.seq < n2.seq) ? -1 : ((n1.seq == n2.seq) ? 0 : 1);
            }
        });
        Map<VName, V> ret = new LinkedHashMap<VName, V>();
        for (Node<V> node : nodes) {
            ret.put(node.key, node.value);
        }
        return ret;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof BindingMap &&
                toMap().equals(((BindingMap<?>)o).toMap()));
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    /*==================================================================*/
    /* AVL tree                                                         */
    /*==================================================================*/

    private static final class Node<V> {

        private final VName key;

        private final V value;

        private final long seq;

        private final Node<V> left;

        private final Node<V> right;

        private final int height;

        private final int size;

        Node(VName key, V value, long seq, Node<V> left, Node<V> right) {
            this.key = key;
            this.value = value;
            this.seq = seq;
            this.left = left;
            this.right = right;
            this.height = Math.max(height(left), height(right)) + 1;
            this.size = size(left) + size(right) + 1;
        }

        Node<V> with(Node<V> new_left, Node<V> new_right) {
            return new Node<V>(key, value, seq, new_left, new_right);
        }
    }

    private static int height(Node<?> node) {
        return (node == null) ? 0 : node.height;
    }

    private static int size(Node<?> node) {
        return (node == null) ? 0 : node.size;
    }

    // A name that is already present keeps its insertion stamp.
    private static <V> Node<V> insert(Node<V> node, VName key, V value,
                                      long seq) {
        if (node == null) {
            return new Node<V>(key, value, seq, null, null);
        }
        int cmp = key.compareTo(node.key);
        if (cmp == 0) {
            return new Node<V>(key, value, node.seq, node.left, node.right);
        } else if (cmp < 0) {
            return balance(node.with(insert(node.left, key, value, seq),
                                     node.right));
        } else {
            return balance(node.with(node.left,
                                     insert(node.right, key, value, seq)));
        }
    }

    private static <V> Node<V> balance(Node<V> node) {
        int diff = height(node.left) - height(node.right);
        if (diff > 1) {
            Node<V> l = node.left;
            if (height(l.left) < height(l.right)) {
                l = rotateLeft(l);
            }
            return rotateRight(node.with(l, node.right));
        } else if (diff < -1) {
            Node<V> r = node.right;
            if (height(r.right) < height(r.left)) {
                r = rotateRight(r);
            }
            return rotateLeft(node.with(node.left, r));
        }
        return node;
    }

    private static <V> Node<V> rotateRight(Node<V> node) {
        Node<V> l = node.left;
        return l.with(l.left, node.with(l.right, node.right));
    }

    private static <V> Node<V> rotateLeft(Node<V> node) {
        Node<V> r = node.right;
        return r.with(node.with(node.left, r.left), r.right);
    }

    private static <V> void collect(Node<V> node, List<Node<V>> ret) {
        if (node != null) {
            collect(node.left, ret);
            ret.add(node);
            collect(node.right, ret);
        }
    }
}
