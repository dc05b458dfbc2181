package strata.hir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Pre-order walk over an IR subtree that yields the nodes of one type. The
* children of a node are read only when the walk moves past it, so a caller
* may rewrite the inside of the node it was just handed.
*/
public class DFIterator<E extends Traversable> {

    private final Traversable root;

    private final Class<? extends Traversable> type;

    /** Nodes still to visit, the next one on top. */
    private final Deque<Traversable> pending = new ArrayDeque<Traversable>();

    /** Last returned node; its children are queued on the next look-ahead. */
    private Traversable unexpanded;

    private Traversable next;

    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * @param root the subtree to walk; it is a candidate itself.
    * @param c the type of the nodes returned.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        this.type = c;
        reset();
    }

    /** Restarts the walk at the root. */
    public void reset() {
        pending.clear();
        pending.push(root);
        unexpanded = null;
        next = null;
    }

    public boolean hasNext() {
        if (next == null) {
            next = lookAhead();
        }
        return next != null;
    }

    /**
    * @throws NoSuchElementException when the walk is over.
    */
    @SuppressWarnings("unchecked")
    public E next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        unexpanded = next;
        next = null;
        return ret;
    }

    private Traversable lookAhead() {
        while (true) {
            if (unexpanded != null) {
                queueChildren(unexpanded);
                unexpanded = null;
            }
            if (pending.isEmpty()) {
                return null;
            }
            Traversable t = pending.pop();
            if (type.isInstance(t)) {
                return t;
            }
            unexpanded = t;
        }
    }

    private void queueChildren(Traversable t) {
        List<Traversable> children = t.getChildren();
        if (children == null) {
            return;
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i) != null) {
                pending.push(children.get(i));
            }
        }
    }

    /** Collects the remaining walk from the root into a list. */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        reset();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

}
