package strata.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
* Base class for all expressions. Every child of an expression is an
* expression. Expressions are values: two expressions are equal when they
* print the same way up to the case of names, which is also what the hash
* code is computed from.
*/
public abstract class Expression implements Cloneable, Traversable {

    private static final List<Traversable> NO_CHILDREN =
            Collections.emptyList();

    protected Traversable parent;

    protected List<Traversable> children;

    protected Expression() {
        this(1);
    }

    /**
    * @param size the expected number of children; a negative size makes a
    *   leaf expression.
    */
    protected Expression(int size) {
        parent = null;
        children = (size < 0) ? NO_CHILDREN
                              : new ArrayList<Traversable>(size);
    }

    /** Returns a deep copy without a parent. */
    @Override
    public Expression clone() {
        Expression o;
        try {
            o = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError(e.getMessage());
        }
        o.parent = null;
        if (children != NO_CHILDREN) {
            o.children = new ArrayList<Traversable>(children.size());
            for (Traversable child : children) {
                Expression copy = ((Expression)child).clone();
                copy.parent = o;
                o.children.add(copy);
            }
        }
        return o;
    }

    /**
    * Checks the class and the children. Subclasses with fields of their own
    * compare them after calling this method.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    @Override
    public int hashCode() {
        return toString().toLowerCase(Locale.ROOT).hashCode();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Expressions have a fixed arity.
    * @throws UnsupportedOperationException always.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(getClass().getSimpleName() +
                " has a fixed number of operands");
    }

    /**
    * Replaces the operand at the given position.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    * @throws IllegalArgumentException if <b>t</b> is not an expression or
    *   the position is out of range.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        if (!(t instanceof Expression) || index < 0 ||
            index >= children.size()) {
            throw new IllegalArgumentException("invalid operand at " + index);
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * Exchanges the places of this expression and <var>expr</var> in their
    * parents. The usual use is replacing a node of the tree by an orphan
    * replacement, after which this expression is the orphan.
    *
    * @throws IllegalArgumentException if <var>expr</var> is null.
    * @throws IllegalStateException if a parent does not list its child.
    */
    public void swapWith(Expression expr) {
        if (expr == null) {
            throw new IllegalArgumentException("null replacement");
        }
        if (expr == this) {
            return;
        }
        Traversable my_parent = parent;
        Traversable other_parent = expr.parent;
        int my_index = indexIn(my_parent, this);
        int other_index = indexIn(other_parent, expr);
        parent = null;
        expr.parent = null;
        if (my_parent != null) {
            my_parent.getChildren().set(my_index, expr);
            expr.setParent(my_parent);
        }
        if (other_parent != null) {
            other_parent.getChildren().set(other_index, this);
            setParent(other_parent);
        }
    }

    private static int indexIn(Traversable parent, Expression e) {
        if (parent == null) {
            return -1;
        }
        int ret = Tools.identityIndexOf(parent.getChildren(), e);
        if (ret < 0) {
            throw new IllegalStateException(e + " is not listed by its parent");
        }
        return ret;
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        PrintWriter o = new PrintWriter(sw);
        print(o);
        o.flush();
        return sw.toString();
    }

    /**
    * Appends an operand.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /** Prints an operand, in parentheses if <var>parens</var> is set. */
    protected static void printChild(Expression e, boolean parens,
                                     PrintWriter o) {
        if (parens) {
            o.print("(");
        }
        e.print(o);
        if (parens) {
            o.print(")");
        }
    }

}
