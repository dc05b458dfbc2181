package strata.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all statements. A statement owns its child statements and
* expressions and the annotations attached to it; the annotations print on
* their own lines before the statement. Statements compare by identity.
*/
public abstract class Statement implements Cloneable, Annotatable {

    private static final List<Traversable> NO_CHILDREN =
            Collections.emptyList();

    protected Traversable parent;

    protected List<Traversable> children;

    /** Attached annotations; null until the first one is attached. */
    protected List<Annotation> annotations;

    protected Statement() {
        this(1);
    }

    /**
    * @param size the expected number of children; a negative size makes a
    *   statement that never has children.
    */
    protected Statement(int size) {
        parent = null;
        children = (size < 0) ? NO_CHILDREN
                              : new ArrayList<Traversable>(size);
        annotations = null;
    }

    /**
    * Returns a deep copy without a parent. Child nodes and annotations are
    * copied as well.
    */
    @Override
    public Statement clone() {
        Statement o;
        try {
            o = (Statement)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError(e.getMessage());
        }
        o.parent = null;
        if (children != NO_CHILDREN) {
            o.children = new ArrayList<Traversable>(children.size());
            for (Traversable child : children) {
                Traversable copy = copyChild(child);
                copy.setParent(o);
                o.children.add(copy);
            }
        }
        o.annotations = null;
        if (annotations != null) {
            for (Annotation note : annotations) {
                o.annotate(note.clone());
            }
        }
        return o;
    }

    private Traversable copyChild(Traversable child) {
        if (child instanceof Statement) {
            return ((Statement)child).clone();
        } else if (child instanceof Expression) {
            return ((Expression)child).clone();
        }
        throw new InternalError("unexpected child " +
                child.getClass().getName() + " of " + getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    /** Removes this statement from its parent, if any. */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
            parent = null;
        }
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

    public void print(PrintWriter o) {
        if (annotations != null && !annotations.isEmpty()) {
            o.print(Tools.listToString(annotations, PrintTools.line_sep));
            if (this instanceof AnnotationStatement) {
                return;
            }
            o.println();
        }
        printStatement(o);
    }

    /** Prints the statement without its annotations. */
    protected abstract void printStatement(PrintWriter o);

    /**
    * Statements with a fixed layout do not support removal of a child.
    * @throws UnsupportedOperationException always, unless overridden.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(getClass().getSimpleName() +
                " does not support removal of its children");
    }

    /**
    * Replaces the child at the given position; the old child loses its
    * parent.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException("invalid child at " + index);
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        Traversable old = children.get(index);
        if (old != null) {
            old.setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    protected void addChild(Traversable t) {
        addChild(children.size(), t);
    }

    /**
    * Inserts a child at the given position.
    * @throws IllegalArgumentException if <b>t</b> is null or the position is
    *   out of range.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child at " + index);
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(index, t);
        t.setParent(this);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        PrintWriter o = new PrintWriter(sw);
        print(o);
        o.flush();
        return sw.toString();
    }

    public void annotate(Annotation annotation) {
        annotation.attach(this);
        if (annotations == null) {
            annotations = new ArrayList<Annotation>(1);
        }
        annotations.add(annotation);
    }

    public List<Annotation> getAnnotations() {
        if (annotations == null) {
            annotations = new ArrayList<Annotation>(1);
        }
        return annotations;
    }

    @SuppressWarnings("unchecked")
    public <T extends Annotation> List<T> getAnnotations(Class<T> type) {
        List<T> ret = new ArrayList<T>(1);
        if (annotations != null) {
            for (Annotation note : annotations) {
                if (type.isInstance(note)) {
                    ret.add((T)note);
                }
            }
        }
        return ret;
    }

}
