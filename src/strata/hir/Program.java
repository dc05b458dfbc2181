package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Root of the IR: one top-level procedure per input file, whose names live in
* a shared outermost scope.
*/
public class Program implements Traversable {

    private List<Traversable> children;

    private Scope global_scope;

    public Program() {
        children = new ArrayList<Traversable>();
        global_scope = new Scope(null);
    }

    /** Returns the scope holding the names of the top-level procedures. */
    public Scope getScope() {
        return global_scope;
    }

    /**
    * Appends a top-level procedure.
    * @throws NotAnOrphanException if the procedure has a parent.
    */
    public void addProcedure(Procedure proc) {
        if (proc.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(proc);
        proc.setParent(this);
    }

    /** Returns the top-level procedures. */
    public List<Procedure> getProcedures() {
        List<Procedure> ret = new ArrayList<Procedure>(children.size());
        for (Traversable t : children) {
            ret.add((Procedure)t);
        }
        return ret;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return null;
    }

    public void removeChild(Traversable child) {
        if (!children.remove(child)) {
            throw new NotAChildException(child + " is not in the program");
        }
        child.setParent(null);
    }

    /** Procedures are added and removed, never replaced in place. */
    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException("use addProcedure");
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException("the program is the root");
    }

    /** Procedures separated by a blank line. */
    public void print(PrintWriter o) {
        for (Traversable proc : children) {
            proc.print(o);
            o.println();
            o.println();
        }
    }

}
