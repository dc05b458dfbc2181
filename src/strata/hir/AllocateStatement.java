package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents <code>ALLOCATE(a(n), b(m)[, SOURCE=src])</code>. The allocated
* variables carry the allocated extents as subscripts; the optional data
* source is the last child.
*/
public class AllocateStatement extends Statement {

    private boolean has_source;

    /**
    * Creates an allocation.
    * @param vars the allocated variables.
    * @param data_source the variable whose shape and value are copied, or
    *   null.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public AllocateStatement(List<Variable> vars, Expression data_source) {
        super(vars.size() + 1);
        for (Variable var : vars) {
            addChild(var);
        }
        has_source = (data_source != null);
        if (data_source != null) {
            addChild(data_source);
        }
    }

    @Override
    public AllocateStatement clone() {
        return (AllocateStatement)super.clone();
    }

    /** Returns the allocated variables. */
    public List<Variable> getVariables() {
        int n = has_source ? children.size() - 1 : children.size();
        List<Variable> ret = new ArrayList<Variable>(n);
        for (int i = 0; i < n; i++) {
            ret.add((Variable)children.get(i));
        }
        return ret;
    }

    /** Returns the data source, or null. */
    public Expression getDataSource() {
        return has_source ? (Expression)children.get(children.size() - 1)
                          : null;
    }

    protected void printStatement(PrintWriter o) {
        o.print("ALLOCATE(");
        o.print(Tools.listToString(getVariables(), ", "));
        if (has_source) {
            o.print(", SOURCE=");
            getDataSource().print(o);
        }
        o.print(")");
    }

}
