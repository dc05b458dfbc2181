package strata.hir;

import java.io.PrintWriter;

/**
* Represents a counted loop <code>DO index = start, stop[, step]</code>.
* The children are the index variable, the bounds and the body.
*/
public class DoLoop extends Statement {

    /**
    * Creates a loop.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public DoLoop(Variable index, RangeExpression bounds,
                  CompoundStatement body) {
        super(3);
        addChild(index);
        addChild(bounds);
        addChild(body);
    }

    @Override
    public DoLoop clone() {
        return (DoLoop)super.clone();
    }

    public Variable getVariable() {
        return (Variable)children.get(0);
    }

    public RangeExpression getBounds() {
        return (RangeExpression)children.get(1);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(2);
    }

    protected void printStatement(PrintWriter o) {
        RangeExpression bounds = getBounds();
        o.print("DO ");
        getVariable().print(o);
        o.print(" = ");
        bounds.getStart().print(o);
        o.print(", ");
        bounds.getStop().print(o);
        if (bounds.getStep() != null) {
            o.print(", ");
            bounds.getStep().print(o);
        }
        o.println();
        if (!getBody().isEmpty()) {
            getBody().print(o);
            o.println();
        }
        o.print("END DO");
    }

}
