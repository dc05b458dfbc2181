package strata.hir;

import java.io.PrintWriter;

/**
* Represents a range <code>start:stop[:step]</code>. It is used for loop
* bounds as well as for array section subscripts. An omitted bound of a
* section is a {@link DeferredExtent}.
*/
public class RangeExpression extends Expression {

    /**
    * Creates a range with unit step.
    * @throws NotAnOrphanException if a bound has a parent.
    */
    public RangeExpression(Expression start, Expression stop) {
        this(start, stop, null);
    }

    /**
    * Creates a range with the given step; a null step means unit step.
    * @throws NotAnOrphanException if a bound has a parent.
    */
    public RangeExpression(Expression start, Expression stop, Expression step) {
        super(3);
        addChild(start);
        addChild(stop);
        if (step != null) {
            addChild(step);
        }
    }

    @Override
    public RangeExpression clone() {
        return (RangeExpression)super.clone();
    }

    public void print(PrintWriter o) {
        printBound(getStart(), o);
        o.print(":");
        printBound(getStop(), o);
        if (getStep() != null) {
            o.print(":");
            getStep().print(o);
        }
    }

    private static void printBound(Expression e, PrintWriter o) {
        if (!(e instanceof DeferredExtent)) {
            e.print(o);
        }
    }

    public Expression getStart() {
        return (Expression)children.get(0);
    }

    public Expression getStop() {
        return (Expression)children.get(1);
    }

    /** Returns the step, or null if the range has the implicit unit step. */
    public Expression getStep() {
        return (children.size() > 2) ? (Expression)children.get(2) : null;
    }

    /**
    * Checks if the step of this range is absent or the literal 1.
    */
    public boolean hasUnitStep() {
        Expression step = getStep();
        return (step == null || (step instanceof IntegerLiteral &&
                ((IntegerLiteral)step).getValue() == 1));
    }

}
