package strata.hir;

import java.io.PrintWriter;

/**
* <code>lhs = rhs</code>. Only appears as the expression of an
* {@link ExpressionStatement}.
*/
public class AssignmentExpression extends Expression {

    /** @throws NotAnOrphanException if a side is already in a tree. */
    public AssignmentExpression(Expression lhs, Expression rhs) {
        super(2);
        addChild(lhs);
        addChild(rhs);
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    /** The assigned reference. */
    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        getLHS().print(o);
        o.print(" = ");
        getRHS().print(o);
    }

}
