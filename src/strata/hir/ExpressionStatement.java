package strata.hir;

import java.io.PrintWriter;

/**
* Represents a statement made of one expression: an assignment, or a
* subroutine call when the expression is a {@link FunctionCall}.
*/
public class ExpressionStatement extends Statement {

    /**
    * Creates a statement from the given expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ExpressionStatement(Expression expr) {
        super(1);
        addChild(expr);
    }

    @Override
    public ExpressionStatement clone() {
        return (ExpressionStatement)super.clone();
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    protected void printStatement(PrintWriter o) {
        if (getExpression() instanceof FunctionCall) {
            o.print("CALL ");
        }
        getExpression().print(o);
    }

}
