package strata.hir;

import java.io.PrintWriter;

/** A sign or <code>.NOT.</code> applied to one operand. */
public class UnaryExpression extends Expression {

    protected UnaryOperator op;

    /** @throws NotAnOrphanException if <b>expr</b> is already in a tree. */
    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        this.op = op;
        addChild(expr);
    }

    @Override
    public UnaryExpression clone() {
        return (UnaryExpression)super.clone();
    }

    public void print(PrintWriter o) {
        op.print(o);
        Expression expr = getExpression();
        printChild(expr, BinaryExpression.precedenceOf(expr) <=
                op.getPrecedence(), o);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public UnaryOperator getOperator() {
        return op;
    }

}
