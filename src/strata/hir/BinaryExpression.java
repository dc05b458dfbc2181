package strata.hir;

import java.io.PrintWriter;

/**
* Two operands joined by an infix operator. The IR has no parentheses node;
* printing adds them where precedence asks for them.
*/
public class BinaryExpression extends Expression {

    protected BinaryOperator op;

    /** @throws NotAnOrphanException if an operand is already in a tree. */
    public BinaryExpression(Expression lhs, BinaryOperator op, Expression rhs) {
        super(2);
        if (op == null) {
            throw new IllegalArgumentException("null operator");
        }
        this.op = op;
        addChild(lhs);
        addChild(rhs);
    }

    @Override
    public BinaryExpression clone() {
        return (BinaryExpression)super.clone();
    }

    public void print(PrintWriter o) {
        int prec = op.getPrecedence();
        Expression lhs = getLHS(), rhs = getRHS();
        int lprec = precedenceOf(lhs), rprec = precedenceOf(rhs);
        boolean right_sensitive = (op != BinaryOperator.ADD &&
                !op.isLogical());
        printChild(lhs, lprec < prec ||
                (lprec == prec && op == BinaryOperator.POWER), o);
        if (op.isTight()) {
            op.print(o);
        } else {
            o.print(" ");
            op.print(o);
            o.print(" ");
        }
        printChild(rhs, rprec < prec || (rprec == prec && right_sensitive) ||
                isSigned(rhs), o);
    }

    /**
    * Returns the printing precedence of the specified expression. Leaves and
    * calls bind tighter than any operator.
    */
    protected static int precedenceOf(Expression e) {
        if (e instanceof BinaryExpression) {
            return ((BinaryExpression)e).op.getPrecedence();
        } else if (e instanceof UnaryExpression) {
            return ((UnaryExpression)e).getOperator().getPrecedence();
        } else if (isSigned(e)) {
            return UnaryOperator.MINUS.getPrecedence();
        } else {
            return Integer.MAX_VALUE;
        }
    }

    // A signed operand may not follow an operator directly.
    private static boolean isSigned(Expression e) {
        return (e instanceof UnaryExpression ||
                (e instanceof IntegerLiteral &&
                 ((IntegerLiteral)e).getValue() < 0));
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryExpression)o).op);
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

}
