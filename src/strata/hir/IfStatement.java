package strata.hir;

import java.io.PrintWriter;

/**
* Represents a block conditional with an optional else part.
*/
public class IfStatement extends Statement {

    /**
    * Creates a conditional without an else part.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, CompoundStatement then_stmt) {
        this(condition, then_stmt, null);
    }

    /**
    * Creates a conditional.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, CompoundStatement then_stmt,
                       CompoundStatement else_stmt) {
        super(3);
        addChild(condition);
        addChild(then_stmt);
        if (else_stmt != null) {
            addChild(else_stmt);
        }
    }

    @Override
    public IfStatement clone() {
        return (IfStatement)super.clone();
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getThenStatement() {
        return (CompoundStatement)children.get(1);
    }

    /** Returns the else part or null. */
    public CompoundStatement getElseStatement() {
        return (children.size() > 2) ? (CompoundStatement)children.get(2) : null;
    }

    protected void printStatement(PrintWriter o) {
        o.print("IF (");
        getCondition().print(o);
        o.println(") THEN");
        if (!getThenStatement().isEmpty()) {
            getThenStatement().print(o);
            o.println();
        }
        if (getElseStatement() != null) {
            o.println("ELSE");
            if (!getElseStatement().isEmpty()) {
                getElseStatement().print(o);
                o.println();
            }
        }
        o.print("END IF");
    }

}
