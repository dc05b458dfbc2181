package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* An ordered block of statements: the spec or body of a procedure, the body
* of a loop, a branch of an if. Members print one per line.
*/
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super(4);
    }

    /**
    * Adopts the given statements in order.
    * @throws NotAnOrphanException if one of them already has a parent.
    */
    public CompoundStatement(List<? extends Statement> stmts) {
        super(stmts.size());
        for (Statement stmt : stmts) {
            addChild(stmt);
        }
    }

    /** @throws NotAnOrphanException if <b>stmt</b> has a parent. */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /** @throws NotAnOrphanException if <b>stmt</b> has a parent. */
    public void addStatement(int index, Statement stmt) {
        addChild(index, stmt);
    }

    /**
    * Inserts <b>new_stmt</b> right in front of <b>ref_stmt</b>.
    * @throws NotAChildException if <b>ref_stmt</b> is not in this block.
    */
    public void addStatementBefore(Statement ref_stmt, Statement new_stmt) {
        addChild(positionOf(ref_stmt), new_stmt);
    }

    private int positionOf(Traversable t) {
        int pos = Tools.identityIndexOf(children, t);
        if (pos < 0) {
            throw new NotAChildException(t + " is not in this block");
        }
        return pos;
    }

    /** Snapshot of the members; changing it leaves the block alone. */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(children.size());
        for (Traversable t : children) {
            ret.add((Statement)t);
        }
        return ret;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /** @throws NotAChildException if <b>child</b> is not in this block. */
    @Override
    public void removeChild(Traversable child) {
        children.remove(positionOf(child));
        child.setParent(null);
    }

    /** Empties the block and hands back its former members as orphans. */
    public List<Statement> removeStatements() {
        List<Statement> ret = getStatements();
        children.clear();
        for (Statement stmt : ret) {
            stmt.setParent(null);
        }
        return ret;
    }

    @Override
    public CompoundStatement clone() {
        return (CompoundStatement)super.clone();
    }

    protected void printStatement(PrintWriter o) {
        String sep = "";
        for (Traversable t : children) {
            o.print(sep);
            t.print(o);
            sep = PrintTools.line_sep;
        }
    }

}
