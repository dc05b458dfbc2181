package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a type declaration statement of one or more variables sharing
* a type specification, e.g. <code>REAL, INTENT(IN) :: a(n), b</code>. The
* children are the declared variables; their dimensions are the declared
* extents.
*/
public class VariableDeclaration extends Statement {

    /**
    * Creates a declaration of the given variables.
    * @throws IllegalArgumentException if the list is empty.
    * @throws NotAnOrphanException if a variable has a parent.
    */
    public VariableDeclaration(List<Variable> vars) {
        super(vars.size());
        if (vars.isEmpty()) {
            throw new IllegalArgumentException("empty declaration");
        }
        for (Variable var : vars) {
            addChild(var);
        }
    }

    @Override
    public VariableDeclaration clone() {
        return (VariableDeclaration)super.clone();
    }

    /** Returns the declared variables in order. */
    public List<Variable> getVariables() {
        List<Variable> ret = new ArrayList<Variable>(children.size());
        for (Traversable t : children) {
            ret.add((Variable)t);
        }
        return ret;
    }

    /**
    * Replaces the declared variables.
    * @throws IllegalArgumentException if the list is empty.
    * @throws NotAnOrphanException if a variable has a parent.
    */
    public void setVariables(List<Variable> vars) {
        if (vars.isEmpty()) {
            throw new IllegalArgumentException("empty declaration");
        }
        for (Traversable t : children) {
            t.setParent(null);
        }
        children.clear();
        for (Variable var : vars) {
            addChild(var);
        }
    }

    /** Returns the type of the first declared variable. */
    public SymbolAttributes getType() {
        return ((Variable)children.get(0)).getType();
    }

    protected void printStatement(PrintWriter o) {
        o.print(getType().toDeclarationString());
        o.print(" :: ");
        o.print(Tools.listToString(children, ", "));
    }

}
