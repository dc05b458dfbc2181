package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* <code>name(arg, ...)</code>: a function or intrinsic invocation. Child 0 is
* the callee name, the arguments follow it.
*/
public class FunctionCall extends Expression {

    /** Non-owning link to the called procedure, or null. */
    private Procedure routine;

    private boolean active;

    /** @throws NotAnOrphanException if an argument is already in a tree. */
    public FunctionCall(NameID name, List<Expression> args) {
        super(args.size() + 1);
        addChild(name);
        for (Expression arg : args) {
            addChild(arg);
        }
        routine = null;
        active = true;
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    public void print(PrintWriter o) {
        getNameID().print(o);
        o.print("(");
        o.print(Tools.listToString(getArguments(), ", "));
        o.print(")");
    }

    public NameID getNameID() {
        return (NameID)children.get(0);
    }

    public String getName() {
        return getNameID().getName();
    }

    /**
    * Returns the procedure attached to this call, or null if the target is
    * unknown.
    */
    public Procedure getRoutine() {
        return routine;
    }

    /**
    * Returns false for an inactive edge of the call graph; an inactive call
    * is kept in the code but not followed by interprocedural passes.
    */
    public boolean isActive() {
        return active;
    }

    /** Attaches the called procedure; copies of this call share it. */
    public void setRoutine(Procedure routine, boolean active) {
        this.routine = routine;
        this.active = active;
    }

    /** Arguments in call order, as a fresh list. */
    public List<Expression> getArguments() {
        List<Expression> ret = new ArrayList<Expression>(children.size() - 1);
        for (int i = 1; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

}
