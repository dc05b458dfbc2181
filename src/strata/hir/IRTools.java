package strata.hir;

import java.util.List;
import java.util.Map;

/** Whole-tree checks and variable substitution. */
public final class IRTools {

    private IRTools() {
    }

    /**
    * Verifies the parent links below <var>t</var>: each node must be listed
    * by the parent it names. The first broken link is reported at verbosity
    * 0.
    */
    public static boolean checkConsistency(Traversable t) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable node = iter.next();
            Traversable up = node.getParent();
            if (up == null || Tools.identityIndexOf(up.getChildren(), node) < 0) {
                PrintTools.printlnStatus(0, "[IRTools] broken parent link at",
                        node, "under", up);
                return false;
            }
        }
        return true;
    }

    /**
    * Replaces every scalar, non-member reference under <var>t</var> whose
    * name is a key of <var>map</var> by a clone of the mapped expression.
    * Keys are matched ignoring case.
    *
    * @param t the subtree to be edited in place.
    * @param map the replacements keyed by variable name.
    */
    public static void
            replaceVariables(Traversable t, Map<String, Expression> map) {
        List<Variable> vars = new DFIterator<Variable>(t, Variable.class)
                .getList();
        for (Variable var : vars) {
            Expression repl = lookupIgnoreCase(map, var.getName());
            if (repl != null && var.getParentVariable() == null &&
                var.getDimensions().isEmpty() && var.getParent() != null &&
                !(var.getParent() instanceof Variable &&
                  ((Variable)var.getParent()).getParentVariable() == var)) {
                var.swapWith(repl.clone());
            }
        }
    }

    /**
    * Returns the result of the substitution described in
    * {@link #replaceVariables} applied to an orphan expression. The
    * expression itself may be replaced, so the returned root must be used.
    */
    public static Expression
            substitute(Expression e, Map<String, Expression> map) {
        if (e instanceof Variable) {
            Variable var = (Variable)e;
            Expression repl = lookupIgnoreCase(map, var.getName());
            if (repl != null && var.getParentVariable() == null &&
                var.getDimensions().isEmpty()) {
                return repl.clone();
            }
        }
        replaceVariables(e, map);
        return e;
    }

    private static Expression
            lookupIgnoreCase(Map<String, Expression> map, String name) {
        for (String key : map.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return map.get(key);
            }
        }
        return null;
    }

}
