package strata.hir;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
* <b>SymbolTools</b> provides tools that resolve names against the scope
* hierarchy.
*/
public final class SymbolTools {

    /** Intrinsic procedures recognized in call position */
    private static final Set<String> intrinsics = new HashSet<String>(
            Arrays.asList(
            "abs", "all", "allocated", "any", "associated", "atan", "atan2",
            "ceiling", "cos", "count", "dble", "dot_product", "epsilon",
            "exp", "floor", "huge", "int", "kind", "lbound", "len", "log",
            "log10", "matmul", "max", "maxval", "merge", "min", "minval",
            "mod", "modulo", "nint", "present", "product", "real", "reshape",
            "selected_real_kind", "shape", "sign", "sin", "size", "spread",
            "sqrt", "sum", "tan", "tanh", "tiny", "transpose", "trim",
            "ubound"));

    private SymbolTools() {
    }

    /** Checks if the given name is a known intrinsic procedure. */
    public static boolean isIntrinsic(String name) {
        return intrinsics.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
    * Checks if <code>name(...)</code> in the given scope is a call rather
    * than an array reference: the name resolves to a procedure, or it is an
    * intrinsic that no visible declaration hides.
    */
    public static boolean isCallable(Scope scope, String name) {
        SymbolAttributes attr = (scope == null) ? null : scope.lookup(name);
        if (attr != null) {
            return attr.isProcedure();
        }
        return isIntrinsic(name);
    }

    /**
    * Creates a reference to the given name bound to <var>scope</var>. The
    * type is the one visible from the scope; members of derived types and
    * undeclared names get a deferred type.
    *
    * @param scope the scope in which the reference resolves.
    * @param name the referenced name.
    * @param parent the parent variable of a member access, or null.
    * @param dims the subscripts, or null.
    */
    public static Variable makeVariable(Scope scope, String name,
            Variable parent, List<Expression> dims) {
        SymbolAttributes type = null;
        if (parent == null && scope != null) {
            type = scope.lookup(name);
        }
        return new Variable(name, type, scope, parent, dims);
    }

    /**
    * Declares every variable of the spec of <var>proc</var> in the symbol
    * table of <var>proc</var>.
    */
    public static void declareSpecSymbols(Procedure proc) {
        for (Variable var : proc.getVariables()) {
            proc.declare(var.getName(), var.getType());
        }
    }

}
