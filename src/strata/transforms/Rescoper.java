package strata.transforms;

import strata.hir.CompoundStatement;
import strata.hir.DFIterator;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.Scope;
import strata.hir.SymbolAttributes;
import strata.hir.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
* Rebinds every variable reference in the spec and the body of a procedure
* to the scope that declares it. A reference to a name declared or imported
* by the procedure resolves to the procedure; any other name resolves to the
* closest enclosing scope that declares it, whose type then replaces the
* carried type. Names that no scope declares are bound to the procedure with
* a warning. Running the pass twice changes nothing the second time.
*/
public class Rescoper {

    private final Procedure proc;

    private final Map<String, Variable> var_map;

    private final Map<String, String> import_map;

    private Rescoper(Procedure proc) {
        this.proc = proc;
        var_map = proc.getVariableMap();
        import_map = proc.getImportedSymbolMap();
    }

    /**
    * Rescopes the references of the given procedure. Members are not
    * visited.
    */
    public static void rescope(Procedure proc) {
        Rescoper rescoper = new Rescoper(proc);
        rescoper.rescopeSection(proc.getSpec());
        rescoper.rescopeSection(proc.getBody());
    }

    private void rescopeSection(CompoundStatement section) {
        List<Variable> refs = new ArrayList<Variable>();
        DFIterator<Variable> iter =
                new DFIterator<Variable>(section, Variable.class);
        while (iter.hasNext()) {
            Variable var = iter.next();
            if (!isParentSlot(var)) {
                refs.add(var);
            }
        }
        // Inner references first, so replacements copy rescoped subscripts.
        for (int i = refs.size() - 1; i >= 0; i--) {
            Variable var = refs.get(i);
            Variable repl = rescopeReference(var);
            if (repl != null) {
                var.swapWith(repl);
            }
        }
    }

    private static boolean isParentSlot(Variable var) {
        return (var.getParent() instanceof Variable &&
                ((Variable)var.getParent()).getParentVariable() == var);
    }

    /**
    * Returns the rescoped replacement of the reference, or null if the
    * reference is consistent already.
    */
    private Variable rescopeReference(Variable var) {
        Variable parent = var.getParentVariable();
        if (parent != null) {
            // Members resolve through their parent.
            Variable new_parent = rescopeReference(parent);
            Scope scope = (new_parent == null) ? parent.getScope()
                                               : new_parent.getScope();
            if (new_parent == null && var.getScope() == scope) {
                return null;
            }
            Variable ret = (new_parent == null) ? var
                                                : var.withParentVariable(new_parent);
            return ret.withScope(scope);
        }
        String name = var.getName();
        if (var_map.containsKey(name) || import_map.containsKey(name)) {
            return (var.getScope() == proc) ? null : var.withScope(proc);
        }
        for (Scope scope : proc.getHierarchy()) {
            SymbolAttributes declared = scope.lookup(name, false);
            if (declared == null) {
                continue;
            }
            boolean same_type = declared.equals(var.getType());
            if (scope == var.getScope() && same_type) {
                return null;
            }
            if (!same_type && !var.getType().isDeferred()) {
                PrintTools.printlnStatus(0, "[WARNING] Type of", name,
                        "in", proc.getName(), "is", var.getType(),
                        "but its declaration has", declared);
            }
            return var.withScope(scope).withType(declared);
        }
        if (var.getScope() == proc) {
            PrintTools.printlnStatus(2, "[Rescoper]", name,
                    "is not declared in", proc.getName(), "or its parents");
            return null;
        }
        PrintTools.printlnStatus(0, "[WARNING] Could not resolve", name,
                "in", proc.getName(), "- binding it to the procedure");
        return var.withScope(proc);
    }

}
