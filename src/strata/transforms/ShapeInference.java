package strata.transforms;

import strata.hir.AllocateStatement;
import strata.hir.CompoundStatement;
import strata.hir.DFIterator;
import strata.hir.Expression;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.SymbolAttributes;
import strata.hir.Tools;
import strata.hir.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* Back-fills the shapes of allocatable variables whose declared shape is
* deferred. The allocation statements of the body give the shape, either
* through the allocated extents or through the type of the data source. The
* shape is then attached to the type of the declaration and of every
* reference of the same name in the spec and the body; the declared
* dimensions are kept as written.
* <p>
* When a variable is allocated with different shapes, the last allocation
* wins and a warning is printed.
*/
public class ShapeInference {

    private ShapeInference() {
    }

    /**
    * Infers the shapes of the deferred-shape variables of the procedure.
    */
    public static void infer(Procedure proc) {
        Map<String, List<Expression>> shapes = collectShapes(proc);
        if (shapes.isEmpty()) {
            return;
        }
        Map<String, Variable> var_map = proc.getVariableMap();
        for (String name : shapes.keySet()) {
            Variable decl = var_map.get(name);
            proc.declare(decl.getName(),
                    decl.getType().withShape(shapes.get(name)));
        }
        applyShapes(proc.getSpec(), shapes);
        applyShapes(proc.getBody(), shapes);
    }

    /**
    * Returns the allocated shape of each deferred-shape variable declared by
    * the procedure, keyed by the lower-case name.
    */
    private static Map<String, List<Expression>>
            collectShapes(Procedure proc) {
        Map<String, Variable> var_map = proc.getVariableMap();
        Map<String, List<Expression>> ret =
                new LinkedHashMap<String, List<Expression>>();
        DFIterator<AllocateStatement> iter = new DFIterator<AllocateStatement>(
                proc.getBody(), AllocateStatement.class);
        while (iter.hasNext()) {
            AllocateStatement alloc = iter.next();
            Expression source = alloc.getDataSource();
            for (Variable var : alloc.getVariables()) {
                Variable decl = var_map.get(var.getName());
                if (var.getParentVariable() != null || decl == null ||
                    !decl.getType().hasDeferredShape()) {
                    continue;
                }
                List<Expression> shape = null;
                if (!var.getDimensions().isEmpty()) {
                    shape = var.getDimensions();
                } else if (source instanceof Variable) {
                    shape = getSourceShape((Variable)source, ret);
                }
                if (shape == null) {
                    continue;
                }
                String key = var.getName().toLowerCase(Locale.ROOT);
                List<Expression> old = ret.get(key);
                if (old != null && !old.equals(shape)) {
                    PrintTools.printlnStatus(0, "[WARNING]", var.getName(),
                            "in", proc.getName(), "is allocated with shapes (" +
                            Tools.listToString(old, ",") + ") and (" +
                            Tools.listToString(shape, ",") +
                            "); using the last one");
                }
                List<Expression> copy = new ArrayList<Expression>();
                for (Expression e : shape) {
                    copy.add(e.clone());
                }
                ret.put(key, copy);
            }
        }
        return ret;
    }

    private static List<Expression> getSourceShape(Variable source,
            Map<String, List<Expression>> inferred) {
        if (source.getParentVariable() == null &&
            inferred.containsKey(source.getName().toLowerCase(Locale.ROOT))) {
            return inferred.get(source.getName().toLowerCase(Locale.ROOT));
        }
        SymbolAttributes type = source.getType();
        if (type.getShape() == null || type.hasDeferredShape()) {
            return null;
        }
        return type.getShape();
    }

    private static void applyShapes(CompoundStatement section,
                                    Map<String, List<Expression>> shapes) {
        List<Variable> refs =
                new DFIterator<Variable>(section, Variable.class).getList();
        for (int i = refs.size() - 1; i >= 0; i--) {
            Variable var = refs.get(i);
            List<Expression> shape = shapes.get(var.getName().toLowerCase(Locale.ROOT));
            if (shape == null || var.getParentVariable() != null) {
                continue;
            }
            SymbolAttributes type = var.getType().withShape(shape);
            if (!type.equals(var.getType())) {
                var.swapWith(var.withType(type));
            }
        }
    }

}
