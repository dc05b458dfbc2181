package strata.transforms;

import strata.hir.AnnotationStatement;
import strata.hir.BinaryExpression;
import strata.hir.BinaryOperator;
import strata.hir.CommentAnnotation;
import strata.hir.CompoundStatement;
import strata.hir.DFIterator;
import strata.hir.DoLoop;
import strata.hir.Expression;
import strata.hir.FunctionCall;
import strata.hir.IntegerLiteral;
import strata.hir.NameID;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.Program;
import strata.hir.RangeExpression;
import strata.hir.Statement;
import strata.hir.StrataAnnotation;
import strata.hir.SymbolAttributes;
import strata.hir.Symbolic;
import strata.hir.Tools;
import strata.hir.Variable;
import strata.hir.VariableDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
* Splits loops at <code>!$strata loop-fission [promote(a, b, ...)]</code>
* directives found among the statements of their bodies.
* <p>
* A stand-alone directive ends the current part of the body and is dropped;
* a directive attached to a statement makes that statement the first one of
* the next part. Every part becomes a loop with the bounds of the original
* loop. The variables named by <code>promote</code> get a trailing dimension
* sized by the trip count of the loop, and every reference to them inside the
* loop gets the loop variable as trailing subscript. A variable promoted by
* several loops gets the largest trip count.
* <p>
* Loops are processed innermost first. A loop that cannot be split is left
* untouched, and the first error is rethrown once the other loops have been
* split.
*/
public class LoopFission extends ProcedureTransformPass {

    /** The directive name */
    public static final String DIRECTIVE = "loop-fission";

    private static final String pass_name = "[LoopFission]";

    public LoopFission(Program program) {
        super(program);
    }

    public String getPassName() {
        return pass_name;
    }

    public void transformProcedure(Procedure proc) {
        split(proc);
    }

    /**
    * Splits the annotated loops in the body of the procedure.
    *
    * @param proc the procedure to be transformed.
    * @return the number of loops that were split.
    * @throws TransformException the first error raised by a loop.
    */
    public static int split(Procedure proc) {
        List<DoLoop> loops =
                new DFIterator<DoLoop>(proc.getBody(), DoLoop.class).getList();
        // Trailing dimension of each promoted variable, keyed by lower-case name.
        Map<String, Expression> promoted = new LinkedHashMap<String, Expression>();
        List<TransformException> errors = new ArrayList<TransformException>();
        int num_loops = 0, num_parts = 0;
        for (int i = loops.size() - 1; i >= 0; i--) {
            DoLoop loop = loops.get(i);
            List<DoLoop> parts;
            try {
                parts = splitLoop(proc, loop, promoted);
            } catch(TransformException e) {
                PrintTools.printlnStatus(0, "[WARNING]", pass_name,
                        "cannot split loop over", loop.getVariable(), "in",
                        proc.getName() + ":", e.getMessage());
                errors.add(e);
                continue;
            }
            if (parts == null) {
                continue;
            }
            CompoundStatement parent = (CompoundStatement)loop.getParent();
            for (DoLoop part : parts) {
                parent.addStatementBefore(loop, new AnnotationStatement(
                        new CommentAnnotation("strata transformation " +
                        DIRECTIVE)));
                parent.addStatementBefore(loop, part);
            }
            loop.detach();
            num_loops++;
            num_parts += parts.size();
        }
        if (num_loops > 0) {
            PrintTools.printlnStatus(1, pass_name, proc.getName() + ":",
                    "split", num_loops, "loops into", num_parts, "loops");
        }
        if (!promoted.isEmpty()) {
            promote(proc, promoted);
            PrintTools.printlnStatus(1, pass_name, proc.getName() + ":",
                    "promoted variables",
                    Tools.listToString(new ArrayList<String>(promoted.keySet()),
                    ", "));
        }
        if (!errors.isEmpty()) {
            TransformException ret = errors.get(0);
            for (int i = 1; i < errors.size(); i++) {
                ret.addSuppressed(errors.get(i));
            }
            throw ret;
        }
        return num_loops;
    }

    /**
    * Returns the loops replacing the given loop, or null if its body holds
    * no directive. The IR is not modified; the trailing dimensions of the
    * promoted variables are recorded in <var>promoted</var> only on success.
    */
    private static List<DoLoop> splitLoop(Procedure proc, DoLoop loop,
                                          Map<String, Expression> promoted) {
        List<Statement> stmts = loop.getBody().getStatements();
        List<StrataAnnotation> notes = new ArrayList<StrataAnnotation>();
        for (Statement stmt : stmts) {
            StrataAnnotation note = StrataAnnotation.find(stmt, DIRECTIVE);
            if (note != null) {
                if (!note.isWellFormed()) {
                    throw new InvalidDirectiveException("malformed directive '" +
                            note + "': " + note.getError());
                }
                notes.add(note);
            }
        }
        if (notes.isEmpty()) {
            return null;
        }
        // Parts of the body
        List<List<Statement>> parts = new ArrayList<List<Statement>>();
        List<Statement> current = new ArrayList<Statement>();
        for (Statement stmt : stmts) {
            StrataAnnotation note = StrataAnnotation.find(stmt, DIRECTIVE);
            if (note == null) {
                current.add(stmt.clone());
                continue;
            }
            if (!current.isEmpty()) {
                parts.add(current);
            }
            current = new ArrayList<Statement>();
            if (!(stmt instanceof AnnotationStatement)) {
                Statement copy = stmt.clone();
                StrataAnnotation copy_note =
                        StrataAnnotation.find(copy, DIRECTIVE);
                copy_note.detach();
                current.add(copy);
            }
        }
        if (!current.isEmpty()) {
            parts.add(current);
        }
        // Promotion
        Set<String> names = new LinkedHashSet<String>();
        for (StrataAnnotation note : notes) {
            String value = note.getParameter("promote");
            if (value == null) {
                continue;
            }
            for (String name : value.split(",")) {
                if (name.trim().length() > 0) {
                    names.add(name.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        Map<String, Expression> sizes = new LinkedHashMap<String, Expression>();
        if (!names.isEmpty()) {
            RangeExpression bounds = loop.getBounds();
            if (!bounds.hasUnitStep()) {
                throw new UnsupportedLoopShapeException("step of loop over " +
                        loop.getVariable() + " is not 1");
            }
            Expression trip_count = Symbolic.simplify(new BinaryExpression(
                    new BinaryExpression(bounds.getStop().clone(),
                    BinaryOperator.SUBTRACT, bounds.getStart().clone()),
                    BinaryOperator.ADD, new IntegerLiteral(1)));
            Map<String, Variable> var_map = proc.getVariableMap();
            for (String name : names) {
                if (!var_map.containsKey(name)) {
                    throw new InvalidDirectiveException("cannot promote " +
                            name + ": not a variable of " + proc.getName());
                }
                sizes.put(name, maxSize(promoted.get(name), trip_count));
            }
        }
        List<DoLoop> ret = new ArrayList<DoLoop>(parts.size());
        for (List<Statement> part : parts) {
            CompoundStatement body = new CompoundStatement(part);
            if (!sizes.isEmpty()) {
                addSubscript(body, sizes.keySet(), loop.getVariable());
            }
            ret.add(new DoLoop(loop.getVariable().clone(),
                    loop.getBounds().clone(), body));
        }
        promoted.putAll(sizes);
        return ret;
    }

    /** Returns the larger of two trailing dimensions. */
    private static Expression maxSize(Expression old, Expression size) {
        if (old == null) {
            return size;
        }
        Integer diff = Symbolic.compare(old, size);
        if (diff == null) {
            List<Expression> args = new ArrayList<Expression>(2);
            args.add(old.clone());
            args.add(size.clone());
            return new FunctionCall(new NameID("max"), args);
        }
        return (diff.intValue() < 0) ? size : old;
    }

    /**
    * Appends the loop variable to the subscripts of every reference to the
    * given variables.
    */
    private static void addSubscript(Statement body, Set<String> names,
                                     Variable index) {
        List<Variable> refs =
                new DFIterator<Variable>(body, Variable.class).getList();
        for (int i = refs.size() - 1; i >= 0; i--) {
            Variable ref = refs.get(i);
            if (ref.getParentVariable() != null ||
                !names.contains(ref.getName().toLowerCase(Locale.ROOT))) {
                continue;
            }
            List<Expression> dims = ref.getDimensions();
            dims.add(index.clone());
            ref.swapWith(ref.withDimensions(dims));
        }
    }

    /**
    * Adds the trailing dimensions to the declarations of the promoted
    * variables and updates the types of their references.
    */
    private static void promote(Procedure proc, Map<String, Expression> sizes) {
        Map<String, SymbolAttributes> types =
                new LinkedHashMap<String, SymbolAttributes>();
        for (VariableDeclaration decl : proc.getDeclarations()) {
            for (Variable var : decl.getVariables()) {
                Expression size = sizes.get(var.getName().toLowerCase(Locale.ROOT));
                if (size == null) {
                    continue;
                }
                List<Expression> dims = var.getDimensions();
                dims.add(size);
                List<Expression> shape = var.getType().getShape();
                if (shape == null) {
                    shape = var.getDimensions();
                } else {
                    shape = new ArrayList<Expression>(shape);
                }
                shape.add(size);
                SymbolAttributes type = var.getType().withShape(shape);
                var.swapWith(var.withDimensions(dims).withType(type));
                proc.declare(var.getName(), type);
                types.put(var.getName().toLowerCase(Locale.ROOT), type);
            }
        }
        List<Variable> refs = new DFIterator<Variable>(
                proc.getBody(), Variable.class).getList();
        for (int i = refs.size() - 1; i >= 0; i--) {
            Variable ref = refs.get(i);
            SymbolAttributes type = types.get(ref.getName().toLowerCase(Locale.ROOT));
            if (type != null && ref.getParentVariable() == null &&
                !type.equals(ref.getType())) {
                ref.swapWith(ref.withType(type));
            }
        }
    }

}
