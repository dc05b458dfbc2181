package strata.transforms;

import strata.hir.Expression;
import strata.hir.ExpressionParser;
import strata.hir.Procedure;
import strata.hir.StrataAnnotation;
import strata.hir.Variable;
import strata.hir.VariableDeclaration;

import java.util.List;

/**
* Applies <code>!$strata dimension(d1, d2, ...)</code> directives attached to
* declarations: every variable of the declaration gets the given dimensions,
* both as written and in its type.
*/
public class DimensionPragmas {

    /** The directive name */
    public static final String DIRECTIVE = "dimension";

    private DimensionPragmas() {
    }

    /**
    * Applies the dimension directives of the spec of the procedure.
    * @throws InvalidDirectiveException if a directive cannot be parsed.
    */
    public static void apply(Procedure proc) {
        ExpressionParser parser = new ExpressionParser(proc);
        for (VariableDeclaration decl : proc.getDeclarations()) {
            StrataAnnotation note = StrataAnnotation.find(decl, DIRECTIVE);
            if (note == null) {
                continue;
            }
            String text = note.getParameter(DIRECTIVE);
            if (!note.isWellFormed() || text == null || text.length() == 0) {
                throw new InvalidDirectiveException("malformed directive '" +
                        note + "' in " + proc.getName());
            }
            List<Expression> dims;
            try {
                dims = parser.parseExpressionList(text);
            } catch(IllegalArgumentException e) {
                throw new InvalidDirectiveException("malformed directive '" +
                        note + "' in " + proc.getName(), e);
            }
            for (Variable var : decl.getVariables()) {
                Variable repl = var.withDimensions(dims);
                repl = repl.withType(var.getType().withShape(dims));
                var.swapWith(repl);
                proc.declare(repl.getName(), repl.getType());
            }
        }
    }

}
