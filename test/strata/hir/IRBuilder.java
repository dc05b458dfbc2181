package strata.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Builds small procedures for tests. Expressions are written in source
* syntax and resolve in the procedure scope.
*/
public final class IRBuilder {

    private IRBuilder() {
    }

    public static Procedure procedure(String name, String... args) {
        return new Procedure(name, Arrays.asList(args), false, null, null);
    }

    public static SymbolAttributes integer() {
        return new SymbolAttributes(SymbolAttributes.BasicType.INTEGER);
    }

    public static SymbolAttributes real() {
        return new SymbolAttributes(SymbolAttributes.BasicType.REAL);
    }

    /**
    * Declares a variable in the spec; <var>dims</var> is a comma-separated
    * list of extents, or null for a scalar.
    */
    public static Variable declare(Procedure proc, SymbolAttributes type,
                                   String name, String dims) {
        List<Expression> extents = null;
        if (dims != null) {
            extents = new ArrayList<Expression>();
            for (String dim : dims.split(",")) {
                if (dim.trim().equals(":")) {
                    extents.add(new DeferredExtent());
                } else {
                    extents.add(parse(proc, dim));
                }
            }
            type = type.withShape(extents);
        }
        Variable var = new Variable(name, type, proc, null, extents);
        List<Variable> vars = new ArrayList<Variable>(1);
        vars.add(var);
        proc.addDeclaration(new VariableDeclaration(vars));
        return var;
    }

    public static Expression parse(Scope scope, String text) {
        return new ExpressionParser(scope).parseExpression(text);
    }

    public static RangeExpression range(Scope scope, String text) {
        return new ExpressionParser(scope).parseRangeList(text).get(0);
    }

    public static ExpressionStatement assign(Scope scope, String lhs,
                                             String rhs) {
        return new ExpressionStatement(new AssignmentExpression(
                parse(scope, lhs), parse(scope, rhs)));
    }

    public static DoLoop loop(Procedure proc, String var, String bounds,
                              Statement... body) {
        Variable index = SymbolTools.makeVariable(proc, var, null, null);
        return new DoLoop(index, range(proc, bounds),
                new CompoundStatement(Arrays.asList(body)));
    }

    /** Attaches a pragma such as <code>!$strata loop-fusion</code>. */
    public static <T extends Statement> T pragma(T stmt, String text) {
        stmt.annotate(PragmaAnnotation.parse(text));
        return stmt;
    }

    /** Returns a stand-alone pragma statement. */
    public static AnnotationStatement pragma(String text) {
        return new AnnotationStatement(PragmaAnnotation.parse(text));
    }

    /** Returns the statements of the body that are not annotations. */
    public static List<Statement> code(CompoundStatement block) {
        List<Statement> ret = new ArrayList<Statement>();
        for (Statement stmt : block.getStatements()) {
            if (!(stmt instanceof AnnotationStatement)) {
                ret.add(stmt);
            }
        }
        return ret;
    }

}
