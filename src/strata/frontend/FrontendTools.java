package strata.frontend;

import strata.hir.AnnotationStatement;
import strata.hir.CommentAnnotation;
import strata.hir.Expression;
import strata.hir.FunctionCall;
import strata.hir.NameID;
import strata.hir.PragmaAnnotation;
import strata.hir.Scope;
import strata.hir.SourceSpan;
import strata.hir.SymbolAttributes;
import strata.hir.SymbolTools;
import strata.hir.Variable;

import java.util.List;
import java.util.Locale;

/**
* Helpers shared by the frontend adapters.
*/
public final class FrontendTools {

    private FrontendTools() {
    }

    /**
    * Returns a call if <code>name(args)</code> is callable in the scope and
    * an array reference otherwise. Member accesses are always references.
    */
    public static Expression makeReference(Scope scope, String name,
            Variable parent, List<Expression> args) {
        if (parent == null && args != null && !args.isEmpty() &&
            SymbolTools.isCallable(scope, name)) {
            return new FunctionCall(new NameID(name), args);
        }
        return SymbolTools.makeVariable(scope, name, parent, args);
    }

    /**
    * Returns the statement of a comment line; lines starting with
    * <code>!$</code> are pragmas.
    */
    public static AnnotationStatement makeComment(String text) {
        String t = text.trim();
        if (t.startsWith("!$")) {
            return new AnnotationStatement(PragmaAnnotation.parse(t));
        }
        return new AnnotationStatement(new CommentAnnotation(t));
    }

    /** Returns the statement of a pragma given without its sentinel. */
    public static AnnotationStatement makePragma(String text) {
        return new AnnotationStatement(PragmaAnnotation.parse(text));
    }

    /**
    * Returns the basic type of a Fortran type name such as
    * <code>REAL</code> or <code>double precision</code>.
    */
    public static SymbolAttributes.BasicType toBasicType(String name) {
        String s = name.trim().toUpperCase(Locale.ROOT);
        if (s.equals("INTEGER")) {
            return SymbolAttributes.BasicType.INTEGER;
        } else if (s.equals("REAL") || s.equals("DOUBLE PRECISION")) {
            return SymbolAttributes.BasicType.REAL;
        } else if (s.equals("LOGICAL")) {
            return SymbolAttributes.BasicType.LOGICAL;
        } else if (s.equals("CHARACTER")) {
            return SymbolAttributes.BasicType.CHARACTER;
        } else if (s.equals("COMPLEX")) {
            return SymbolAttributes.BasicType.COMPLEX;
        } else if (s.equals("TYPE")) {
            return SymbolAttributes.BasicType.DERIVED;
        }
        return null;
    }

    /**
    * Applies a declaration attribute such as <code>allocatable</code> or
    * <code>intent(in)</code> to the given attributes.
    *
    * @return the new attributes, or null if the attribute is unknown.
    */
    public static SymbolAttributes
            applyAttribute(SymbolAttributes type, String attr) {
        String s = attr.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        if (s.equals("allocatable")) {
            return type.withAllocatable(true);
        } else if (s.equals("pointer")) {
            return type.withPointer(true);
        } else if (s.equals("parameter")) {
            return type.withParameter(true);
        } else if (s.equals("optional")) {
            return type.withOptional(true);
        } else if (s.startsWith("intent(") && s.endsWith(")")) {
            return type.withIntent(SymbolAttributes.Intent.parse(
                    s.substring(7, s.length() - 1)));
        }
        return null;
    }

    /**
    * Returns the declared variable with the given dimensions; the type
    * takes the dimensions as its shape.
    */
    public static Variable makeDeclared(Scope scope, String name,
            SymbolAttributes type, List<Expression> dims) {
        if (dims != null && !dims.isEmpty()) {
            type = type.withShape(dims);
        }
        return new Variable(name, type, scope, null, dims);
    }

    /**
    * Returns the span of lines <var>begin</var> to <var>end</var>
    * (1-based, inclusive) of the source text. The text is null when the
    * source or the lines are not available.
    */
    public static SourceSpan makeSpan(int begin, int end, String raw_source) {
        String text = null;
        if (raw_source != null && begin > 0 && end >= begin) {
            String[] lines = raw_source.split("\r?\n", -1);
            if (end <= lines.length) {
                StringBuilder sb = new StringBuilder();
                for (int i = begin - 1; i < end; i++) {
                    sb.append(lines[i]);
                    if (i < end - 1) {
                        sb.append("\n");
                    }
                }
                text = sb.toString();
            }
        }
        return new SourceSpan(begin, end, text);
    }

}
