package strata.frontend;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import strata.hir.AllocateStatement;
import strata.hir.AssignmentExpression;
import strata.hir.BinaryExpression;
import strata.hir.BinaryOperator;
import strata.hir.BooleanLiteral;
import strata.hir.CompoundStatement;
import strata.hir.DeferredExtent;
import strata.hir.DoLoop;
import strata.hir.Expression;
import strata.hir.ExpressionStatement;
import strata.hir.FloatLiteral;
import strata.hir.FunctionCall;
import strata.hir.IfStatement;
import strata.hir.ImportStatement;
import strata.hir.IntegerLiteral;
import strata.hir.IntrinsicStatement;
import strata.hir.NameID;
import strata.hir.Procedure;
import strata.hir.RangeExpression;
import strata.hir.SourceSpan;
import strata.hir.Statement;
import strata.hir.StringLiteral;
import strata.hir.SymbolAttributes;
import strata.hir.SymbolTools;
import strata.hir.UnaryExpression;
import strata.hir.UnaryOperator;
import strata.hir.Variable;
import strata.hir.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
* Reads the XML trees of the Open Fortran Parser. A procedure is a
* <code>subroutine</code> or <code>function</code> element with a
* <code>header</code>, a <code>body</code> whose <code>specification</code>
* element separates the docstring from the executable statements, and an
* optional <code>members</code> element.
*/
public class OFPAdapter implements FrontendAdapter {

    public Frontend getFrontend() {
        return Frontend.OFP;
    }

    public ProcedureDescriptor describe(Object ast, String raw_source) {
        Element root = findProcedure(ast);
        if (root == null) {
            return null;
        }
        String name = XMLTools.getAttribute(root, "name");
        if (name == null) {
            throw error("procedure without a name");
        }
        boolean is_function = root.getTagName().equals("function");
        List<String> args = new ArrayList<String>();
        Element header = XMLTools.getElement(root, "header");
        for (Element arg : XMLTools.getElements(
                XMLTools.getElement(header, "arguments"), "argument")) {
            args.add(arg.getAttribute("name"));
        }
        for (Element arg : XMLTools.getElements(
                XMLTools.getElement(header, "names"), "name")) {
            args.add(arg.getAttribute("id"));
        }
        Element body = XMLTools.getElement(root, "body");
        if (body == null) {
            throw error("procedure " + name + " has no body");
        }
        int begin, end;
        try {
            begin = XMLTools.getInt(root, "line_begin", 0);
            end = XMLTools.getInt(root, "line_end", begin);
        } catch(NumberFormatException e) {
            throw error("invalid line numbers of " + name, e);
        }
        return new Descriptor(name, is_function, args,
                FrontendTools.makeSpan(begin, end, raw_source), root, body);
    }

    /** Returns the first procedure element at or below the given node. */
    private static Element findProcedure(Object ast) {
        Element e;
        if (ast instanceof Document) {
            e = ((Document)ast).getDocumentElement();
        } else if (ast instanceof Element) {
            e = (Element)ast;
        } else {
            throw error("unexpected tree " +
                    (ast == null ? "null" : ast.getClass().getName()));
        }
        if (isProcedure(e)) {
            return e;
        }
        for (Element child : XMLTools.getElements(e)) {
            Element ret = findProcedure(child);
            if (ret != null) {
                return ret;
            }
        }
        return null;
    }

    private static boolean isProcedure(Element e) {
        return e.getTagName().equals("subroutine") ||
               e.getTagName().equals("function");
    }

    private static FrontendException error(String message) {
        return new FrontendException(Frontend.OFP, message);
    }

    private static FrontendException error(String message, Throwable cause) {
        return new FrontendException(Frontend.OFP, message, cause);
    }

    private static class Descriptor extends ProcedureDescriptor {

        private final Element root;

        private final Element body;

        private final Element spec;

        Descriptor(String name, boolean is_function, List<String> args,
                   SourceSpan source, Element root, Element body) {
            super(name, is_function, args, source);
            this.root = root;
            this.body = body;
            this.spec = XMLTools.getElement(body, "specification");
        }

        public List<Object> getMemberTrees() {
            List<Object> ret = new ArrayList<Object>();
            for (Element e : XMLTools.getElements(
                    XMLTools.getElement(root, "members"))) {
                if (isProcedure(e)) {
                    ret.add(e);
                }
            }
            return ret;
        }

        public void buildDocstring(Procedure proc) {
            if (spec == null) {
                return;
            }
            Converter conv = new Converter(proc);
            for (Element e : XMLTools.getElements(body)) {
                if (e == spec) {
                    break;
                }
                proc.getDocstring().addStatement(conv.toStatement(e));
            }
        }

        public void buildSpec(Procedure proc) {
            if (spec == null) {
                return;
            }
            Converter conv = new Converter(proc);
            for (Element e : XMLTools.getElements(spec)) {
                proc.getSpec().addStatement(conv.toStatement(e));
            }
        }

        public void buildBody(Procedure proc) {
            Converter conv = new Converter(proc);
            boolean after_spec = (spec == null);
            for (Element e : XMLTools.getElements(body)) {
                if (e == spec) {
                    after_spec = true;
                } else if (after_spec) {
                    proc.getBody().addStatement(conv.toStatement(e));
                }
            }
        }

    }

    /**
    * Converts the elements of one procedure; names resolve in the procedure
    * scope.
    */
    private static class Converter {

        private final Procedure proc;

        Converter(Procedure proc) {
            this.proc = proc;
        }

        Statement toStatement(Element e) {
            String tag = e.getTagName();
            if (tag.equals("comment")) {
                return FrontendTools.makeComment(e.getAttribute("text"));
            } else if (tag.equals("use")) {
                List<String> symbols = new ArrayList<String>();
                for (Element name : XMLTools.getElements(
                        XMLTools.getElement(e, "only"), "name")) {
                    symbols.add(name.getAttribute("id"));
                }
                return new ImportStatement(e.getAttribute("name"), symbols);
            } else if (tag.equals("implicit")) {
                String text = XMLTools.getAttribute(e, "text");
                return new IntrinsicStatement(
                        (text == null) ? "IMPLICIT NONE" : text);
            } else if (tag.equals("declaration")) {
                return toDeclaration(e);
            } else if (tag.equals("loop")) {
                return toLoop(e);
            } else if (tag.equals("assignment")) {
                return new ExpressionStatement(new AssignmentExpression(
                        toExpression(single(XMLTools.getElement(e, "target"))),
                        toExpression(single(XMLTools.getElement(e, "value")))));
            } else if (tag.equals("call")) {
                return new ExpressionStatement(new FunctionCall(
                        new NameID(e.getAttribute("name")),
                        toExpressions(XMLTools.getElement(e, "arguments"))));
            } else if (tag.equals("if")) {
                CompoundStatement else_stmt = null;
                if (XMLTools.getElement(e, "else") != null) {
                    else_stmt = toBlock(XMLTools.getElement(e, "else"));
                }
                return new IfStatement(
                        toExpression(single(XMLTools.getElement(e, "condition"))),
                        toBlock(XMLTools.getElement(e, "then")), else_stmt);
            } else if (tag.equals("allocate")) {
                List<Variable> vars = new ArrayList<Variable>();
                for (Element object : XMLTools.getElements(e, "object")) {
                    Expression var = toExpression(single(object));
                    if (!(var instanceof Variable)) {
                        throw error("cannot allocate " + var);
                    }
                    vars.add((Variable)var);
                }
                Element source = XMLTools.getElement(e, "source");
                return new AllocateStatement(vars,
                        (source == null) ? null : toExpression(single(source)));
            }
            throw error("unsupported statement <" + tag + ">");
        }

        CompoundStatement toBlock(Element e) {
            CompoundStatement ret = new CompoundStatement();
            for (Element child : XMLTools.getElements(e)) {
                ret.addStatement(toStatement(child));
            }
            return ret;
        }

        VariableDeclaration toDeclaration(Element e) {
            String type_name = e.getAttribute("type");
            SymbolAttributes.BasicType basic =
                    FrontendTools.toBasicType(type_name);
            SymbolAttributes type;
            if (basic == null) {
                type = SymbolAttributes.derived(type_name);
            } else if (basic == SymbolAttributes.BasicType.DERIVED) {
                type = SymbolAttributes.derived(e.getAttribute("name"));
            } else {
                type = new SymbolAttributes(basic);
            }
            String kind = XMLTools.getAttribute(e, "kind");
            if (kind != null && kind.length() > 0) {
                type = type.withKind(kind);
            }
            String intent = XMLTools.getAttribute(e, "intent");
            if (intent != null && intent.length() > 0) {
                type = type.withIntent(SymbolAttributes.Intent.parse(intent));
            }
            String attrs = XMLTools.getAttribute(e, "attrs");
            if (attrs != null) {
                for (String attr : attrs.split(",")) {
                    if (attr.trim().length() == 0) {
                        continue;
                    }
                    SymbolAttributes new_type =
                            FrontendTools.applyAttribute(type, attr);
                    if (new_type == null) {
                        throw error("unknown attribute " + attr);
                    }
                    type = new_type;
                }
            }
            List<Variable> vars = new ArrayList<Variable>();
            for (Element var : XMLTools.getElements(e, "variable")) {
                List<Expression> dims = null;
                Element dimension = XMLTools.getElement(var, "dimension");
                if (dimension != null) {
                    dims = toExpressions(dimension);
                }
                vars.add(FrontendTools.makeDeclared(proc,
                        var.getAttribute("name"), type, dims));
            }
            if (vars.isEmpty()) {
                throw error("declaration without variables");
            }
            return new VariableDeclaration(vars);
        }

        DoLoop toLoop(Element e) {
            Variable index = SymbolTools.makeVariable(proc,
                    e.getAttribute("var"), null, null);
            return new DoLoop(index,
                    toRange(XMLTools.getElement(e, "range")),
                    toBlock(XMLTools.getElement(e, "body")));
        }

        RangeExpression toRange(Element e) {
            if (e == null) {
                throw error("loop without range");
            }
            Element step = XMLTools.getElement(e, "step");
            return new RangeExpression(
                    toBound(XMLTools.getElement(e, "lower")),
                    toBound(XMLTools.getElement(e, "upper")),
                    (step == null) ? null : toExpression(single(step)));
        }

        private Expression toBound(Element e) {
            return (e == null) ? new DeferredExtent() : toExpression(single(e));
        }

        List<Expression> toExpressions(Element e) {
            List<Expression> ret = new ArrayList<Expression>();
            for (Element child : XMLTools.getElements(e)) {
                ret.add(toExpression(child));
            }
            return ret;
        }

        Expression toExpression(Element e) {
            String tag = e.getTagName();
            if (tag.equals("name")) {
                return toName(e);
            } else if (tag.equals("literal")) {
                return toLiteral(e);
            } else if (tag.equals("operation")) {
                List<Element> operands = XMLTools.getElements(e, "operand");
                String op = e.getAttribute("operator");
                if (operands.size() == 1) {
                    UnaryOperator uop = UnaryOperator.fromString(op);
                    if (uop == null) {
                        throw error("unknown operator " + op);
                    }
                    return new UnaryExpression(uop,
                            toExpression(single(operands.get(0))));
                } else if (operands.size() == 2) {
                    BinaryOperator bop = BinaryOperator.fromString(op);
                    if (bop == null) {
                        throw error("unknown operator " + op);
                    }
                    return new BinaryExpression(
                            toExpression(single(operands.get(0))), bop,
                            toExpression(single(operands.get(1))));
                }
                throw error("operation with " + operands.size() +
                        " operands");
            } else if (tag.equals("range")) {
                return toRange(e);
            } else if (tag.equals("deferred")) {
                return new DeferredExtent();
            } else if (tag.equals("parenthesized")) {
                return toExpression(single(e));
            }
            throw error("unsupported expression <" + tag + ">");
        }

        private Expression toName(Element e) {
            Variable parent = null;
            Element parent_elem = XMLTools.getElement(e, "parent");
            if (parent_elem != null) {
                Expression p = toExpression(single(parent_elem));
                if (!(p instanceof Variable)) {
                    throw error("member access on " + p);
                }
                parent = (Variable)p;
            }
            List<Expression> subscripts = null;
            Element subs = XMLTools.getElement(e, "subscripts");
            if (subs != null) {
                subscripts = new ArrayList<Expression>();
                for (Element sub : XMLTools.getElements(subs, "subscript")) {
                    subscripts.add(toExpression(single(sub)));
                }
            }
            return FrontendTools.makeReference(proc, e.getAttribute("id"),
                    parent, subscripts);
        }

        private Expression toLiteral(Element e) {
            String type = e.getAttribute("type");
            String value = e.getAttribute("value");
            if (type.equals("int")) {
                try {
                    return new IntegerLiteral(Long.parseLong(value.trim()));
                } catch(NumberFormatException ex) {
                    throw error("invalid integer " + value, ex);
                }
            } else if (type.equals("real")) {
                return new FloatLiteral(value.trim());
            } else if (type.equals("char")) {
                return new StringLiteral(value);
            } else if (type.equals("bool")) {
                return new BooleanLiteral(
                        value.trim().toLowerCase(Locale.ROOT).contains("true"));
            }
            throw error("unknown literal type " + type);
        }

        /** Returns the only child element of the given element. */
        private static Element single(Element e) {
            Element ret = (e == null) ? null : XMLTools.getFirstElement(e);
            if (ret == null) {
                throw error("missing expression in <" +
                        (e == null ? "null" : e.getTagName()) + ">");
            }
            return ret;
        }

    }

}
