package strata.frontend;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import strata.hir.AllocateStatement;
import strata.hir.AnnotationStatement;
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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* Reads the XcodeML trees of the OMNI compiler. Types are given by hash in the
* <code>typeTable</code> of the document; a procedure is an
* <code>FfunctionDefinition</code> with <code>symbols</code>,
* <code>declarations</code> and <code>body</code>, and its members are the
* definitions of the <code>FcontainsStatement</code> of the body.
* <p>
* OMNI declares the name of a subroutine as a variable and drops the
* <code>IMPLICIT NONE</code> statement; the spec built here removes the
* former and restores the latter after the imports.
*/
public class OMNIAdapter implements FrontendAdapter {

    private static final Map<String, BinaryOperator> binary_ops =
            new HashMap<String, BinaryOperator>();

    private static final Map<String, SymbolAttributes.BasicType> basic_types =
            new HashMap<String, SymbolAttributes.BasicType>();

    static {
        binary_ops.put("plusExpr", BinaryOperator.ADD);
        binary_ops.put("minusExpr", BinaryOperator.SUBTRACT);
        binary_ops.put("mulExpr", BinaryOperator.MULTIPLY);
        binary_ops.put("divExpr", BinaryOperator.DIVIDE);
        binary_ops.put("FpowerExpr", BinaryOperator.POWER);
        binary_ops.put("logEQExpr", BinaryOperator.COMPARE_EQ);
        binary_ops.put("logNEQExpr", BinaryOperator.COMPARE_NE);
        binary_ops.put("logLTExpr", BinaryOperator.COMPARE_LT);
        binary_ops.put("logLEExpr", BinaryOperator.COMPARE_LE);
        binary_ops.put("logGTExpr", BinaryOperator.COMPARE_GT);
        binary_ops.put("logGEExpr", BinaryOperator.COMPARE_GE);
        binary_ops.put("logAndExpr", BinaryOperator.LOGICAL_AND);
        binary_ops.put("logOrExpr", BinaryOperator.LOGICAL_OR);
        basic_types.put("Fint", SymbolAttributes.BasicType.INTEGER);
        basic_types.put("Freal", SymbolAttributes.BasicType.REAL);
        basic_types.put("Flogical", SymbolAttributes.BasicType.LOGICAL);
        basic_types.put("Fcharacter", SymbolAttributes.BasicType.CHARACTER);
        basic_types.put("Fcomplex", SymbolAttributes.BasicType.COMPLEX);
    }

    public Frontend getFrontend() {
        return Frontend.OMNI;
    }

    public ProcedureDescriptor describe(Object ast, String raw_source) {
        Element root = findDefinition(ast);
        if (root == null) {
            return null;
        }
        Map<String, Element> type_map = getTypeMap(root.getOwnerDocument());
        Element name_elem = XMLTools.getElement(root, "name");
        if (name_elem == null) {
            throw error("function definition without a name");
        }
        String name = XMLTools.getText(name_elem);
        Element ftype = type_map.get(name_elem.getAttribute("type"));
        if (ftype == null || !ftype.getTagName().equals("FfunctionType")) {
            throw error("no function type for " + name);
        }
        boolean is_function = !"Fvoid".equals(ftype.getAttribute("return_type"));
        List<String> args = new ArrayList<String>();
        for (Element param : XMLTools.getElements(
                XMLTools.getElement(ftype, "params"), "name")) {
            args.add(XMLTools.getText(param));
        }
        int line;
        try {
            line = XMLTools.getInt(root, "lineno", 0);
        } catch(NumberFormatException e) {
            throw error("invalid line number of " + name, e);
        }
        return new Descriptor(name, is_function, args,
                FrontendTools.makeSpan(line, line, raw_source), root, type_map);
    }

    private static Element findDefinition(Object ast) {
        Element e;
        if (ast instanceof Document) {
            e = ((Document)ast).getDocumentElement();
        } else if (ast instanceof Element) {
            e = (Element)ast;
        } else {
            throw error("unexpected tree " +
                    (ast == null ? "null" : ast.getClass().getName()));
        }
        if (e.getTagName().equals("FfunctionDefinition")) {
            return e;
        }
        for (Element child : XMLTools.getElements(e)) {
            Element ret = findDefinition(child);
            if (ret != null) {
                return ret;
            }
        }
        return null;
    }

    private static Map<String, Element> getTypeMap(Document doc) {
        Map<String, Element> ret = new HashMap<String, Element>();
        if (doc == null) {
            return ret;
        }
        NodeList tables = doc.getElementsByTagName("typeTable");
        for (int i = 0; i < tables.getLength(); i++) {
            for (Element type : XMLTools.getElements(tables.item(i))) {
                ret.put(type.getAttribute("type"), type);
            }
        }
        return ret;
    }

    private static FrontendException error(String message) {
        return new FrontendException(Frontend.OMNI, message);
    }

    private static FrontendException error(String message, Throwable cause) {
        return new FrontendException(Frontend.OMNI, message, cause);
    }

    private static class Descriptor extends ProcedureDescriptor {

        private final Element root;

        private final Map<String, Element> type_map;

        Descriptor(String name, boolean is_function, List<String> args,
                   SourceSpan source, Element root,
                   Map<String, Element> type_map) {
            super(name, is_function, args, source);
            this.root = root;
            this.type_map = type_map;
        }

        public List<Object> getMemberTrees() {
            List<Object> ret = new ArrayList<Object>();
            Element contains =
                    XMLTools.getPath(root, "body", "FcontainsStatement");
            for (Element e :
                    XMLTools.getElements(contains, "FfunctionDefinition")) {
                ret.add(e);
            }
            return ret;
        }

        /** The docstring comments are found in the spec by the builder. */
        public void buildDocstring(Procedure proc) {
        }

        public void buildSpec(Procedure proc) {
            Converter conv = new Converter(proc, type_map);
            CompoundStatement spec = proc.getSpec();
            for (Element e : XMLTools.getElements(
                    XMLTools.getElement(root, "declarations"))) {
                Statement stmt = conv.toStatement(e);
                if (!isFunction() && stmt instanceof VariableDeclaration &&
                    ((VariableDeclaration)stmt).getVariables().get(0)
                    .getName().equalsIgnoreCase(getName())) {
                    continue;
                }
                spec.addStatement(stmt);
            }
            List<Statement> stmts = spec.getStatements();
            int index = 0;
            for (int i = 0; i < stmts.size(); i++) {
                if (stmts.get(i) instanceof ImportStatement) {
                    index = i + 1;
                }
            }
            if (index == 0) {
                while (index < stmts.size() &&
                       stmts.get(index) instanceof AnnotationStatement &&
                       ((AnnotationStatement)stmts.get(index)).isComment()) {
                    index++;
                }
            }
            spec.addStatement(index, new IntrinsicStatement("IMPLICIT NONE"));
        }

        public void buildBody(Procedure proc) {
            Converter conv = new Converter(proc, type_map);
            for (Element e : XMLTools.getElements(
                    XMLTools.getElement(root, "body"))) {
                if (e.getTagName().equals("FcontainsStatement")) {
                    continue;
                }
                proc.getBody().addStatement(conv.toStatement(e));
            }
        }

    }

    private static class Converter {

        private final Procedure proc;

        private final Map<String, Element> type_map;

        Converter(Procedure proc, Map<String, Element> type_map) {
            this.proc = proc;
            this.type_map = type_map;
        }

        Statement toStatement(Element e) {
            String tag = e.getTagName();
            if (tag.equals("FcommentLine")) {
                String text = XMLTools.getText(e);
                return FrontendTools.makeComment(
                        text.startsWith("!") ? text : "!" + text);
            } else if (tag.equals("FpragmaStatement")) {
                return FrontendTools.makePragma(XMLTools.getText(e));
            } else if (tag.equals("FuseDecl") || tag.equals("FuseOnlyDecl")) {
                List<String> symbols = new ArrayList<String>();
                for (Element r : XMLTools.getElements(e, "renamable")) {
                    symbols.add(r.getAttribute("use_name"));
                }
                return new ImportStatement(e.getAttribute("name"), symbols);
            } else if (tag.equals("varDecl")) {
                return toDeclaration(e);
            } else if (tag.equals("FdoStatement")) {
                Element var = XMLTools.getElement(e, "Var");
                if (var == null) {
                    throw error("do statement without a variable");
                }
                return new DoLoop(SymbolTools.makeVariable(proc,
                        XMLTools.getText(var), null, null),
                        toRange(XMLTools.getElement(e, "indexRange")),
                        toBlock(XMLTools.getElement(e, "body")));
            } else if (tag.equals("FassignStatement")) {
                List<Element> sides = XMLTools.getElements(e);
                if (sides.size() != 2) {
                    throw error("assignment with " + sides.size() +
                            " operands");
                }
                return new ExpressionStatement(new AssignmentExpression(
                        toExpression(sides.get(0)),
                        toExpression(sides.get(1))));
            } else if (tag.equals("exprStatement")) {
                return new ExpressionStatement(
                        toExpression(single(e)));
            } else if (tag.equals("FifStatement")) {
                Element else_elem = XMLTools.getElement(e, "else");
                return new IfStatement(
                        toExpression(single(XMLTools.getElement(e, "condition"))),
                        toBlock(XMLTools.getPath(e, "then", "body")),
                        (else_elem == null) ? null :
                        toBlock(XMLTools.getElement(else_elem, "body")));
            } else if (tag.equals("FallocateStatement")) {
                List<Variable> vars = new ArrayList<Variable>();
                for (Element alloc : XMLTools.getElements(e, "alloc")) {
                    vars.add(toAllocation(alloc));
                }
                Expression source = null;
                for (Element opt : XMLTools.getElements(e, "allocOpt")) {
                    if ("source".equalsIgnoreCase(opt.getAttribute("kind"))) {
                        source = toExpression(single(opt));
                    }
                }
                return new AllocateStatement(vars, source);
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
            Element name = XMLTools.getElement(e, "name");
            if (name == null) {
                throw error("declaration without a name");
            }
            String hash = name.getAttribute("type");
            List<Expression> dims = getDimensions(hash);
            List<Variable> vars = new ArrayList<Variable>(1);
            vars.add(FrontendTools.makeDeclared(proc, XMLTools.getText(name),
                    toType(hash), dims.isEmpty() ? null : dims));
            return new VariableDeclaration(vars);
        }

        /** Returns the attributes of the type with the given hash. */
        SymbolAttributes toType(String hash) {
            if (basic_types.containsKey(hash)) {
                return new SymbolAttributes(basic_types.get(hash));
            }
            Element type = type_map.get(hash);
            if (type == null) {
                throw error("unknown type " + hash);
            }
            String tag = type.getTagName();
            if (tag.equals("FstructType")) {
                return SymbolAttributes.derived(getTypeName(type, hash));
            } else if (tag.equals("FfunctionType")) {
                return SymbolAttributes.procedure(hash, !"Fvoid".equals(
                        type.getAttribute("return_type")));
            } else if (!tag.equals("FbasicType")) {
                throw error("unsupported type <" + tag + ">");
            }
            SymbolAttributes ret = toType(type.getAttribute("ref"));
            Element kind = XMLTools.getElement(type, "kind");
            if (kind != null) {
                Element kind_expr = XMLTools.getFirstElement(kind);
                ret = ret.withKind((kind_expr == null) ? XMLTools.getText(kind)
                        : toExpression(kind_expr).toString());
            }
            String intent = XMLTools.getAttribute(type, "intent");
            if (intent != null && intent.length() > 0) {
                ret = ret.withIntent(SymbolAttributes.Intent.parse(intent));
            }
            if (XMLTools.isTrue(type, "is_allocatable")) {
                ret = ret.withAllocatable(true);
            }
            if (XMLTools.isTrue(type, "is_pointer")) {
                ret = ret.withPointer(true);
            }
            if (XMLTools.isTrue(type, "is_parameter")) {
                ret = ret.withParameter(true);
            }
            if (XMLTools.isTrue(type, "is_optional")) {
                ret = ret.withOptional(true);
            }
            return ret;
        }

        /** Returns the dimensions along the reference chain of a type. */
        List<Expression> getDimensions(String hash) {
            List<Expression> ret = new ArrayList<Expression>();
            Element type = type_map.get(hash);
            while (type != null && type.getTagName().equals("FbasicType")) {
                for (Element dim : XMLTools.getElements(type)) {
                    if (dim.getTagName().equals("indexRange") ||
                        dim.getTagName().equals("arrayIndex")) {
                        ret.add(toExtent(dim));
                    }
                }
                if (!ret.isEmpty()) {
                    break;
                }
                type = type_map.get(type.getAttribute("ref"));
            }
            return ret;
        }

        private String getTypeName(Element type, String hash) {
            NodeList ids = type.getOwnerDocument().getElementsByTagName("id");
            for (int i = 0; i < ids.getLength(); i++) {
                Element id = (Element)ids.item(i);
                if (hash.equals(id.getAttribute("type")) &&
                    "ftype_name".equals(id.getAttribute("sclass"))) {
                    Element name = XMLTools.getElement(id, "name");
                    if (name != null) {
                        return XMLTools.getText(name);
                    }
                }
            }
            return hash;
        }

        private Variable toAllocation(Element alloc) {
            Element ref = XMLTools.getFirstElement(alloc);
            if (ref == null) {
                throw error("empty allocation");
            }
            Expression base = toExpression(ref);
            if (!(base instanceof Variable)) {
                throw error("cannot allocate " + base);
            }
            List<Expression> dims = new ArrayList<Expression>();
            for (Element dim : XMLTools.getElements(alloc)) {
                if (dim != ref) {
                    dims.add(toExtent(dim));
                }
            }
            return ((Variable)base).withDimensions(dims);
        }

        RangeExpression toRange(Element e) {
            if (e == null) {
                throw error("missing index range");
            }
            Element step = XMLTools.getElement(e, "step");
            return new RangeExpression(
                    toBound(XMLTools.getElement(e, "lowerBound")),
                    toBound(XMLTools.getElement(e, "upperBound")),
                    (step == null) ? null : toExpression(single(step)));
        }

        private Expression toBound(Element e) {
            return (e == null) ? new DeferredExtent() : toExpression(single(e));
        }

        Expression toExpression(Element e) {
            String tag = e.getTagName();
            if (binary_ops.containsKey(tag)) {
                List<Element> operands = XMLTools.getElements(e);
                if (operands.size() != 2) {
                    throw error("<" + tag + "> with " + operands.size() +
                            " operands");
                }
                return new BinaryExpression(toExpression(operands.get(0)),
                        binary_ops.get(tag), toExpression(operands.get(1)));
            } else if (tag.equals("unaryMinusExpr")) {
                return new UnaryExpression(UnaryOperator.MINUS,
                        toExpression(single(e)));
            } else if (tag.equals("logNotExpr")) {
                return new UnaryExpression(UnaryOperator.LOGICAL_NEGATION,
                        toExpression(single(e)));
            } else if (tag.equals("Var")) {
                return SymbolTools.makeVariable(proc, XMLTools.getText(e),
                        null, null);
            } else if (tag.equals("varRef")) {
                return toExpression(single(e));
            } else if (tag.equals("FmemberRef")) {
                Expression parent = toExpression(single(e));
                if (!(parent instanceof Variable)) {
                    throw error("member access on " + parent);
                }
                return SymbolTools.makeVariable(proc, e.getAttribute("member"),
                        (Variable)parent, null);
            } else if (tag.equals("FarrayRef")) {
                List<Element> children = XMLTools.getElements(e);
                if (children.isEmpty()) {
                    throw error("empty array reference");
                }
                Expression base = toExpression(children.get(0));
                if (!(base instanceof Variable)) {
                    throw error("subscripted " + base);
                }
                List<Expression> dims = new ArrayList<Expression>();
                for (int i = 1; i < children.size(); i++) {
                    dims.add(toExpression(children.get(i)));
                }
                return ((Variable)base).withDimensions(dims);
            } else if (tag.equals("arrayIndex")) {
                return toExpression(single(e));
            } else if (tag.equals("indexRange")) {
                if (XMLTools.isTrue(e, "is_assumed_shape") ||
                    XMLTools.isTrue(e, "is_assumed_size")) {
                    return new DeferredExtent();
                }
                return toRange(e);
            } else if (tag.equals("functionCall")) {
                Element name = XMLTools.getElement(e, "name");
                if (name == null) {
                    throw error("function call without a name");
                }
                List<Expression> args = new ArrayList<Expression>();
                for (Element arg : XMLTools.getElements(
                        XMLTools.getElement(e, "arguments"))) {
                    args.add(toExpression(arg));
                }
                return new FunctionCall(new NameID(XMLTools.getText(name)), args);
            } else if (tag.equals("FintConstant")) {
                String text = XMLTools.getText(e).replaceFirst("_.*$", "");
                try {
                    return new IntegerLiteral(Long.parseLong(text));
                } catch(NumberFormatException ex) {
                    throw error("invalid integer " + text, ex);
                }
            } else if (tag.equals("FrealConstant")) {
                return new FloatLiteral(XMLTools.getText(e));
            } else if (tag.equals("FcharacterConstant")) {
                return new StringLiteral(e.getTextContent());
            } else if (tag.equals("FlogicalConstant")) {
                return new BooleanLiteral(
                        XMLTools.getText(e).toLowerCase(Locale.ROOT).contains("true"));
            }
            throw error("unsupported expression <" + tag + ">");
        }

        /**
        * Returns a declared or allocated extent; <code>1:n</code> is the
        * default extent <code>n</code>.
        */
        private Expression toExtent(Element dim) {
            Expression ret = toExpression(dim);
            if (ret instanceof RangeExpression) {
                RangeExpression range = (RangeExpression)ret;
                if (isOne(range.getStart()) && range.getStep() == null &&
                    !(range.getStop() instanceof DeferredExtent)) {
                    return range.getStop().clone();
                }
            }
            return ret;
        }

        private static boolean isOne(Expression e) {
            return (e instanceof IntegerLiteral &&
                    ((IntegerLiteral)e).getValue() == 1);
        }

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
