package strata.frontend;

import antlr.collections.AST;
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
* Reads fparser-style abstract syntax trees whose node types are the
* constants of {@link FPNodeTypes}. A procedure node has a
* <code>NAME</code>, optional <code>DUMMY_ARGS</code>, and optional
* specification, execution and internal-subprogram parts. The parser keeps
* the comments around the specification part inside it; the builder moves
* them to the docstring and the body.
*/
public class FPAdapter implements FrontendAdapter, FPNodeTypes {

    public Frontend getFrontend() {
        return Frontend.FP;
    }

    public ProcedureDescriptor describe(Object ast, String raw_source) {
        if (ast != null && !(ast instanceof AST)) {
            throw error("unexpected tree " + ast.getClass().getName());
        }
        AST root = findProcedure((AST)ast);
        if (root == null) {
            return null;
        }
        AST name = getChild(root, NAME);
        if (name == null) {
            throw error("procedure without a name");
        }
        List<String> args = new ArrayList<String>();
        for (AST arg : getChildren(getChild(root, DUMMY_ARGS))) {
            args.add(arg.getText());
        }
        SourceSpan source = FrontendTools.makeSpan(
                root.getLine(), lastLine(root), raw_source);
        return new Descriptor(name.getText(),
                root.getType() == FUNCTION_SUBPROGRAM, args, source, root);
    }

    /**
    * Returns the first procedure node among the given node, its siblings and
    * their descendants.
    */
    private static AST findProcedure(AST t) {
        for (AST n = t; n != null; n = n.getNextSibling()) {
            if (isProcedure(n)) {
                return n;
            }
            AST ret = findProcedure(n.getFirstChild());
            if (ret != null) {
                return ret;
            }
        }
        return null;
    }

    private static boolean isProcedure(AST t) {
        return (t.getType() == SUBROUTINE_SUBPROGRAM ||
                t.getType() == FUNCTION_SUBPROGRAM);
    }

    private static int lastLine(AST t) {
        int ret = t.getLine();
        for (AST child : getChildren(t)) {
            ret = Math.max(ret, lastLine(child));
        }
        return ret;
    }

    /** Returns the first child of the given type, or null. */
    private static AST getChild(AST t, int type) {
        for (AST child : getChildren(t)) {
            if (child.getType() == type) {
                return child;
            }
        }
        return null;
    }

    /** Returns the children of the node; none for a null node. */
    private static List<AST> getChildren(AST t) {
        List<AST> ret = new ArrayList<AST>();
        if (t == null) {
            return ret;
        }
        for (AST child = t.getFirstChild(); child != null;
                child = child.getNextSibling()) {
            ret.add(child);
        }
        return ret;
    }

    private static FrontendException error(String message) {
        return new FrontendException(Frontend.FP, message);
    }

    private static FrontendException error(String message, Throwable cause) {
        return new FrontendException(Frontend.FP, message, cause);
    }

    private static class Descriptor extends ProcedureDescriptor {

        private final AST root;

        Descriptor(String name, boolean is_function, List<String> args,
                   SourceSpan source, AST root) {
            super(name, is_function, args, source);
            this.root = root;
        }

        public List<Object> getMemberTrees() {
            List<Object> ret = new ArrayList<Object>();
            for (AST child :
                    getChildren(getChild(root, INTERNAL_SUBPROGRAM_PART))) {
                if (isProcedure(child)) {
                    ret.add(child);
                }
            }
            return ret;
        }

        /** The docstring comments are found in the spec by the builder. */
        public void buildDocstring(Procedure proc) {
        }

        public void buildSpec(Procedure proc) {
            Converter conv = new Converter(proc);
            for (AST t : getChildren(getChild(root, SPECIFICATION_PART))) {
                proc.getSpec().addStatement(conv.toStatement(t));
            }
        }

        public void buildBody(Procedure proc) {
            Converter conv = new Converter(proc);
            for (AST t : getChildren(getChild(root, EXECUTION_PART))) {
                proc.getBody().addStatement(conv.toStatement(t));
            }
        }

    }

    private static class Converter {

        private final Procedure proc;

        Converter(Procedure proc) {
            this.proc = proc;
        }

        Statement toStatement(AST t) {
            List<AST> children = getChildren(t);
            switch (t.getType()) {
            case COMMENT:
                return FrontendTools.makeComment(t.getText());
            case USE_STMT: {
                List<String> symbols = new ArrayList<String>();
                for (AST name : getChildren(getChild(t, ONLY_LIST))) {
                    symbols.add(name.getText());
                }
                AST module = getChild(t, NAME);
                return new ImportStatement(
                        (module == null) ? t.getText() : module.getText(),
                        symbols);
            }
            case IMPLICIT_STMT:
                return new IntrinsicStatement(t.getText());
            case TYPE_DECLARATION:
                return toDeclaration(t);
            case DO_CONSTRUCT: {
                List<AST> control = getChildren(getChild(t, LOOP_CONTROL));
                if (control.size() < 3 || control.size() > 4) {
                    throw error("malformed loop control");
                }
                Expression index = toExpression(control.get(0));
                if (!(index instanceof Variable)) {
                    throw error("loop over " + index);
                }
                return new DoLoop((Variable)index, new RangeExpression(
                        toExpression(control.get(1)),
                        toExpression(control.get(2)),
                        (control.size() == 4) ?
                        toExpression(control.get(3)) : null),
                        toBlock(getChild(t, BLOCK)));
            }
            case ASSIGNMENT_STMT:
                if (children.size() != 2) {
                    throw error("assignment with " + children.size() +
                            " operands");
                }
                return new ExpressionStatement(new AssignmentExpression(
                        toExpression(children.get(0)),
                        toExpression(children.get(1))));
            case CALL_STMT: {
                AST name = getChild(t, NAME);
                if (name == null) {
                    throw error("call without a name");
                }
                return new ExpressionStatement(new FunctionCall(
                        new NameID(name.getText()),
                        toExpressions(getChild(t, ARGUMENTS))));
            }
            case IF_CONSTRUCT: {
                if (children.isEmpty()) {
                    throw error("conditional without a condition");
                }
                AST else_block = getChild(t, ELSE_BLOCK);
                return new IfStatement(toExpression(children.get(0)),
                        toBlock(getChild(t, BLOCK)),
                        (else_block == null) ? null : toBlock(else_block));
            }
            case ALLOCATE_STMT: {
                List<Variable> vars = new ArrayList<Variable>();
                Expression source = null;
                for (AST child : children) {
                    if (child.getType() == ALLOC_SOURCE) {
                        source = toExpression(single(child));
                        continue;
                    }
                    Expression var = toExpression(single(child));
                    if (!(var instanceof Variable)) {
                        throw error("cannot allocate " + var);
                    }
                    vars.add((Variable)var);
                }
                return new AllocateStatement(vars, source);
            }
            default:
                throw error("unsupported statement node " + t.getType() +
                        " '" + t.getText() + "'");
            }
        }

        CompoundStatement toBlock(AST t) {
            CompoundStatement ret = new CompoundStatement();
            for (AST child : getChildren(t)) {
                ret.addStatement(toStatement(child));
            }
            return ret;
        }

        VariableDeclaration toDeclaration(AST t) {
            AST spec = getChild(t, TYPE_SPEC);
            if (spec == null) {
                throw error("declaration without a type");
            }
            SymbolAttributes.BasicType basic =
                    FrontendTools.toBasicType(spec.getText());
            SymbolAttributes type;
            if (basic == null) {
                throw error("unknown type " + spec.getText());
            } else if (basic == SymbolAttributes.BasicType.DERIVED) {
                AST type_name = getChild(spec, NAME);
                if (type_name == null) {
                    throw error("derived type without a name");
                }
                type = SymbolAttributes.derived(type_name.getText());
            } else {
                type = new SymbolAttributes(basic);
            }
            AST kind = getChild(spec, KIND_SELECTOR);
            if (kind != null) {
                type = type.withKind(toExpression(single(kind)).toString());
            }
            List<Variable> vars = new ArrayList<Variable>();
            for (AST child : getChildren(t)) {
                if (child.getType() == ATTR_SPEC) {
                    SymbolAttributes new_type =
                            FrontendTools.applyAttribute(type, child.getText());
                    if (new_type == null) {
                        throw error("unknown attribute " + child.getText());
                    }
                    type = new_type;
                } else if (child.getType() == ENTITY_DECL) {
                    AST name = getChild(child, NAME);
                    if (name == null) {
                        throw error("entity without a name");
                    }
                    AST array_spec = getChild(child, ARRAY_SPEC);
                    vars.add(FrontendTools.makeDeclared(proc, name.getText(),
                            type, (array_spec == null) ? null :
                            toExpressions(array_spec)));
                }
            }
            if (vars.isEmpty()) {
                throw error("declaration without entities");
            }
            return new VariableDeclaration(vars);
        }

        List<Expression> toExpressions(AST t) {
            List<Expression> ret = new ArrayList<Expression>();
            for (AST child : getChildren(t)) {
                ret.add(toExpression(child));
            }
            return ret;
        }

        Expression toExpression(AST t) {
            List<AST> children = getChildren(t);
            switch (t.getType()) {
            case DESIGNATOR: {
                Variable parent = null;
                AST data_ref = getChild(t, DATA_REF);
                if (data_ref != null) {
                    Expression p = toExpression(single(data_ref));
                    if (!(p instanceof Variable)) {
                        throw error("member access on " + p);
                    }
                    parent = (Variable)p;
                }
                AST subscripts = getChild(t, SUBSCRIPTS);
                return FrontendTools.makeReference(proc, t.getText(), parent,
                        (subscripts == null) ? null : toExpressions(subscripts));
            }
            case SUBSCRIPT_TRIPLET:
                if (children.size() < 2 || children.size() > 3) {
                    throw error("malformed subscript triplet");
                }
                return new RangeExpression(toExpression(children.get(0)),
                        toExpression(children.get(1)),
                        (children.size() == 3) ?
                        toExpression(children.get(2)) : null);
            case DEFERRED:
                return new DeferredExtent();
            case INT_LITERAL: {
                String text = t.getText().replaceFirst("_.*$", "");
                try {
                    return new IntegerLiteral(Long.parseLong(text));
                } catch(NumberFormatException e) {
                    throw error("invalid integer " + t.getText(), e);
                }
            }
            case REAL_LITERAL:
                return new FloatLiteral(t.getText());
            case CHAR_LITERAL:
                return new StringLiteral(
                        t.getText().replaceAll("^['\"]|['\"]$", ""));
            case LOGICAL_LITERAL:
                return new BooleanLiteral(
                        t.getText().toLowerCase(Locale.ROOT).contains("true"));
            case BINARY_OP: {
                BinaryOperator op = BinaryOperator.fromString(t.getText());
                if (op == null || children.size() != 2) {
                    throw error("malformed binary operation " + t.getText());
                }
                return new BinaryExpression(toExpression(children.get(0)), op,
                        toExpression(children.get(1)));
            }
            case UNARY_OP: {
                UnaryOperator op = UnaryOperator.fromString(t.getText());
                if (op == null || children.size() != 1) {
                    throw error("malformed unary operation " + t.getText());
                }
                return new UnaryExpression(op, toExpression(children.get(0)));
            }
            case PARENTHESES:
                return toExpression(single(t));
            default:
                throw error("unsupported expression node " + t.getType() +
                        " '" + t.getText() + "'");
            }
        }

        private static AST single(AST t) {
            AST ret = t.getFirstChild();
            if (ret == null) {
                throw error("missing operand of '" + t.getText() + "'");
            }
            return ret;
        }

    }

}
