package strata.hir;

import strata.transforms.Rescoper;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
* Represents a subroutine or a function. A procedure is a {@link Scope}
* whose symbol table holds the symbols declared in its spec; its members are
* procedures nested in it, whose parent scope is this procedure.
* <p>
* The children are the docstring, the spec and the body (each a
* {@link CompoundStatement}) followed by the member procedures. The dummy
* argument names are kept separately from the declarations and always name
* variables declared in the spec.
*/
public class Procedure extends Scope implements Traversable {

    private static final int DOCSTRING = 0, SPEC = 1, BODY = 2, MEMBERS = 3;

    /** Directive that marks a call as an inactive call-graph edge */
    private static final String REFERENCE = "reference";

    private String name;

    private List<String> arguments;

    private boolean is_function;

    private SourceSpan source;

    private Traversable parent;

    private List<Traversable> children;

    /**
    * Creates an empty procedure and registers its name as a callable
    * procedure in the parent scope.
    *
    * @param name the procedure name.
    * @param arguments the dummy argument names in signature order.
    * @param is_function true for a function.
    * @param source the source span, or null.
    * @param parent_scope the enclosing scope, or null.
    */
    public Procedure(String name, List<String> arguments, boolean is_function,
                     SourceSpan source, Scope parent_scope) {
        super(parent_scope);
        this.name = name;
        this.arguments = new ArrayList<String>(arguments);
        this.is_function = is_function;
        this.source = source;
        parent = null;
        children = new ArrayList<Traversable>(4);
        for (int i = DOCSTRING; i < MEMBERS; i++) {
            CompoundStatement section = new CompoundStatement();
            section.setParent(this);
            children.add(section);
        }
        if (parent_scope != null) {
            parent_scope.declare(name,
                    SymbolAttributes.procedure(name, is_function));
        }
    }

    public String getName() {
        return name;
    }

    public boolean isFunction() {
        return is_function;
    }

    /** Returns the source span, or null. */
    public SourceSpan getSource() {
        return source;
    }

    /** Returns the leading comments of the procedure. */
    public CompoundStatement getDocstring() {
        return (CompoundStatement)children.get(DOCSTRING);
    }

    /** Returns the specification section. */
    public CompoundStatement getSpec() {
        return (CompoundStatement)children.get(SPEC);
    }

    /** Returns the executable section. */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(BODY);
    }

    /** Returns the member procedures in order. */
    public List<Procedure> getMembers() {
        List<Procedure> ret = new ArrayList<Procedure>();
        for (int i = MEMBERS; i < children.size(); i++) {
            ret.add((Procedure)children.get(i));
        }
        return ret;
    }

    /** Returns the member procedure with the given name, or null. */
    public Procedure getMember(String name) {
        for (Procedure member : getMembers()) {
            if (member.getName().equalsIgnoreCase(name)) {
                return member;
            }
        }
        return null;
    }

    /**
    * Appends a member procedure.
    * @throws IllegalArgumentException if the member is not nested in this
    *   scope.
    * @throws NotAnOrphanException if the member has a parent.
    */
    public void addMember(Procedure member) {
        if (member.getParentScope() != this) {
            throw new IllegalArgumentException(
                    member.getName() + " is not nested in " + name);
        }
        if (member.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(member);
        member.setParent(this);
    }

    /** Returns the dummy argument names in signature order. */
    public List<String> getArgumentNames() {
        return new ArrayList<String>(arguments);
    }

    /**
    * Returns the declared variables of the dummy arguments in signature
    * order.
    */
    public List<Variable> getArguments() {
        Map<String, Variable> vars = getVariableMap();
        List<Variable> ret = new ArrayList<Variable>(arguments.size());
        for (String arg : arguments) {
            if (vars.containsKey(arg)) {
                ret.add(vars.get(arg));
            }
        }
        return ret;
    }

    /**
    * Sets the dummy arguments. Declarations of the given variables replace
    * the existing ones or are added; no declaration is ever removed.
    *
    * @param args the new arguments in signature order.
    * @throws IllegalArgumentException if an argument has no intent.
    */
    public void setArguments(List<Variable> args) {
        for (Variable arg : args) {
            if (arg.getType().getIntent() == null) {
                throw new IllegalArgumentException(
                        "argument " + arg.getName() + " has no intent");
            }
        }
        List<String> names = new ArrayList<String>(args.size());
        for (Variable arg : args) {
            declareVariable(arg);
            names.add(arg.getName());
        }
        arguments = names;
    }

    /** Returns the variables declared in the spec, in declaration order. */
    public List<Variable> getVariables() {
        List<Variable> ret = new ArrayList<Variable>();
        for (VariableDeclaration decl : getDeclarations()) {
            ret.addAll(decl.getVariables());
        }
        return ret;
    }

    /**
    * Sets the declared variables. Declarations of variables not in the list
    * are removed, together with any dummy argument of that name; variables
    * not declared yet get a new declaration.
    */
    public void setVariables(List<Variable> vars) {
        Map<String, Variable> wanted =
                new TreeMap<String, Variable>(String.CASE_INSENSITIVE_ORDER);
        for (Variable var : vars) {
            wanted.put(var.getName(), var);
        }
        for (VariableDeclaration decl : getDeclarations()) {
            List<Variable> kept = new ArrayList<Variable>();
            for (Variable var : decl.getVariables()) {
                if (wanted.containsKey(var.getName())) {
                    kept.add(var.clone());
                } else {
                    undeclare(var.getName());
                }
            }
            if (kept.isEmpty()) {
                decl.detach();
            } else {
                decl.setVariables(kept);
            }
        }
        List<String> args = new ArrayList<String>();
        for (String arg : arguments) {
            if (wanted.containsKey(arg)) {
                args.add(arg);
            }
        }
        arguments = args;
        for (Variable var : vars) {
            declareVariable(var);
        }
    }

    /**
    * Replaces the declaration of the variable with the same name or adds a
    * new declaration for it.
    */
    private void declareVariable(Variable var) {
        Variable decl_var = var.withScope(this);
        declare(decl_var.getName(), decl_var.getType());
        for (VariableDeclaration decl : getDeclarations()) {
            List<Variable> vars = decl.getVariables();
            for (int i = 0; i < vars.size(); i++) {
                if (vars.get(i).getName().equalsIgnoreCase(var.getName())) {
                    if (!vars.get(i).equals(decl_var) ||
                        !vars.get(i).getType().equals(decl_var.getType())) {
                        vars.get(i).swapWith(decl_var);
                    }
                    return;
                }
            }
        }
        List<Variable> new_vars = new ArrayList<Variable>(1);
        new_vars.add(decl_var);
        addDeclaration(new VariableDeclaration(new_vars));
    }

    /**
    * Inserts a declaration after the last non-annotation statement of the
    * spec.
    */
    public void addDeclaration(VariableDeclaration decl) {
        List<Statement> stmts = getSpec().getStatements();
        int index = stmts.size();
        while (index > 0 && stmts.get(index - 1) instanceof AnnotationStatement) {
            index--;
        }
        getSpec().addStatement(index, decl);
        for (Variable var : decl.getVariables()) {
            declare(var.getName(), var.getType());
        }
    }

    /** Returns the declaration statements of the spec. */
    public List<VariableDeclaration> getDeclarations() {
        List<VariableDeclaration> ret = new ArrayList<VariableDeclaration>();
        for (Statement stmt : getSpec().getStatements()) {
            if (stmt instanceof VariableDeclaration) {
                ret.add((VariableDeclaration)stmt);
            }
        }
        return ret;
    }

    /**
    * Returns the declared variables keyed by name; lookups ignore case.
    */
    public Map<String, Variable> getVariableMap() {
        Map<String, Variable> ret =
                new TreeMap<String, Variable>(String.CASE_INSENSITIVE_ORDER);
        for (Variable var : getVariables()) {
            ret.put(var.getName(), var);
        }
        return ret;
    }

    /** Returns the import statements of the spec. */
    public List<ImportStatement> getImports() {
        List<ImportStatement> ret = new ArrayList<ImportStatement>();
        for (Statement stmt : getSpec().getStatements()) {
            if (stmt instanceof ImportStatement) {
                ret.add((ImportStatement)stmt);
            }
        }
        return ret;
    }

    /** Returns the names imported with ONLY lists, in order. */
    public List<String> getImportedSymbols() {
        List<String> ret = new ArrayList<String>();
        for (ImportStatement imp : getImports()) {
            ret.addAll(imp.getSymbols());
        }
        return ret;
    }

    /**
    * Returns the module of every imported name keyed by the name; lookups
    * ignore case.
    */
    public Map<String, String> getImportedSymbolMap() {
        Map<String, String> ret =
                new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        for (ImportStatement imp : getImports()) {
            for (String symbol : imp.getSymbols()) {
                ret.put(symbol, imp.getModule());
            }
        }
        return ret;
    }

    /**
    * Returns the signature of this procedure as a new procedure without a
    * parent scope: the spec keeps the declarations that declare dummy
    * arguments only, and every other spec statement except declarations of
    * local variables. The docstring, the body and the members are left out.
    * References in the copy resolve to the copy.
    */
    public Procedure getInterface() {
        Procedure o = new Procedure(name, arguments, is_function, source, null);
        for (Statement stmt : getSpec().getStatements()) {
            if (!(stmt instanceof VariableDeclaration)) {
                o.getSpec().addStatement(stmt.clone());
                continue;
            }
            VariableDeclaration decl = (VariableDeclaration)stmt;
            if (declaresArgumentsOnly(decl)) {
                VariableDeclaration copy = decl.clone();
                o.getSpec().addStatement(copy);
                for (Variable var : copy.getVariables()) {
                    o.declare(var.getName(), var.getType());
                }
            }
        }
        Rescoper.rescope(o);
        return o;
    }

    private boolean declaresArgumentsOnly(VariableDeclaration decl) {
        for (Variable var : decl.getVariables()) {
            boolean found = false;
            for (String arg : arguments) {
                if (arg.equalsIgnoreCase(var.getName())) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
    * Attaches the given procedures to the calls of the body that name them.
    * A call preceded by, or annotated with, a <code>!$strata reference</code>
    * directive is attached as an inactive call. Calls to other names are
    * left untouched.
    *
    * @param routines the call targets; names are matched ignoring case.
    */
    public void enrichCalls(List<Procedure> routines) {
        Map<String, Procedure> routine_map =
                new TreeMap<String, Procedure>(String.CASE_INSENSITIVE_ORDER);
        for (Procedure routine : routines) {
            routine_map.put(routine.getName(), routine);
        }
        DFIterator<ExpressionStatement> iter =
                new DFIterator<ExpressionStatement>(getBody(),
                        ExpressionStatement.class);
        while (iter.hasNext()) {
            ExpressionStatement stmt = iter.next();
            if (!(stmt.getExpression() instanceof FunctionCall)) {
                continue;
            }
            FunctionCall call = (FunctionCall)stmt.getExpression();
            Procedure routine = routine_map.get(call.getName());
            if (routine != null) {
                call.setRoutine(routine, !isReference(stmt));
            }
        }
    }

    /**
    * Checks the directives attached to the statement and the pragmas placed
    * immediately before it.
    */
    private static boolean isReference(Statement stmt) {
        if (StrataAnnotation.find(stmt, REFERENCE) != null) {
            return true;
        }
        if (!(stmt.getParent() instanceof CompoundStatement)) {
            return false;
        }
        List<Statement> stmts =
                ((CompoundStatement)stmt.getParent()).getStatements();
        int index = Tools.identityIndexOf(stmts, stmt);
        for (int i = index - 1; i >= 0; i--) {
            Statement prev = stmts.get(i);
            if (!(prev instanceof AnnotationStatement) ||
                ((AnnotationStatement)prev).isComment()) {
                break;
            }
            if (StrataAnnotation.find(prev, REFERENCE) != null) {
                return true;
            }
        }
        return false;
    }

    /**
    * Rebinds every variable reference of the spec and the body to the scope
    * that declares it.
    */
    public void rescopeVariables() {
        Rescoper.rescope(this);
    }

    /**
    * Returns a deep copy of this procedure in the same parent scope. The
    * references of the copy resolve to the copy.
    */
    @Override
    public Procedure clone() {
        return clone(parent_scope);
    }

    /**
    * Returns a deep copy of this procedure nested in the given scope.
    */
    public Procedure clone(Scope new_parent) {
        Procedure o = new Procedure(name, arguments, is_function, source,
                new_parent);
        symbol_table.copyInto(o.symbol_table);
        for (int i = DOCSTRING; i < MEMBERS; i++) {
            CompoundStatement section =
                    ((CompoundStatement)children.get(i)).clone();
            o.children.get(i).setParent(null);
            o.children.set(i, section);
            section.setParent(o);
        }
        for (Procedure member : getMembers()) {
            o.addMember(member.clone(o));
        }
        Rescoper.rescope(o);
        return o;
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * Removes a member procedure.
    * @throws UnsupportedOperationException for the sections.
    * @throws NotAChildException if <b>child</b> is not a child.
    */
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        if (index < MEMBERS) {
            throw new UnsupportedOperationException(
                    "Sections of a procedure cannot be removed.");
        }
        children.remove(index);
        child.setParent(null);
    }

    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException();
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void print(PrintWriter o) {
        String kind = is_function ? "FUNCTION" : "SUBROUTINE";
        o.print(kind + " " + name + "(");
        o.print(Tools.listToString(arguments, ", "));
        o.println(")");
        for (int i = DOCSTRING; i < MEMBERS; i++) {
            CompoundStatement section = (CompoundStatement)children.get(i);
            if (!section.isEmpty()) {
                section.print(o);
                o.println();
            }
        }
        if (children.size() > MEMBERS) {
            o.println("CONTAINS");
            for (Procedure member : getMembers()) {
                member.print(o);
                o.println();
            }
        }
        o.print("END " + kind + " " + name);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(400);
        PrintWriter o = new PrintWriter(sw);
        print(o);
        o.flush();
        return sw.toString();
    }

}
