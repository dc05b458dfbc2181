package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a typed reference to a symbol. A variable carries its name, its
* {@link SymbolAttributes}, a non-owning link to the {@link Scope} in which it
* must resolve and, for derived-type member access such as
* <code>a%b</code>, the parent variable <code>a</code>. The parent, if any,
* is the first child; the remaining children are the subscripts of an array
* reference or the declared dimensions in a declaration.
* <p>
* Equality is lexical: the name (ignoring case), the parent and the
* subscripts take part in it; the type and the scope do not.
*/
public class Variable extends Expression {

    private String name;

    private SymbolAttributes type;

    private Scope scope;

    private boolean has_parent;

    /**
    * Creates a scalar reference with the given name, type and scope.
    */
    public Variable(String name, SymbolAttributes type, Scope scope) {
        this(name, type, scope, null, null);
    }

    /**
    * Creates a reference.
    *
    * @param name the symbol name.
    * @param type the attributes; null is treated as a deferred type.
    * @param scope the scope in which the reference resolves.
    * @param parent the parent variable of a member access, or null.
    * @param dims the subscripts or dimensions, or null.
    * @throws NotAnOrphanException if <b>parent</b> or a dimension has a
    *   parent.
    */
    public Variable(String name, SymbolAttributes type, Scope scope,
                    Variable parent, List<Expression> dims) {
        super(1 + (dims == null ? 0 : dims.size()));
        this.name = name;
        this.type = (type == null) ? SymbolAttributes.deferred() : type;
        this.scope = scope;
        has_parent = (parent != null);
        if (parent != null) {
            addChild(parent);
        }
        if (dims != null) {
            for (Expression dim : dims) {
                addChild(dim);
            }
        }
    }

    @Override
    public Variable clone() {
        return (Variable)super.clone();
    }

    public void print(PrintWriter o) {
        if (has_parent) {
            getParentVariable().print(o);
            o.print("%");
        }
        o.print(name);
        List<Expression> dims = getDimensions();
        if (!dims.isEmpty()) {
            o.print("(");
            o.print(Tools.listToString(dims, ", "));
            o.print(")");
        }
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && has_parent == ((Variable)o).has_parent &&
                name.equalsIgnoreCase(((Variable)o).name));
    }

    public String getName() {
        return name;
    }

    /** Returns the name prefixed with the parent chain, e.g. a%b. */
    public String getFullName() {
        if (has_parent) {
            return getParentVariable().getFullName() + "%" + name;
        }
        return name;
    }

    public SymbolAttributes getType() {
        return type;
    }

    public Scope getScope() {
        return scope;
    }

    /** Returns the parent variable of a member access, or null. */
    public Variable getParentVariable() {
        return has_parent ? (Variable)children.get(0) : null;
    }

    /** Returns the subscripts or the declared dimensions. */
    public List<Expression> getDimensions() {
        int first = has_parent ? 1 : 0;
        List<Expression> ret = new ArrayList<Expression>(children.size());
        for (int i = first; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    /** Returns an orphan copy of this reference bound to the given scope. */
    public Variable withScope(Scope scope) {
        Variable ret = clone();
        ret.scope = scope;
        return ret;
    }

    /** Returns an orphan copy of this reference with the given type. */
    public Variable withType(SymbolAttributes type) {
        Variable ret = clone();
        ret.type = (type == null) ? SymbolAttributes.deferred() : type;
        return ret;
    }

    /** Returns an orphan copy of this reference with the given name. */
    public Variable withName(String name) {
        Variable ret = clone();
        ret.name = name;
        return ret;
    }

    /**
    * Returns an orphan copy of this reference with the given parent; a null
    * parent removes the member access.
    */
    public Variable withParentVariable(Variable parent) {
        List<Expression> dims = new ArrayList<Expression>();
        for (Expression dim : getDimensions()) {
            dims.add(dim.clone());
        }
        return new Variable(name, type, scope,
                (parent == null) ? null : parent.clone(), dims);
    }

    /**
    * Returns an orphan copy of this reference with the given subscripts or
    * dimensions; the list elements are cloned.
    */
    public Variable withDimensions(List<Expression> dims) {
        List<Expression> new_dims = new ArrayList<Expression>();
        if (dims != null) {
            for (Expression dim : dims) {
                new_dims.add(dim.clone());
            }
        }
        Variable parent = getParentVariable();
        return new Variable(name, type, scope,
                (parent == null) ? null : parent.clone(), new_dims);
    }

}
