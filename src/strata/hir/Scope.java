package strata.hir;

import java.util.ArrayList;
import java.util.List;

/**
* A lexical scope owning a {@link SymbolTable}. Each scope holds a
* non-owning reference to its parent scope; lookups walk this chain while
* declarations only ever change the local table.
*/
public class Scope {

    /** The local symbol table */
    protected SymbolTable symbol_table;

    /** The enclosing scope, or null for an outermost scope */
    protected Scope parent_scope;

    /**
    * Creates an empty scope nested in the given parent scope.
    * @param parent_scope the enclosing scope, or null.
    */
    public Scope(Scope parent_scope) {
        this.parent_scope = parent_scope;
        symbol_table = new SymbolTable();
    }

    /** Returns the local symbol table. */
    public SymbolTable getSymbolTable() {
        return symbol_table;
    }

    public Scope getParentScope() {
        return parent_scope;
    }

    /**
    * Declares (or re-declares) the given name in this scope.
    */
    public void declare(String name, SymbolAttributes attr) {
        symbol_table.put(name, attr);
    }

    /** Removes the local declaration of the given name. */
    public void undeclare(String name) {
        symbol_table.remove(name);
    }

    /**
    * Looks up the given name in this scope and then in the enclosing scopes.
    * @return the attributes of the closest declaration, or null.
    */
    public SymbolAttributes lookup(String name) {
        return lookup(name, true);
    }

    /**
    * Looks up the given name.
    * @param name the name to be searched for, ignoring case.
    * @param recursive false to search only the local table.
    * @return the attributes of the closest declaration, or null.
    */
    public SymbolAttributes lookup(String name, boolean recursive) {
        Scope scope = this;
        while (scope != null) {
            SymbolAttributes ret = scope.symbol_table.get(name);
            if (ret != null || !recursive) {
                return ret;
            }
            scope = scope.parent_scope;
        }
        return null;
    }

    /**
    * Returns the closest scope, starting from this one, whose local table
    * declares the given name, or null.
    */
    public Scope findDeclaringScope(String name) {
        for (Scope scope : getHierarchy()) {
            if (scope.symbol_table.containsKey(name)) {
                return scope;
            }
        }
        return null;
    }

    /**
    * Returns the chain of scopes from this scope to the outermost one.
    */
    public List<Scope> getHierarchy() {
        List<Scope> ret = new ArrayList<Scope>(4);
        for (Scope scope = this; scope != null; scope = scope.parent_scope) {
            ret.add(scope);
        }
        return ret;
    }

}
