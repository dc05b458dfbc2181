package strata.frontend;

import strata.hir.Procedure;
import strata.hir.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* The parts of a procedure located in a raw tree. The signature is known
* up front; the docstring, spec and body are built on demand into a
* {@link Procedure}, whose scope resolves the names they refer to.
*/
public abstract class ProcedureDescriptor {

    private final String name;

    private final boolean is_function;

    private final List<String> arguments;

    private final SourceSpan source;

    protected ProcedureDescriptor(String name, boolean is_function,
            List<String> arguments, SourceSpan source) {
        this.name = name;
        this.is_function = is_function;
        this.arguments = Collections.unmodifiableList(
                new ArrayList<String>(arguments));
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public boolean isFunction() {
        return is_function;
    }

    /** Returns the dummy argument names in signature order. */
    public List<String> getArguments() {
        return arguments;
    }

    public SourceSpan getSource() {
        return source;
    }

    /** Returns the raw trees of the member procedures, in source order. */
    public abstract List<Object> getMemberTrees();

    /** Fills the docstring of the procedure. */
    public abstract void buildDocstring(Procedure proc);

    /** Fills the spec of the procedure. */
    public abstract void buildSpec(Procedure proc);

    /**
    * Fills the body of the procedure. The spec symbols and the member names
    * are declared when this is called.
    */
    public abstract void buildBody(Procedure proc);

}
