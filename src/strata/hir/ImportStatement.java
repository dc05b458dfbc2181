package strata.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a module import, <code>USE module[, ONLY: a, b]</code>.
*/
public class ImportStatement extends Statement {

    private String module;

    private List<String> symbols;

    /**
    * Creates an import of the given module; an empty symbol list imports
    * everything.
    */
    public ImportStatement(String module, List<String> symbols) {
        super(-1);
        this.module = module;
        this.symbols = new ArrayList<String>(symbols);
    }

    @Override
    public ImportStatement clone() {
        ImportStatement o = (ImportStatement)super.clone();
        o.symbols = new ArrayList<String>(symbols);
        return o;
    }

    public String getModule() {
        return module;
    }

    /** Returns the names listed after ONLY, in order. */
    public List<String> getSymbols() {
        return new ArrayList<String>(symbols);
    }

    protected void printStatement(PrintWriter o) {
        o.print("USE ");
        o.print(module);
        if (!symbols.isEmpty()) {
            o.print(", ONLY: ");
            o.print(Tools.listToString(symbols, ", "));
        }
    }

}
