package strata.hir;

import java.io.PrintWriter;
import java.util.Locale;

/**
* Represents an untyped name, such as the name of a called procedure. Names
* compare equal ignoring case.
*/
public class NameID extends Expression {

    private String name;

    public NameID(String name) {
        super(-1);
        this.name = name;
    }

    @Override
    public NameID clone() {
        return (NameID)super.clone();
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && name.equalsIgnoreCase(((NameID)o).name));
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    public String getName() {
        return name;
    }

}
