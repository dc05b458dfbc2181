package strata.hir;

import java.io.PrintWriter;
import java.util.Locale;

/**
* Represents a specification statement kept as text, such as
* <code>IMPLICIT NONE</code>.
*/
public class IntrinsicStatement extends Statement {

    private String text;

    public IntrinsicStatement(String text) {
        super(-1);
        this.text = text.trim();
    }

    @Override
    public IntrinsicStatement clone() {
        return (IntrinsicStatement)super.clone();
    }

    public String getText() {
        return text;
    }

    /** Checks if this is an implicit typing statement. */
    public boolean isImplicit() {
        return text.toUpperCase(Locale.ROOT).startsWith("IMPLICIT");
    }

    protected void printStatement(PrintWriter o) {
        o.print(text);
    }

}
