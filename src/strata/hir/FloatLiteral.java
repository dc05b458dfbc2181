package strata.hir;

import java.io.PrintWriter;
import java.util.Locale;

/**
* Represents a real literal. The source spelling is kept as is, including any
* exponent letter or kind suffix (e.g. <code>1.0d0</code>, <code>2._jprb</code>).
*/
public class FloatLiteral extends Literal {

    private String text;

    public FloatLiteral(String text) {
        this.text = text;
    }

    @Override
    public FloatLiteral clone() {
        return (FloatLiteral)super.clone();
    }

    public void print(PrintWriter o) {
        o.print(text);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) &&
                text.equalsIgnoreCase(((FloatLiteral)o).text));
    }

    @Override
    public int hashCode() {
        return text.toLowerCase(Locale.ROOT).hashCode();
    }

    /** Returns the source spelling of the literal. */
    public String getText() {
        return text;
    }

}
