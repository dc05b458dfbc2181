package strata.hir;

import java.io.PrintWriter;

/** Represents a character literal, printed in single quotes. */
public class StringLiteral extends Literal {

    private String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    @Override
    public StringLiteral clone() {
        return (StringLiteral)super.clone();
    }

    public void print(PrintWriter o) {
        o.print("'");
        o.print(value.replace("'", "''"));
        o.print("'");
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value.equals(((StringLiteral)o).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    public String getValue() {
        return value;
    }

}
