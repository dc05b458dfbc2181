package strata.hir;

import java.io.PrintWriter;

/** Represents a logical literal. */
public class BooleanLiteral extends Literal {

    private boolean value;

    public BooleanLiteral(boolean value) {
        this.value = value;
    }

    @Override
    public BooleanLiteral clone() {
        return (BooleanLiteral)super.clone();
    }

    public void print(PrintWriter o) {
        o.print(value ? ".TRUE." : ".FALSE.");
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((BooleanLiteral)o).value);
    }

    @Override
    public int hashCode() {
        return (value ? 1 : 0);
    }

    public boolean getValue() {
        return value;
    }

}
