package strata.hir;

import java.io.PrintWriter;

/** A whole number constant without a kind suffix. */
public class IntegerLiteral extends Literal {

    private final long value;

    public IntegerLiteral(long value) {
        this.value = value;
    }

    @Override
    public IntegerLiteral clone() {
        return (IntegerLiteral)super.clone();
    }

    public void print(PrintWriter o) {
        o.print(value);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((IntegerLiteral)o).value == value;
    }

    @Override
    public int hashCode() {
        return (int)(value ^ (value >>> 32));
    }

    public long getValue() {
        return value;
    }

}
