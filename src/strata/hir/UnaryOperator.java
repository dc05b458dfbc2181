package strata.hir;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** The prefix operators: signs and logical negation. */
public final class UnaryOperator implements Printable {

    private static final Map<String, UnaryOperator> by_spelling =
            new HashMap<String, UnaryOperator>(4);

    public static final UnaryOperator MINUS = new UnaryOperator("-", 5);
    public static final UnaryOperator PLUS = new UnaryOperator("+", 5);
    public static final UnaryOperator LOGICAL_NEGATION =
            new UnaryOperator(".NOT.", 3);

    private final String spelling;

    private final int precedence;

    private UnaryOperator(String spelling, int precedence) {
        this.spelling = spelling;
        this.precedence = precedence;
        by_spelling.put(spelling, this);
    }

    /** Operator for a spelling in any case, or null. */
    public static UnaryOperator fromString(String s) {
        return by_spelling.get(s.trim().toUpperCase(Locale.ROOT));
    }

    /** Dotted operators are followed by a blank. */
    public void print(PrintWriter o) {
        o.print(toString());
    }

    @Override
    public String toString() {
        return spelling.startsWith(".") ? spelling + " " : spelling;
    }

    public int getPrecedence() {
        return precedence;
    }

}
