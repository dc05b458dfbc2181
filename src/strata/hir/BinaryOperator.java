package strata.hir;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
* The two-operand Fortran operators. Instances are the constants below; the
* dotted relational spellings (<code>.EQ.</code> and friends) map onto the
* symbolic ones.
*/
public final class BinaryOperator implements Printable {

    private static final Map<String, BinaryOperator> by_spelling =
            new HashMap<String, BinaryOperator>(32);

    public static final BinaryOperator ADD = new BinaryOperator("+", 5);
    public static final BinaryOperator SUBTRACT = new BinaryOperator("-", 5);
    public static final BinaryOperator MULTIPLY = new BinaryOperator("*", 6);
    public static final BinaryOperator DIVIDE = new BinaryOperator("/", 6);
    public static final BinaryOperator POWER = new BinaryOperator("**", 7);
    public static final BinaryOperator COMPARE_EQ =
            new BinaryOperator("==", 4, ".EQ.");
    public static final BinaryOperator COMPARE_NE =
            new BinaryOperator("/=", 4, ".NE.");
    public static final BinaryOperator COMPARE_LT =
            new BinaryOperator("<", 4, ".LT.");
    public static final BinaryOperator COMPARE_LE =
            new BinaryOperator("<=", 4, ".LE.");
    public static final BinaryOperator COMPARE_GT =
            new BinaryOperator(">", 4, ".GT.");
    public static final BinaryOperator COMPARE_GE =
            new BinaryOperator(">=", 4, ".GE.");
    public static final BinaryOperator LOGICAL_AND =
            new BinaryOperator(".AND.", 2);
    public static final BinaryOperator LOGICAL_OR =
            new BinaryOperator(".OR.", 1);

    private final String spelling;

    /** Larger binds tighter. */
    private final int precedence;

    private BinaryOperator(String spelling, int precedence,
                           String... aliases) {
        this.spelling = spelling;
        this.precedence = precedence;
        by_spelling.put(spelling, this);
        for (String alias : aliases) {
            by_spelling.put(alias, this);
        }
    }

    /** Operator for a spelling in any case, or null. */
    public static BinaryOperator fromString(String s) {
        return by_spelling.get(s.trim().toUpperCase(Locale.ROOT));
    }

    public void print(PrintWriter o) {
        o.print(spelling);
    }

    @Override
    public String toString() {
        return spelling;
    }

    public int getPrecedence() {
        return precedence;
    }

    /** Multiplicative operators and the power print without blanks. */
    public boolean isTight() {
        return precedence >= 6;
    }

    public boolean isLogical() {
        return this == LOGICAL_AND || this == LOGICAL_OR;
    }

}
