package strata.analysis;

import strata.hir.BinaryExpression;
import strata.hir.BinaryOperator;
import strata.hir.Expression;
import strata.hir.IntegerLiteral;
import strata.hir.RangeExpression;
import strata.hir.Symbolic;
import strata.hir.Variable;
import strata.transforms.NonAffineBoundException;
import strata.transforms.UnsupportedLoopShapeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
* Halfspace representation of the iteration space of a loop nest: the
* integer points <code>x</code> with <code>A x &lt;= b</code>. Column
* <code>j</code> of <code>A</code> stands for the <code>j</code>th variable
* of the attached variable list.
* <p>
* A polyhedron built from loop ranges has two rows per loop variable, a
* lower-bound row and an upper-bound row, in loop order. Variables that
* appear only in the bounds follow the loop variables, sorted by name.
*/
public class Polyhedron {

    private final long[][] A;

    private final long[] b;

    private final List<Variable> variables;

    /**
    * Creates a polyhedron from its matrix, right-hand side and column
    * variables.
    * @throws IllegalArgumentException if the dimensions do not agree.
    */
    public Polyhedron(long[][] A, long[] b, List<Variable> variables) {
        if (A.length != b.length) {
            throw new IllegalArgumentException(
                    "matrix has " + A.length + " rows, vector has " + b.length);
        }
        for (long[] row : A) {
            if (variables != null && row.length != variables.size()) {
                throw new IllegalArgumentException(
                        "matrix row has " + row.length + " columns for " +
                        variables.size() + " variables");
            }
        }
        this.A = A;
        this.b = b;
        this.variables = variables;
    }

    /**
    * Builds the polyhedron of a loop nest.
    *
    * @param loop_vars the loop variables, outermost first.
    * @param ranges the range of each loop variable.
    * @return the polyhedron.
    * @throws UnsupportedLoopShapeException if a step is not 1.
    * @throws NonAffineBoundException if a bound is not affine.
    */
    public static Polyhedron fromLoopRanges(List<Variable> loop_vars,
                                            List<RangeExpression> ranges) {
        if (loop_vars.size() != ranges.size()) {
            throw new IllegalArgumentException(
                    loop_vars.size() + " variables for " + ranges.size() +
                    " ranges");
        }
        List<Map<List<Expression>, Long>> lower =
                new ArrayList<Map<List<Expression>, Long>>();
        List<Map<List<Expression>, Long>> upper =
                new ArrayList<Map<List<Expression>, Long>>();
        // Free variables, sorted by name.
        Map<String, Variable> free = new TreeMap<String, Variable>();
        for (int i = 0; i < ranges.size(); i++) {
            RangeExpression range = ranges.get(i);
            if (!range.hasUnitStep()) {
                throw new UnsupportedLoopShapeException(
                        "step " + range.getStep() + " of " + loop_vars.get(i) +
                        " is not 1");
            }
            lower.add(affineTerms(range.getStart(), loop_vars, free));
            upper.add(affineTerms(range.getStop(), loop_vars, free));
        }
        List<Variable> vars = new ArrayList<Variable>();
        for (Variable var : loop_vars) {
            vars.add(var.clone());
        }
        vars.addAll(free.values());
        int n = vars.size();
        long[][] A = new long[2 * ranges.size()][n];
        long[] b = new long[2 * ranges.size()];
        for (int i = 0; i < ranges.size(); i++) {
            // -x_i + lower_terms <= -lower_const
            A[2 * i][i] = -1;
            b[2 * i] = -fillRow(A[2 * i], lower.get(i), vars, 1);
            // x_i - upper_terms <= upper_const
            A[2 * i + 1][i] = 1;
            b[2 * i + 1] = fillRow(A[2 * i + 1], upper.get(i), vars, -1);
        }
        return new Polyhedron(A, b, vars);
    }

    /**
    * Returns the affine terms of a bound and records the variables that are
    * not loop variables.
    */
    private static Map<List<Expression>, Long> affineTerms(Expression bound,
            List<Variable> loop_vars, Map<String, Variable> free) {
        Map<List<Expression>, Long> terms = Symbolic.getPolynomialTerms(bound);
        for (List<Expression> key : terms.keySet()) {
            if (key.isEmpty()) {
                continue;
            }
            if (key.size() != 1 || !isScalar(key.get(0))) {
                throw new NonAffineBoundException(
                        "bound " + bound + " is not affine");
            }
            Variable var = (Variable)key.get(0);
            if (indexOf(loop_vars, var.getName()) < 0) {
                String name = var.getName().toLowerCase(Locale.ROOT);
                if (!free.containsKey(name)) {
                    free.put(name, var.clone());
                }
            }
        }
        return terms;
    }

    private static boolean isScalar(Expression e) {
        return (e instanceof Variable &&
                ((Variable)e).getParentVariable() == null &&
                ((Variable)e).getDimensions().isEmpty());
    }

    // Adds sign * coefficient of every term to the row; returns the constant.
    private static long fillRow(long[] row, Map<List<Expression>, Long> terms,
                                List<Variable> vars, int sign) {
        long constant = 0;
        for (List<Expression> key : terms.keySet()) {
            long coef = terms.get(key).longValue();
            if (key.isEmpty()) {
                constant = coef;
            } else {
                String name = ((Variable)key.get(0)).getName();
                row[indexOf(vars, name)] += sign * coef;
            }
        }
        return constant;
    }

    private static int indexOf(List<Variable> vars, String name) {
        for (int i = 0; i < vars.size(); i++) {
            if (vars.get(i).getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    /** Returns a copy of the constraint matrix. */
    public long[][] getA() {
        long[][] ret = new long[A.length][];
        for (int i = 0; i < A.length; i++) {
            ret[i] = A[i].clone();
        }
        return ret;
    }

    /** Returns a copy of the right-hand side. */
    public long[] getB() {
        return b.clone();
    }

    /** Returns the column variables. */
    public List<Variable> getVariables() {
        return variables;
    }

    /**
    * Returns the lower bounds of the <var>j</var>th variable, one per row
    * whose coefficient for it is negative, in row order.
    */
    public List<Expression> lowerBounds(int j) {
        return bounds(j, true);
    }

    /** Returns the lower bounds of the variable with the given name. */
    public List<Expression> lowerBounds(String name) {
        return lowerBounds(columnOf(name));
    }

    /** Returns the lower bounds of the given variable. */
    public List<Expression> lowerBounds(Variable var) {
        return lowerBounds(var.getName());
    }

    /**
    * Returns the upper bounds of the <var>j</var>th variable, one per row
    * whose coefficient for it is positive, in row order.
    */
    public List<Expression> upperBounds(int j) {
        return bounds(j, false);
    }

    /** Returns the upper bounds of the variable with the given name. */
    public List<Expression> upperBounds(String name) {
        return upperBounds(columnOf(name));
    }

    /** Returns the upper bounds of the given variable. */
    public List<Expression> upperBounds(Variable var) {
        return upperBounds(var.getName());
    }

    private int columnOf(String name) {
        int ret = (variables == null) ? -1 : indexOf(variables, name);
        if (ret < 0) {
            throw new IllegalArgumentException(
                    name + " is not a variable of the polyhedron");
        }
        return ret;
    }

    /*
    * Solves row r for x_j. With a = A[r][j]:
    *   lower (a < 0): x_j >= (sum_{k!=j} A[r][k] x_k - b[r]) / -a
    *   upper (a > 0): x_j <= (b[r] - sum_{k!=j} A[r][k] x_k) / a
    */
    private List<Expression> bounds(int j, boolean lower) {
        if (variables == null) {
            throw new IllegalStateException("no variables attached");
        }
        List<Expression> ret = new ArrayList<Expression>();
        for (int r = 0; r < A.length; r++) {
            long a = A[r][j];
            if ((lower && a >= 0) || (!lower && a <= 0)) {
                continue;
            }
            int sign = lower ? 1 : -1;
            Expression numerator = new IntegerLiteral(-sign * b[r]);
            for (int k = 0; k < A[r].length; k++) {
                if (k == j || A[r][k] == 0) {
                    continue;
                }
                numerator = new BinaryExpression(numerator, BinaryOperator.ADD,
                        new BinaryExpression(
                        new IntegerLiteral(sign * A[r][k]),
                        BinaryOperator.MULTIPLY, variables.get(k).clone()));
            }
            ret.add(Symbolic.simplify(new BinaryExpression(numerator,
                    BinaryOperator.DIVIDE, new IntegerLiteral(-sign * a))));
        }
        return ret;
    }

}
