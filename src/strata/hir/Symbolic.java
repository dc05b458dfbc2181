package strata.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* Class Symbolic provides static utility methods that simplify integer
* expressions symbolically. An expression is normalized into a polynomial:
* a map from monomials (sorted lists of factors) to integer coefficients.
* Sub-expressions that are not polynomial, such as array references,
* non-exact divisions or calls, are kept as opaque factors with their own
* operands simplified.
*/
public final class Symbolic {

    /** Largest literal exponent expanded into a product */
    private static final int MAX_EXPANDED_POWER = 8;

    private static final List<Expression> CONSTANT_KEY =
            Collections.unmodifiableList(new ArrayList<Expression>(0));

    private static final Comparator<Expression> factor_order =
            new Comparator<Expression>() {
                public int compare(Expression e1, Expression e2) {
                    return e1.toString().toLowerCase(Locale.ROOT).compareTo(
                            e2.toString().toLowerCase(Locale.ROOT));
                }
            };

    // No instantiation is used.
    private Symbolic() {
    }

    /**
    * Returns a simplified copy of the given expression. Terms appear in order
    * of first occurrence with the constant term last.
    * @param e the given expression.
    * @return the simplified expression.
    */
    public static Expression simplify(Expression e) {
        return fromPolynomial(toPolynomial(e));
    }

    /**
    * Returns addition of the two expressions with simplification.
    */
    public static Expression add(Expression e1, Expression e2) {
        return binary(e1, BinaryOperator.ADD, e2);
    }

    /**
    * Returns subtraction of two expressions with simplification.
    */
    public static Expression subtract(Expression e1, Expression e2) {
        return binary(e1, BinaryOperator.SUBTRACT, e2);
    }

    /**
    * Returns multiplication of two expressions with simplification.
    */
    public static Expression multiply(Expression e1, Expression e2) {
        return binary(e1, BinaryOperator.MULTIPLY, e2);
    }

    /**
    * Returns division of two expressions with simplification.
    */
    public static Expression divide(Expression e1, Expression e2) {
        return binary(e1, BinaryOperator.DIVIDE, e2);
    }

    /**
    * Returns the negation of the given expression with simplification.
    */
    public static Expression negate(Expression e) {
        return simplify(new UnaryExpression(UnaryOperator.MINUS, e.clone()));
    }

    private static Expression
            binary(Expression e1, BinaryOperator op, Expression e2) {
        return simplify(new BinaryExpression(e1.clone(), op, e2.clone()));
    }

    /**
    * Checks if the given expression simplifies to an integer constant.
    */
    public static boolean isConstant(Expression e) {
        return getConstant(e) != null;
    }

    /**
    * Returns the value of the given expression if it simplifies to an
    * integer constant, or null otherwise.
    */
    public static Long getConstant(Expression e) {
        return constantOf(toPolynomial(e));
    }

    /**
    * Compares two expressions symbolically.
    * @return the sign of <code>e1 - e2</code> if the difference simplifies
    *   to a constant, or null if the expressions are not comparable.
    */
    public static Integer compare(Expression e1, Expression e2) {
        Long diff = getConstant(new BinaryExpression(
                e1.clone(), BinaryOperator.SUBTRACT, e2.clone()));
        if (diff == null) {
            return null;
        }
        return Integer.valueOf(Long.signum(diff.longValue()));
    }

    /**
    * Checks if two expressions are symbolically equal.
    */
    public static boolean isEqual(Expression e1, Expression e2) {
        Integer ret = compare(e1, e2);
        return (ret != null && ret.intValue() == 0);
    }

    /**
    * Returns the terms of the normalized polynomial of the given expression.
    * Each key is a monomial given as its sorted list of factors; the
    * constant term, if nonzero, has the empty list as its key.
    */
    public static Map<List<Expression>, Long>
            getPolynomialTerms(Expression e) {
        return toPolynomial(e);
    }

    private static Map<List<Expression>, Long> constant(long value) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>();
        if (value != 0) {
            ret.put(CONSTANT_KEY, Long.valueOf(value));
        }
        return ret;
    }

    private static Map<List<Expression>, Long> atom(Expression e) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>();
        List<Expression> key = new ArrayList<Expression>(1);
        key.add(e);
        ret.put(key, Long.valueOf(1));
        return ret;
    }

    private static Long constantOf(Map<List<Expression>, Long> p) {
        if (p.isEmpty()) {
            return Long.valueOf(0);
        }
        if (p.size() == 1 && p.containsKey(CONSTANT_KEY)) {
            return p.get(CONSTANT_KEY);
        }
        return null;
    }

    private static Map<List<Expression>, Long> toPolynomial(Expression e) {
        if (e instanceof IntegerLiteral) {
            return constant(((IntegerLiteral)e).getValue());
        } else if (e instanceof BinaryExpression) {
            return binaryToPolynomial((BinaryExpression)e);
        } else if (e instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)e;
            if (ue.getOperator() == UnaryOperator.MINUS) {
                return scale(toPolynomial(ue.getExpression()), -1);
            } else if (ue.getOperator() == UnaryOperator.PLUS) {
                return toPolynomial(ue.getExpression());
            }
            return atom(new UnaryExpression(ue.getOperator(),
                    simplify(ue.getExpression())));
        } else if (e instanceof FunctionCall) {
            return callToPolynomial((FunctionCall)e);
        }
        return atom(e.clone());
    }

    private static Map<List<Expression>, Long>
            binaryToPolynomial(BinaryExpression be) {
        BinaryOperator op = be.getOperator();
        if (op == BinaryOperator.ADD) {
            return sum(toPolynomial(be.getLHS()), toPolynomial(be.getRHS()));
        } else if (op == BinaryOperator.SUBTRACT) {
            return sum(toPolynomial(be.getLHS()),
                       scale(toPolynomial(be.getRHS()), -1));
        } else if (op == BinaryOperator.MULTIPLY) {
            return product(toPolynomial(be.getLHS()),
                           toPolynomial(be.getRHS()));
        } else if (op == BinaryOperator.DIVIDE) {
            Map<List<Expression>, Long> p = toPolynomial(be.getLHS());
            Map<List<Expression>, Long> q = toPolynomial(be.getRHS());
            Long c = constantOf(q);
            if (c != null && c.longValue() != 0 && isDivisible(p, c)) {
                Map<List<Expression>, Long> ret =
                        new LinkedHashMap<List<Expression>, Long>();
                for (List<Expression> key : p.keySet()) {
                    ret.put(key, Long.valueOf(p.get(key) / c));
                }
                return ret;
            }
            return atom(new BinaryExpression(fromPolynomial(p), op,
                    fromPolynomial(q)));
        } else if (op == BinaryOperator.POWER) {
            Map<List<Expression>, Long> p = toPolynomial(be.getLHS());
            Map<List<Expression>, Long> q = toPolynomial(be.getRHS());
            Long c = constantOf(q);
            if (c != null && c.longValue() >= 0 &&
                c.longValue() <= MAX_EXPANDED_POWER) {
                Map<List<Expression>, Long> ret = constant(1);
                for (long i = 0; i < c.longValue(); i++) {
                    ret = product(ret, p);
                }
                return ret;
            }
            return atom(new BinaryExpression(fromPolynomial(p), op,
                    fromPolynomial(q)));
        }
        return atom(new BinaryExpression(simplify(be.getLHS()), op,
                simplify(be.getRHS())));
    }

    // Folds min, max and abs of constants; other calls become factors.
    private static Map<List<Expression>, Long>
            callToPolynomial(FunctionCall fc) {
        List<Expression> args = new ArrayList<Expression>();
        List<Long> values = new ArrayList<Long>();
        for (Expression arg : fc.getArguments()) {
            Expression sarg = simplify(arg);
            args.add(sarg);
            Long value = getConstant(sarg);
            if (value != null) {
                values.add(value);
            }
        }
        String name = fc.getName().toLowerCase(Locale.ROOT);
        if (!args.isEmpty() && values.size() == args.size()) {
            if (name.equals("min")) {
                return constant(Collections.min(values).longValue());
            } else if (name.equals("max")) {
                return constant(Collections.max(values).longValue());
            } else if (name.equals("abs") && values.size() == 1) {
                return constant(Math.abs(values.get(0).longValue()));
            }
        }
        return atom(new FunctionCall(fc.getNameID().clone(), args));
    }

    private static boolean isDivisible(Map<List<Expression>, Long> p, long c) {
        for (Long coef : p.values()) {
            if (coef.longValue() % c != 0) {
                return false;
            }
        }
        return true;
    }

    private static Map<List<Expression>, Long>
            scale(Map<List<Expression>, Long> p, long factor) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>();
        if (factor == 0) {
            return ret;
        }
        for (List<Expression> key : p.keySet()) {
            ret.put(key, Long.valueOf(p.get(key) * factor));
        }
        return ret;
    }

    private static Map<List<Expression>, Long> sum(
            Map<List<Expression>, Long> p, Map<List<Expression>, Long> q) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>(p);
        for (List<Expression> key : q.keySet()) {
            accumulate(ret, key, q.get(key));
        }
        return removeZeros(ret);
    }

    private static Map<List<Expression>, Long> product(
            Map<List<Expression>, Long> p, Map<List<Expression>, Long> q) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>();
        for (List<Expression> k1 : p.keySet()) {
            for (List<Expression> k2 : q.keySet()) {
                List<Expression> key = new ArrayList<Expression>(k1);
                key.addAll(k2);
                Collections.sort(key, factor_order);
                if (key.isEmpty()) {
                    key = CONSTANT_KEY;
                }
                accumulate(ret, key, p.get(k1) * q.get(k2));
            }
        }
        return removeZeros(ret);
    }

    private static void accumulate(Map<List<Expression>, Long> p,
            List<Expression> key, long coef) {
        Long old = p.get(key);
        p.put(key, Long.valueOf((old == null) ? coef : old + coef));
    }

    private static Map<List<Expression>, Long>
            removeZeros(Map<List<Expression>, Long> p) {
        Map<List<Expression>, Long> ret =
                new LinkedHashMap<List<Expression>, Long>();
        for (List<Expression> key : p.keySet()) {
            if (p.get(key).longValue() != 0) {
                ret.put(key, p.get(key));
            }
        }
        return ret;
    }

    private static Expression fromPolynomial(Map<List<Expression>, Long> p) {
        Expression ret = null;
        for (List<Expression> key : p.keySet()) {
            if (key.isEmpty()) {
                continue;
            }
            long coef = p.get(key).longValue();
            Expression term = null;
            for (Expression factor : key) {
                term = (term == null) ? factor.clone() : new BinaryExpression(
                        term, BinaryOperator.MULTIPLY, factor.clone());
            }
            if (Math.abs(coef) != 1) {
                term = new BinaryExpression(new IntegerLiteral(Math.abs(coef)),
                        BinaryOperator.MULTIPLY, term);
            }
            if (ret == null) {
                ret = (coef < 0) ?
                        new UnaryExpression(UnaryOperator.MINUS, term) : term;
            } else {
                ret = new BinaryExpression(ret, (coef < 0) ?
                        BinaryOperator.SUBTRACT : BinaryOperator.ADD, term);
            }
        }
        Long c = p.get(CONSTANT_KEY);
        long value = (c == null) ? 0 : c.longValue();
        if (ret == null) {
            return new IntegerLiteral(value);
        } else if (value != 0) {
            ret = new BinaryExpression(ret, (value < 0) ?
                    BinaryOperator.SUBTRACT : BinaryOperator.ADD,
                    new IntegerLiteral(Math.abs(value)));
        }
        return ret;
    }

}
