package strata.hir;

import java.util.ArrayList;
import java.util.List;

/**
* Parses expressions written in source syntax, such as the parameters of
* directives, into IR bound to a scope. Names followed by a parenthesized
* list become calls when they are callable in the scope and array references
* otherwise.
* <pre>
*   ExpressionParser parser = new ExpressionParser(proc);
*   List&lt;RangeExpression&gt; ranges = parser.parseRangeList("1:n, 2:m-1");
* </pre>
*/
public class ExpressionParser {

    private Scope scope;

    private String text;

    private int pos;

    /**
    * Creates a parser resolving names in the given scope.
    */
    public ExpressionParser(Scope scope) {
        this.scope = scope;
    }

    /**
    * Parses a single expression.
    * @throws IllegalArgumentException if the text is not an expression.
    */
    public Expression parseExpression(String text) {
        reset(text);
        Expression ret = parseOr();
        expectEnd();
        return ret;
    }

    /**
    * Parses a comma-separated list of expressions.
    * @throws IllegalArgumentException if an element is not an expression.
    */
    public List<Expression> parseExpressionList(String text) {
        reset(text);
        List<Expression> ret = new ArrayList<Expression>();
        if (atEnd()) {
            return ret;
        }
        ret.add(parseOr());
        while (accept(",")) {
            ret.add(parseOr());
        }
        expectEnd();
        return ret;
    }

    /**
    * Parses a comma-separated list of ranges <code>start:stop[:step]</code>.
    * @throws IllegalArgumentException if an element is not a range with
    *   both bounds.
    */
    public List<RangeExpression> parseRangeList(String text) {
        reset(text);
        List<RangeExpression> ret = new ArrayList<RangeExpression>();
        do {
            Expression e = parseSection();
            if (!(e instanceof RangeExpression) ||
                ((RangeExpression)e).getStart() instanceof DeferredExtent ||
                ((RangeExpression)e).getStop() instanceof DeferredExtent) {
                throw error("range expected");
            }
            ret.add((RangeExpression)e);
        } while (accept(","));
        expectEnd();
        return ret;
    }

    private void reset(String text) {
        this.text = (text == null) ? "" : text;
        pos = 0;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(
                message + " at position " + pos + " in \"" + text + "\"");
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean atEnd() {
        skipSpaces();
        return pos >= text.length();
    }

    private void expectEnd() {
        if (!atEnd()) {
            throw error("unexpected input");
        }
    }

    private boolean lookingAt(String token) {
        skipSpaces();
        return text.regionMatches(true, pos, token, 0, token.length());
    }

    private boolean accept(String token) {
        if (lookingAt(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw error("'" + token + "' expected");
        }
    }

    private Expression parseOr() {
        Expression ret = parseAnd();
        while (accept(".or.")) {
            ret = new BinaryExpression(ret, BinaryOperator.LOGICAL_OR,
                    parseAnd());
        }
        return ret;
    }

    private Expression parseAnd() {
        Expression ret = parseNot();
        while (accept(".and.")) {
            ret = new BinaryExpression(ret, BinaryOperator.LOGICAL_AND,
                    parseNot());
        }
        return ret;
    }

    private Expression parseNot() {
        if (accept(".not.")) {
            return new UnaryExpression(UnaryOperator.LOGICAL_NEGATION,
                    parseNot());
        }
        return parseRelational();
    }

    private static final String[] relational = {
            "==", "/=", "<=", ">=", "<", ">",
            ".eq.", ".ne.", ".le.", ".ge.", ".lt.", ".gt."};

    private Expression parseRelational() {
        Expression ret = parseAdditive();
        for (String op : relational) {
            if (accept(op)) {
                return new BinaryExpression(ret, BinaryOperator.fromString(op),
                        parseAdditive());
            }
        }
        return ret;
    }

    private Expression parseAdditive() {
        Expression ret;
        if (accept("-")) {
            ret = new UnaryExpression(UnaryOperator.MINUS, parseMultiplicative());
        } else {
            accept("+");
            ret = parseMultiplicative();
        }
        while (true) {
            if (accept("+")) {
                ret = new BinaryExpression(ret, BinaryOperator.ADD,
                        parseMultiplicative());
            } else if (accept("-")) {
                ret = new BinaryExpression(ret, BinaryOperator.SUBTRACT,
                        parseMultiplicative());
            } else {
                return ret;
            }
        }
    }

    private Expression parseMultiplicative() {
        Expression ret = parsePower();
        while (true) {
            if (lookingAt("*") && !lookingAt("**")) {
                pos++;
                ret = new BinaryExpression(ret, BinaryOperator.MULTIPLY,
                        parsePower());
            } else if (lookingAt("/") && !lookingAt("/=")) {
                pos++;
                ret = new BinaryExpression(ret, BinaryOperator.DIVIDE,
                        parsePower());
            } else {
                return ret;
            }
        }
    }

    private Expression parsePower() {
        Expression ret = parsePrimary();
        if (accept("**")) {
            return new BinaryExpression(ret, BinaryOperator.POWER, parsePower());
        }
        return ret;
    }

    private Expression parsePrimary() {
        skipSpaces();
        if (pos >= text.length()) {
            throw error("expression expected");
        }
        char c = text.charAt(pos);
        if (accept("(")) {
            Expression ret = parseOr();
            expect(")");
            return ret;
        } else if (accept(".true.")) {
            return new BooleanLiteral(true);
        } else if (accept(".false.")) {
            return new BooleanLiteral(false);
        } else if (Character.isDigit(c)) {
            return parseNumber();
        } else if (c == '\'' || c == '"') {
            return parseString(c);
        } else if (Character.isLetter(c)) {
            return parseDesignator();
        }
        throw error("unexpected character '" + c + "'");
    }

    private Expression parseNumber() {
        int start = pos;
        boolean real = false;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        // A dot followed by a letter starts an operator such as .eq.
        if (pos < text.length() && text.charAt(pos) == '.' &&
            !isDotOperator(pos)) {
            real = true;
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && "eEdD".indexOf(text.charAt(pos)) >= 0 &&
            pos + 1 < text.length() &&
            (Character.isDigit(text.charAt(pos + 1)) ||
             "+-".indexOf(text.charAt(pos + 1)) >= 0)) {
            real = true;
            pos += 2;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && text.charAt(pos) == '_') {
            real = true;
            pos++;
            while (pos < text.length() && isNameChar(text.charAt(pos))) {
                pos++;
            }
        }
        String number = text.substring(start, pos);
        if (real) {
            return new FloatLiteral(number);
        }
        return new IntegerLiteral(Long.parseLong(number));
    }

    // Checks for an operator such as .eq. or .and. at the given position.
    private boolean isDotOperator(int at) {
        int i = at + 1;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
            i++;
        }
        return (i > at + 1 && i < text.length() && text.charAt(i) == '.');
    }

    private Expression parseString(char quote) {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == quote) {
                if (pos < text.length() && text.charAt(pos) == quote) {
                    sb.append(c);
                    pos++;
                } else {
                    return new StringLiteral(sb.toString());
                }
            } else {
                sb.append(c);
            }
        }
        throw error("unterminated string");
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private String parseName() {
        skipSpaces();
        int start = pos;
        while (pos < text.length() && isNameChar(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("name expected");
        }
        return text.substring(start, pos);
    }

    private Expression parseDesignator() {
        String name = parseName();
        Variable parent = null;
        while (true) {
            List<Expression> subscripts = null;
            if (accept("(")) {
                subscripts = new ArrayList<Expression>();
                if (!accept(")")) {
                    do {
                        subscripts.add(parseSection());
                    } while (accept(","));
                    expect(")");
                }
                if (parent == null && SymbolTools.isCallable(scope, name)) {
                    return new FunctionCall(new NameID(name), subscripts);
                }
            }
            Variable var = SymbolTools.makeVariable(scope, name, parent,
                    subscripts);
            if (!accept("%")) {
                return var;
            }
            parent = var;
            name = parseName();
        }
    }

    // A subscript: an expression or a triplet with optional parts.
    private Expression parseSection() {
        Expression start = null, stop = null, step = null;
        if (!lookingAt(":")) {
            start = parseOr();
        }
        if (!accept(":")) {
            return start;
        }
        if (!lookingAt(":") && !lookingAt(",") && !lookingAt(")") &&
            !atEnd()) {
            stop = parseOr();
        }
        if (accept(":")) {
            step = parseOr();
        }
        if (start == null && stop == null && step == null) {
            return new DeferredExtent();
        }
        return new RangeExpression(
                (start == null) ? new DeferredExtent() : start,
                (stop == null) ? new DeferredExtent() : stop, step);
    }

}
