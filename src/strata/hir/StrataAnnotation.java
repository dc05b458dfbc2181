package strata.hir;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* StrataAnnotation represents a <code>!$strata</code> directive. The first
* word of the content is the directive name; the rest is a list of
* parameters written as <code>key(value)</code> or a bare <code>key</code>:
* <pre>
*   !$strata loop-fusion group(g1) collapse(2) range(1:n, 1:m)
*   !$strata loop-fission promote(tmp, work)
* </pre>
* Parameter values keep their text; balanced parentheses may appear inside
* a value. Content that cannot be split into parameters is recorded as an
* error and reported by the pass that consumes the directive.
*/
public class StrataAnnotation extends PragmaAnnotation {

    private static final long serialVersionUID = 3473L;

    /** The pragma keyword of strata directives */
    public static final String KEYWORD = "strata";

    /**
    * Constructs a directive with no parameters.
    */
    public StrataAnnotation(String directive) {
        super(KEYWORD, directive);
        put("strata", directive.toLowerCase(Locale.ROOT));
        put("parameters", new LinkedHashMap<String, String>());
    }

    /**
    * Parses the content of a strata pragma (the text after the keyword).
    * The directive may itself carry a value, as in
    * <code>dimension(n, m)</code>; it is then kept as a parameter named
    * after the directive.
    */
    public static StrataAnnotation parse(String content) {
        String t = content.trim();
        int end = 0;
        while (end < t.length() && isKeyChar(t.charAt(end))) {
            end++;
        }
        StrataAnnotation ret = new StrataAnnotation(t.substring(0, end));
        ret.parseParameters(t);
        String directive = ret.getDirective();
        if ("".equals(ret.getParameters().get(directive))) {
            ret.getParameters().remove(directive);
        }
        return ret;
    }

    private void parseParameters(String text) {
        Map<String, String> params = getParameters();
        int i = 0, n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
                continue;
            }
            int start = i;
            while (i < n && isKeyChar(text.charAt(i))) {
                i++;
            }
            if (i == start) {
                put("error", "unexpected character '" + c + "' in: " + text);
                return;
            }
            String key = text.substring(start, i).toLowerCase(Locale.ROOT);
            while (i < n && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i < n && text.charAt(i) == '(') {
                int depth = 0, open = i;
                for (; i < n; i++) {
                    if (text.charAt(i) == '(') {
                        depth++;
                    } else if (text.charAt(i) == ')' && --depth == 0) {
                        break;
                    }
                }
                if (depth != 0) {
                    put("error", "unbalanced parentheses in: " + text);
                    return;
                }
                params.put(key, text.substring(open + 1, i).trim());
                i++;
            } else {
                params.put(key, "");
            }
        }
    }

    private static boolean isKeyChar(char c) {
        return (Character.isLetterOrDigit(c) || c == '_' || c == '-');
    }

    /** Returns the directive name in lower case. */
    public String getDirective() {
        return get("strata");
    }

    /** Returns the parameters in order of appearance. */
    public Map<String, String> getParameters() {
        return get("parameters");
    }

    /**
    * Returns the text of the given parameter, the empty string for a bare
    * parameter, or null if the parameter is absent.
    */
    public String getParameter(String key) {
        return getParameters().get(key.toLowerCase(Locale.ROOT));
    }

    public boolean isWellFormed() {
        return !containsKey("error");
    }

    /** Returns the parse error message, or null. */
    public String getError() {
        return get("error");
    }

    @Override
    public String getContent() {
        StringBuilder sb = new StringBuilder(40);
        String directive = getDirective();
        Map<String, String> params = getParameters();
        sb.append(directive);
        if (params.containsKey(directive)) {
            sb.append("(").append(params.get(directive)).append(")");
        }
        for (String key : params.keySet()) {
            if (key.equals(directive)) {
                continue;
            }
            sb.append(" ").append(key);
            if (params.get(key).length() > 0) {
                sb.append("(").append(params.get(key)).append(")");
            }
        }
        return sb.toString();
    }

    /**
    * Returns the first strata annotation of the given directive attached to
    * the annotatable object, or null.
    */
    public static StrataAnnotation
            find(Annotatable at, String directive) {
        List<StrataAnnotation> notes = at.getAnnotations(StrataAnnotation.class);
        for (StrataAnnotation note : notes) {
            if (note.getDirective().equalsIgnoreCase(directive)) {
                return note;
            }
        }
        return null;
    }

}
