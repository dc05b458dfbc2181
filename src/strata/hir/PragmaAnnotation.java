package strata.hir;

/**
* PragmaAnnotation is used for annotations of pragma type, i.e. comment
* lines of the form <code>!$keyword content</code>.
*/
public class PragmaAnnotation extends Annotation {

    private static final long serialVersionUID = 3470L;

    /**
    * Constructs a pragma with the given keyword and raw content.
    */
    public PragmaAnnotation(String keyword, String content) {
        super();
        put("pragma", keyword);
        put("content", (content == null) ? "" : content.trim());
    }

    /**
    * Returns the keyword of this pragma annotation.
    */
    public String getKeyword() {
        return get("pragma");
    }

    /** Returns the raw content following the keyword. */
    public String getContent() {
        return get("content");
    }

    /**
    * Returns the string representation of this pragma annotation.
    * @return the string.
    */
    @Override
    public String toString() {
        String content = getContent();
        if (content.length() == 0) {
            return "!$" + getKeyword();
        }
        return "!$" + getKeyword() + " " + content;
    }

    /**
    * Returns a pragma annotation object after parsing the given text
    * contents. Pragmas with the <code>strata</code> keyword become
    * {@link StrataAnnotation}s.
    * @param keyword the pragma keyword.
    * @param content the text following the keyword.
    * @return the matching pragma annotation.
    */
    public static PragmaAnnotation parse(String keyword, String content) {
        if (StrataAnnotation.KEYWORD.equalsIgnoreCase(keyword)) {
            return StrataAnnotation.parse(content);
        }
        return new PragmaAnnotation(keyword, content);
    }

    /**
    * Parses a full pragma line such as <code>!$strata loop-fission</code>
    * or <code>strata loop-fission</code>. The first word is the keyword.
    */
    public static PragmaAnnotation parse(String text) {
        String t = text.trim().replaceFirst("^!\\$", "").trim();
        int space = t.indexOf(' ');
        if (space < 0) {
            return parse(t, "");
        }
        return parse(t.substring(0, space), t.substring(space + 1));
    }

}
