package strata.hir;

/**
* CommentAnnotation is used for an annotation of comment type. The stored
* text does not include the leading comment marker.
*/
public class CommentAnnotation extends Annotation {

    private static final long serialVersionUID = 3476L;

    /**
    * Constructs a new comment annotation with the given comment; a leading
    * <code>!</code> is stripped.
    */
    public CommentAnnotation(String comment) {
        super();
        put("comment", comment.replaceFirst("^\\s*!\\s?", ""));
    }

    /** Returns the comment text. */
    public String getText() {
        return get("comment");
    }

    /**
    * Returns the string representation of this comment.
    * @return the string comments.
    */
    @Override
    public String toString() {
        return "! " + get("comment");
    }

}
