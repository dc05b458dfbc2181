package strata.hir;

import java.io.PrintWriter;

/**
* AnnotationStatement is used for stand-alone comments and pragmas in a
* sequence of statements.
*/
public class AnnotationStatement extends Statement {

    /**
    * Constructs a new annotation statement with the specified annotation.
    * @param annotation the new annotation to be inserted.
    */
    public AnnotationStatement(Annotation annotation) {
        super(-1);
        annotate(annotation);
    }

    @Override
    public AnnotationStatement clone() {
        return (AnnotationStatement)super.clone();
    }

    /** Checks if every annotation of this statement is a comment. */
    public boolean isComment() {
        return getAnnotations(CommentAnnotation.class).size() ==
                getAnnotations().size();
    }

    protected void printStatement(PrintWriter o) {
        // nothing to print.
    }

}
