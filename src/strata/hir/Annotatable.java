package strata.hir;

import java.util.List;

/**
* An IR object that carries comments and pragmas. Only statements are
* annotatable.
*/
public interface Annotatable extends Traversable {

    /** Attaches the annotation, which must not be attached elsewhere. */
    void annotate(Annotation annotation);

    /**
    * Returns the attached annotations in attachment order. The list is live;
    * {@link Annotation#detach} removes from it.
    */
    List<Annotation> getAnnotations();

    /** Returns the attached annotations of the given class. */
    <T extends Annotation> List<T> getAnnotations(Class<T> type);

}
