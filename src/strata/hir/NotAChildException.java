package strata.hir;

/** Raised when a node is looked up among children that do not hold it. */
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 3481L;

    public NotAChildException() {
        super("node is not a child of this parent");
    }

    public NotAChildException(String message) {
        super(message);
    }

}
