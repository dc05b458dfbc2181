package strata.hir;

/**
* Raised when a node that already hangs in a tree is offered as the new child
* of another node. Detach or clone it first.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 3480L;

    public NotAnOrphanException() {
        super("node already has a parent");
    }

    public NotAnOrphanException(String message) {
        super(message);
    }

}
