package strata.transforms;

/**
* Base class of the errors raised when the input of a transformation cannot
* be handled. The transformation leaves the IR outside the failing loop or
* group unchanged.
*/
public class TransformException extends RuntimeException {

    private static final long serialVersionUID = 3500L;

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }

}
