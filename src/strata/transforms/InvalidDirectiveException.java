package strata.transforms;

/**
* Thrown when a directive cannot be interpreted: malformed parameters,
* unknown variable names or a range count not matching the collapse depth.
*/
public class InvalidDirectiveException extends TransformException {

    private static final long serialVersionUID = 3504L;

    public InvalidDirectiveException(String message) {
        super(message);
    }

    public InvalidDirectiveException(String message, Throwable cause) {
        super(message, cause);
    }

}
