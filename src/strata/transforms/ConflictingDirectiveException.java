package strata.transforms;

/**
* Thrown when the loops of one fusion group disagree on their collapse depth
* or on their explicit range.
*/
public class ConflictingDirectiveException extends TransformException {

    private static final long serialVersionUID = 3503L;

    public ConflictingDirectiveException(String message) {
        super(message);
    }

}
