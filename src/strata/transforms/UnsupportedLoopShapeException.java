package strata.transforms;

/**
* Thrown when a loop nest has a shape the polyhedral transformations do not
* handle, such as a non-unit step or an imperfect nest.
*/
public class UnsupportedLoopShapeException extends TransformException {

    private static final long serialVersionUID = 3501L;

    public UnsupportedLoopShapeException(String message) {
        super(message);
    }

}
