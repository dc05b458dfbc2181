package strata.transforms;

/**
* Thrown when a loop bound is not a constant plus an affine combination of
* variables.
*/
public class NonAffineBoundException extends TransformException {

    private static final long serialVersionUID = 3502L;

    public NonAffineBoundException(String message) {
        super(message);
    }

}
