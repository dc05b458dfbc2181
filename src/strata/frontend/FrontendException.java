package strata.frontend;

/**
* Thrown when a raw tree cannot be turned into a procedure: the parser is
* unknown, or the tree does not hold what the parser is expected to produce.
*/
public class FrontendException extends RuntimeException {

    private static final long serialVersionUID = 3510L;

    private final String frontend;

    public FrontendException(String frontend, String message) {
        super("[" + frontend + "] " + message);
        this.frontend = frontend;
    }

    public FrontendException(Frontend frontend, String message) {
        this(String.valueOf(frontend), message);
    }

    public FrontendException(Frontend frontend, String message,
                             Throwable cause) {
        this(String.valueOf(frontend), message);
        initCause(cause);
    }

    /** Returns the name of the parser the error refers to. */
    public String getFrontend() {
        return frontend;
    }

}
