package strata.frontend;

/**
* Identifies the parser that produced a raw tree.
*/
public enum Frontend {

    /** Open Fortran Parser, XML output */
    OFP,

    /** OMNI compiler, XcodeML output */
    OMNI,

    /** fparser-style abstract syntax tree */
    FP;

    /**
    * Returns the frontend with the given name, ignoring case.
    * @throws FrontendException if no frontend has that name.
    */
    public static Frontend fromString(String name) {
        for (Frontend f : values()) {
            if (name != null && f.name().equalsIgnoreCase(name.trim())) {
                return f;
            }
        }
        throw new FrontendException(name, "unknown frontend");
    }

}
