package strata.frontend;

/**
* Reads the raw tree of one parser. An adapter only locates the parts of a
* procedure; the IR is built by {@link ProcedureBuilder} through the returned
* descriptor.
*/
public interface FrontendAdapter {

    /** Returns the parser this adapter reads. */
    Frontend getFrontend();

    /**
    * Describes the procedure held by the given tree.
    *
    * @param ast the raw tree, or a node of it.
    * @param raw_source the source text the tree was parsed from, or null.
    * @return the descriptor, or null if the tree holds no procedure.
    * @throws FrontendException if the tree is malformed.
    */
    ProcedureDescriptor describe(Object ast, String raw_source);

}
