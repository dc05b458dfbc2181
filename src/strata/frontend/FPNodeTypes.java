package strata.frontend;

/**
* Node kinds that {@link FPAdapter} accepts as the <code>getType()</code> of
* the <code>antlr.collections.AST</code> nodes it walks. A producer of FP
* trees has to label its nodes with these values; any other kind inside a
* procedure is rejected as unsupported.
*/
public interface FPNodeTypes {
    int SUBROUTINE_SUBPROGRAM = 1;
    int FUNCTION_SUBPROGRAM = 2;
    int NAME = 3;
    int DUMMY_ARGS = 4;
    int SPECIFICATION_PART = 5;
    int EXECUTION_PART = 6;
    int INTERNAL_SUBPROGRAM_PART = 7;
    int USE_STMT = 8;
    int ONLY_LIST = 9;
    int IMPLICIT_STMT = 10;
    int TYPE_DECLARATION = 11;
    int TYPE_SPEC = 12;
    int KIND_SELECTOR = 13;
    int ATTR_SPEC = 14;
    int ENTITY_DECL = 15;
    int ARRAY_SPEC = 16;
    int COMMENT = 17;
    int DO_CONSTRUCT = 18;
    int LOOP_CONTROL = 19;
    int BLOCK = 20;
    int ASSIGNMENT_STMT = 21;
    int CALL_STMT = 22;
    int ARGUMENTS = 23;
    int IF_CONSTRUCT = 24;
    int ELSE_BLOCK = 25;
    int ALLOCATE_STMT = 26;
    int ALLOCATION = 27;
    int ALLOC_SOURCE = 28;
    int DESIGNATOR = 29;
    int DATA_REF = 30;
    int SUBSCRIPTS = 31;
    int SUBSCRIPT_TRIPLET = 32;
    int DEFERRED = 33;
    int INT_LITERAL = 34;
    int REAL_LITERAL = 35;
    int CHAR_LITERAL = 36;
    int LOGICAL_LITERAL = 37;
    int BINARY_OP = 38;
    int UNARY_OP = 39;
    int PARENTHESES = 40;
}
