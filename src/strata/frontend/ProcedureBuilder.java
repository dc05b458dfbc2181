package strata.frontend;

import strata.hir.AnnotationStatement;
import strata.hir.CompoundStatement;
import strata.hir.DFIterator;
import strata.hir.DoLoop;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.PragmaAnnotation;
import strata.hir.Scope;
import strata.hir.Statement;
import strata.hir.SymbolAttributes;
import strata.hir.SymbolTools;
import strata.hir.VariableDeclaration;
import strata.transforms.DimensionPragmas;
import strata.transforms.Rescoper;
import strata.transforms.ShapeInference;

import java.util.ArrayList;
import java.util.List;

/**
* Builds procedures out of the raw trees of the supported parsers. Whatever
* the parser, the resulting procedure has the same layout: a docstring made
* of the leading comments, a spec whose symbols are declared in the
* procedure scope, the members, and a body whose references are bound to the
* scope that declares them. Pragmas are attached to the loop or declaration
* that follows them.
*/
public class ProcedureBuilder {

    private ProcedureBuilder() {
    }

    /**
    * Returns the adapter reading the trees of the given parser.
    * @throws FrontendException if there is no such adapter.
    */
    public static FrontendAdapter getAdapter(Frontend frontend) {
        if (frontend == null) {
            throw new FrontendException("null", "unknown frontend");
        }
        switch (frontend) {
        case OFP:
            return new OFPAdapter();
        case OMNI:
            return new OMNIAdapter();
        case FP:
            return new FPAdapter();
        default:
            throw new FrontendException(frontend, "unknown frontend");
        }
    }

    /**
    * Builds the procedure held by a raw tree.
    *
    * @param frontend the parser that produced the tree.
    * @param ast the raw tree.
    * @param raw_source the source text of the tree, or null.
    * @param parent_scope the enclosing scope, or null.
    * @return the new procedure, registered in the parent scope.
    * @throws FrontendException if the tree holds no procedure or is
    *   malformed.
    */
    public static Procedure build(Frontend frontend, Object ast,
                                  String raw_source, Scope parent_scope) {
        FrontendAdapter adapter = getAdapter(frontend);
        ProcedureDescriptor desc = adapter.describe(ast, raw_source);
        if (desc == null) {
            throw new FrontendException(frontend,
                    "the tree holds no procedure");
        }
        return build(adapter, desc, raw_source, parent_scope);
    }

    private static Procedure build(FrontendAdapter adapter,
            ProcedureDescriptor desc, String raw_source, Scope parent_scope) {
        PrintTools.printlnStatus(2, "[ProcedureBuilder]", "building",
                desc.getName(), "from", adapter.getFrontend());
        Procedure proc = new Procedure(desc.getName(), desc.getArguments(),
                desc.isFunction(), desc.getSource(), parent_scope);
        desc.buildDocstring(proc);
        desc.buildSpec(proc);
        SymbolTools.declareSpecSymbols(proc);
        // Members may call each other; their names must be known first.
        List<ProcedureDescriptor> member_descs =
                new ArrayList<ProcedureDescriptor>();
        for (Object tree : desc.getMemberTrees()) {
            ProcedureDescriptor member_desc =
                    adapter.describe(tree, raw_source);
            if (member_desc != null) {
                member_descs.add(member_desc);
                proc.declare(member_desc.getName(), SymbolAttributes.procedure(
                        member_desc.getName(), member_desc.isFunction()));
            }
        }
        for (ProcedureDescriptor member_desc : member_descs) {
            proc.addMember(build(adapter, member_desc, raw_source, proc));
        }
        desc.buildBody(proc);
        relocateComments(proc);
        attachPragmas(proc.getSpec(), VariableDeclaration.class);
        List<CompoundStatement> blocks = new DFIterator<CompoundStatement>(
                proc.getBody(), CompoundStatement.class).getList();
        for (CompoundStatement block : blocks) {
            attachPragmas(block, DoLoop.class);
        }
        ShapeInference.infer(proc);
        Rescoper.rescope(proc);
        DimensionPragmas.apply(proc);
        return proc;
    }

    /**
    * Moves the leading comments of the spec to the end of the docstring, and
    * the trailing comments and pragmas of the spec to the front of the body.
    */
    private static void relocateComments(Procedure proc) {
        CompoundStatement spec = proc.getSpec();
        List<Statement> stmts = spec.getStatements();
        int first = 0;
        while (first < stmts.size() && isComment(stmts.get(first))) {
            Statement stmt = stmts.get(first++);
            stmt.detach();
            proc.getDocstring().addStatement(stmt);
        }
        int last = stmts.size();
        while (last > first && stmts.get(last - 1) instanceof AnnotationStatement) {
            last--;
        }
        for (int i = stmts.size() - 1; i >= last; i--) {
            Statement stmt = stmts.get(i);
            stmt.detach();
            proc.getBody().addStatement(0, stmt);
        }
    }

    private static boolean isComment(Statement stmt) {
        return (stmt instanceof AnnotationStatement &&
                ((AnnotationStatement)stmt).isComment());
    }

    /**
    * Moves the pragmas that directly precede a statement of the given class
    * onto that statement.
    */
    private static void attachPragmas(CompoundStatement block,
                                      Class<? extends Statement> target) {
        List<AnnotationStatement> pending = new ArrayList<AnnotationStatement>();
        for (Statement stmt : block.getStatements()) {
            if (stmt instanceof AnnotationStatement && !isComment(stmt)) {
                pending.add((AnnotationStatement)stmt);
                continue;
            }
            if (target.isInstance(stmt)) {
                for (AnnotationStatement pragma : pending) {
                    List<PragmaAnnotation> notes =
                            pragma.getAnnotations(PragmaAnnotation.class);
                    for (PragmaAnnotation note : notes) {
                        note.detach();
                        stmt.annotate(note);
                    }
                    if (pragma.getAnnotations().isEmpty()) {
                        pragma.detach();
                    }
                }
            }
            pending.clear();
        }
    }

}
