package strata.transforms;

import strata.exec.Driver;
import strata.hir.DFIterator;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.Program;

import java.util.Locale;
import java.util.Set;

/**
* A pass applied to one procedure at a time. Member procedures are visited
* after their host; names given to <code>-skip-procedures</code> are left
* untouched.
*/
public abstract class ProcedureTransformPass extends TransformPass {

    protected ProcedureTransformPass(Program program) {
        super(program);
    }

    public abstract void transformProcedure(Procedure proc);

    public void start() {
        Set<String> skipped = Driver.getSkipProcedureSet();
        DFIterator<Procedure> procs =
                new DFIterator<Procedure>(program, Procedure.class);
        while (procs.hasNext()) {
            Procedure proc = procs.next();
            boolean skip = skipped.contains(proc.getName().toLowerCase(Locale.ROOT));
            PrintTools.printlnStatus(1, getPassName(),
                    skip ? "skipping" : "transforming", proc.getName());
            if (!skip) {
                transformProcedure(proc);
            }
        }
    }

}
