package strata.transforms;

import strata.hir.IRTools;
import strata.hir.PrintTools;
import strata.hir.Program;

/**
* A pass that rewrites the program in place. {@link #run} times the pass and
* verifies the parent links of the tree once it is done.
*/
public abstract class TransformPass {

    protected Program program;

    protected TransformPass(Program program) {
        this.program = program;
    }

    /** Label used in status messages, such as <code>[LoopFusion]</code>. */
    public abstract String getPassName();

    public abstract void start();

    /**
    * Runs the pass over its program.
    * @throws InternalError if the pass leaves a broken tree behind.
    */
    public static void run(TransformPass pass) {
        String name = pass.getPassName();
        long begin = System.nanoTime();
        PrintTools.printlnStatus(0, name, "begin");
        pass.start();
        double seconds = (System.nanoTime() - begin) / 1e9;
        PrintTools.printlnStatus(0, name, "end in",
                String.format("%.2f seconds", seconds));
        if (!IRTools.checkConsistency(pass.program)) {
            throw new InternalError(name + " left an inconsistent IR");
        }
    }

}
