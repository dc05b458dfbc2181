package strata.transforms;

import org.junit.Before;
import org.junit.Test;
import strata.hir.AnnotationStatement;
import strata.hir.AssignmentExpression;
import strata.hir.CommentAnnotation;
import strata.hir.DoLoop;
import strata.hir.ExpressionStatement;
import strata.hir.IRBuilder;
import strata.hir.IRTools;
import strata.hir.Procedure;
import strata.hir.Program;
import strata.hir.Statement;
import strata.hir.StrataAnnotation;
import strata.hir.Variable;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class LoopFissionTest {

    private Procedure proc;

    @Before
    public void setUp() {
        proc = IRBuilder.procedure("kernel", "n", "m");
        IRBuilder.declare(proc, IRBuilder.integer(), "n", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "m", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "i", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "j", null);
        IRBuilder.declare(proc, IRBuilder.real(), "tmp", null);
        IRBuilder.declare(proc, IRBuilder.real(), "work", "n");
        IRBuilder.declare(proc, IRBuilder.real(), "a", "n");
        IRBuilder.declare(proc, IRBuilder.real(), "b", "n");
    }

    private DoLoop loop(String var, String bounds, Statement... body) {
        DoLoop ret = IRBuilder.loop(proc, var, bounds, body);
        proc.getBody().addStatement(ret);
        return ret;
    }

    private List<Statement> code() {
        return IRBuilder.code(proc.getBody());
    }

    private Variable declared(String name) {
        return proc.getVariableMap().get(name);
    }

    @Test
    public void splitsAtStandAloneDirectives() {
        loop("i", "1:5",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        assertThat(LoopFission.split(proc), is(1));
        List<Statement> stmts = proc.getBody().getStatements();
        assertThat(stmts.size(), is(4));
        AnnotationStatement mark = (AnnotationStatement)stmts.get(0);
        assertThat(mark.getAnnotations(CommentAnnotation.class).get(0).getText(),
                is("strata transformation loop-fission"));
        DoLoop first = (DoLoop)stmts.get(1);
        DoLoop second = (DoLoop)stmts.get(3);
        assertThat(first.getBounds().toString(), is("1:5"));
        assertThat(second.getBounds().toString(), is("1:5"));
        assertThat(first.getBody().getStatements().size(), is(1));
        assertThat(first.getBody().getStatements().get(0).toString(),
                is("tmp(i) = a(i)"));
        assertThat(second.getBody().getStatements().size(), is(1));
        assertThat(second.getBody().getStatements().get(0).toString(),
                is("b(i) = tmp(i)"));
        assertThat(IRTools.checkConsistency(proc), is(true));
    }

    @Test
    public void promotedVariablesGetATrailingDimension() {
        loop("i", "1:5",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(TMP)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        ExpressionStatement after = IRBuilder.assign(proc, "a(1)", "tmp");
        proc.getBody().addStatement(after);
        LoopFission.split(proc);
        assertThat(declared("tmp").toString(), is("tmp(5)"));
        assertThat(proc.lookup("tmp").getShape().toString(), is("[5]"));
        Variable ref = (Variable)
                ((AssignmentExpression)after.getExpression()).getRHS();
        assertThat(ref.getType().getShape().size(), is(1));
        assertThat(ref.getDimensions().size(), is(0));
    }

    @Test
    public void arraysKeepTheirDimensions() {
        loop("i", "1:m",
                IRBuilder.assign(proc, "work(1)", "a(i)"),
                IRBuilder.pragma(IRBuilder.assign(proc, "b(i)", "work(1)"),
                        "!$strata loop-fission promote(work)"));
        LoopFission.split(proc);
        assertThat(declared("work").toString(), is("work(n, m)"));
        DoLoop second = (DoLoop)code().get(1);
        assertThat(second.getBody().getStatements().get(0).toString(),
                is("b(i) = work(1, i)"));
    }

    @Test
    public void attachedDirectivesStartTheNextPart() {
        loop("i", "1:n",
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.pragma(IRBuilder.assign(proc, "b(i)", "2"),
                        "!$strata loop-fission"));
        LoopFission.split(proc);
        List<Statement> code = code();
        assertThat(code.size(), is(2));
        Statement moved = ((DoLoop)code.get(1)).getBody().getStatements().get(0);
        assertThat(moved.toString(), is("b(i) = 2"));
        assertThat(StrataAnnotation.find(moved, LoopFission.DIRECTIVE),
                is(nullValue()));
    }

    @Test
    public void emptyPartsAreSkipped() {
        loop("i", "1:n",
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.assign(proc, "b(i)", "2"),
                IRBuilder.pragma("!$strata loop-fission"));
        LoopFission.split(proc);
        assertThat(code().size(), is(2));
    }

    @Test
    public void loopsWithoutDirectivesAreUntouched() {
        DoLoop plain = loop("i", "1:n", IRBuilder.assign(proc, "a(i)", "1"));
        assertThat(LoopFission.split(proc), is(0));
        assertThat(code().get(0), is(sameInstance((Statement)plain)));
    }

    @Test
    public void promotionUsesTheLargestTripCount() {
        loop("i", "1:5",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        loop("i", "0:9",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        assertThat(LoopFission.split(proc), is(2));
        assertThat(declared("tmp").toString(), is("tmp(10)"));
    }

    @Test
    public void incomparableTripCountsCombineWithMax() {
        loop("i", "1:n",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        loop("j", "1:m",
                IRBuilder.assign(proc, "tmp", "a(j)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(j)", "tmp"));
        LoopFission.split(proc);
        assertThat(declared("tmp").toString(), is("tmp(max(m, n))"));
    }

    @Test
    public void nestedLoopsSplitInnermostFirst() {
        loop("j", "1:m",
                IRBuilder.loop(proc, "i", "1:n",
                        IRBuilder.assign(proc, "a(i)", "1"),
                        IRBuilder.pragma("!$strata loop-fission"),
                        IRBuilder.assign(proc, "b(i)", "2")));
        assertThat(LoopFission.split(proc), is(1));
        DoLoop outer = (DoLoop)code().get(0);
        assertThat(IRBuilder.code(outer.getBody()).size(), is(2));
    }

    @Test
    public void stridedLoopsKeepTheirStep() {
        loop("i", "1:n:2",
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.assign(proc, "b(i)", "2"));
        LoopFission.split(proc);
        assertThat(((DoLoop)code().get(1)).getBounds().toString(), is("1:n:2"));
    }

    @Test(expected = UnsupportedLoopShapeException.class)
    public void promotionNeedsAUnitStep() {
        loop("i", "1:n:2",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        LoopFission.split(proc);
    }

    @Test
    public void unknownVariablesFailWithoutSideEffects() {
        DoLoop bad = loop("i", "1:n",
                IRBuilder.assign(proc, "tmp", "a(i)"),
                IRBuilder.pragma("!$strata loop-fission promote(nothere)"),
                IRBuilder.assign(proc, "b(i)", "tmp"));
        loop("j", "1:m",
                IRBuilder.assign(proc, "a(j)", "1"),
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.assign(proc, "b(j)", "2"));
        try {
            LoopFission.split(proc);
            fail("an undeclared variable was promoted");
        } catch(InvalidDirectiveException e) {
            assertThat(e.getMessage().contains("nothere"), is(true));
        }
        List<Statement> code = code();
        assertThat(code.size(), is(3));
        assertThat(code.get(0), is(sameInstance((Statement)bad)));
        assertThat(declared("tmp").getDimensions().size(), is(0));
    }

    @Test(expected = InvalidDirectiveException.class)
    public void malformedDirectives() {
        loop("i", "1:n",
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.pragma("!$strata loop-fission promote(tmp"),
                IRBuilder.assign(proc, "b(i)", "2"));
        LoopFission.split(proc);
    }

    @Test
    public void runsAsAPass() {
        Program program = new Program();
        program.addProcedure(proc);
        loop("i", "1:n",
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.pragma("!$strata loop-fission"),
                IRBuilder.assign(proc, "b(i)", "2"));
        TransformPass.run(new LoopFission(program));
        assertThat(code().size(), is(2));
    }

}
