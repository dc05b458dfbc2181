package strata.transforms;

import org.junit.Before;
import org.junit.Test;
import strata.hir.AnnotationStatement;
import strata.hir.CommentAnnotation;
import strata.hir.DoLoop;
import strata.hir.IRBuilder;
import strata.hir.IRTools;
import strata.hir.IfStatement;
import strata.hir.Procedure;
import strata.hir.Program;
import strata.hir.Statement;
import strata.hir.StrataAnnotation;

import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class LoopFusionTest {

    private Procedure proc;

    @Before
    public void setUp() {
        proc = IRBuilder.procedure("kernel", "n", "m");
        IRBuilder.declare(proc, IRBuilder.integer(), "n", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "m", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "i", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "j", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "k", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "l", null);
        IRBuilder.declare(proc, IRBuilder.real(), "a", "100");
        IRBuilder.declare(proc, IRBuilder.real(), "b", "100");
        IRBuilder.declare(proc, IRBuilder.real(), "c", "n,m");
        IRBuilder.declare(proc, IRBuilder.real(), "d", "n,m");
    }

    private DoLoop loop(String var, String bounds, String directive,
                        Statement... body) {
        DoLoop ret = IRBuilder.loop(proc, var, bounds, body);
        if (directive != null) {
            IRBuilder.pragma(ret, "!$strata " + directive);
        }
        proc.getBody().addStatement(ret);
        return ret;
    }

    private List<Statement> code() {
        return IRBuilder.code(proc.getBody());
    }

    @Test
    public void fusesIntoTheLargestRange() {
        loop("i", "1:10", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("j", "1:20", "loop-fusion", IRBuilder.assign(proc, "b(j)", "2"));
        assertThat(LoopFusion.fuse(proc), is(1));
        assertThat(code().size(), is(1));
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getVariable().getName(), is("i"));
        assertThat(fused.getBounds().toString(), is("1:20"));
        assertThat(StrataAnnotation.find(fused, LoopFusion.DIRECTIVE),
                is(nullValue()));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(body.size(), is(2));
        IfStatement guard = (IfStatement)body.get(0);
        assertThat(guard.getCondition().toString(), is("i <= 10"));
        assertThat(guard.getThenStatement().getStatements().get(0).toString(),
                is("a(i) = 1"));
        assertThat(body.get(1).toString(), is("b(i) = 2"));
        assertThat(IRTools.checkConsistency(proc), is(true));
    }

    @Test
    public void marksTheFusedLoop() {
        loop("i", "1:n", "loop-fusion group(g1)",
                IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion group(g1)",
                IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        List<Statement> stmts = proc.getBody().getStatements();
        assertThat(stmts.size(), is(2));
        AnnotationStatement mark = (AnnotationStatement)stmts.get(0);
        assertThat(mark.getAnnotations(CommentAnnotation.class).get(0).getText(),
                is("strata transformation loop-fusion group(g1)"));
        DoLoop fused = (DoLoop)stmts.get(1);
        assertThat(fused.getBody().getStatements().size(), is(2));
        assertThat(fused.getBody().getStatements().get(0).toString(),
                is("a(i) = 1"));
    }

    @Test
    public void replacesTheFirstLoopInPlace() {
        proc.getBody().addStatement(IRBuilder.assign(proc, "n", "10"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        Statement between = IRBuilder.assign(proc, "m", "n");
        proc.getBody().addStatement(between);
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        loop("k", "1:m", null, IRBuilder.assign(proc, "a(k)", "0"));
        LoopFusion.fuse(proc);
        List<Statement> code = code();
        assertThat(code.size(), is(4));
        assertThat(code.get(1), instanceOf(DoLoop.class));
        assertThat(code.get(2), is(sameInstance(between)));
        assertThat(((DoLoop)code.get(3)).getVariable().getName(), is("k"));
    }

    @Test
    public void groupsAreFusedSeparately() {
        loop("i", "1:n", "loop-fusion group(g1)",
                IRBuilder.assign(proc, "a(i)", "1"));
        loop("j", "1:m", "loop-fusion group(g2)",
                IRBuilder.assign(proc, "b(j)", "1"));
        loop("i", "1:n", "loop-fusion group(g1)",
                IRBuilder.assign(proc, "a(i)", "2"));
        loop("j", "1:m", "loop-fusion group(g2)",
                IRBuilder.assign(proc, "b(j)", "2"));
        assertThat(LoopFusion.fuse(proc), is(2));
        assertThat(code().size(), is(2));
        assertThat(((DoLoop)code().get(0)).getVariable().getName(), is("i"));
        assertThat(((DoLoop)code().get(1)).getVariable().getName(), is("j"));
    }

    @Test
    public void symbolicBoundsCombineWithMax() {
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:m", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("1:max(n, m)"));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(((IfStatement)body.get(0)).getCondition().toString(),
                is("i <= n"));
        assertThat(((IfStatement)body.get(1)).getCondition().toString(),
                is("i <= m"));
    }

    @Test
    public void lowerBoundsTakeTheMinimum() {
        loop("i", "2:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("1:n"));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(((IfStatement)body.get(0)).getCondition().toString(),
                is("i >= 2"));
        assertThat(body.get(1).toString(), is("b(i) = 2"));
    }

    @Test
    public void constantUpperBoundsJoinSymbolicOnes() {
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:10", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("1:max(n, 10)"));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(((IfStatement)body.get(0)).getCondition().toString(),
                is("i <= n"));
        assertThat(((IfStatement)body.get(1)).getCondition().toString(),
                is("i <= 10"));
    }

    @Test
    public void symbolicUpperBoundsJoinConstantOnes() {
        loop("i", "1:10", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("1:max(10, n)"));
    }

    @Test
    public void constantLowerBoundsJoinSymbolicOnes() {
        loop("i", "n:10", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:10", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("min(n, 1):10"));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(((IfStatement)body.get(0)).getCondition().toString(),
                is("i >= n"));
        assertThat(((IfStatement)body.get(1)).getCondition().toString(),
                is("i >= 1"));
    }

    @Test
    public void symbolicLowerBoundsJoinConstantOnes() {
        loop("i", "1:10", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "n:10", "loop-fusion", IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("min(1, n):10"));
    }

    @Test
    public void nestedGroupsAreBothFused() {
        loop("i", "1:n", "loop-fusion group(outer)",
                IRBuilder.pragma(IRBuilder.loop(proc, "j", "1:m",
                        IRBuilder.assign(proc, "c(i, j)", "1")),
                        "!$strata loop-fusion group(inner)"),
                IRBuilder.pragma(IRBuilder.loop(proc, "k", "1:m",
                        IRBuilder.assign(proc, "d(i, k)", "2")),
                        "!$strata loop-fusion group(inner)"));
        loop("i", "1:n", "loop-fusion group(outer)",
                IRBuilder.assign(proc, "a(i)", "3"));
        assertThat(LoopFusion.fuse(proc), is(2));
        assertThat(code().size(), is(1));
        DoLoop outer = (DoLoop)code().get(0);
        List<Statement> body = IRBuilder.code(outer.getBody());
        assertThat(body.size(), is(2));
        DoLoop inner = (DoLoop)body.get(0);
        assertThat(inner.getVariable().getName(), is("j"));
        assertThat(inner.getBounds().toString(), is("1:m"));
        List<Statement> inner_body = inner.getBody().getStatements();
        assertThat(inner_body.size(), is(2));
        assertThat(inner_body.get(0).toString(), is("c(i, j) = 1"));
        assertThat(inner_body.get(1).toString(), is("d(i, j) = 2"));
        assertThat(body.get(1).toString(), is("a(i) = 3"));
        assertThat(StrataAnnotation.find(inner, LoopFusion.DIRECTIVE),
                is(nullValue()));
        assertThat(IRTools.checkConsistency(proc), is(true));
    }

    @Test
    public void collapsedNestsFuseLevelByLevel() {
        loop("i", "1:n", "loop-fusion collapse(2)",
                IRBuilder.loop(proc, "j", "1:m",
                IRBuilder.assign(proc, "c(i, j)", "1")));
        loop("k", "1:n", "loop-fusion collapse(2)",
                IRBuilder.loop(proc, "l", "1:m",
                IRBuilder.assign(proc, "d(k, l)", "c(k, l)")));
        LoopFusion.fuse(proc);
        DoLoop outer = (DoLoop)code().get(0);
        assertThat(outer.getBounds().toString(), is("1:n"));
        DoLoop inner = (DoLoop)outer.getBody().getStatements().get(0);
        assertThat(inner.getVariable().getName(), is("j"));
        assertThat(inner.getBounds().toString(), is("1:m"));
        List<Statement> body = inner.getBody().getStatements();
        assertThat(body.size(), is(2));
        assertThat(body.get(1).toString(), is("d(i, j) = c(i, j)"));
    }

    @Test
    public void explicitRangesOverrideTheIterationSpaces() {
        loop("i", "1:10", "loop-fusion range(1:100)",
                IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:20", "loop-fusion range(1:100)",
                IRBuilder.assign(proc, "b(i)", "2"));
        LoopFusion.fuse(proc);
        DoLoop fused = (DoLoop)code().get(0);
        assertThat(fused.getBounds().toString(), is("1:100"));
        List<Statement> body = fused.getBody().getStatements();
        assertThat(((IfStatement)body.get(0)).getCondition().toString(),
                is("i <= 10"));
        assertThat(((IfStatement)body.get(1)).getCondition().toString(),
                is("i <= 20"));
    }

    @Test(expected = ConflictingDirectiveException.class)
    public void collapseValuesMustAgree() {
        loop("i", "1:n", "loop-fusion collapse(2)",
                IRBuilder.loop(proc, "j", "1:m",
                IRBuilder.assign(proc, "c(i, j)", "1")));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test(expected = ConflictingDirectiveException.class)
    public void explicitRangesMustAgree() {
        loop("i", "1:n", "loop-fusion range(1:n)",
                IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion range(1:m)",
                IRBuilder.assign(proc, "b(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test(expected = InvalidDirectiveException.class)
    public void rangeCountMustMatchCollapse() {
        loop("i", "1:n", "loop-fusion range(1:n, 1:m)",
                IRBuilder.assign(proc, "a(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test(expected = InvalidDirectiveException.class)
    public void collapseMustBeAPositiveInteger() {
        loop("i", "1:n", "loop-fusion collapse(two)",
                IRBuilder.assign(proc, "a(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test(expected = UnsupportedLoopShapeException.class)
    public void stepsMustBeOne() {
        loop("i", "1:n:2", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test(expected = UnsupportedLoopShapeException.class)
    public void collapsedNestsMustBePerfect() {
        loop("i", "1:n", "loop-fusion collapse(2)",
                IRBuilder.assign(proc, "a(i)", "1"),
                IRBuilder.loop(proc, "j", "1:m",
                IRBuilder.assign(proc, "c(i, j)", "1")));
        LoopFusion.fuse(proc);
    }

    @Test(expected = NonAffineBoundException.class)
    public void boundsMustBeAffine() {
        loop("i", "1:n*m", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "1"));
        LoopFusion.fuse(proc);
    }

    @Test
    public void failingGroupsLeaveTheOthersFused() {
        DoLoop bad1 = loop("i", "1:n", "loop-fusion group(bad) range(1:n)",
                IRBuilder.assign(proc, "a(i)", "1"));
        loop("j", "1:m", "loop-fusion group(good)",
                IRBuilder.assign(proc, "b(j)", "1"));
        DoLoop bad2 = loop("i", "1:n", "loop-fusion group(bad) range(2:n)",
                IRBuilder.assign(proc, "a(i)", "2"));
        loop("j", "1:m", "loop-fusion group(good)",
                IRBuilder.assign(proc, "b(j)", "2"));
        try {
            LoopFusion.fuse(proc);
            fail("conflicting ranges were accepted");
        } catch(ConflictingDirectiveException e) {
            assertThat(e.getSuppressed().length, is(0));
        }
        List<Statement> code = code();
        assertThat(code.size(), is(3));
        assertThat(code.get(0), is(sameInstance((Statement)bad1)));
        assertThat(((DoLoop)code.get(1)).getVariable().getName(), is("j"));
        assertThat(code.get(2), is(sameInstance((Statement)bad2)));
    }

    @Test
    public void runsAsAPass() {
        Program program = new Program();
        program.addProcedure(proc);
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "a(i)", "1"));
        loop("i", "1:n", "loop-fusion", IRBuilder.assign(proc, "b(i)", "1"));
        TransformPass.run(new LoopFusion(program));
        assertThat(code().size(), is(1));
    }

    @Test
    public void nothingToFuse() {
        loop("i", "1:n", null, IRBuilder.assign(proc, "a(i)", "1"));
        assertThat(LoopFusion.fuse(proc), is(0));
        assertThat(code().size(), is(1));
    }

}
