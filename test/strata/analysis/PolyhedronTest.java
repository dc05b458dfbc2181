package strata.analysis;

import org.junit.Before;
import org.junit.Test;
import strata.hir.IRBuilder;
import strata.hir.Procedure;
import strata.hir.RangeExpression;
import strata.hir.SymbolTools;
import strata.hir.Variable;
import strata.transforms.NonAffineBoundException;
import strata.transforms.UnsupportedLoopShapeException;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class PolyhedronTest {

    private Procedure proc;

    private List<Variable> vars;

    private List<RangeExpression> ranges;

    @Before
    public void setUp() {
        proc = IRBuilder.procedure("kernel");
        IRBuilder.declare(proc, IRBuilder.integer(), "n", null);
        IRBuilder.declare(proc, IRBuilder.integer(), "m", null);
        vars = new ArrayList<Variable>();
        ranges = new ArrayList<RangeExpression>();
    }

    private void addLoop(String var, String range) {
        vars.add(SymbolTools.makeVariable(proc, var, null, null));
        ranges.add(IRBuilder.range(proc, range));
    }

    @Test
    public void constantBounds() {
        addLoop("i", "1:10");
        Polyhedron p = Polyhedron.fromLoopRanges(vars, ranges);
        assertArrayEquals(new long[][] {{-1}, {1}}, p.getA());
        assertArrayEquals(new long[] {-1, 10}, p.getB());
        assertThat(p.lowerBounds(0).toString(), is("[1]"));
        assertThat(p.upperBounds("I").toString(), is("[10]"));
    }

    @Test
    public void freeVariablesFollowTheLoopVariables() {
        addLoop("i", "1:n");
        addLoop("j", "i:m + 1");
        Polyhedron p = Polyhedron.fromLoopRanges(vars, ranges);
        List<Variable> columns = p.getVariables();
        assertThat(columns.size(), is(4));
        assertThat(columns.get(2).getName(), is("m"));
        assertThat(columns.get(3).getName(), is("n"));
        // -j + i <= 0 and j - m <= 1
        assertArrayEquals(new long[] {1, -1, 0, 0}, p.getA()[2]);
        assertArrayEquals(new long[] {0, 1, -1, 0}, p.getA()[3]);
        assertThat(p.getB()[3], is(1L));
        assertThat(p.lowerBounds(1).toString(), is("[i]"));
        assertThat(p.upperBounds(1).toString(), is("[m + 1]"));
    }

    @Test
    public void variablesAppearingInSeveralRowsGetEveryBound() {
        addLoop("i", "1:n");
        addLoop("j", "i:n");
        Polyhedron p = Polyhedron.fromLoopRanges(vars, ranges);
        // i >= 1 and, from j >= i, i <= j
        assertThat(p.lowerBounds(0).toString(), is("[1]"));
        assertThat(p.upperBounds(0).toString(), is("[n, j]"));
    }

    @Test
    public void constantsBeyondTheIntRangeAreKept() {
        addLoop("i", "1:3000000000");
        Polyhedron p = Polyhedron.fromLoopRanges(vars, ranges);
        assertThat(p.getB()[1], is(3000000000L));
        assertThat(p.upperBounds(0).toString(), is("[3000000000]"));
    }

    @Test(expected = UnsupportedLoopShapeException.class)
    public void stepsMustBeOne() {
        addLoop("i", "1:n:2");
        Polyhedron.fromLoopRanges(vars, ranges);
    }

    @Test(expected = NonAffineBoundException.class)
    public void boundsMustBeAffine() {
        addLoop("i", "1:n*m");
        Polyhedron.fromLoopRanges(vars, ranges);
    }

    @Test(expected = IllegalArgumentException.class)
    public void dimensionsMustAgree() {
        new Polyhedron(new long[][] {{1, 0}}, new long[] {1, 2}, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariables() {
        addLoop("i", "1:n");
        Polyhedron.fromLoopRanges(vars, ranges).lowerBounds("k");
    }

}
