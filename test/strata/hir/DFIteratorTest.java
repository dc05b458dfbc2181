package strata.hir;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class DFIteratorTest {

    private Procedure proc;

    private DoLoop outer;

    @Before
    public void setUp() {
        proc = IRBuilder.procedure("kernel", "n");
        IRBuilder.declare(proc, IRBuilder.integer(), "n", null);
        IRBuilder.declare(proc, IRBuilder.real(), "x", "n");
        for (String index : new String[] {"i", "j", "k"}) {
            IRBuilder.declare(proc, IRBuilder.integer(), index, null);
        }
        outer = IRBuilder.loop(proc, "i", "1:n",
                IRBuilder.assign(proc, "x(i)", "1.0"),
                IRBuilder.loop(proc, "j", "1:n",
                        IRBuilder.assign(proc, "x(j)", "2.0")));
        proc.getBody().addStatement(outer);
    }

    private static List<String> names(List<? extends Traversable> nodes) {
        List<String> ret = new ArrayList<String>();
        for (Traversable t : nodes) {
            ret.add(t.toString());
        }
        return ret;
    }

    @Test
    public void visitsInPreOrder() {
        List<DoLoop> loops =
                new DFIterator<DoLoop>(proc.getBody(), DoLoop.class).getList();
        assertThat(loops.size(), is(2));
        assertThat(loops.get(0), is(sameInstance(outer)));
        assertThat(loops.get(1).getVariable().getName(), is("j"));
        ExpressionStatement first =
                (ExpressionStatement)outer.getBody().getStatements().get(0);
        List<Variable> vars =
                new DFIterator<Variable>(first, Variable.class).getList();
        assertThat(names(vars).toString(), is("[x(i), i]"));
    }

    @Test
    public void rootIsACandidate() {
        DFIterator<DoLoop> iter = new DFIterator<DoLoop>(outer, DoLoop.class);
        assertThat(iter.next(), is(sameInstance(outer)));
    }

    @Test
    public void theLastReturnedNodeMayBeRewritten() {
        DFIterator<DoLoop> iter =
                new DFIterator<DoLoop>(proc.getBody(), DoLoop.class);
        DoLoop first = iter.next();
        first.getBody().removeStatements();
        first.getBody().addStatement(IRBuilder.loop(proc, "k", "1:2"));
        assertThat(iter.next().getVariable().getName(), is("k"));
        assertThat(iter.hasNext(), is(false));
    }

    @Test
    public void resetRestartsTheWalk() {
        DFIterator<DoLoop> iter =
                new DFIterator<DoLoop>(proc.getBody(), DoLoop.class);
        iter.next();
        iter.next();
        iter.reset();
        assertThat(iter.next(), is(sameInstance(outer)));
    }

    @Test(expected = NoSuchElementException.class)
    public void nextFailsAtTheEnd() {
        DFIterator<DoLoop> iter =
                new DFIterator<DoLoop>(proc.getSpec(), DoLoop.class);
        iter.next();
    }

}
