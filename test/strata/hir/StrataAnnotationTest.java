package strata.hir;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

public class StrataAnnotationTest {

    @Test
    public void parametersKeepTheirText() {
        StrataAnnotation note = StrataAnnotation.parse(
                "loop-fusion group(g1) collapse(2) range(1:n, 1:min(m, 4))");
        assertThat(note.isWellFormed(), is(true));
        assertThat(note.getDirective(), is("loop-fusion"));
        assertThat(note.getParameter("group"), is("g1"));
        assertThat(note.getParameter("COLLAPSE"), is("2"));
        assertThat(note.getParameter("range"), is("1:n, 1:min(m, 4)"));
        assertThat(note.getParameter("promote"), is(nullValue()));
    }

    @Test
    public void bareParametersAreEmpty() {
        StrataAnnotation note = StrataAnnotation.parse("loop-fission nowait");
        assertThat(note.getParameter("nowait"), is(""));
        assertThat(note.getContent(), is("loop-fission nowait"));
    }

    @Test
    public void directiveMayCarryAValue() {
        StrataAnnotation note = StrataAnnotation.parse("dimension(n, 3)");
        assertThat(note.getDirective(), is("dimension"));
        assertThat(note.getParameter("dimension"), is("n, 3"));
        assertThat(note.toString(), is("!$strata dimension(n, 3)"));
    }

    @Test
    public void unbalancedParenthesesAreRecorded() {
        StrataAnnotation note =
                StrataAnnotation.parse("loop-fusion range(1:n");
        assertThat(note.isWellFormed(), is(false));
        assertThat(note.getError(), is(notNullValue()));
    }

    @Test
    public void pragmaLinesDispatchOnTheKeyword() {
        assertThat(PragmaAnnotation.parse("!$strata loop-fission"),
                instanceOf(StrataAnnotation.class));
        PragmaAnnotation omp = PragmaAnnotation.parse("!$omp parallel do");
        assertThat(omp instanceof StrataAnnotation, is(false));
        assertThat(omp.getKeyword(), is("omp"));
        assertThat(omp.getContent(), is("parallel do"));
        assertThat(omp.toString(), is("!$omp parallel do"));
    }

    @Test
    public void findMatchesTheDirective() {
        Scope scope = new Scope(null);
        Statement stmt = IRBuilder.assign(scope, "x", "1");
        StrataAnnotation fission =
                (StrataAnnotation)PragmaAnnotation.parse("strata loop-fission");
        stmt.annotate(PragmaAnnotation.parse("!$omp simd"));
        stmt.annotate(fission);
        assertThat(StrataAnnotation.find(stmt, "LOOP-FISSION"),
                is(sameInstance(fission)));
        assertThat(StrataAnnotation.find(stmt, "loop-fusion"), is(nullValue()));
        fission.detach();
        assertThat(StrataAnnotation.find(stmt, "loop-fission"), is(nullValue()));
        assertThat(stmt.getAnnotations().size(), is(1));
    }

    @Test
    public void clonedStatementsCarryCopies() {
        Scope scope = new Scope(null);
        Statement stmt = IRBuilder.pragma(IRBuilder.assign(scope, "x", "1"),
                "!$strata loop-fission promote(tmp)");
        Statement copy = stmt.clone();
        StrataAnnotation note = StrataAnnotation.find(copy, "loop-fission");
        assertThat(note.getParameter("promote"), is("tmp"));
        assertThat(note == StrataAnnotation.find(stmt, "loop-fission"),
                is(false));
        assertThat(note.getAnnotatable(), is(sameInstance((Annotatable)copy)));
    }

    @Test
    public void commentsDropTheMarker() {
        CommentAnnotation note = new CommentAnnotation("! compute fluxes");
        assertThat(note.getText(), is("compute fluxes"));
        assertThat(note.toString(), is("! compute fluxes"));
        assertThat(new AnnotationStatement(note).isComment(), is(true));
    }

}
