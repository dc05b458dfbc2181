package strata.frontend;

import org.junit.Test;
import strata.hir.AnnotationStatement;
import strata.hir.Procedure;
import strata.hir.Statement;

import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ProcedureBuilderTest {

    @Test
    public void everyFrontendHasAnAdapter() {
        for (Frontend frontend : Frontend.values()) {
            assertThat(ProcedureBuilder.getAdapter(frontend).getFrontend(),
                    is(frontend));
        }
    }

    @Test
    public void frontendNamesIgnoreCase() {
        assertThat(Frontend.fromString(" Omni "), is(Frontend.OMNI));
        assertThat(Frontend.fromString("ofp"), is(Frontend.OFP));
    }

    @Test
    public void unknownFrontends() {
        try {
            Frontend.fromString("gfortran");
            fail("gfortran is not a frontend");
        } catch(FrontendException e) {
            assertThat(e.getFrontend(), is("gfortran"));
            assertThat(e.getMessage(), containsString("unknown frontend"));
        }
    }

    @Test(expected = FrontendException.class)
    public void missingFrontend() {
        ProcedureBuilder.getAdapter(null);
    }

    @Test
    public void treesWithoutProcedures() throws Exception {
        try {
            ProcedureBuilder.build(Frontend.OFP,
                    OFPAdapterTest.parse("<ofp><file/></ofp>"), null, null);
            fail("an empty file holds no procedure");
        } catch(FrontendException e) {
            assertThat(e.getFrontend(), is("OFP"));
            assertThat(e.getMessage(), containsString("no procedure"));
        }
    }

    @Test
    public void commentsStopPragmaAttachment() throws Exception {
        Procedure proc = ProcedureBuilder.build(Frontend.OFP,
                OFPAdapterTest.parse(
                "<subroutine name='s'><body>" +
                " <specification>" +
                "  <declaration type='INTEGER'><variable name='i'/></declaration>" +
                " </specification>" +
                " <comment text='!$strata loop-fusion'/>" +
                " <comment text='! not a pragma'/>" +
                " <loop var='i'><range>" +
                "  <lower><literal type='int' value='1'/></lower>" +
                "  <upper><literal type='int' value='4'/></upper>" +
                " </range><body/></loop>" +
                "</body></subroutine>"), null, null);
        List<Statement> body = proc.getBody().getStatements();
        assertThat(body.size(), is(3));
        assertThat(body.get(0), instanceOf(AnnotationStatement.class));
        assertThat(body.get(2).getAnnotations().isEmpty(), is(true));
    }

}
