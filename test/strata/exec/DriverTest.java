package strata.exec;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import strata.frontend.FrontendException;
import strata.hir.DoLoop;
import strata.hir.Procedure;
import strata.hir.Statement;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class DriverTest {

    private static final String LOOP =
        " <loop var='i'><range>" +
        "  <lower><literal type='int' value='1'/></lower>" +
        "  <upper><literal type='int' value='%d'/></upper>" +
        " </range><body>" +
        "  <assignment><target><name id='%s'><subscripts>" +
        "   <subscript><name id='i'/></subscript></subscripts></name></target>" +
        "  <value><literal type='real' value='0.0'/></value></assignment>" +
        " </body></loop>";

    private static final String KERNEL =
        "<ofp><file><subroutine name='Kernel'><body>" +
        " <specification>" +
        "  <declaration type='INTEGER'><variable name='i'/></declaration>" +
        "  <declaration type='REAL'>" +
        "   <variable name='a'><dimension><literal type='int' value='8'/></dimension></variable>" +
        "   <variable name='b'><dimension><literal type='int' value='8'/></dimension></variable>" +
        "  </declaration>" +
        " </specification>" +
        " <comment text='!$strata loop-fusion'/>" +
        String.format(LOOP, 4, "a") +
        " <comment text='!$strata loop-fusion'/>" +
        String.format(LOOP, 8, "b") +
        "</body></subroutine></file></ofp>";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Driver driver;

    @Before
    public void setUp() {
        driver = new Driver();
    }

    @After
    public void tearDown() {
        Driver.registerOptions();
    }

    private String write(String name, String text) throws IOException {
        File file = folder.newFile(name);
        Writer w = new OutputStreamWriter(new FileOutputStream(file), "UTF-8");
        try {
            w.write(text);
        } finally {
            w.close();
        }
        return file.getPath();
    }

    @Test
    public void optionsComeBeforeTheFiles() {
        driver.parseCommandLine(new String[] {"-verbosity=2",
                "-skip-procedures=Foo, BAR", "-loop-fusion", "-bogus",
                "a.xml", "b.xml"});
        assertThat(driver.filenames, is(Arrays.asList("a.xml", "b.xml")));
        assertThat(Driver.getOptionValue("verbosity"), is("2"));
        assertThat(Driver.getOptionValue("loop-fusion"), is("1"));
        assertThat(Driver.getOptionValue("bogus"), is(nullValue()));
        assertThat(Driver.getSkipProcedureSet(),
                is(new HashSet<String>(Arrays.asList("foo", "bar"))));
    }

    @Test
    public void defaults() {
        assertThat(Driver.getOptionValue("frontend"), is("ofp"));
        assertThat(Driver.getOptionValue("verbosity"), is("0"));
        assertThat(Driver.getOptionValue("loop-fission"), is(nullValue()));
        assertThat(Driver.getSkipProcedureSet().isEmpty(), is(true));
    }

    @Test
    public void buildsOneProcedurePerFile() throws Exception {
        String path = write("kernel.xml", KERNEL);
        driver.parseCommandLine(new String[] {"-loop-fusion", path});
        driver.parseFiles();
        List<Procedure> procs = driver.getProgram().getProcedures();
        assertThat(procs.size(), is(1));
        assertThat(driver.getProgram().getScope().lookup("kernel")
                .isProcedure(), is(true));
        driver.runPasses();
        List<Statement> body = procs.get(0).getBody().getStatements();
        DoLoop fused = (DoLoop)body.get(body.size() - 1);
        assertThat(fused.getBounds().toString(), is("1:8"));
        assertThat(fused.getBody().getStatements().size(), is(2));
    }

    @Test
    public void skippedProceduresAreLeftAlone() throws Exception {
        String path = write("kernel.xml", KERNEL);
        driver.parseCommandLine(new String[] {"-loop-fusion",
                "-skip-procedures=kernel", path});
        driver.parseFiles();
        driver.runPasses();
        Procedure proc = driver.getProgram().getProcedures().get(0);
        assertThat(proc.getBody().getStatements().size(), is(2));
    }

    @Test
    public void malformedFiles() throws Exception {
        String path = write("broken.xml", "<ofp><file>");
        driver.parseCommandLine(new String[] {path});
        try {
            driver.parseFiles();
            fail("the file is not XML");
        } catch(FrontendException e) {
            assertThat(e.getMessage(), containsString("broken.xml"));
            assertThat(e.getCause(), instanceOf(org.xml.sax.SAXException.class));
        }
    }

    @Test(expected = FrontendException.class)
    public void missingFiles() {
        driver.parseCommandLine(new String[] {
                new File(folder.getRoot(), "missing.xml").getPath()});
        driver.parseFiles();
    }

    @Test(expected = FrontendException.class)
    public void fpTreesCannotBeRead() throws Exception {
        String path = write("kernel.xml", KERNEL);
        driver.parseCommandLine(new String[] {"-frontend=fp", path});
        driver.parseFiles();
    }

    @Test
    public void usageListsTheOptions() {
        String usage = Driver.options.getUsage();
        assertThat(usage, containsString("-frontend=ofp|omni"));
        assertThat(usage, containsString("-loop-fission"));
        assertThat(usage.indexOf("UTILITY") < usage.indexOf("TRANSFORM"),
                is(true));
    }

}
