package strata.exec;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

public class CommandLineOptionSetTest {

    private CommandLineOptionSet options;

    @Before
    public void setUp() {
        options = new CommandLineOptionSet();
        options.add("help", "Print this message");
        options.add(options.UTILITY, "verbosity", "0", "N", "Status level");
        options.add(options.TRANSFORM, "loop-fusion", "Fuse loops");
    }

    @Test
    public void registeredOptionsHoldValues() {
        assertThat(options.contains("verbosity"), is(true));
        assertThat(options.getValue("verbosity"), is("0"));
        options.setValue("verbosity", "3");
        assertThat(options.getValue("verbosity"), is("3"));
        assertThat(options.getType("loop-fusion"), is(options.TRANSFORM));
    }

    @Test
    public void unknownOptionsAreIgnored() {
        options.setValue("bogus", "1");
        assertThat(options.contains("bogus"), is(false));
        assertThat(options.getValue("bogus"), is(nullValue()));
    }

    @Test
    public void usageIsGroupedByKind() {
        String utility = options.getUsage(options.UTILITY);
        assertThat(utility, containsString("-verbosity=N"));
        assertThat(utility, not(containsString("loop-fusion")));
        assertThat(options.getUsage(options.TRANSFORM),
                containsString("-loop-fusion"));
    }

}
