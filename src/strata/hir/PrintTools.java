package strata.hir;

import strata.exec.Driver;

import java.util.Arrays;

/**
* Status messages on standard error, filtered by the <code>-verbosity</code>
* option.
*/
public final class PrintTools {

    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Prints the items joined by single spaces when the verbosity level is at
    * least <b>min_verbosity</b>. Nothing is formatted below that level.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (items.length == 0 || min_verbosity > getVerbosity()) {
            return;
        }
        System.err.println(Tools.listToString(Arrays.asList(items), " "));
    }

    /**
    * @throws IllegalArgumentException if the option is not an integer.
    */
    public static int getVerbosity() {
        String level = Driver.getOptionValue("verbosity");
        if (level == null) {
            return 0;
        }
        try {
            return Integer.parseInt(level.trim());
        } catch(NumberFormatException e) {
            throw new IllegalArgumentException(
                    "-verbosity expects a number, got " + level, e);
        }
    }

}
