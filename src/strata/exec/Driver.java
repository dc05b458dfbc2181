package strata.exec;

import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import strata.frontend.Frontend;
import strata.frontend.FrontendException;
import strata.frontend.ProcedureBuilder;
import strata.hir.PrintTools;
import strata.hir.Procedure;
import strata.hir.Program;
import strata.transforms.LoopFission;
import strata.transforms.LoopFusion;
import strata.transforms.TransformException;
import strata.transforms.TransformPass;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
* Implements the command line parser and controls pass ordering.
* Users may extend this class by overriding runPasses, which provides the
* default sequence of passes. Derived classes have access to a protected
* {@link Program Program} object.
*/
public class Driver {

    /** A mapping from option names to option values. */
    protected static CommandLineOptionSet options = new CommandLineOptionSet();

    /** The program built from the input files. */
    protected Program program;

    /** The filenames supplied on the command line. */
    protected List<String> filenames;

    protected Driver() {
        registerOptions();
        filenames = new ArrayList<String>();
    }

    /**
    * Registers the legal set of options and their default values. Only
    * registered options can have values set.
    */
    public static void registerOptions() {
        options.add(options.UTILITY, "frontend", "ofp", "ofp|omni",
                "Select the parser that produced the XML input files " +
                "(default is ofp)");
        options.add(options.UTILITY, "help",
                "Print this message");
        options.add(options.UTILITY, "skip-procedures", "proc1,proc2,...",
                "Causes all passes that observe this flag to skip the " +
                "listed procedures");
        options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see " +
                "(default is 0)");
        options.add(options.TRANSFORM, "loop-fusion",
                "Fuse the loops marked with !$strata loop-fusion");
        options.add(options.TRANSFORM, "loop-fission",
                "Split the loops marked with !$strata loop-fission");
    }

    /**
    * Returns the value of the given key or null if the value is not set.
    * Key values are set on the command line as <b>-option_name=value</b>.
    */
    public static String getOptionValue(String key) {
        return options.getValue(key);
    }

    /** Sets the value of a registered option. */
    public static void setOptionValue(String key, String value) {
        options.setValue(key, value);
    }

    /**
    * Returns the lower-cased names of the procedures listed with
    * <code>-skip-procedures</code>.
    */
    public static Set<String> getSkipProcedureSet() {
        Set<String> proc_skip_set = new HashSet<String>();
        String s = getOptionValue("skip-procedures");
        if (s != null) {
            for (String name : s.split(",")) {
                if (name.trim().length() > 0) {
                    proc_skip_set.add(name.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return proc_skip_set;
    }

    /**
    * Parses the command line. Options come first and start with a dash; the
    * remaining arguments are input files.
    */
    protected void parseCommandLine(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }
        int i;
        for (i = 0; i < args.length; ++i) {
            String opt = args[i];
            if (opt.length() == 0 || opt.charAt(0) != '-') {
                break;
            }
            int eq = opt.indexOf('=');
            String option_name = (eq == -1) ?
                    opt.substring(1) : opt.substring(1, eq);
            if (!options.contains(option_name)) {
                PrintTools.printlnStatus(0, "[WARNING]",
                        "ignoring unrecognized option", option_name);
            } else if (eq == -1) {
                setOptionValue(option_name, "1");
            } else {
                setOptionValue(option_name, opt.substring(eq + 1));
            }
            if (getOptionValue("help") != null) {
                printUsage();
                System.exit(0);
            }
        }
        if (i >= args.length) {
            System.err.println("No input files!");
            System.exit(1);
        }
        for (; i < args.length; ++i) {
            filenames.add(args[i]);
        }
    }

    /**
    * Builds one top-level procedure per input file.
    * @throws FrontendException if a file cannot be read or holds no
    *   procedure.
    */
    protected void parseFiles() {
        Frontend frontend = Frontend.fromString(getOptionValue("frontend"));
        if (frontend == Frontend.FP) {
            throw new FrontendException(frontend,
                    "the fp frontend only reads trees built in memory");
        }
        program = new Program();
        DocumentBuilder builder = newDocumentBuilder(frontend);
        for (String filename : filenames) {
            Document doc;
            try {
                doc = builder.parse(new File(filename));
            } catch (SAXException e) {
                throw new FrontendException(frontend,
                        "malformed XML in " + filename, e);
            } catch (IOException e) {
                throw new FrontendException(frontend,
                        "cannot read " + filename, e);
            }
            Procedure proc = ProcedureBuilder.build(
                    frontend, doc, null, program.getScope());
            program.addProcedure(proc);
            PrintTools.printlnStatus(1, "[Driver]", "built", proc.getName(),
                    "from", filename);
        }
    }

    private static DocumentBuilder newDocumentBuilder(Frontend frontend) {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setIgnoringComments(true);
        try {
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new FrontendException(frontend,
                    "no XML parser available", e);
        }
    }

    /** Runs the passes enabled on the command line. */
    public void runPasses() {
        if (getOptionValue("loop-fusion") != null) {
            TransformPass.run(new LoopFusion(program));
        }
        if (getOptionValue("loop-fission") != null) {
            TransformPass.run(new LoopFission(program));
        }
    }

    /** Prints the program to standard output. */
    public void print() {
        PrintWriter o = new PrintWriter(new OutputStreamWriter(System.out));
        program.print(o);
        o.flush();
    }

    /**
    * Entry point for derived classes: parses the command line, builds the
    * program, runs the passes and prints the result.
    */
    public void run(String[] args) {
        parseCommandLine(args);
        parseFiles();
        runPasses();
        print();
    }

    public void printUsage() {
        String usage = "strata.exec.Driver" + PrintTools.line_sep +
                "usage: java -cp strata.jar strata.exec.Driver [option]... " +
                "[file]..." + PrintTools.line_sep;
        usage += options.getUsage();
        System.err.println(usage);
    }

    /** Returns the program built by the driver. */
    public Program getProgram() {
        return program;
    }

    public static void main(String[] args) {
        try {
            new Driver().run(args);
        } catch (FrontendException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (TransformException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

}
