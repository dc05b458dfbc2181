package strata.exec;

import strata.hir.PrintTools;

import java.util.Map;
import java.util.TreeMap;

/**
* Registry of the command line options: their kind, current value, argument
* placeholder and usage text.
*/
public class CommandLineOptionSet {

    public final int TRANSFORM = 1;
    public final int UTILITY = 2;

    private class OptionRecord {

        public int option_type;
        public String value;
        public String arg;
        public String usage;

        public OptionRecord(int type, String value, String arg, String usage) {
            this.option_type = type;
            this.value = value;
            this.arg = arg;
            this.usage = usage;
        }
    }

    private TreeMap<String, OptionRecord> name_to_record;

    public CommandLineOptionSet() {
        name_to_record = new TreeMap<String, OptionRecord>();
    }

    public void add(String name, String usage) {
        add(UTILITY, name, null, null, usage);
    }

    public void add(int type, String name, String usage) {
        add(type, name, null, null, usage);
    }

    public void add(int type, String name, String arg, String usage) {
        add(type, name, null, arg, usage);
    }

    /**
    * Registers an option; an option registered twice keeps the last record.
    * @param type the kind of option.
    * @param name the option name, without the leading dash.
    * @param value the default value, or null.
    * @param arg the argument placeholder printed in the usage, or null.
    * @param usage the description printed in the usage.
    */
    public void add(int type, String name, String value, String arg,
                    String usage) {
        name_to_record.put(name, new OptionRecord(type, value, arg, usage));
    }

    public boolean contains(String name) {
        return name_to_record.containsKey(name);
    }

    public String getUsage() {
        StringBuilder sb = new StringBuilder(2000);
        String sep = PrintTools.line_sep;
        appendRule(sb);
        sb.append(sep).append("UTILITY").append(sep);
        appendRule(sb);
        sb.append(sep).append(getUsage(UTILITY));
        appendRule(sb);
        sb.append(sep).append("TRANSFORM").append(sep);
        appendRule(sb);
        sb.append(sep).append(getUsage(TRANSFORM));
        return sb.toString();
    }

    private static void appendRule(StringBuilder sb) {
        for (int i = 0; i < 80; i++) {
            sb.append("-");
        }
    }

    public String getUsage(int type) {
        StringBuilder usage = new StringBuilder();
        String sep = PrintTools.line_sep;
        for (Map.Entry<String, OptionRecord> entry :
                name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            if (record.option_type != type) {
                continue;
            }
            usage.append("-").append(entry.getKey());
            if (record.arg != null) {
                usage.append("=").append(record.arg);
            }
            usage.append(sep).append("    ").append(record.usage);
            usage.append(sep).append(sep);
        }
        return usage.toString();
    }

    /** Returns the value of the option, or null if it is not set. */
    public String getValue(String name) {
        OptionRecord record = name_to_record.get(name);
        return (record == null) ? null : record.value;
    }

    /** Sets the value of a registered option; unknown names are ignored. */
    public void setValue(String name, String value) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            record.value = value;
        }
    }

    public int getType(String name) {
        OptionRecord record = name_to_record.get(name);
        return (record == null) ? 0 : record.option_type;
    }

}
