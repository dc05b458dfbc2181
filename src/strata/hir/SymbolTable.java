package strata.hir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* Case-insensitive mapping from names to {@link SymbolAttributes}. Names are
* returned with the spelling of their latest declaration, in declaration
* order.
*/
public class SymbolTable {

    /** Attributes keyed by the lower-case name */
    private Map<String, SymbolAttributes> table;

    /** Declared spelling keyed by the lower-case name */
    private Map<String, String> spelling;

    public SymbolTable() {
        table = new LinkedHashMap<String, SymbolAttributes>();
        spelling = new LinkedHashMap<String, String>();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
    * Sets the attributes of the given name, replacing any previous entry.
    */
    public void put(String name, SymbolAttributes attr) {
        if (name == null || attr == null) {
            throw new IllegalArgumentException();
        }
        table.put(key(name), attr);
        spelling.put(key(name), name);
    }

    /** Returns the attributes of the given name or null. */
    public SymbolAttributes get(String name) {
        return table.get(key(name));
    }

    public boolean containsKey(String name) {
        return table.containsKey(key(name));
    }

    /** Removes the given name; returns the removed attributes or null. */
    public SymbolAttributes remove(String name) {
        spelling.remove(key(name));
        return table.remove(key(name));
    }

    /** Returns the declared names in declaration order. */
    public List<String> getNames() {
        return new ArrayList<String>(spelling.values());
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    /** Copies every entry of this table into <b>other</b>. */
    public void copyInto(SymbolTable other) {
        for (String k : table.keySet()) {
            other.put(spelling.get(k), table.get(k));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("{");
        for (String k : table.keySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(spelling.get(k)).append(": ").append(table.get(k));
        }
        sb.append("}");
        return sb.toString();
    }

}
