package strata.hir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* A note attached to an {@link Annotatable} node and printed on its own line
* before it. The content is kept as named values; subclasses decide which
* names they use and how the note prints.
*/
public abstract class Annotation extends HashMap<String, Object> {

    private static final long serialVersionUID = 3490L;

    /** The node carrying this note, or null while unattached. */
    protected transient Annotatable ir;

    protected Annotation() {
        super();
        ir = null;
    }

    /** Typed lookup of a stored value; null if absent. */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T)super.get(key);
    }

    /** Renders the note the way it appears in Fortran source. */
    public abstract String toString();

    /**
    * Copies the note with its values; collections and maps are copied, the
    * rest is shared. The copy is unattached.
    */
    @Override
    public Annotation clone() {
        Annotation o = (Annotation)super.clone();
        o.ir = null;
        for (Map.Entry<String, Object> entry : o.entrySet()) {
            entry.setValue(copyValue(entry.getValue()));
        }
        return o;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<Object, Object>();
            for (Map.Entry<Object, Object> entry :
                    ((Map<Object, Object>)value).entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection) {
            Collection<Object> values = (Collection<Object>)value;
            List<Object> copy = new ArrayList<Object>(values.size());
            for (Object v : values) {
                copy.add(copyValue(v));
            }
            return copy;
        }
        return value;
    }

    /** Records the node that carries this note. */
    public void attach(Annotatable ir) {
        this.ir = ir;
    }

    /** Takes this note off the node carrying it. */
    public void detach() {
        if (ir == null) {
            return;
        }
        List<Annotation> notes = ir.getAnnotations();
        int pos = Tools.identityIndexOf(notes, this);
        if (pos >= 0) {
            notes.remove(pos);
        }
        ir = null;
    }

    public Annotatable getAnnotatable() {
        return ir;
    }

    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

}
