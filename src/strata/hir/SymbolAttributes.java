package strata.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
* Immutable type attributes of a symbol: the basic type and kind, the shape
* (one extent expression per dimension), the intent of a dummy argument and
* the declaration attributes. The <code>with*</code> methods return modified
* copies.
*/
public final class SymbolAttributes {

    /** Basic types. DEFERRED marks a type that is not resolved yet. */
    public enum BasicType {
        INTEGER, REAL, LOGICAL, CHARACTER, COMPLEX, DERIVED, PROCEDURE,
        DEFERRED
    }

    /** Intent of a dummy argument. */
    public enum Intent {
        IN, OUT, INOUT;

        /**
        * Parses an intent spelling such as <code>in</code> or
        * <code>inout</code>; returns null for null or empty input.
        */
        public static Intent parse(String s) {
            if (s == null || s.trim().length() == 0) {
                return null;
            }
            String t = s.trim().toUpperCase(Locale.ROOT).replace(" ", "");
            if (t.equals("IN")) {
                return IN;
            } else if (t.equals("OUT")) {
                return OUT;
            } else if (t.equals("INOUT")) {
                return INOUT;
            }
            throw new IllegalArgumentException("unknown intent: " + s);
        }
    }

    private final BasicType type;
    private final String kind;
    private final String type_name;
    private final List<Expression> shape;
    private final Intent intent;
    private final boolean allocatable;
    private final boolean pointer;
    private final boolean parameter;
    private final boolean optional;
    private final boolean is_function;

    /**
    * Creates attributes of the given basic type with no kind, no shape and
    * no attribute.
    */
    public SymbolAttributes(BasicType type) {
        this(type, null, null, null, null, false, false, false, false, false);
    }

    private SymbolAttributes(BasicType type, String kind, String type_name,
            List<Expression> shape, Intent intent, boolean allocatable,
            boolean pointer, boolean parameter, boolean optional,
            boolean is_function) {
        this.type = type;
        this.kind = kind;
        this.type_name = type_name;
        this.shape = copyShape(shape);
        this.intent = intent;
        this.allocatable = allocatable;
        this.pointer = pointer;
        this.parameter = parameter;
        this.optional = optional;
        this.is_function = is_function;
    }

    private static List<Expression> copyShape(List<Expression> shape) {
        if (shape == null) {
            return null;
        }
        List<Expression> ret = new ArrayList<Expression>(shape.size());
        for (Expression e : shape) {
            ret.add(e.clone());
        }
        return Collections.unmodifiableList(ret);
    }

    /** Returns attributes of a type that is not resolved yet. */
    public static SymbolAttributes deferred() {
        return new SymbolAttributes(BasicType.DEFERRED);
    }

    /**
    * Returns the attributes of a callable procedure.
    * @param name the procedure name.
    * @param is_function true if the procedure returns a value.
    */
    public static SymbolAttributes procedure(String name, boolean is_function) {
        return new SymbolAttributes(BasicType.PROCEDURE, null, name, null,
                null, false, false, false, false, is_function);
    }

    /** Returns the attributes of a derived type with the given name. */
    public static SymbolAttributes derived(String type_name) {
        return new SymbolAttributes(BasicType.DERIVED, null, type_name, null,
                null, false, false, false, false, false);
    }

    public BasicType getType() {
        return type;
    }

    public String getKind() {
        return kind;
    }

    /** Returns the derived-type name, or the procedure name. */
    public String getTypeName() {
        return type_name;
    }

    /**
    * Returns the shape as an unmodifiable list of extent expressions, or
    * null for a scalar.
    */
    public List<Expression> getShape() {
        return shape;
    }

    public Intent getIntent() {
        return intent;
    }

    public boolean isAllocatable() {
        return allocatable;
    }

    public boolean isPointer() {
        return pointer;
    }

    public boolean isParameter() {
        return parameter;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isFunction() {
        return is_function;
    }

    public boolean isDeferred() {
        return type == BasicType.DEFERRED;
    }

    public boolean isProcedure() {
        return type == BasicType.PROCEDURE;
    }

    /**
    * Checks if the shape is absent from an array declaration or contains a
    * deferred extent.
    */
    public boolean hasDeferredShape() {
        if (shape == null) {
            return allocatable || pointer;
        }
        for (Expression e : shape) {
            if (e instanceof DeferredExtent) {
                return true;
            }
        }
        return false;
    }

    public SymbolAttributes withKind(String kind) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withTypeName(String type_name) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    /** Returns a copy with the given shape; null makes it a scalar. */
    public SymbolAttributes withShape(List<Expression> shape) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withIntent(Intent intent) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withAllocatable(boolean allocatable) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withPointer(boolean pointer) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withParameter(boolean parameter) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    public SymbolAttributes withOptional(boolean optional) {
        return new SymbolAttributes(type, kind, type_name, shape, intent,
                allocatable, pointer, parameter, optional, is_function);
    }

    /**
    * Returns the type specification as written in a declaration, e.g.
    * <code>REAL(KIND=jprb), INTENT(IN), ALLOCATABLE</code>. The shape is
    * printed with the declared variables.
    */
    public String toDeclarationString() {
        StringBuilder sb = new StringBuilder(40);
        if (type == BasicType.DERIVED) {
            sb.append("TYPE(").append(type_name).append(")");
        } else if (type == BasicType.PROCEDURE) {
            sb.append("PROCEDURE(").append(type_name).append(")");
        } else {
            sb.append(type.name());
            if (kind != null) {
                sb.append("(KIND=").append(kind).append(")");
            }
        }
        if (parameter) {
            sb.append(", PARAMETER");
        }
        if (intent != null) {
            sb.append(", INTENT(").append(intent.name()).append(")");
        }
        if (optional) {
            sb.append(", OPTIONAL");
        }
        if (allocatable) {
            sb.append(", ALLOCATABLE");
        }
        if (pointer) {
            sb.append(", POINTER");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof SymbolAttributes)) {
            return false;
        }
        SymbolAttributes other = (SymbolAttributes)o;
        return (type == other.type && intent == other.intent &&
                allocatable == other.allocatable &&
                pointer == other.pointer && parameter == other.parameter &&
                optional == other.optional &&
                is_function == other.is_function &&
                equalsIgnoreCase(kind, other.kind) &&
                equalsIgnoreCase(type_name, other.type_name) &&
                (shape == null ? other.shape == null :
                 shape.equals(other.shape)));
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return (a == null ? b == null : a.equalsIgnoreCase(b));
    }

    @Override
    public int hashCode() {
        return toString().toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        if (shape == null) {
            return toDeclarationString();
        }
        return toDeclarationString() + ", DIMENSION(" +
                Tools.listToString(shape, ",") + ")";
    }

}
