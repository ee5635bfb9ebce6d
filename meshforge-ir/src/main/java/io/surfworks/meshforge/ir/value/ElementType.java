package io.surfworks.meshforge.ir.value;

/**
 * Tensor element types.
 *
 * <p>Element types are literals: they render by their qualified runtime name
 * (e.g. {@code torch.float32}) and never by identity.
 */
public enum ElementType implements Value {
    // Floating point
    F16("float16"),
    F32("float32"),
    F64("float64"),
    BF16("bfloat16"),
    F8_E5M2("float8_e5m2"),
    F8_E4M3FN("float8_e4m3fn"),

    // Integer
    U8("uint8"),
    I8("int8"),
    I16("int16"),
    I32("int32"),
    I64("int64"),
    BOOL("bool");

    /** Module that owns the element type names in the generated code */
    public static final String RUNTIME_MODULE = "torch";

    private final String runtimeName;

    ElementType(String runtimeName) {
        this.runtimeName = runtimeName;
    }

    /**
     * Short name as used by the runtime, e.g. {@code float32}.
     */
    public String runtimeName() {
        return runtimeName;
    }

    /**
     * Qualified name, e.g. {@code torch.float32}.
     */
    public String qualifiedName() {
        return RUNTIME_MODULE + "." + runtimeName;
    }

    /**
     * Parse a runtime name, with or without the module qualifier.
     */
    public static ElementType fromRuntimeName(String name) {
        String shortName = name.startsWith(RUNTIME_MODULE + ".")
            ? name.substring(RUNTIME_MODULE.length() + 1)
            : name;
        for (ElementType type : values()) {
            if (type.runtimeName.equals(shortName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown element type: " + name);
    }
}
