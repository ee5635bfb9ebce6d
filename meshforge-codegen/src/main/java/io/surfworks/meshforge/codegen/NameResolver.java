package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.ir.value.Device;
import io.surfworks.meshforge.ir.value.ElementType;
import io.surfworks.meshforge.ir.value.IRObject;
import io.surfworks.meshforge.ir.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns values into text that can be spliced directly into generated statements.
 *
 * <p>Managed values resolve to {@code {name}_{tid}}, where every character of the
 * base name that cannot appear in an identifier is replaced by {@code _}. An attribute
 * additionally gets the scope prefix, when one is given. Containers resolve element
 * by element and keep their kind; literals stay as they are; devices become their
 * canonical {@code "type"} or {@code "type:index"} string.
 */
public final class NameResolver {

    private NameResolver() {} // Utility class

    /**
     * Resolve and render a value in literal syntax.
     *
     * @param value      an IR value or a plain Java value (see {@link #lift(Object)})
     * @param prefixAttr prefix for attribute names, or {@code null}
     * @return the text of the value
     * @throws EmissionException with {@code UNSUPPORTED_VALUE} if the value has no rendering
     */
    public static String tensorName(Object value, String prefixAttr) {
        return LiteralRenderer.literal(resolve(value, prefixAttr));
    }

    public static String tensorName(Object value) {
        return tensorName(value, null);
    }

    /**
     * Identifier of a managed value.
     */
    public static String objectName(IRObject obj, String prefixAttr) {
        String name = sanitize(obj.name()) + "_" + obj.tid();
        if (prefixAttr != null && obj.isAttr()) {
            name = prefixAttr + name;
        }
        return name;
    }

    /**
     * Resolve a value: every managed value in it becomes a {@link Value.Name}.
     *
     * @throws EmissionException with {@code UNSUPPORTED_VALUE} if the value has no rendering
     */
    public static Value resolve(Object value, String prefixAttr) {
        return resolveValue(lift(value), prefixAttr);
    }

    /**
     * Lift a plain Java value into the IR value variant.
     *
     * <p>Accepted: {@code null}, {@link Value}s, {@link Boolean}, {@link Byte}, {@link Short},
     * {@link Integer}, {@link Long}, {@link Float}, {@link Double}, {@link String},
     * {@code byte[]}, {@link List}s (become lists) and {@link Map}s (become dicts) of those.
     *
     * @throws EmissionException with {@code UNSUPPORTED_VALUE} for anything else
     */
    public static Value lift(Object value) {
        if (value == null) {
            return Value.none();
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return Value.of(b.booleanValue());
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return Value.of(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return Value.of(((Number) value).doubleValue());
        }
        if (value instanceof String s) {
            return Value.of(s);
        }
        if (value instanceof byte[] bytes) {
            return Value.bytes(bytes);
        }
        if (value instanceof List<?> list) {
            List<Value> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(lift(element));
            }
            return new Value.ListValue(elements);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Value, Value> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(lift(k), lift(v)));
            return new Value.DictValue(entries);
        }
        throw new EmissionException("Unsupported data type: " + value.getClass().getName(),
            EmissionException.ErrorCode.UNSUPPORTED_VALUE);
    }

    // ==================== Internal Helpers ====================

    private static Value resolveValue(Value value, String prefixAttr) {
        if (value instanceof Value.Name) {
            return value;
        }
        if (value instanceof IRObject obj) {
            return new Value.Name(objectName(obj, prefixAttr));
        }
        if (value instanceof Value.SliceValue slice) {
            return new Value.SliceValue(
                resolveBound(slice.start(), prefixAttr),
                resolveBound(slice.stop(), prefixAttr),
                resolveBound(slice.step(), prefixAttr));
        }
        if (value instanceof Value.DictValue dict) {
            Map<Value, Value> entries = new LinkedHashMap<>();
            dict.entries().forEach((k, v) -> entries.put(resolveValue(k, prefixAttr), resolveValue(v, prefixAttr)));
            return new Value.DictValue(entries);
        }
        if (value instanceof Value.ListValue list) {
            return new Value.ListValue(resolveAll(list.elements(), prefixAttr));
        }
        if (value instanceof Value.TupleValue tuple) {
            return new Value.TupleValue(resolveAll(tuple.elements(), prefixAttr));
        }
        if (value instanceof Device device) {
            return Value.of(device.canonical());
        }
        if (isLiteral(value)) {
            return value;
        }
        throw new EmissionException("Unsupported data type: " + value.getClass().getName(),
            EmissionException.ErrorCode.UNSUPPORTED_VALUE);
    }

    private static boolean isLiteral(Value value) {
        return value instanceof Value.NoneValue
            || value instanceof Value.BoolValue
            || value instanceof Value.IntValue
            || value instanceof Value.FloatValue
            || value instanceof Value.StrValue
            || value instanceof Value.BytesValue
            || value instanceof Value.EllipsisValue
            || value instanceof ElementType;
    }

    private static Value resolveBound(Value bound, String prefixAttr) {
        return bound == null ? null : resolveValue(bound, prefixAttr);
    }

    private static List<Value> resolveAll(List<Value> values, String prefixAttr) {
        List<Value> resolved = new ArrayList<>(values.size());
        for (Value v : values) {
            resolved.add(resolveValue(v, prefixAttr));
        }
        return resolved;
    }

    private static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
