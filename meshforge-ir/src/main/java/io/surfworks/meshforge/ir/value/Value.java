package io.surfworks.meshforge.ir.value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value carried by an IR node: an input, an output or a keyword argument.
 *
 * <p>The set of value kinds is closed:
 * <ul>
 *   <li>literals: {@link NoneValue}, {@link BoolValue}, {@link IntValue}, {@link FloatValue},
 *       {@link StrValue}, {@link BytesValue}, {@link EllipsisValue} and {@link ElementType} tags</li>
 *   <li>managed values: {@link IRObject} and {@link IRTensor}</li>
 *   <li>containers: {@link ListValue}, {@link TupleValue}, {@link DictValue}, {@link SliceValue}</li>
 *   <li>{@link Device} descriptors</li>
 *   <li>{@link Name}, an identifier that has already been resolved for emission</li>
 * </ul>
 *
 * <p>Containers nest arbitrarily and may mix managed values with literals.
 */
public sealed interface Value permits
        Value.NoneValue, Value.BoolValue, Value.IntValue, Value.FloatValue, Value.StrValue,
        Value.BytesValue, Value.EllipsisValue, ElementType, IRObject,
        Value.SequenceValue, Value.DictValue, Value.SliceValue,
        Device, Value.Name {

    // ==================== Literals ====================

    record NoneValue() implements Value {
        static final NoneValue INSTANCE = new NoneValue();
    }

    record BoolValue(boolean value) implements Value {}

    record IntValue(long value) implements Value {}

    record FloatValue(double value) implements Value {}

    record StrValue(String value) implements Value {
        public StrValue {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    /**
     * Byte-string literal. The array is copied on the way in and out.
     */
    record BytesValue(byte[] value) implements Value {
        public BytesValue {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BytesValue that)) return false;
            return Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue" + Arrays.toString(value);
        }
    }

    record EllipsisValue() implements Value {
        static final EllipsisValue INSTANCE = new EllipsisValue();
    }

    // ==================== Containers ====================

    /**
     * Ordered, fixed-arity container: a list or a tuple.
     */
    sealed interface SequenceValue extends Value permits ListValue, TupleValue {
        List<Value> elements();

        default int size() {
            return elements().size();
        }
    }

    record ListValue(List<Value> elements) implements SequenceValue {
        public ListValue {
            elements = List.copyOf(elements);
        }
    }

    record TupleValue(List<Value> elements) implements SequenceValue {
        public TupleValue {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Mapping container. Keys are values themselves and iteration follows insertion order.
     */
    record DictValue(Map<Value, Value> entries) implements Value {
        public DictValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Slice with optional bounds; an absent bound is {@code null}.
     */
    record SliceValue(Value start, Value stop, Value step) implements Value {}

    // ==================== Names ====================

    /**
     * An identifier spliced verbatim into generated statements, never quoted.
     */
    record Name(String name) implements Value {
        public Name {
            Objects.requireNonNull(name, "name cannot be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    // ==================== Factories ====================

    static Value none() {
        return NoneValue.INSTANCE;
    }

    static Value ellipsis() {
        return EllipsisValue.INSTANCE;
    }

    static Value of(boolean value) {
        return new BoolValue(value);
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(String value) {
        return new StrValue(value);
    }

    static Value bytes(byte[] value) {
        return new BytesValue(value);
    }

    static ListValue list(Value... elements) {
        return new ListValue(List.of(elements));
    }

    static TupleValue tuple(Value... elements) {
        return new TupleValue(List.of(elements));
    }

    static DictValue dict(Map<Value, Value> entries) {
        return new DictValue(entries);
    }

    static SliceValue slice(Value start, Value stop, Value step) {
        return new SliceValue(start, stop, step);
    }
}
