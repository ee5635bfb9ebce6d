package io.surfworks.meshforge.ir.value;

import java.util.Objects;

/**
 * Physical device descriptor, e.g. {@code cuda:2} or {@code cpu}.
 *
 * @param type  device type ("cpu", "cuda", ...)
 * @param index device index, or {@code null} when unspecified
 */
public record Device(String type, Integer index) implements Value {

    public Device {
        Objects.requireNonNull(type, "type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got " + index);
        }
    }

    public static Device of(String type) {
        return new Device(type, null);
    }

    public static Device of(String type, int index) {
        return new Device(type, index);
    }

    /**
     * Parse {@code "type"} or {@code "type:index"}.
     */
    public static Device parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return of(text);
        }
        return of(text.substring(0, colon), Integer.parseInt(text.substring(colon + 1)));
    }

    /**
     * Canonical {@code "type"} or {@code "type:index"} form.
     */
    public String canonical() {
        return index == null ? type : type + ":" + index;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
