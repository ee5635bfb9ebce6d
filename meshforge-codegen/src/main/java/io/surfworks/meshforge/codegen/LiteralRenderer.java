package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.ir.value.Device;
import io.surfworks.meshforge.ir.value.ElementType;
import io.surfworks.meshforge.ir.value.IRObject;
import io.surfworks.meshforge.ir.value.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders resolved values in the literal syntax of the generated code.
 *
 * <p>The output follows the target language's canonical literal form:
 * <ul>
 *   <li>{@code None}, {@code True}, {@code False}, {@code Ellipsis}</li>
 *   <li>floats in shortest round-trip form: {@code 0.1}, {@code 1e-05}, {@code 1e+16}, {@code inf}</li>
 *   <li>strings in single quotes unless only double quotes avoid escaping</li>
 *   <li>{@code [a, b]}, {@code (a,)}, {@code {k: v}}, {@code slice(a, None, None)}</li>
 * </ul>
 *
 * <p>Managed values must be resolved to {@link Value.Name}s first; see {@link NameResolver}.
 */
public final class LiteralRenderer {

    private LiteralRenderer() {} // Utility class

    /**
     * Literal form: strings are quoted.
     */
    public static String literal(Value value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    /**
     * Text form: identical to {@link #literal(Value)} except that a top-level string
     * is spliced verbatim. Nested strings stay quoted.
     */
    public static String text(Value value) {
        if (value instanceof Value.StrValue str) {
            return str.value();
        }
        return literal(value);
    }

    // ==================== Rendering ====================

    private static void append(StringBuilder sb, Value value) {
        if (value instanceof Value.Name name) {
            sb.append(name.name());
        } else if (value instanceof Value.NoneValue) {
            sb.append("None");
        } else if (value instanceof Value.BoolValue b) {
            sb.append(b.value() ? "True" : "False");
        } else if (value instanceof Value.IntValue i) {
            sb.append(i.value());
        } else if (value instanceof Value.FloatValue f) {
            sb.append(formatFloat(f.value()));
        } else if (value instanceof Value.StrValue s) {
            appendQuoted(sb, s.value());
        } else if (value instanceof Value.BytesValue b) {
            appendBytes(sb, b.value());
        } else if (value instanceof Value.EllipsisValue) {
            sb.append("Ellipsis");
        } else if (value instanceof ElementType dtype) {
            sb.append(dtype.qualifiedName());
        } else if (value instanceof Device device) {
            appendQuoted(sb, device.canonical());
        } else if (value instanceof Value.ListValue list) {
            sb.append('[');
            appendJoined(sb, list.elements());
            sb.append(']');
        } else if (value instanceof Value.TupleValue tuple) {
            sb.append('(');
            appendJoined(sb, tuple.elements());
            if (tuple.size() == 1) {
                sb.append(',');
            }
            sb.append(')');
        } else if (value instanceof Value.DictValue dict) {
            appendDict(sb, dict.entries());
        } else if (value instanceof Value.SliceValue slice) {
            sb.append("slice(");
            appendBound(sb, slice.start());
            sb.append(", ");
            appendBound(sb, slice.stop());
            sb.append(", ");
            appendBound(sb, slice.step());
            sb.append(')');
        } else if (value instanceof IRObject obj) {
            throw new EmissionException(
                "Managed value must be resolved to a name before rendering: " + obj,
                EmissionException.ErrorCode.UNSUPPORTED_VALUE);
        } else {
            throw new EmissionException("Unsupported data type: " + value,
                EmissionException.ErrorCode.UNSUPPORTED_VALUE);
        }
    }

    private static void appendJoined(StringBuilder sb, List<Value> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            append(sb, values.get(i));
        }
    }

    private static void appendDict(StringBuilder sb, Map<Value, Value> entries) {
        sb.append('{');
        Iterator<Map.Entry<Value, Value>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Value, Value> entry = it.next();
            append(sb, entry.getKey());
            sb.append(": ");
            append(sb, entry.getValue());
            if (it.hasNext()) sb.append(", ");
        }
        sb.append('}');
    }

    private static void appendBound(StringBuilder sb, Value bound) {
        if (bound == null) {
            sb.append("None");
        } else {
            append(sb, bound);
        }
    }

    // ==================== Strings ====================

    private static char chooseQuote(boolean hasSingle, boolean hasDouble) {
        return hasSingle && !hasDouble ? '"' : '\'';
    }

    private static void appendQuoted(StringBuilder sb, String s) {
        char quote = chooseQuote(s.indexOf('\'') >= 0, s.indexOf('"') >= 0);
        sb.append(quote);
        s.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                sb.append('\\').append((char) cp);
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (cp < 0x20 || (cp >= 0x7f && cp <= 0x9f)) {
                sb.append(String.format("\\x%02x", cp));
            } else {
                sb.appendCodePoint(cp);
            }
        });
        sb.append(quote);
    }

    private static void appendBytes(StringBuilder sb, byte[] bytes) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : bytes) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = chooseQuote(hasSingle, hasDouble);
        sb.append('b').append(quote);
        for (byte b : bytes) {
            int c = b & 0xff;
            if (c == quote || c == '\\') {
                sb.append('\\').append((char) c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c >= 0x7f) {
                sb.append(String.format("\\x%02x", c));
            } else {
                sb.append((char) c);
            }
        }
        sb.append(quote);
    }

    // ==================== Floats ====================

    private static final RoundingMode[] SHORTEST_CANDIDATES = {
        RoundingMode.HALF_EVEN, RoundingMode.DOWN, RoundingMode.UP
    };

    /**
     * Shortest round-trip decimal, fixed notation for exponents in [-4, 16),
     * scientific with a signed two-digit exponent otherwise.
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return (1.0 / d < 0) ? "-0.0" : "0.0";
        }

        BigDecimal bd = shortestDecimal(Math.abs(d));
        String digits = bd.unscaledValue().toString();
        int pointPos = digits.length() - bd.scale();
        int exponent = pointPos - 1;

        StringBuilder sb = new StringBuilder();
        if (d < 0) {
            sb.append('-');
        }
        if (exponent >= -4 && exponent < 16) {
            if (pointPos <= 0) {
                sb.append("0.").append("0".repeat(-pointPos)).append(digits);
            } else if (pointPos >= digits.length()) {
                sb.append(digits).append("0".repeat(pointPos - digits.length())).append(".0");
            } else {
                sb.append(digits, 0, pointPos).append('.').append(digits, pointPos, digits.length());
            }
        } else {
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int absExp = Math.abs(exponent);
            if (absExp < 10) {
                sb.append('0');
            }
            sb.append(absExp);
        }
        return sb.toString();
    }

    /**
     * Fewest significant digits that parse back to {@code d}; among candidates of that
     * length, the one closest to the exact binary value.
     */
    private static BigDecimal shortestDecimal(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision <= 17; precision++) {
            BigDecimal best = null;
            for (RoundingMode mode : SHORTEST_CANDIDATES) {
                BigDecimal candidate = exact.round(new MathContext(precision, mode));
                if (candidate.doubleValue() != d) {
                    continue;
                }
                if (best == null
                        || candidate.subtract(exact).abs().compareTo(best.subtract(exact).abs()) < 0) {
                    best = candidate;
                }
            }
            if (best != null) {
                return best.stripTrailingZeros();
            }
        }
        return exact.stripTrailingZeros();
    }
}
