package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.codegen.config.EmitterConfig;
import io.surfworks.meshforge.ir.cell.IRCell;
import io.surfworks.meshforge.ir.value.IRObject;
import io.surfworks.meshforge.ir.value.IRTensor;
import io.surfworks.meshforge.ir.value.Value;
import io.surfworks.meshforge.ir.value.ValueTrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Names of nodes, values and value groups as they appear in generated statements.
 */
public class CodeEmission {

    protected final EmitterConfig config;

    public CodeEmission(EmitterConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public EmitterConfig config() {
        return config;
    }

    /**
     * {@code {name}{cid}}, e.g. {@code linear12}.
     */
    public String nodeName(IRCell node) {
        return node.name() + node.cid();
    }

    /**
     * Literal text of a value; managed values become identifiers.
     *
     * @param value      value or plain Java value
     * @param prefixAttr prefix for attribute names, or {@code null}
     */
    public String tensorName(Object value, String prefixAttr) {
        return NameResolver.tensorName(value, prefixAttr);
    }

    public String tensorName(Object value) {
        return tensorName(value, null);
    }

    /**
     * Text of a container tree with its managed values replaced by identifiers.
     * A top-level string is spliced verbatim.
     */
    public String complexName(Value value, String prefixAttr) {
        Value named = ValueTrees.mapObjects(value,
            obj -> new Value.Name(NameResolver.objectName(obj, prefixAttr)));
        return LiteralRenderer.text(NameResolver.resolve(named, prefixAttr));
    }

    /**
     * Tuple of value names with a trailing empty slot: {@code (a, b, )}, {@code (a, )}
     * or {@code ()}. Usable both as a tuple and as an argument list.
     *
     * @param values     values to name
     * @param skipAttr   whether to leave out attribute tensors
     * @param prefixAttr prefix for attribute names, or {@code null}
     */
    public String tupleName(List<? extends Value> values, boolean skipAttr, String prefixAttr) {
        List<String> names = new ArrayList<>();
        for (Value v : values) {
            if (skipAttr && isAttrTensor(v)) {
                continue;
            }
            names.add(tensorName(v, prefixAttr));
        }
        names.add("");
        return "(" + String.join(", ", names) + ")";
    }

    public String tupleName(List<? extends Value> values) {
        return tupleName(values, false, null);
    }

    /**
     * Left-hand side binding the values: {@code a, b}. Binds the discard name when
     * nothing is left to bind.
     *
     * @param values     values to bind
     * @param skipAttr   whether to leave out attribute tensors
     * @param prefixAttr prefix for attribute names, or {@code null}
     */
    public String returnName(List<? extends Value> values, boolean skipAttr, String prefixAttr) {
        List<String> names = new ArrayList<>();
        for (Value v : values) {
            if (skipAttr && isAttrTensor(v)) {
                continue;
            }
            names.add(tensorName(v, prefixAttr));
        }
        return names.isEmpty() ? config.discardName() : String.join(", ", names);
    }

    public String returnName(List<? extends Value> values) {
        return returnName(values, false, null);
    }

    /**
     * Like {@link #returnName(List, boolean, String)} with every element rendered by
     * {@link #complexName(Value, String)}; attribute filtering applies to any managed value.
     */
    public String returnNameComplex(List<? extends Value> values, boolean skipAttr, String prefixAttr) {
        List<String> names = new ArrayList<>();
        for (Value v : values) {
            if (skipAttr && v instanceof IRObject obj && obj.isAttr()) {
                continue;
            }
            names.add(complexName(v, prefixAttr));
        }
        return names.isEmpty() ? config.discardName() : String.join(", ", names);
    }

    /**
     * Keyword arguments as call text: {@code k0=v0, k1=v1}.
     *
     * <p>Managed values inside the arguments become identifiers. A string argument is
     * spliced verbatim, since adapter primitives pass runtime names (dtypes, reduce
     * ops) as strings; strings nested in containers stay quoted.
     */
    public String kwargsName(Map<String, ? extends Value> kwargs) {
        List<String> names = new ArrayList<>(kwargs.size());
        kwargs.forEach((name, value) -> names.add(name + "=" + complexName(value, null)));
        return String.join(", ", names);
    }

    /**
     * Keyword arguments as a map from the keyword to the literal text of the value,
     * for rules that need structured access.
     */
    public Map<String, String> kwargsDict(Map<String, ? extends Value> kwargs) {
        Map<String, String> dict = new LinkedHashMap<>();
        kwargs.forEach((name, value) -> dict.put(name, tensorName(value)));
        return Collections.unmodifiableMap(dict);
    }

    private static boolean isAttrTensor(Value value) {
        return value instanceof IRTensor tensor && tensor.isAttr();
    }
}
