package io.surfworks.meshforge.ir.adapter;

import io.surfworks.meshforge.ir.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Smallest communication or data-movement step of an adapter.
 *
 * <p>Either a {@link CommPrim} (collective across a device group) or a
 * {@link SpatialPrim} (local data movement).
 */
public abstract sealed class AdapterPrim implements PrimitiveCall permits CommPrim, SpatialPrim {

    /** Runtime module holding the adapter functions */
    public static final String RUNTIME_MODULE = "nnscaler.runtime.adapter";

    private final List<Value> inputs;
    private final List<Value> outputs;
    private final Map<String, Value> kwargs;
    private final List<Integer> device;

    AdapterPrim(List<? extends Value> inputs, List<? extends Value> outputs,
                Map<String, ? extends Value> kwargs, List<Integer> device) {
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs cannot be null"));
        this.outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs cannot be null"));
        this.kwargs = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(kwargs, "kwargs cannot be null")));
        this.device = List.copyOf(Objects.requireNonNull(device, "device cannot be null"));
    }

    @Override
    public List<Value> inputs() {
        return inputs;
    }

    @Override
    public List<Value> outputs() {
        return outputs;
    }

    @Override
    public Map<String, Value> kwargs() {
        return kwargs;
    }

    @Override
    public List<Integer> device() {
        return device;
    }

    @Override
    public String toString() {
        return signature() + " device=" + device + " inputs=" + inputs + " outputs=" + outputs;
    }
}
