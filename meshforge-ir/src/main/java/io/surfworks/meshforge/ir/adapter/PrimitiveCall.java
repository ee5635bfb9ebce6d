package io.surfworks.meshforge.ir.adapter;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Anything emitted as a single {@code outputs = signature(inputs, kwargs)} call
 * inside an adapter: a primitive, or an adapter that is itself one
 * differentiable custom primitive.
 */
public interface PrimitiveCall {

    /**
     * Fully qualified runtime function invoked by the call.
     */
    String signature();

    List<Value> inputs();

    List<Value> outputs();

    Map<String, Value> kwargs();

    /**
     * Devices taking part in the call.
     */
    List<Integer> device();

    /**
     * Whether the call synchronizes across a device group.
     */
    boolean isCollective();
}
