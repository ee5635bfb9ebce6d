package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.adapter.AdapterPrim;
import io.surfworks.meshforge.ir.adapter.PrimitiveCall;
import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-device data movement between producers and consumers on different devices.
 *
 * <p>An adapter is either an ordered sequence of {@link AdapterPrim}s, or, when it is
 * both differentiable and custom, a single primitive call of its own signature.
 */
public final class IRAdapter extends IRCell implements PrimitiveCall {

    public static final String SIGNATURE = "adapter";

    private final List<AdapterPrim> prims;
    private final boolean forward;
    private final boolean differentiable;
    private final boolean custom;

    /**
     * Adapter built from a primitive sequence.
     */
    public IRAdapter(long cid, List<? extends Value> inputs, List<? extends Value> outputs,
                     List<? extends AdapterPrim> prims, boolean forward) {
        this(cid, SIGNATURE, inputs, outputs, Map.of(), prims, forward, false, false);
    }

    /**
     * Differentiable custom adapter emitted as one call of {@code signature}.
     */
    public static IRAdapter custom(long cid, String signature,
                                   List<? extends Value> inputs, List<? extends Value> outputs,
                                   Map<String, ? extends Value> kwargs, boolean forward) {
        return new IRAdapter(cid, signature, inputs, outputs, kwargs, List.of(), forward, true, true);
    }

    private IRAdapter(long cid, String signature,
                      List<? extends Value> inputs, List<? extends Value> outputs,
                      Map<String, ? extends Value> kwargs, List<? extends AdapterPrim> prims,
                      boolean forward, boolean differentiable, boolean custom) {
        super(cid, "adapter", signature, inputs, outputs, kwargs);
        this.prims = List.copyOf(Objects.requireNonNull(prims, "prims cannot be null"));
        this.forward = forward;
        this.differentiable = differentiable;
        this.custom = custom;
    }

    public List<AdapterPrim> prims() {
        return prims;
    }

    public boolean isDifferentiable() {
        return differentiable;
    }

    public boolean isCustom() {
        return custom;
    }

    @Override
    public boolean isForward() {
        return forward;
    }

    /**
     * A custom adapter is not a collective: its own runtime call decides how it communicates.
     */
    @Override
    public boolean isCollective() {
        return false;
    }
}
