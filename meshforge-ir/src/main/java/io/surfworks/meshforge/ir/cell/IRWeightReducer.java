package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.value.IRTensor;

import java.util.List;
import java.util.Map;

/**
 * Synchronizes the gradients of a group of weights across devices.
 *
 * <p>Emission only needs the reducer id: the runtime holds one reducer object
 * per id and the weights are registered with it at assembly time.
 */
public final class IRWeightReducer extends IRCell {

    public static final String SIGNATURE = "reducer";

    private final long reducerId;

    public IRWeightReducer(long cid, long reducerId, List<IRTensor> weights) {
        super(cid, "reducer", SIGNATURE, weights, List.of(), Map.of());
        if (reducerId < 0) {
            throw new IllegalArgumentException("reducerId must be non-negative, got " + reducerId);
        }
        this.reducerId = reducerId;
    }

    public long reducerId() {
        return reducerId;
    }

    @Override
    public boolean isForward() {
        return true;
    }
}
