package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Forward operation: a call of a registered operator signature.
 */
public final class IRFwOperation extends IRCell {

    public IRFwOperation(long cid, String name, String signature,
                         List<? extends Value> inputs, List<? extends Value> outputs,
                         Map<String, ? extends Value> kwargs) {
        super(cid, name, signature, inputs, outputs, kwargs);
    }

    public IRFwOperation(long cid, String name, String signature,
                         List<? extends Value> inputs, List<? extends Value> outputs) {
        this(cid, name, signature, inputs, outputs, Map.of());
    }

    @Override
    public boolean isForward() {
        return true;
    }
}
