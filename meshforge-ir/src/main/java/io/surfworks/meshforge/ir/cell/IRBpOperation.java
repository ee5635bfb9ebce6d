package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Backward operation derived from a forward operation.
 *
 * <p>Inputs are the gradients of the forward outputs, outputs are the gradients
 * of the forward inputs. Which forward tensor each gradient belongs to is not
 * stored here; it is recovered through the mirror.
 */
public final class IRBpOperation extends IRCell {

    public static final String SIGNATURE = "backward";

    /**
     * @param forward the forward node this one was derived from; linked as mirror
     *                in both directions. May be {@code null} only for graphs under
     *                construction.
     */
    public IRBpOperation(long cid, String name, IRCell forward,
                         List<? extends Value> inputs, List<? extends Value> outputs) {
        super(cid, name, SIGNATURE, inputs, outputs, Map.of());
        if (forward != null) {
            if (!forward.isForward()) {
                throw new IllegalArgumentException("Mirror of a backward op must be forward: " + forward);
            }
            setMirror(forward);
            forward.setMirror(this);
        }
    }

    @Override
    public boolean isForward() {
        return false;
    }
}
