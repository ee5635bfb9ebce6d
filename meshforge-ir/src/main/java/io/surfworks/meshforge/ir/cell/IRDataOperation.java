package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Pulls the next sample from a data loader. The only input is the loader handle.
 */
public final class IRDataOperation extends IRCell {

    public static final String SIGNATURE = "dataloader";

    public IRDataOperation(long cid, Value loader, List<? extends Value> outputs) {
        super(cid, "dataloader", SIGNATURE, List.of(loader), outputs, Map.of());
    }

    public Value loader() {
        return input(0);
    }

    @Override
    public boolean isForward() {
        return true;
    }
}
