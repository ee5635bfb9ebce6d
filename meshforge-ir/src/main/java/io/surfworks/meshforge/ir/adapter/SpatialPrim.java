package io.surfworks.meshforge.ir.adapter;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Non-collective data-movement primitive: runs on local data, or moves it
 * point to point without synchronizing a group.
 */
public final class SpatialPrim extends AdapterPrim {

    public enum Kind {
        /** Pass the input through unchanged */
        IDENTITY("identity"),

        /** Take a sub-tensor of the input */
        SELECT("select"),

        /** Concatenate or accumulate local pieces */
        MERGE("merge"),

        /** Send a tensor from one device to another */
        MOVE("move");

        private final String function;

        Kind(String function) {
            this.function = function;
        }

        public String signature() {
            return RUNTIME_MODULE + "." + function;
        }
    }

    private final Kind kind;

    public SpatialPrim(Kind kind, List<? extends Value> inputs, List<? extends Value> outputs,
                       Map<String, ? extends Value> kwargs, List<Integer> device) {
        super(inputs, outputs, kwargs, device);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String signature() {
        return kind.signature();
    }

    @Override
    public boolean isCollective() {
        return false;
    }
}
