package io.surfworks.meshforge.ir.adapter;

import io.surfworks.meshforge.ir.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collective communication primitive. Synchronizes every device in {@link #device()}.
 */
public final class CommPrim extends AdapterPrim {

    /**
     * Collective kinds and the runtime functions that implement them.
     */
    public enum Kind {
        /** Reduce across the group, every rank receives the result */
        ALL_REDUCE("all_reduce"),

        /** Concatenate shards from every rank on every rank */
        ALL_GATHER("all_gather"),

        /** Reduce then scatter shards */
        REDUCE_SCATTER("reduce_scatter"),

        /** Exchange shards between every pair of ranks */
        ALL_TO_ALL("all_to_all"),

        /** Copy from the root rank to every rank */
        BROADCAST("broadcast");

        private final String function;

        Kind(String function) {
            this.function = function;
        }

        public String signature() {
            return RUNTIME_MODULE + "." + function;
        }
    }

    private final Kind kind;

    public CommPrim(Kind kind, List<? extends Value> inputs, List<? extends Value> outputs,
                    Map<String, ? extends Value> kwargs, List<Integer> device) {
        super(inputs, outputs, kwargs, device);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        if (device.isEmpty()) {
            throw new IllegalArgumentException("A collective needs a device group");
        }
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
        return true;
    }
}
