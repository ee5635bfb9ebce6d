package io.surfworks.meshforge.ir.cell;

import io.surfworks.meshforge.ir.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A vertex of a partitioned IR graph.
 *
 * <p>The set of node kinds is closed: {@link IRFwOperation}, {@link IRBpOperation},
 * {@link IRDataOperation}, {@link IRAdapter} and {@link IRWeightReducer}.
 *
 * <p>Inputs and outputs are ordered lists of container trees. Everything except
 * placement, comment and mirror is fixed at construction; those three are filled
 * in by the graph builder and partitioner and only read by emission.
 */
public abstract sealed class IRCell
        permits IRFwOperation, IRBpOperation, IRDataOperation, IRAdapter, IRWeightReducer {

    private final long cid;
    private final String name;
    private final String signature;
    private final List<Value> inputs;
    private final List<Value> outputs;
    private final Map<String, Value> kwargs;

    private String comment;
    private List<Integer> device = List.of();
    private IRCell mirror;

    IRCell(long cid, String name, String signature,
           List<? extends Value> inputs, List<? extends Value> outputs,
           Map<String, ? extends Value> kwargs) {
        this.cid = cid;
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.signature = Objects.requireNonNull(signature, "signature cannot be null");
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs cannot be null"));
        this.outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs cannot be null"));
        this.kwargs = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(kwargs, "kwargs cannot be null")));
    }

    /**
     * Per-graph counter-derived identity.
     */
    public long cid() {
        return cid;
    }

    public String name() {
        return name;
    }

    /**
     * Operation signature, the key for emission rule dispatch.
     */
    public String signature() {
        return signature;
    }

    public List<Value> inputs() {
        return inputs;
    }

    public Value input(int index) {
        return inputs.get(index);
    }

    public List<Value> outputs() {
        return outputs;
    }

    public Value output(int index) {
        return outputs.get(index);
    }

    public Map<String, Value> kwargs() {
        return kwargs;
    }

    public Optional<String> comment() {
        return Optional.ofNullable(comment);
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * Devices this node is placed on. Empty until the partitioner assigns them.
     */
    public List<Integer> device() {
        return device;
    }

    public void setDevice(List<Integer> device) {
        this.device = List.copyOf(Objects.requireNonNull(device, "device cannot be null"));
    }

    /**
     * Whether this node belongs to the forward pass.
     */
    public abstract boolean isForward();

    /**
     * The node this one was derived from (forward to backward or back).
     */
    public Optional<IRCell> mirror() {
        return Optional.ofNullable(mirror);
    }

    public void setMirror(IRCell mirror) {
        if (mirror == this) {
            throw new IllegalArgumentException("A node cannot mirror itself");
        }
        this.mirror = mirror;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + cid + ", " + signature
            + ", inputs=" + inputs + ", outputs=" + outputs + ", device=" + device + ")";
    }
}
