package io.surfworks.meshforge.codegen;

/**
 * Runtime parameters shared by every node of the unit being emitted.
 *
 * @param runtimeDevId device id executing the generated code
 * @param planNDevs    number of devices in the scale unit the plan was made for
 * @param runtimeNDevs number of devices at runtime, a multiple of {@code planNDevs}
 * @param prefixAttr   prefix for attribute names in this scope, or {@code null}
 * @param asyncComm    whether adapters should try asynchronous collectives
 */
public record EmitContext(
    int runtimeDevId,
    int planNDevs,
    int runtimeNDevs,
    String prefixAttr,
    boolean asyncComm
) {
    public EmitContext {
        if (planNDevs <= 0) {
            throw new IllegalArgumentException("planNDevs must be positive, got " + planNDevs);
        }
        if (runtimeNDevs <= 0 || runtimeNDevs % planNDevs != 0) {
            throw new IllegalArgumentException(
                "runtimeNDevs must be a positive multiple of planNDevs (" + planNDevs + "), got " + runtimeNDevs);
        }
        if (runtimeDevId < 0 || runtimeDevId >= runtimeNDevs) {
            throw new IllegalArgumentException(
                "runtimeDevId must be in [0, " + runtimeNDevs + "), got " + runtimeDevId);
        }
    }

    /**
     * Plan and runtime at the same scale, no attribute prefix, synchronous collectives.
     */
    public static EmitContext of(int runtimeDevId, int ndevs) {
        return new EmitContext(runtimeDevId, ndevs, ndevs, null, false);
    }

    public EmitContext withPrefixAttr(String prefix) {
        return new EmitContext(runtimeDevId, planNDevs, runtimeNDevs, prefix, asyncComm);
    }

    public EmitContext withAsyncComm(boolean async) {
        return new EmitContext(runtimeDevId, planNDevs, runtimeNDevs, prefixAttr, async);
    }
}
