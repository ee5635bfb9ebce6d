package io.surfworks.meshforge.codegen.rule;

import io.surfworks.meshforge.ir.cell.IRFwOperation;

import java.util.List;
import java.util.Map;

/**
 * Renders the right-hand side of a forward operation.
 */
@FunctionalInterface
public interface EmitRule {

    /**
     * @param node         the forward operation
     * @param inputs       resolved input texts, one per input
     * @param kwargs       keyword argument name to resolved literal text
     * @param runtimeDevId device id executing the generated code
     * @param planNDevs    number of devices in the scale unit
     * @param runtimeNDevs number of devices at runtime, a multiple of {@code planNDevs}
     * @return a single call expression
     */
    String emit(IRFwOperation node, List<String> inputs, Map<String, String> kwargs,
                int runtimeDevId, int planNDevs, int runtimeNDevs);
}
