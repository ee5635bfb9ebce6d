package io.surfworks.meshforge.codegen.rule;

import io.surfworks.meshforge.ir.cell.IRFwOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain call of the operation signature: {@code signature(in0, in1, k0=v0)}.
 *
 * <p>This is the shape of most operator calls. It is registered explicitly per
 * signature; the registry never falls back to it.
 */
public final class CommonEmitRule implements EmitRule {

    public static final CommonEmitRule INSTANCE = new CommonEmitRule();

    private CommonEmitRule() {}

    @Override
    public String emit(IRFwOperation node, List<String> inputs, Map<String, String> kwargs,
                       int runtimeDevId, int planNDevs, int runtimeNDevs) {
        List<String> args = new ArrayList<>(inputs);
        kwargs.forEach((name, value) -> args.add(name + "=" + value));
        return node.signature() + "(" + String.join(", ", args) + ")";
    }
}
