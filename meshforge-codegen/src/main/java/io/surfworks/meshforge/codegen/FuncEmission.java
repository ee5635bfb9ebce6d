package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.codegen.config.EmitterConfig;
import io.surfworks.meshforge.codegen.rule.EmitRule;
import io.surfworks.meshforge.codegen.rule.EmitRuleRegistry;
import io.surfworks.meshforge.ir.adapter.PrimitiveCall;
import io.surfworks.meshforge.ir.cell.IRAdapter;
import io.surfworks.meshforge.ir.cell.IRBpOperation;
import io.surfworks.meshforge.ir.cell.IRCell;
import io.surfworks.meshforge.ir.cell.IRDataOperation;
import io.surfworks.meshforge.ir.cell.IRFwOperation;
import io.surfworks.meshforge.ir.cell.IRWeightReducer;
import io.surfworks.meshforge.ir.value.IRObject;
import io.surfworks.meshforge.ir.value.Value;
import io.surfworks.meshforge.ir.value.ValueTrees;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Emits the statements of forward, data-loading, adapter and reducer nodes.
 *
 * <p>Each method returns the lines of one node, in order, without the enclosing
 * method signature or return statement. For example a forward node renders as
 * <pre>
 * # comment, if any
 * linear_out_7 = torch.nn.functional.linear(x_3, self.weight_4, bias=None)
 * </pre>
 *
 * <p>Emission never modifies the graph and keeps no state between calls; an instance
 * can be shared between threads once its rule registry is populated.
 */
public class FuncEmission extends CodeEmission {

    private static final Logger LOG = Logger.getLogger(FuncEmission.class.getName());

    private static final String ASYNC_KWARG = "async_op";

    private final EmitRuleRegistry rules;

    public FuncEmission(EmitRuleRegistry rules, EmitterConfig config) {
        super(config);
        this.rules = Objects.requireNonNull(rules, "rules cannot be null");
    }

    public FuncEmission(EmitRuleRegistry rules) {
        this(rules, EmitterConfig.defaults());
    }

    public EmitRuleRegistry rules() {
        return rules;
    }

    // ==================== Dispatch ====================

    /**
     * Emit any node that produces statements on its own.
     *
     * <p>Backward nodes are not emitted here: the assembler calls the runtime backward
     * with the dependencies from {@link #getBackwardCallsiteIoTensors(IRCell)}.
     */
    public List<String> emit(IRCell node, EmitContext ctx) {
        if (node instanceof IRFwOperation fw) {
            return emitFnode(fw, ctx.runtimeDevId(), ctx.planNDevs(), ctx.runtimeNDevs(), ctx.prefixAttr());
        }
        if (node instanceof IRDataOperation data) {
            return emitDataloader(data);
        }
        if (node instanceof IRAdapter adapter) {
            return emitAdapter(adapter, ctx.prefixAttr(), ctx.asyncComm());
        }
        if (node instanceof IRWeightReducer reducer) {
            return emitReducer(reducer);
        }
        if (node instanceof IRBpOperation) {
            throw new IllegalArgumentException(
                "Backward node " + nodeName(node) + " is emitted through its backward call site");
        }
        throw new IllegalArgumentException("Unknown node kind: " + node.getClass().getName());
    }

    // ==================== Data loading ====================

    /**
     * {@code outputs = next(loader)}.
     */
    public List<String> emitDataloader(IRDataOperation node) {
        String outputs = returnName(node.outputs());
        return List.of(outputs + " = next(" + tensorName(node.loader()) + ")");
    }

    // ==================== Forward operations ====================

    /**
     * Emit a forward node.
     *
     * @param node         the forward node to emit
     * @param runtimeDevId the device id at runtime
     * @param planNDevs    the number of devices in the scale unit
     * @param runtimeNDevs the number of devices at runtime, a multiple of {@code planNDevs}
     * @param prefixAttr   prefix for attribute input names, or {@code null}
     * @return the lines of the node
     * @throws EmissionException with {@code MISSING_RULE} if the signature has no rule
     */
    public List<String> emitFnode(IRFwOperation node, int runtimeDevId, int planNDevs, int runtimeNDevs,
                                  String prefixAttr) {
        EmitRule rule = rules.lookup(node.signature());

        List<String> codes = new ArrayList<>();
        node.comment().ifPresent(comment -> codes.add("# " + comment));
        if (config.lineTimer()) {
            codes.add(timerProbe(node.comment().filter(c -> !c.isEmpty()).orElse(node.signature())));
        }

        List<String> inputs = new ArrayList<>(node.inputs().size());
        for (Value input : node.inputs()) {
            inputs.add(tensorName(input, prefixAttr));
        }
        Map<String, String> kwargs = kwargsDict(node.kwargs());

        String body = rule.emit(node, inputs, kwargs, runtimeDevId, planNDevs, runtimeNDevs);

        if (node.outputs().isEmpty()) {
            codes.add(body);
        } else if (allOutputsManaged(node.outputs())) {
            codes.add(returnName(node.outputs()) + " = " + body);
        } else {
            emitNestedOutputs(node, body, codes);
        }

        LOG.fine(() -> "Emitted " + nodeName(node) + ": " + codes.size() + " line(s)");
        return codes;
    }

    /**
     * Bind non-managed top-level slots to intermediates, extract the managed values
     * nested in them, then release the intermediates, which no lifecycle tracks.
     */
    private void emitNestedOutputs(IRFwOperation node, String body, List<String> codes) {
        List<String> outputs = new ArrayList<>();
        List<String> intermediates = new ArrayList<>();
        for (int i = 0; i < node.outputs().size(); i++) {
            Value output = node.output(i);
            if (output instanceof IRObject) {
                outputs.add(tensorName(output));
            } else {
                String im = intermediateName(node, i);
                intermediates.add(im);
                outputs.add(im);
            }
        }
        codes.add(String.join(", ", outputs) + " = " + body);

        for (ValueTrees.ObjectPath path : ValueTrees.objectPaths(node.outputs())) {
            if (path.depth() == 1) {
                continue;
            }
            StringBuilder out = new StringBuilder(outputs.get(path.rootIndex()));
            for (Value step : path.innerSteps()) {
                out.append('[').append(tensorName(step)).append(']');
            }
            codes.add(tensorName(path.object()) + " = " + out);
        }

        for (String im : intermediates) {
            codes.add("del " + im);
        }
    }

    /**
     * {@code {prefix}_c{cid}_s{slot}}. Managed names always end in {@code _<tid digits>},
     * so the {@code s} marker keeps the two namespaces apart.
     */
    private String intermediateName(IRCell node, int slot) {
        return config.intermediatePrefix() + "_c" + node.cid() + "_s" + slot;
    }

    private static boolean allOutputsManaged(List<Value> outputs) {
        for (Value output : outputs) {
            if (!(output instanceof IRObject)) {
                return false;
            }
        }
        return true;
    }

    // ==================== Adapters ====================

    /**
     * Emit the calls of an adapter.
     *
     * @param node       adapter already dispatched to one device
     * @param prefixAttr prefix for attribute input names, or {@code null}
     * @param asyncOp    request asynchronous collectives; honored only when
     *                   {@link AsyncOverlap#isLegal(List)} allows it
     * @return one line per primitive, plus timer probes if enabled
     * @throws EmissionException with {@code PLACEMENT_PRECONDITION} if the adapter is not on
     *         exactly one device
     */
    public List<String> emitAdapter(IRAdapter node, String prefixAttr, boolean asyncOp) {
        if (node.device().size() != 1) {
            throw new EmissionException(
                "Expected adapter to be dispatched to one device, got " + node.device() + ": " + node,
                EmissionException.ErrorCode.PLACEMENT_PRECONDITION);
        }
        List<PrimitiveCall> prims = node.isDifferentiable() && node.isCustom()
            ? List.of(node)
            : List.copyOf(node.prims());

        boolean async = asyncOp;
        if (async && !AsyncOverlap.isLegal(prims)) {
            LOG.fine(() -> "Async collectives not legal for " + nodeName(node) + ", emitting synchronously");
            async = false;
        }

        List<String> codes = new ArrayList<>();
        for (PrimitiveCall prim : prims) {
            String inputs = prim.inputs().size() == 1
                ? tensorName(prim.inputs().get(0), prefixAttr)
                : tupleName(prim.inputs(), false, prefixAttr);
            Map<String, Value> primKwargs = new LinkedHashMap<>(prim.kwargs());
            if (async && prim.isCollective()) {
                primKwargs.put(ASYNC_KWARG, Value.of(true));
            }
            String kwargs = kwargsName(primKwargs);
            String outputs = returnName(prim.outputs());
            if (config.lineTimer()) {
                codes.add(timerProbe(prim.signature()));
            }
            codes.add(outputs + " = " + prim.signature() + "(" + inputs + ", " + kwargs + ")");
        }
        return codes;
    }

    public List<String> emitAdapter(IRAdapter node) {
        return emitAdapter(node, null, false);
    }

    // ==================== Reducers ====================

    /**
     * Trigger gradient synchronization of a reducer: {@code self.wreducer3.sync_grads()}.
     */
    public List<String> emitReducer(IRWeightReducer node) {
        String reducerName = config.reducerPrefix() + node.reducerId();
        List<String> codes = new ArrayList<>(2);
        if (config.lineTimer()) {
            codes.add(timerProbe(reducerName));
        }
        codes.add(reducerName + ".sync_grads()");
        return codes;
    }

    // ==================== Releases ====================

    /**
     * {@code del a, b} for values whose lifetime the runtime does not track.
     *
     * @throws IllegalArgumentException if there is nothing to release
     */
    public String emitRelease(Collection<? extends IRObject> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Nothing to release");
        }
        List<String> names = new ArrayList<>(values.size());
        for (IRObject value : values) {
            names.add(tensorName(value));
        }
        return "del " + String.join(", ", names);
    }

    // ==================== Backward ====================

    /**
     * Dependencies of a backward node's call site.
     *
     * @see BackwardDependencyResolver#resolve(IRCell)
     */
    public BackwardCallsite getBackwardCallsiteIoTensors(IRCell bwop) {
        return BackwardDependencyResolver.resolve(bwop);
    }

    // ==================== Internal Helpers ====================

    private String timerProbe(String label) {
        return config.timerFunction() + "(" + LiteralRenderer.literal(Value.of(label)) + ")";
    }
}
