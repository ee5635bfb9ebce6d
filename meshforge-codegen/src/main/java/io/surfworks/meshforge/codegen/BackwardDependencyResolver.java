package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.ir.cell.IRCell;
import io.surfworks.meshforge.ir.value.IRTensor;
import io.surfworks.meshforge.ir.value.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Recovers which forward tensors a backward node reads and writes gradients for.
 *
 * <p>The backward node only lists gradients. Its mirror, the forward node, lists the
 * tensors, and each forward tensor points to its gradient. The gradient-to-tensor map
 * is rebuilt per call from those links.
 */
public final class BackwardDependencyResolver {

    private static final Logger LOG = Logger.getLogger(BackwardDependencyResolver.class.getName());

    private BackwardDependencyResolver() {} // Utility class

    /**
     * Resolve the call site of a backward node.
     *
     * <p>Gradients without a matching forward tensor are left out of the tensor lists
     * but kept in the gradient lists.
     *
     * @param bwop backward node
     * @return the four dependency lists
     * @throws IllegalArgumentException if {@code bwop} is a forward node
     * @throws EmissionException with {@code MISSING_MIRROR} if it has no forward counterpart
     */
    public static BackwardCallsite resolve(IRCell bwop) {
        if (bwop.isForward()) {
            throw new IllegalArgumentException("Expected a backward node, got forward: " + bwop);
        }
        IRCell fwop = bwop.mirror().orElseThrow(() -> new EmissionException(
            "Backward node has no forward mirror: " + bwop,
            EmissionException.ErrorCode.MISSING_MIRROR));

        Map<IRTensor, IRTensor> grad2tensor = new HashMap<>();
        addGradients(fwop.inputs(), grad2tensor);
        addGradients(fwop.outputs(), grad2tensor);

        List<IRTensor> inputGrads = tensors(bwop.outputs());
        List<IRTensor> outputGrads = tensors(bwop.inputs());
        List<IRTensor> inputTensors = lookup(inputGrads, grad2tensor, bwop);
        List<IRTensor> outputTensors = lookup(outputGrads, grad2tensor, bwop);

        return new BackwardCallsite(inputTensors, outputTensors, outputGrads, inputGrads);
    }

    private static void addGradients(List<Value> values, Map<IRTensor, IRTensor> grad2tensor) {
        for (Value v : values) {
            if (v instanceof IRTensor tensor) {
                tensor.grad().ifPresent(grad -> grad2tensor.put(grad, tensor));
            }
        }
    }

    private static List<IRTensor> tensors(List<Value> values) {
        List<IRTensor> tensors = new ArrayList<>();
        for (Value v : values) {
            if (v instanceof IRTensor tensor) {
                tensors.add(tensor);
            }
        }
        return tensors;
    }

    private static List<IRTensor> lookup(List<IRTensor> grads, Map<IRTensor, IRTensor> grad2tensor, IRCell bwop) {
        List<IRTensor> found = new ArrayList<>(grads.size());
        for (IRTensor grad : grads) {
            IRTensor tensor = grad2tensor.get(grad);
            if (tensor != null) {
                found.add(tensor);
            } else {
                LOG.fine(() -> "No forward tensor for gradient " + grad + " of " + bwop);
            }
        }
        return found;
    }
}
