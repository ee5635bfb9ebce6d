package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.ir.value.IRTensor;

import java.util.List;

/**
 * Data dependencies of a backward call.
 *
 * <pre>
 * (inputTensors, outputTensors, outputGrads, inputGrads)
 *  ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~  ~~~~~~~~~~
 *  inputs of the backward call                outputs of the backward call
 * </pre>
 *
 * @param inputTensors  forward inputs whose gradients the backward op produces
 * @param outputTensors forward outputs whose gradients the backward op consumes
 * @param outputGrads   gradients of the forward outputs (backward inputs)
 * @param inputGrads    gradients of the forward inputs (backward outputs)
 */
public record BackwardCallsite(
    List<IRTensor> inputTensors,
    List<IRTensor> outputTensors,
    List<IRTensor> outputGrads,
    List<IRTensor> inputGrads
) {
    public BackwardCallsite {
        inputTensors = List.copyOf(inputTensors);
        outputTensors = List.copyOf(outputTensors);
        outputGrads = List.copyOf(outputGrads);
        inputGrads = List.copyOf(inputGrads);
    }
}
