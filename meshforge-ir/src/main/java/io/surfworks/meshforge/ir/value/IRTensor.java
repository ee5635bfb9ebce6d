package io.surfworks.meshforge.ir.value;

import java.util.List;
import java.util.Optional;

/**
 * A tensor-like managed value: shape, element type and an optional gradient.
 *
 * <p>The gradient link only points from a tensor to its gradient. The reverse
 * direction is rebuilt on demand by whoever needs it.
 */
public final class IRTensor extends IRObject {

    private final List<Integer> shape;
    private final ElementType dtype;
    private IRTensor grad;

    public IRTensor(String name, long tid, List<Integer> shape, ElementType dtype) {
        this(name, tid, shape, dtype, false);
    }

    public IRTensor(String name, long tid, List<Integer> shape, ElementType dtype, boolean attr) {
        super(name, tid, attr);
        this.shape = List.copyOf(shape);
        this.dtype = dtype;
        for (int dim : this.shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + this.shape);
            }
        }
    }

    /**
     * Create a scalar-shaped float32 tensor, mostly useful in tests and fixtures.
     */
    public static IRTensor of(String name, long tid) {
        return new IRTensor(name, tid, List.of(), ElementType.F32);
    }

    public List<Integer> shape() {
        return shape;
    }

    public ElementType dtype() {
        return dtype;
    }

    public Optional<IRTensor> grad() {
        return Optional.ofNullable(grad);
    }

    /**
     * Attach the gradient tensor. Called by the graph builder when the backward
     * graph is derived; emission only reads it.
     */
    public void setGrad(IRTensor grad) {
        if (grad == this) {
            throw new IllegalArgumentException("A tensor cannot be its own gradient");
        }
        this.grad = grad;
    }

    @Override
    public String toString() {
        return "Tensor(" + name() + ", tid=" + tid() + ", shape=" + shape
            + (dtype != null ? ", " + dtype.runtimeName() : "")
            + (isAttr() ? ", attr" : "") + ")";
    }
}
