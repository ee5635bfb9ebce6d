package io.surfworks.meshforge.ir.value;

import java.util.Objects;

/**
 * A managed value: a tracked entity identified by {@code (name, tid)}.
 *
 * <p>The {@code tid} is assigned upstream by the graph builder and is unique
 * within a graph, so two distinct managed values never share one even when
 * their base names collide. Equality is by {@code tid}.
 *
 * <p>A managed value flagged as an attribute is owned by a persistent module
 * (a parameter or a buffer) rather than by a transient computation.
 */
public sealed class IRObject implements Value permits IRTensor {

    private final String name;
    private final long tid;
    private final boolean attr;

    public IRObject(String name, long tid) {
        this(name, tid, false);
    }

    public IRObject(String name, long tid, boolean attr) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (tid < 0) {
            throw new IllegalArgumentException("tid must be non-negative, got " + tid);
        }
        this.tid = tid;
        this.attr = attr;
    }

    public String name() {
        return name;
    }

    public long tid() {
        return tid;
    }

    public boolean isAttr() {
        return attr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tid == ((IRObject) o).tid;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(tid);
    }

    @Override
    public String toString() {
        return "Object(" + name + ", tid=" + tid + (attr ? ", attr" : "") + ")";
    }
}
