package io.surfworks.meshforge.ir.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Structural helpers over container trees of {@link Value}s.
 */
public final class ValueTrees {

    private ValueTrees() {} // Utility class

    /**
     * Location of a managed value inside a list of container trees.
     *
     * @param object the managed value
     * @param steps  container subscripts from the list root: {@link Value.IntValue} for
     *               list/tuple positions, the key itself for dict entries. The first step
     *               is always the index into the root list.
     */
    public record ObjectPath(IRObject object, List<Value> steps) {
        public ObjectPath {
            steps = List.copyOf(steps);
            if (steps.isEmpty()) {
                throw new IllegalArgumentException("A path has at least one step");
            }
        }

        public int depth() {
            return steps.size();
        }

        /**
         * Index into the root list.
         */
        public int rootIndex() {
            return (int) ((Value.IntValue) steps.get(0)).value();
        }

        /**
         * Steps below the root slot.
         */
        public List<Value> innerSteps() {
            return steps.subList(1, steps.size());
        }
    }

    /**
     * Collect the path of every managed value in {@code roots}, in traversal order.
     * A managed value reachable twice keeps its first position in the result and
     * its last path.
     */
    public static List<ObjectPath> objectPaths(List<? extends Value> roots) {
        Map<IRObject, ObjectPath> paths = new LinkedHashMap<>();
        for (int i = 0; i < roots.size(); i++) {
            List<Value> prefix = new ArrayList<>();
            prefix.add(Value.of(i));
            collectPaths(roots.get(i), prefix, paths);
        }
        return List.copyOf(paths.values());
    }

    /**
     * All managed values in a tree, depth first.
     */
    public static List<IRObject> objects(Value root) {
        List<IRObject> found = new ArrayList<>();
        collectObjects(root, found);
        return found;
    }

    /**
     * Rebuild {@code value} with every managed value replaced by {@code modifier(obj)}.
     * Containers are rebuilt with the same kind; other leaves are returned as they are.
     */
    public static Value mapObjects(Value value, Function<? super IRObject, ? extends Value> modifier) {
        if (value instanceof IRObject obj) {
            return modifier.apply(obj);
        }
        if (value instanceof Value.ListValue list) {
            return new Value.ListValue(mapAll(list.elements(), modifier));
        }
        if (value instanceof Value.TupleValue tuple) {
            return new Value.TupleValue(mapAll(tuple.elements(), modifier));
        }
        if (value instanceof Value.DictValue dict) {
            Map<Value, Value> mapped = new LinkedHashMap<>();
            dict.entries().forEach((k, v) -> mapped.put(mapObjects(k, modifier), mapObjects(v, modifier)));
            return new Value.DictValue(mapped);
        }
        if (value instanceof Value.SliceValue slice) {
            return new Value.SliceValue(
                mapNullable(slice.start(), modifier),
                mapNullable(slice.stop(), modifier),
                mapNullable(slice.step(), modifier));
        }
        return value;
    }

    // ==================== Internal Helpers ====================

    private static void collectPaths(Value value, List<Value> path, Map<IRObject, ObjectPath> paths) {
        if (value instanceof IRObject obj) {
            paths.put(obj, new ObjectPath(obj, path));
        } else if (value instanceof Value.SequenceValue seq) {
            List<Value> elements = seq.elements();
            for (int i = 0; i < elements.size(); i++) {
                collectPaths(elements.get(i), extend(path, Value.of(i)), paths);
            }
        } else if (value instanceof Value.DictValue dict) {
            dict.entries().forEach((k, v) -> collectPaths(v, extend(path, k), paths));
        }
        // literals, slices and devices hold no addressable objects
    }

    private static void collectObjects(Value value, List<IRObject> found) {
        if (value instanceof IRObject obj) {
            found.add(obj);
        } else if (value instanceof Value.SequenceValue seq) {
            seq.elements().forEach(v -> collectObjects(v, found));
        } else if (value instanceof Value.DictValue dict) {
            dict.entries().forEach((k, v) -> {
                collectObjects(k, found);
                collectObjects(v, found);
            });
        } else if (value instanceof Value.SliceValue slice) {
            for (Value bound : new Value[]{slice.start(), slice.stop(), slice.step()}) {
                if (bound != null) {
                    collectObjects(bound, found);
                }
            }
        }
    }

    private static List<Value> extend(List<Value> path, Value step) {
        List<Value> next = new ArrayList<>(path.size() + 1);
        next.addAll(path);
        next.add(step);
        return next;
    }

    private static List<Value> mapAll(List<Value> values, Function<? super IRObject, ? extends Value> modifier) {
        List<Value> mapped = new ArrayList<>(values.size());
        for (Value v : values) {
            mapped.add(mapObjects(v, modifier));
        }
        return mapped;
    }

    private static Value mapNullable(Value value, Function<? super IRObject, ? extends Value> modifier) {
        return value == null ? null : mapObjects(value, modifier);
    }
}
