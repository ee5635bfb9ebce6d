package io.surfworks.meshforge.codegen;

import io.surfworks.meshforge.ir.adapter.PrimitiveCall;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether the collectives of a primitive sequence may run asynchronously
 * on an overlapped communication stream.
 *
 * <p>Two conditions must hold:
 * <ol>
 *   <li>every non-collective primitive comes before every collective one;</li>
 *   <li>all collectives run on the same device group, hence on the same stream.</li>
 * </ol>
 */
public final class AsyncOverlap {

    private AsyncOverlap() {} // Utility class

    public static boolean isLegal(List<? extends PrimitiveCall> prims) {
        return nonCollectivesFirst(prims) && sameDeviceGroup(prims);
    }

    /**
     * The highest index of a non-collective equals the number of non-collectives
     * minus one, i.e. they form a contiguous prefix.
     */
    static boolean nonCollectivesFirst(List<? extends PrimitiveCall> prims) {
        int count = 0;
        int maxIndex = -1;
        for (int i = 0; i < prims.size(); i++) {
            if (!prims.get(i).isCollective()) {
                count++;
                maxIndex = i;
            }
        }
        return maxIndex == count - 1;
    }

    static boolean sameDeviceGroup(List<? extends PrimitiveCall> prims) {
        Set<Integer> group = null;
        for (PrimitiveCall prim : prims) {
            if (!prim.isCollective()) {
                continue;
            }
            Set<Integer> devices = new HashSet<>(prim.device());
            if (group == null) {
                group = devices;
            } else if (!group.equals(devices)) {
                return false;
            }
        }
        return true;
    }
}
