package com.designlens.core.grouping;

import com.designlens.core.model.ComponentDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Descriptors still free to be claimed during auto-repair, in traversal order.
 * <p>
 * Owned by a single repair pass: it is handed to the repairer and handed back with the
 * result. A descriptor taken from the pool is never offered again. Not thread-safe.
 */
public final class DescriptorPool {

    private final List<ComponentDescriptor> available;

    private DescriptorPool(List<ComponentDescriptor> available) {
        this.available = available;
    }

    /** Pool of every descriptor whose id is not already claimed. */
    public static DescriptorPool of(List<ComponentDescriptor> descriptors, Set<String> claimedIds) {
        var free = new ArrayList<ComponentDescriptor>();
        for (ComponentDescriptor d : descriptors) {
            if (!claimedIds.contains(d.id())) {
                free.add(d);
            }
        }
        return new DescriptorPool(free);
    }

    /**
     * Removes and returns up to {@code limit} matching descriptors, in pool order.
     */
    public List<ComponentDescriptor> take(Predicate<ComponentDescriptor> filter, int limit) {
        var taken = new ArrayList<ComponentDescriptor>();
        var iterator = available.iterator();
        while (iterator.hasNext() && taken.size() < limit) {
            ComponentDescriptor candidate = iterator.next();
            if (filter.test(candidate)) {
                taken.add(candidate);
                iterator.remove();
            }
        }
        return taken;
    }

    public List<ComponentDescriptor> take(Predicate<ComponentDescriptor> filter) {
        return take(filter, Integer.MAX_VALUE);
    }

    public int size() {
        return available.size();
    }

    public boolean contains(String id) {
        return available.stream().anyMatch(d -> d.id().equals(id));
    }

    public List<ComponentDescriptor> remaining() {
        return List.copyOf(available);
    }
}
