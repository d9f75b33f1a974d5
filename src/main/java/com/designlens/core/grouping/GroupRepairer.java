package com.designlens.core.grouping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.SemanticGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-assigns descriptors to groups the model returned without resolvable children.
 * <p>
 * Groups are repaired in order, each claiming from the same pool, so no descriptor is
 * handed to two groups. Groups that already have children pass through untouched;
 * groups that are still empty afterwards are dropped.
 */
public final class GroupRepairer {

    private static final Logger log = LoggerFactory.getLogger(GroupRepairer.class);

    private GroupRepairer() {}

    public record Outcome(List<SemanticGroup> groups, DescriptorPool pool, int repaired, int dropped) {

        public Outcome {
            groups = List.copyOf(groups);
        }
    }

    public static Outcome repair(List<SemanticGroup> groups, DescriptorPool pool) {
        var result = new ArrayList<SemanticGroup>();
        int repaired = 0;
        int dropped = 0;
        for (SemanticGroup group : groups) {
            if (!group.children().isEmpty()) {
                result.add(group);
                continue;
            }
            RepairRule rule = RepairRule.forGroup(group);
            List<ComponentDescriptor> claimed = pool.take(d -> rule.claims().test(group, d), rule.limit());
            if (claimed.isEmpty()) {
                log.debug("Dropping group '{}': nothing left to claim", group.name());
                dropped++;
                continue;
            }
            log.debug("Mapped {} descriptors to '{}'", claimed.size(), group.name());
            result.add(group.withChildren(claimed.stream().map(ComponentDescriptor::id).toList()));
            repaired++;
        }
        if (repaired > 0 || dropped > 0) {
            log.info("Auto-repair: {} groups repaired, {} dropped, {} descriptors unclaimed",
                    repaired, dropped, pool.size());
        }
        return new Outcome(result, pool, repaired, dropped);
    }
}
