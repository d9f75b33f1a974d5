package com.designlens.core.grouping;

import com.designlens.core.llm.LlmProperties;
import com.designlens.core.llm.LlmService;
import com.designlens.core.llm.ModelCallResult;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.LayoutStructure;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions descriptors into semantic groups with one reasoning-model call.
 * <p>
 * The model's answer is resolved against the run's descriptors: dangling or already claimed
 * child ids are dropped, empty groups are repaired or removed, and confidences are clamped to
 * [0.1, 1.0]. Any call outcome other than {@link ModelCallResult.Ok} yields the
 * {@link FallbackGrouper} result instead.
 */
@Service
public class SemanticGroupingService {

    private static final Logger log = LoggerFactory.getLogger(SemanticGroupingService.class);

    static final double DEFAULT_CONFIDENCE = 0.7;

    private static final String SYSTEM_PROMPT = """
            You are a UI structure analyst specializing in semantic component grouping.
            You receive a flattened design-tool node hierarchy and group related nodes into
            the logical UI components a developer would build.

            Focus on:
            - grouping related nodes (text + background = button)
            - identifying interactive patterns
            - recognizing collections of similar elements
            - understanding section hierarchy and nesting

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public SemanticGroupingService(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    public GroupingResult group(String designName, List<ComponentDescriptor> descriptors) {
        long start = System.currentTimeMillis();
        String prompt = GroupingPromptBuilder.build(designName, descriptors);
        ModelCallResult<GroupingResponse> outcome = llmService.structuredCall(
                SYSTEM_PROMPT, prompt, GroupingResponse.class, llmProperties.groupingSettings());

        if (outcome instanceof ModelCallResult.Ok<GroupingResponse> ok) {
            GroupingResponse response = ok.value();
            if (response.groups() == null) {
                log.warn("Grouping response has no groups array, using heuristic fallback");
                return FallbackGrouper.group(descriptors, elapsed(start));
            }
            return resolve(response, descriptors, elapsed(start));
        } else if (outcome instanceof ModelCallResult.ParseError<GroupingResponse>
                || outcome instanceof ModelCallResult.TransportError<GroupingResponse>
                || outcome instanceof ModelCallResult.Timeout<GroupingResponse>) {
            log.warn("Semantic grouping failed ({}), using heuristic fallback", outcome.describe());
            return FallbackGrouper.group(descriptors, elapsed(start));
        }
        throw new IllegalStateException("Unhandled model call result " + outcome);
    }

    /**
     * Turns a structurally valid model response into a {@link GroupingResult}.
     */
    static GroupingResult resolve(GroupingResponse response, List<ComponentDescriptor> descriptors,
                                  long processingTimeMs) {
        Map<String, ComponentDescriptor> byId = new LinkedHashMap<>();
        descriptors.forEach(d -> byId.putIfAbsent(d.id(), d));

        Set<String> claimed = new HashSet<>();
        Set<String> groupIds = new HashSet<>();
        var groups = new ArrayList<SemanticGroup>();
        int index = 0;
        for (GroupingResponse.Group raw : response.groups()) {
            index++;
            if (raw == null) continue;
            var children = new ArrayList<String>();
            for (String childId : raw.children() == null ? List.<String>of() : raw.children()) {
                if (childId == null || !byId.containsKey(childId)) {
                    log.debug("Dropping unresolved child id {} from group {}", childId, raw.id());
                } else if (!claimed.add(childId)) {
                    log.debug("Dropping child id {} already claimed by another group", childId);
                } else {
                    children.add(childId);
                }
            }
            groups.add(new SemanticGroup(
                    uniqueId(raw.id(), index, groupIds),
                    raw.name() == null || raw.name().isBlank() ? "Unnamed Group" : raw.name(),
                    SemanticType.fromValue(raw.type()),
                    raw.description() == null ? "" : raw.description(),
                    bounds(raw.bounds()),
                    children,
                    raw.properties(),
                    clamp(raw.confidence())));
        }

        GroupRepairer.Outcome repaired = GroupRepairer.repair(groups, DescriptorPool.of(descriptors, claimed));

        Set<String> grouped = new HashSet<>();
        repaired.groups().forEach(g -> grouped.addAll(g.children()));
        List<ComponentDescriptor> ungrouped = descriptors.stream().filter(d -> !grouped.contains(d.id())).toList();

        log.info("Grouped {} of {} descriptors into {} groups", descriptors.size() - ungrouped.size(),
                descriptors.size(), repaired.groups().size());
        return new GroupingResult(layout(response.layoutStructure()), repaired.groups(), descriptors.size(),
                descriptors.size() - ungrouped.size(), ungrouped, clamp(response.confidence()), processingTimeMs, false);
    }

    static double clamp(Double confidence) {
        double value = confidence == null || confidence.isNaN() || confidence == 0 ? DEFAULT_CONFIDENCE : confidence;
        return Math.max(0.1, Math.min(1.0, value));
    }

    private static String uniqueId(String id, int index, Set<String> used) {
        String candidate = id == null || id.isBlank() ? "group-" + index : id;
        if (!used.add(candidate)) {
            candidate = candidate + "-" + index;
            used.add(candidate);
        }
        return candidate;
    }

    private static Bounds bounds(GroupingResponse.Box box) {
        if (box == null || !box.isComplete()) {
            return Bounds.DEFAULT;
        }
        return new Bounds(box.x(), box.y(), box.width(), box.height());
    }

    private static LayoutStructure layout(GroupingResponse.Layout raw) {
        if (raw == null) {
            return null;
        }
        return new LayoutStructure(
                raw.screenType() == null || raw.screenType().isBlank() ? "general" : raw.screenType(),
                raw.mainSections() == null ? List.of() : raw.mainSections().stream().filter(s -> s != null).toList(),
                raw.userFlow() == null || raw.userFlow().isBlank() ? "User interacts with interface" : raw.userFlow());
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
