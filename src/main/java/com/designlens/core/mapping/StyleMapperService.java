package com.designlens.core.mapping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.DesignTokenSet;
import com.designlens.core.model.MappedComponent;
import com.designlens.core.model.StyleMapping;
import com.designlens.core.model.StyleMapping.MappedDesignSystem;
import com.designlens.core.model.ValidatedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic mapping of validated components onto the target UI-library vocabulary.
 * <p>
 * Pure: no model calls and no state between invocations, so mapping the same input twice
 * yields equal output. Produces exactly one {@link MappedComponent} per validated component.
 */
@Service
public class StyleMapperService {

    private static final Logger log = LoggerFactory.getLogger(StyleMapperService.class);

    public StyleMapping map(List<ValidatedComponent> components, List<ComponentDescriptor> descriptors,
                            DesignTokenSet tokens, Map<String, String> assetUrls,
                            Map<String, String> contentOverrides) {
        List<MappedComponent> mapped = mapComponents(components, descriptors, assetUrls, contentOverrides);
        MappedDesignSystem designSystem = buildDesignSystem(tokens);
        if (log.isDebugEnabled()) {
            var byTarget = new TreeMap<String, Integer>();
            mapped.forEach(m -> byTarget.merge(m.targetComponent(), 1, Integer::sum));
            log.debug("Mapped components by target: {}", byTarget);
        }
        log.info("Mapped {} components", mapped.size());
        return new StyleMapping(mapped, designSystem);
    }

    public List<MappedComponent> mapComponents(List<ValidatedComponent> components,
                                               List<ComponentDescriptor> descriptors,
                                               Map<String, String> assetUrls,
                                               Map<String, String> contentOverrides) {
        Map<String, ComponentDescriptor> byId = new LinkedHashMap<>();
        descriptors.forEach(d -> byId.putIfAbsent(d.id(), d));
        Map<String, String> assets = assetUrls == null ? Map.of() : assetUrls;
        Map<String, String> overrides = contentOverrides == null ? Map.of() : contentOverrides;

        var mapped = new ArrayList<MappedComponent>(components.size());
        for (ValidatedComponent component : components) {
            ComponentDescriptor descriptor = component.sourceNodeId() == null ? null : byId.get(component.sourceNodeId());
            mapped.add(mapOne(new MappingSubject(component, descriptor), assets, overrides));
        }
        return mapped;
    }

    private MappedComponent mapOne(MappingSubject subject, Map<String, String> assets, Map<String, String> overrides) {
        ValidatedComponent component = subject.component();
        String target = TargetComponentRule.select(subject);
        Map<String, Object> props = ComponentProps.build(subject, target);
        Map<String, Object> styleAttributes = StyleAttributes.build(component.bounds(),
                subject.descriptor() == null ? null : subject.descriptor().styling());
        String content = ContentResolver.resolve(subject, overrides);
        String imageUrl = component.sourceNodeId() != null && assets.containsKey(component.sourceNodeId())
                ? assets.get(component.sourceNodeId())
                : assets.get(component.id());
        return new MappedComponent(component.id(), component.name(), target, props, styleAttributes, content, imageUrl);
    }

    /**
     * Names the token colors (orange family as primary/accent, white, black, otherwise
     * {@code color<index>}), keys typography by family+weight+size and passes spacing through.
     */
    public MappedDesignSystem buildDesignSystem(DesignTokenSet tokens) {
        Map<String, String> colors = new LinkedHashMap<>();
        int index = 0;
        for (String color : tokens.colors()) {
            String lower = color.toLowerCase(Locale.ROOT);
            if (lower.contains("ff7f00") || lower.contains("ff8c00")) {
                colors.put("primary", color);
                colors.put("accent", color);
            } else if (lower.contains("ffffff")) {
                colors.put("white", color);
            } else if (lower.contains("000000")) {
                colors.put("black", color);
            } else {
                colors.put("color" + index, color);
            }
            index++;
        }

        Map<String, Map<String, String>> typography = new LinkedHashMap<>();
        for (String style : tokens.textStyles()) {
            int sizeAt = style.lastIndexOf('-');
            int weightAt = sizeAt > 0 ? style.lastIndexOf('-', sizeAt - 1) : -1;
            if (weightAt <= 0) {
                continue;
            }
            String family = style.substring(0, weightAt);
            String weight = style.substring(weightAt + 1, sizeAt);
            String size = style.substring(sizeAt + 1);
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("fontFamily", family);
            entry.put("fontWeight", weight);
            entry.put("fontSize", size + "px");
            typography.put((family + weight + size).replaceAll("\\s", ""), entry);
        }

        return new MappedDesignSystem(colors, typography, new ArrayList<>(tokens.spacingValues()));
    }
}
