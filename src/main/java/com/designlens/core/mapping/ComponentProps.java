package com.designlens.core.mapping;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes target-component props from the component name, type and state.
 */
final class ComponentProps {

    static final double LARGE_BUTTON_HEIGHT = 60.0;

    private static final List<String> SELECTED_NAME_KEYWORDS = List.of("selected", "active");

    private ComponentProps() {}

    static Map<String, Object> build(MappingSubject subject, String target) {
        Map<String, Object> props = new LinkedHashMap<>();
        Map<String, Object> modelProps = subject.component().targetMapping() == null
                ? Map.of() : subject.component().targetMapping().props();
        if (subject.component().targetMapping() != null
                && target.equals(subject.component().targetMapping().componentName())) {
            props.putAll(modelProps);
        }

        switch (target) {
            case "Button" -> button(subject, props);
            case "Card" -> card(props);
            case "Typography" -> typography(subject, props);
            default -> { }
        }

        if (isSelected(subject)) {
            Map<String, Object> sx = sx(props);
            sx.put("borderColor", "primary.main");
            sx.put("borderWidth", 2);
            sx.put("borderStyle", "solid");
            props.put("sx", sx);
        }
        return props;
    }

    private static void button(MappingSubject subject, Map<String, Object> props) {
        boolean primary = subject.nameContains("primary") || subject.nameContains("pay");
        props.put("variant", primary ? "contained" : "outlined");
        props.put("size", subject.height() > LARGE_BUTTON_HEIGHT ? "large" : "medium");
        if (subject.nameContains("pay") || subject.nameContains("confirm")) {
            props.put("variant", "contained");
            props.put("color", "primary");
            props.put("fullWidth", true);
        }
    }

    private static void card(Map<String, Object> props) {
        props.put("variant", "outlined");
        Map<String, Object> sx = sx(props);
        sx.put("cursor", "pointer");
        sx.put("&:hover", Map.of("borderColor", "primary.main"));
        props.put("sx", sx);
    }

    private static void typography(MappingSubject subject, Map<String, Object> props) {
        if (subject.nameContains("total") || subject.nameContains("amount") || subject.nameContains("$")) {
            props.put("variant", "h4");
            props.put("fontWeight", "bold");
        } else if (subject.nameContains("payment") && !subject.nameContains("method")) {
            props.put("variant", "h5");
        } else {
            props.put("variant", "body1");
        }
    }

    static boolean isSelected(MappingSubject subject) {
        Map<String, Object> properties = subject.component().properties();
        if (Boolean.TRUE.equals(properties.get("selected"))) {
            return true;
        }
        if ("selected".equals(properties.get("state"))) {
            return true;
        }
        return SELECTED_NAME_KEYWORDS.stream().anyMatch(subject::nameContains);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sx(Map<String, Object> props) {
        Object existing = props.get("sx");
        Map<String, Object> sx = new LinkedHashMap<>();
        if (existing instanceof Map<?, ?> map) {
            sx.putAll((Map<String, Object>) map);
        }
        return sx;
    }
}
