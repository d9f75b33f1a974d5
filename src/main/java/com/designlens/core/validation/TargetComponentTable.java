package com.designlens.core.validation;

import com.designlens.core.model.SemanticType;
import com.designlens.core.model.TargetMapping;

import java.util.Map;

/**
 * Fixed semantic-type to target-component mapping used whenever the model supplies none.
 */
public final class TargetComponentTable {

    private static final TargetMapping BOX = new TargetMapping("Box", Map.of());

    private static final Map<SemanticType, TargetMapping> TABLE = Map.of(
            SemanticType.BUTTON, new TargetMapping("Button", Map.of("variant", "contained")),
            SemanticType.TEXT, new TargetMapping("Typography", Map.of("variant", "body1")),
            SemanticType.CARD, new TargetMapping("Card", Map.of()),
            SemanticType.NAVIGATION, new TargetMapping("AppBar", Map.of()),
            SemanticType.INPUT, new TargetMapping("TextField", Map.of()),
            SemanticType.LIST, new TargetMapping("List", Map.of()),
            SemanticType.IMAGE, new TargetMapping("Avatar", Map.of()),
            SemanticType.CONTAINER, BOX
    );

    private TargetComponentTable() {}

    public static TargetMapping forType(SemanticType type) {
        return TABLE.getOrDefault(type, BOX);
    }
}
