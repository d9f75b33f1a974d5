package com.designlens.core.mapping;

import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticType;

import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered target-component selection table. The first matching rule names the component;
 * the last rule always matches.
 */
record TargetComponentRule(String description, Predicate<MappingSubject> matches, String target) {

    static final List<String> BUTTON_KEYWORDS = List.of("button", "btn", "add new");
    static final List<String> CARD_KEYWORDS = List.of("card", "method", "visa", "mastercard", "paypal", "cash");
    static final List<String> TEXT_KEYWORDS = List.of("text", "title", "total", "payment");

    static final List<TargetComponentRule> TABLE = List.of(
            new TargetComponentRule("button or action name",
                    s -> BUTTON_KEYWORDS.stream().anyMatch(s::nameContains)
                            || (s.nameContains("pay") && s.nameContains("confirm"))
                            || s.component().type() == SemanticType.BUTTON,
                    "Button"),
            new TargetComponentRule("payment method or card",
                    s -> CARD_KEYWORDS.stream().anyMatch(s::nameContains) || s.component().type() == SemanticType.CARD,
                    "Card"),
            new TargetComponentRule("text node or label name",
                    s -> s.kind() == NodeKind.TEXT || TEXT_KEYWORDS.stream().anyMatch(s::nameContains)
                            || s.component().type() == SemanticType.TEXT,
                    "Typography"),
            new TargetComponentRule("rectangle with image fill",
                    s -> s.kind() == NodeKind.RECTANGLE && s.descriptor() != null && s.descriptor().styling().hasImages(),
                    "Box"),
            new TargetComponentRule("frame or group", s -> s.kind().isContainer(), "Box"),
            new TargetComponentRule("anything else", s -> true, "Box")
    );

    static String select(MappingSubject subject) {
        for (TargetComponentRule rule : TABLE) {
            if (rule.matches.test(subject)) {
                return rule.target;
            }
        }
        throw new IllegalStateException("Target rule table has no catch-all");
    }
}
