package com.designlens.core.validation;

import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.LayoutStructure;
import com.designlens.core.model.SemanticGroup;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Restates the semantic groups for the vision model and lists what it should confirm.
 */
public final class VisionPromptBuilder {

    private VisionPromptBuilder() {}

    public static String build(String designName, GroupingResult grouping) {
        var sb = new StringBuilder();
        sb.append("You are validating a design that has already been grouped into semantic components.\n\n")
                .append("## Grouping results\n")
                .append("- Design: ").append(designName).append('\n')
                .append("- Semantic groups: ").append(grouping.groups().size()).append('\n')
                .append("- Structural confidence: ").append(Math.round(grouping.confidence() * 100)).append("%\n")
                .append("- Nodes processed: ").append(grouping.totalNodes()).append('\n');
        LayoutStructure layout = grouping.layoutStructure();
        if (layout != null) {
            sb.append("- Screen type: ").append(layout.screenType()).append('\n')
                    .append("- Main sections: ").append(String.join(", ", layout.mainSections())).append('\n')
                    .append("- User flow: ").append(layout.userFlow()).append('\n');
        }
        sb.append("\n## Groups\n")
                .append(grouping.groups().stream().map(VisionPromptBuilder::describe).collect(Collectors.joining("\n")))
                .append("\n\n## Task\n")
                .append("1. Look at the image and confirm or adjust the type of each group. Keep the group id as the component id.\n")
                .append("2. Add visual properties the structure missed: colors, styles, states (selected, hover, disabled).\n")
                .append("3. Map each component to a Material-UI component in targetMapping (componentName and props).\n")
                .append("4. Report interactive elements the grouping missed.\n")
                .append("5. Summarize the design system: primary, secondary, background and text colors, font family, ")
                .append("size and weight scales, spacing scale and border radii.\n")
                .append("Keep component bounds consistent with the group bounds above. ")
                .append("Focus on validation and enhancement, not re-identification.\n");
        return sb.toString();
    }

    static String describe(SemanticGroup group) {
        return "- id=" + group.id() + " " + group.type().value().toUpperCase(Locale.ROOT) + " \"" + group.name() + "\" ("
                + fmt(group.bounds().width()) + "x" + fmt(group.bounds().height()) + ") at ("
                + fmt(group.bounds().x()) + ", " + fmt(group.bounds().y()) + ") - " + group.description()
                + " [" + group.children().size() + " nodes]";
    }

    private static String fmt(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
