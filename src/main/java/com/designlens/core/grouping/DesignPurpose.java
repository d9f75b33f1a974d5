package com.designlens.core.grouping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.spatial.SpatialAnalyzer;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Screen purpose categories, matched against the lower-cased text content of a design.
 * <p>
 * Declaration order is the tie-break order: when two categories score the same,
 * the one declared first wins.
 */
public enum DesignPurpose {

    PAYMENT(List.of("payment", "pay", "card", "total", "$", "amount", "paypal", "mastercard"),
            "User selects payment method -> Reviews total -> Confirms payment",
            "Header with title/back -> Payment method selection -> Total display -> Primary action button"),
    NAVIGATION(List.of("back", "close", "menu", "home", "settings"),
            "User navigates between sections -> Accesses features",
            "Navigation menu -> Content area -> Action items"),
    FORM(List.of("form", "input", "submit", "save", "cancel", "required"),
            "User fills form fields -> Validates input -> Submits data",
            "Form title -> Input fields -> Validation messages -> Submit button"),
    MODAL(List.of("close", "confirm", "cancel", "ok", "modal"),
            "User views modal content -> Takes action -> Closes modal",
            "Close button -> Modal content -> Action buttons"),
    ECOMMERCE(List.of("cart", "checkout", "buy", "order", "price", "shipping"),
            "User reviews items -> Selects options -> Proceeds to checkout",
            "Product info -> Options/variants -> Price -> Add to cart");

    static final String GENERAL = "general";
    static final String GENERAL_FLOW = "User interacts with interface elements";
    static final String GENERAL_EXPECTATIONS = "Standard UI component hierarchy";

    private final List<String> keywords;
    private final String expectedFlow;
    private final String patternExpectations;

    DesignPurpose(List<String> keywords, String expectedFlow, String patternExpectations) {
        this.keywords = keywords;
        this.expectedFlow = expectedFlow;
        this.patternExpectations = patternExpectations;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Scores every category against the text nodes and returns the best match.
     * Zero matches everywhere yields {@code general}.
     */
    public static Match infer(List<ComponentDescriptor> descriptors) {
        String text = SpatialAnalyzer.textNodes(descriptors).stream()
                .map(ComponentDescriptor::characters)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
        DesignPurpose best = null;
        List<String> bestMatches = List.of();
        for (DesignPurpose purpose : values()) {
            List<String> matches = purpose.keywords.stream().filter(text::contains).toList();
            if (matches.size() > bestMatches.size()) {
                best = purpose;
                bestMatches = matches;
            }
        }
        return new Match(best, bestMatches);
    }

    /**
     * Winning category, or {@code purpose == null} for a general screen.
     */
    public record Match(DesignPurpose purpose, List<String> matchedKeywords) {

        public Match {
            matchedKeywords = List.copyOf(matchedKeywords);
        }

        public String screenType() {
            return purpose == null ? GENERAL : purpose.label();
        }

        public int score() {
            return matchedKeywords.size();
        }

        public String confidenceLabel() {
            return score() > 2 ? "High" : score() > 0 ? "Medium" : "Low";
        }

        public String expectedFlow() {
            return purpose == null ? GENERAL_FLOW : purpose.expectedFlow;
        }

        public String patternExpectations() {
            return purpose == null ? GENERAL_EXPECTATIONS : purpose.patternExpectations;
        }
    }
}
