package com.designlens.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * Canonicalized, deduplicated design values mined once per run from the whole tree.
 * Insertion order is kept for colors, gradients, families and text styles; numeric sets are sorted.
 */
public record DesignTokenSet(
        Set<String> colors,
        Set<String> gradients,
        Set<String> fontFamilies,
        SortedSet<Double> fontSizes,
        SortedSet<Integer> fontWeights,
        SortedSet<Double> spacingValues,
        Set<String> textStyles
) implements Serializable {

    public static final DesignTokenSet EMPTY = new DesignTokenSet(
            Set.of(), Set.of(), Set.of(), new TreeSet<>(), new TreeSet<>(), new TreeSet<>(), Set.of());

    public DesignTokenSet {
        colors = Collections.unmodifiableSet(new LinkedHashSet<>(colors));
        gradients = Collections.unmodifiableSet(new LinkedHashSet<>(gradients));
        fontFamilies = Collections.unmodifiableSet(new LinkedHashSet<>(fontFamilies));
        fontSizes = Collections.unmodifiableSortedSet(new TreeSet<>(fontSizes));
        fontWeights = Collections.unmodifiableSortedSet(new TreeSet<>(fontWeights));
        spacingValues = Collections.unmodifiableSortedSet(new TreeSet<>(spacingValues));
        textStyles = Collections.unmodifiableSet(new LinkedHashSet<>(textStyles));
    }
}
