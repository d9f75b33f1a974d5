package com.designlens.core.state;

import com.designlens.core.comparison.ComparisonMetrics;
import com.designlens.core.design.DesignNode;
import com.designlens.core.llm.ImageInput;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.DesignTokenSet;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.StyleMapping;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one analysis run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Each stage writes its
 * own channels and only reads channels written by earlier stages.
 */
public class AnalysisState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Run input ────────────────────────────────────────────────
        Map.entry("runId",            Channels.base(() -> "")),
        Map.entry("designName",       Channels.base(() -> "")),
        Map.entry("document",         Channels.base((Reducer<DesignNode>) null)),
        Map.entry("image",            Channels.base((Reducer<ImageInput>) null)),
        Map.entry("assetUrls",        Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("contentOverrides", Channels.base((Supplier<Map<String, String>>) Map::of)),

        // ── Stage outputs ────────────────────────────────────────────
        Map.entry("descriptors",      Channels.base((Supplier<List<ComponentDescriptor>>) List::of)),
        Map.entry("tokens",           Channels.base((Reducer<DesignTokenSet>) null)),
        Map.entry("grouping",         Channels.base((Reducer<GroupingResult>) null)),
        Map.entry("analysis",         Channels.base((Reducer<AnalysisResult>) null)),
        Map.entry("mapping",          Channels.base((Reducer<StyleMapping>) null)),
        Map.entry("comparison",       Channels.base((Reducer<ComparisonMetrics>) null)),
        Map.entry("issues",           Channels.base((Supplier<List<String>>) List::of)),

        // ── Stage timings (ms) ───────────────────────────────────────
        Map.entry("extractMs",        Channels.base(() -> 0L)),
        Map.entry("groupingMs",       Channels.base(() -> 0L)),
        Map.entry("validationMs",     Channels.base(() -> 0L)),
        Map.entry("mappingMs",        Channels.base(() -> 0L))
    );

    public AnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String designName() {
        return this.<String>value("designName").orElse("");
    }

    public Optional<DesignNode> document() {
        return value("document");
    }

    public Optional<ImageInput> image() {
        return value("image");
    }

    public Map<String, String> assetUrls() {
        return this.<Map<String, String>>value("assetUrls").orElse(Map.of());
    }

    public Map<String, String> contentOverrides() {
        return this.<Map<String, String>>value("contentOverrides").orElse(Map.of());
    }

    public List<ComponentDescriptor> descriptors() {
        return this.<List<ComponentDescriptor>>value("descriptors").orElse(List.of());
    }

    public DesignTokenSet tokens() {
        return this.<DesignTokenSet>value("tokens").orElse(DesignTokenSet.EMPTY);
    }

    public Optional<GroupingResult> grouping() {
        return value("grouping");
    }

    public Optional<AnalysisResult> analysis() {
        return value("analysis");
    }

    public Optional<StyleMapping> mapping() {
        return value("mapping");
    }

    public Optional<ComparisonMetrics> comparison() {
        return value("comparison");
    }

    public List<String> issues() {
        return this.<List<String>>value("issues").orElse(List.of());
    }

    public long extractMs() {
        return this.<Long>value("extractMs").orElse(0L);
    }

    public long groupingMs() {
        return this.<Long>value("groupingMs").orElse(0L);
    }

    public long validationMs() {
        return this.<Long>value("validationMs").orElse(0L);
    }

    public long mappingMs() {
        return this.<Long>value("mappingMs").orElse(0L);
    }
}
