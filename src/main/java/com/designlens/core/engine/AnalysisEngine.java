package com.designlens.core.engine;

import com.designlens.core.extraction.NoExtractableStructureException;
import com.designlens.core.graph.AnalysisGraph;
import com.designlens.core.logging.MdcContext;
import com.designlens.core.metrics.AnalysisMetrics;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.state.AnalysisState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates an analysis run by bridging the CLI and REST surfaces to the LangGraph4j graph.
 * <p>
 * Builds the initial state from the request, generates a run id and invokes the compiled
 * graph. A design with no extractable structure surfaces as
 * {@link NoExtractableStructureException}; every other stage degrades to its fallback.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AnalysisGraph analysisGraph;
    private final AnalysisMetrics metrics;

    public AnalysisEngine(AnalysisGraph analysisGraph, AnalysisMetrics metrics) {
        this.analysisGraph = analysisGraph;
        this.metrics = metrics;
    }

    public PipelineOutput runAnalysis(AnalysisRequest request) {
        return runAnalysis(generateRunId(), request);
    }

    /**
     * Runs the full pipeline with a pre-generated run id.
     *
     * @throws NoExtractableStructureException if the document is missing or yields no descriptors
     */
    public PipelineOutput runAnalysis(String runId, AnalysisRequest request) {
        if (request.document() == null) {
            metrics.recordRunResult("rejected");
            throw new NoExtractableStructureException("no document supplied");
        }
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting analysis {} of '{}' (screenshot: {}, assets: {}, overrides: {})",
                    runId, request.designName(), request.image() != null ? request.image().describe() : "none",
                    request.assetUrls().size(), request.contentOverrides().size());

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("designName", request.designName());
            stateMap.put("document", request.document());
            stateMap.put("assetUrls", request.assetUrls());
            stateMap.put("contentOverrides", request.contentOverrides());
            if (request.image() != null) {
                stateMap.put("image", request.image());
            }
            Map<String, Object> initialState = Map.copyOf(stateMap);

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            AnalysisState state;
            try {
                state = analysisGraph.getCompiledGraph()
                        .invoke(initialState, config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for run " + runId));
            } catch (RuntimeException e) {
                NoExtractableStructureException fatal = findFatalCause(e);
                if (fatal != null) {
                    log.warn("Run {} rejected: {}", runId, fatal.getMessage());
                    metrics.recordRunResult("rejected");
                    throw fatal;
                }
                metrics.recordRunResult("failed");
                throw e;
            }

            long totalMs = System.currentTimeMillis() - start;
            PipelineOutput output = toOutput(runId, request, state, totalMs);
            record(output);
            log.info("Analysis {} finished in {}ms: {} descriptors, {} groups, {} components",
                    runId, totalMs, output.descriptorCount(), output.grouping().groups().size(),
                    output.analysis().components().size());
            return output;
        } finally {
            MdcContext.clear();
        }
    }

    private PipelineOutput toOutput(String runId, AnalysisRequest request, AnalysisState state, long totalMs) {
        GroupingResult grouping = state.grouping().orElseThrow(
                () -> new IllegalStateException("Run " + runId + " finished without a grouping result"));
        AnalysisResult analysis = state.analysis().orElseThrow(
                () -> new IllegalStateException("Run " + runId + " finished without an analysis result"));
        return new PipelineOutput(
                runId,
                request.designName(),
                state.descriptors().size(),
                state.tokens(),
                grouping,
                analysis,
                state.mapping().orElse(null),
                state.comparison().orElse(null),
                state.issues(),
                new PipelineOutput.Timings(state.extractMs(), state.groupingMs(), state.validationMs(),
                        state.mappingMs(), totalMs));
    }

    private void record(PipelineOutput output) {
        var timings = output.timings();
        metrics.recordStageDuration("extract_structure", timings.extractMs());
        metrics.recordStageDuration("group_components", timings.groupingMs());
        metrics.recordStageDuration("validate_visuals", timings.validationMs());
        metrics.recordStageDuration("map_styles", timings.mappingMs());
        metrics.recordRunDuration(timings.totalMs());
        if (output.grouping().fallback()) {
            metrics.recordFallback("grouping");
        }
        if (output.analysis().fallback()) {
            metrics.recordFallback("validation");
        }
        metrics.recordDescriptorCount(output.descriptorCount());
        metrics.recordComponentCount(output.analysis().components().size());
        metrics.recordConfidence("grouping", output.grouping().confidence());
        metrics.recordConfidence("validation", output.analysis().confidence());
        metrics.recordRunResult(output.grouping().fallback() || output.analysis().fallback()
                ? "degraded" : "completed");
    }

    static NoExtractableStructureException findFatalCause(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof NoExtractableStructureException fatal) {
                return fatal;
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * Generates a unique run id in the format DLNS-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("DLNS-%d-%04d", year, count);
    }
}
