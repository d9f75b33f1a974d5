package com.designlens.dispatch.api;

import com.designlens.core.engine.AnalysisEngine;
import com.designlens.core.engine.AnalysisRequest;
import com.designlens.core.engine.PipelineOutput;
import com.designlens.core.extraction.NoExtractableStructureException;
import com.designlens.core.llm.ImageInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * REST controller for design analyses.
 */
@RestController
@RequestMapping("/api/v1/analyses")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisEngine analysisEngine;

    /** Completed outputs of this process, keyed by run id. */
    private final ConcurrentHashMap<String, PipelineOutput> results = new ConcurrentHashMap<>();

    public AnalysisController(AnalysisEngine analysisEngine) {
        this.analysisEngine = analysisEngine;
    }

    /**
     * POST /api/v1/analyses runs the pipeline synchronously and returns its output.
     */
    @PostMapping
    public ResponseEntity<PipelineOutput> analyze(@RequestBody AnalysisApiRequest body) {
        if (body == null || body.document() == null) {
            throw new NoExtractableStructureException("request has no document");
        }
        String designName = body.designName() != null && !body.designName().isBlank()
                ? body.designName() : body.document().name();
        ImageInput image = body.imageUrl() != null && !body.imageUrl().isBlank()
                ? ImageInput.ofUrl(body.imageUrl()) : null;

        String runId = analysisEngine.generateRunId();
        log.info("Accepted analysis {}", runId);
        PipelineOutput output = analysisEngine.runAnalysis(runId, new AnalysisRequest(
                designName, body.document(), image, body.assetUrls(), body.contentOverrides()));
        results.put(output.runId(), output);
        return ResponseEntity.ok(output);
    }

    /**
     * GET /api/v1/analyses/{runId} returns a previously completed output.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<PipelineOutput> getAnalysis(@PathVariable String runId) {
        PipelineOutput output = results.get(runId);
        return output != null ? ResponseEntity.ok(output) : ResponseEntity.notFound().build();
    }

    @ExceptionHandler(NoExtractableStructureException.class)
    public ResponseEntity<Map<String, String>> handleNoStructure(NoExtractableStructureException e) {
        log.info("Rejected analysis request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "no extractable structure", "detail", String.valueOf(e.getMessage())));
    }
}
