package com.designlens.dispatch.cli;

import com.designlens.core.comparison.AnalysisComparison;
import com.designlens.core.design.DesignFile;
import com.designlens.core.design.DesignTreeReader;
import com.designlens.core.engine.AnalysisEngine;
import com.designlens.core.engine.AnalysisRequest;
import com.designlens.core.engine.PipelineOutput;
import com.designlens.core.extraction.NoExtractableStructureException;
import com.designlens.core.llm.ImageInput;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: designlens analyze --tree &lt;file.json&gt;
 * <p>
 * Runs the full pipeline over a design tree exported to disk, optionally validated against
 * a screenshot, and prints or writes the resulting {@link PipelineOutput}.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Analyze a design tree and map it to UI components")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Option(names = {"--tree", "-t"}, required = true, description = "Design tree JSON (file payload or bare node)")
    Path tree;

    @Option(names = "--image-url", description = "Public URL of the rendered screenshot")
    String imageUrl;

    @Option(names = "--image", description = "Screenshot file (png or jpeg)")
    Path image;

    @Option(names = "--assets", description = "JSON object mapping node ids to exported image URLs")
    Path assets;

    @Option(names = "--content", description = "JSON object mapping component ids to display text")
    Path content;

    @Option(names = {"--out", "-o"}, description = "Write the full result as JSON to this file")
    Path out;

    @Option(names = "--report", description = "Print the stage comparison report")
    boolean report;

    private final AnalysisEngine analysisEngine;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(AnalysisEngine analysisEngine, ObjectMapper objectMapper) {
        this.analysisEngine = analysisEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AnalysisRequest request;
        try {
            request = buildRequest();
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Cannot read input: " + e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Analyzing '" + request.designName() + "'...");
        return runAndPrint(analysisEngine, objectMapper, request, out, report);
    }

    AnalysisRequest buildRequest() throws IOException {
        DesignFile file = DesignTreeReader.read(tree);
        return new AnalysisRequest(file.displayName(), file.document(), imageInput(),
                readMap(assets), readMap(content));
    }

    private ImageInput imageInput() throws IOException {
        if (image != null) {
            String name = image.getFileName().toString().toLowerCase();
            String mime = name.endsWith(".jpg") || name.endsWith(".jpeg") ? "image/jpeg" : ImageInput.DEFAULT_MIME_TYPE;
            return ImageInput.ofBytes(Files.readAllBytes(image), mime);
        }
        if (imageUrl != null && !imageUrl.isBlank()) {
            return ImageInput.ofUrl(imageUrl);
        }
        return null;
    }

    private Map<String, String> readMap(Path path) throws IOException {
        if (path == null) {
            return Map.of();
        }
        return objectMapper.readValue(path.toFile(), new TypeReference<Map<String, String>>() {});
    }

    /**
     * Shared by {@code analyze} and {@code fetch}: runs the engine, prints the summary and
     * writes the JSON output.
     *
     * @return process exit code
     */
    static int runAndPrint(AnalysisEngine engine, ObjectMapper mapper, AnalysisRequest request,
                           Path out, boolean report) {
        PipelineOutput output;
        try {
            output = engine.runAnalysis(request);
        } catch (NoExtractableStructureException e) {
            ConsoleOutput.error("Nothing to analyze: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Analysis failed: " + rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.info("Run " + output.runId());
        ConsoleOutput.summary(output);
        if (report && output.comparison() != null) {
            System.out.println(AnalysisComparison.report(output.comparison()));
            output.issues().forEach(ConsoleOutput::warn);
        }
        ConsoleOutput.metrics(output.comparison(), output.timings());

        if (out != null) {
            try {
                mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(out.toFile(), output);
                ConsoleOutput.success("Wrote " + out);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot write " + out + ": " + e.getMessage());
                return 2;
            }
        }
        ConsoleOutput.success("Analysis complete.");
        return 0;
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
