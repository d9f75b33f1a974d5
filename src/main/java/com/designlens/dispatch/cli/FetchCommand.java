package com.designlens.dispatch.cli;

import com.designlens.core.design.DesignFile;
import com.designlens.core.engine.AnalysisEngine;
import com.designlens.core.engine.AnalysisRequest;
import com.designlens.core.llm.ImageInput;
import com.designlens.figma.FigmaApiException;
import com.designlens.figma.FigmaClient;
import com.designlens.figma.FigmaFileKeys;
import com.designlens.figma.MainFrameSelector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: designlens fetch --file &lt;key|url&gt;
 * <p>
 * Pulls the document tree and a rendered screenshot of its main frame from the design tool,
 * then runs the same pipeline as {@code analyze}.
 */
@Command(name = "fetch", mixinStandardHelpOptions = true,
        description = "Fetch a design file from the design tool and analyze it")
@Component
public class FetchCommand implements Callable<Integer> {

    @Option(names = {"--file", "-f"}, required = true, description = "File key or share URL")
    String file;

    @Option(names = "--no-image", description = "Skip the screenshot export")
    boolean noImage;

    @Option(names = {"--out", "-o"}, description = "Write the full result as JSON to this file")
    Path out;

    @Option(names = "--report", description = "Print the stage comparison report")
    boolean report;

    private final FigmaClient figmaClient;
    private final AnalysisEngine analysisEngine;
    private final ObjectMapper objectMapper;

    public FetchCommand(FigmaClient figmaClient, AnalysisEngine analysisEngine, ObjectMapper objectMapper) {
        this.figmaClient = figmaClient;
        this.analysisEngine = analysisEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AnalysisRequest request;
        try {
            String fileKey = FigmaFileKeys.extract(file);
            ConsoleOutput.info("Fetching design file " + fileKey + "...");
            DesignFile designFile = figmaClient.getFile(fileKey);
            ImageInput screenshot = noImage ? null : screenshot(fileKey, designFile);
            request = new AnalysisRequest(designFile.displayName(), designFile.document(), screenshot,
                    Map.of(), Map.of());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (FigmaApiException e) {
            ConsoleOutput.error("Design-tool API error" + (e.getStatus() > 0 ? " (HTTP " + e.getStatus() + ")" : "")
                    + ": " + e.getMessage());
            return 2;
        }

        return AnalyzeCommand.runAndPrint(analysisEngine, objectMapper, request, out, report);
    }

    private ImageInput screenshot(String fileKey, DesignFile designFile) {
        List<String> frames = MainFrameSelector.select(designFile.document());
        if (frames.isEmpty()) {
            ConsoleOutput.warn("No frames to export; continuing without a screenshot");
            return null;
        }
        String frameId = frames.get(0);
        String url = figmaClient.getImages(fileKey, List.of(frameId)).get(frameId);
        if (url == null) {
            ConsoleOutput.warn("Export of frame " + frameId + " failed; continuing without a screenshot");
            return null;
        }
        ConsoleOutput.info("Exported frame " + frameId);
        return ImageInput.ofUrl(url);
    }
}
