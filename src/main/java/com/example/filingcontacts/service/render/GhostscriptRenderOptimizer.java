package com.example.filingcontacts.service.render;

import com.example.filingcontacts.dto.CommandResult;
import com.example.filingcontacts.dto.OptimizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites a PDF through Ghostscript's pdfwrite device with /ebook settings.
 * Output is kept only when it is under 90% of the input size.
 */
@Service
public class GhostscriptRenderOptimizer implements RenderOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(GhostscriptRenderOptimizer.class);

    static final double MIN_SIZE_REDUCTION = 0.9;

    private final CommandRunner commandRunner;

    @Value("${ghostscript.command:gs}")
    private String ghostscriptCommand = "gs";

    @Value("${ghostscript.timeout-seconds:120}")
    private long timeoutSeconds = 120;

    public GhostscriptRenderOptimizer(CommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public OptimizationResult optimize(byte[] pdfBytes, Path workDir) {
        try {
            Path input = workDir.resolve("gs-input.pdf");
            Path output = workDir.resolve("gs-optimized.pdf");
            Files.write(input, pdfBytes);

            CommandResult result = commandRunner.run(buildCommand(input, output), Duration.ofSeconds(timeoutSeconds));
            if (!result.isSuccess() || !Files.exists(output)) {
                logger.warn("⚠️ Ghostscript exited with code {}: {}", result.getExitCode(), abbreviate(result.getOutput()));
                return OptimizationResult.unchanged(pdfBytes);
            }

            byte[] optimized = Files.readAllBytes(output);
            if (optimized.length == 0 || optimized.length >= pdfBytes.length * MIN_SIZE_REDUCTION) {
                logger.debug("Ghostscript output {} bytes vs {} original, keeping original", optimized.length, pdfBytes.length);
                return OptimizationResult.unchanged(pdfBytes);
            }

            logger.info("✅ Ghostscript reduced PDF from {} KB to {} KB", pdfBytes.length / 1024, optimized.length / 1024);
            return new OptimizationResult(optimized, true);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("⚠️ Ghostscript optimization interrupted, using original bytes");
            return OptimizationResult.unchanged(pdfBytes);
        } catch (IOException e) {
            logger.warn("⚠️ Ghostscript optimization failed, using original bytes: {}", e.getMessage());
            return OptimizationResult.unchanged(pdfBytes);
        }
    }

    List<String> buildCommand(Path input, Path output) {
        return Arrays.asList(
                ghostscriptCommand,
                "-sDEVICE=pdfwrite",
                "-dPDFSETTINGS=/ebook",
                "-dNOPAUSE",
                "-dQUIET",
                "-dBATCH",
                "-dColorImageResolution=150",
                "-dGrayImageResolution=150",
                "-dMonoImageResolution=300",
                "-sOutputFile=" + output.toAbsolutePath(),
                input.toAbsolutePath().toString()
        );
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
