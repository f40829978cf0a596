package com.example.filingcontacts.service.render;

import com.example.filingcontacts.dto.OptimizationResult;

import java.nio.file.Path;

/**
 * Re-renders a PDF into a smaller, cleaner one. Implementations never throw:
 * on any failure they hand back the original bytes with {@code optimized=false}.
 */
public interface RenderOptimizer {

    OptimizationResult optimize(byte[] pdfBytes, Path workDir);
}
