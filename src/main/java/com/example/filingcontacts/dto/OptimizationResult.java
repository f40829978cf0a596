package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {
    private byte[] bytes;
    private boolean optimized;

    public static OptimizationResult unchanged(byte[] original) {
        return new OptimizationResult(original, false);
    }
}
