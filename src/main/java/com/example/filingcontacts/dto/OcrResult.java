package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OcrResult {
    private String text;
    private Double confidence;

    public static OcrResult empty() {
        return new OcrResult("", null);
    }

    public int length() {
        return text == null ? 0 : text.length();
    }
}
