package com.example.dococr.model;

import java.util.List;

/**
 * 文本校正结果
 * 包含原文、校正后文本、校正日志和整体置信度
 */
public class CorrectionResult {
    private final String original;
    private final String corrected;
    private final List<CorrectionDetail> corrections;
    private final double confidence;

    public CorrectionResult(String original, String corrected,
                            List<CorrectionDetail> corrections, double confidence) {
        this.original = original;
        this.corrected = corrected;
        this.corrections = List.copyOf(corrections);
        this.confidence = confidence;
    }

    public String getOriginal() {
        return original;
    }

    public String getCorrected() {
        return corrected;
    }

    public List<CorrectionDetail> getCorrections() {
        return corrections;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isChanged() {
        return !original.equals(corrected);
    }
}
