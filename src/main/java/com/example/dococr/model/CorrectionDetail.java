package com.example.dococr.model;

/**
 * 单条校正记录
 */
public class CorrectionDetail {
    private final int position;
    private final String original;
    private final String corrected;
    private final CorrectionMethod method;
    private final double confidence;

    public CorrectionDetail(int position, String original, String corrected,
                            CorrectionMethod method, double confidence) {
        this.position = position;
        this.original = original;
        this.corrected = corrected;
        this.method = method;
        this.confidence = confidence;
    }

    public int getPosition() {
        return position;
    }

    public String getOriginal() {
        return original;
    }

    public String getCorrected() {
        return corrected;
    }

    public CorrectionMethod getMethod() {
        return method;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return method + "@" + position + " '" + original + "' -> '" + corrected + "'";
    }
}
