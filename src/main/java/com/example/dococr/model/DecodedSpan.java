package com.example.dococr.model;

/**
 * 单个文本框的识别解码结果
 * 置信度只有 0 和 1 两种取值：解码出至少一个非空白符号时为 1
 */
public class DecodedSpan {
    private static final DecodedSpan EMPTY = new DecodedSpan("", 0.0);

    private final String text;
    private final double confidence;

    public DecodedSpan(String text, double confidence) {
        this.text = text;
        this.confidence = confidence;
    }

    /**
     * 空结果，用于识别失败或未解码出任何符号的区域
     */
    public static DecodedSpan empty() {
        return EMPTY;
    }

    public String getText() {
        return text;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isEmpty() {
        return confidence <= 0.0;
    }

    @Override
    public String toString() {
        return "DecodedSpan{text='" + text + "', confidence=" + confidence + '}';
    }
}
