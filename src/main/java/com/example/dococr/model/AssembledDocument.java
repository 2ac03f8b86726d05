package com.example.dococr.model;

import lombok.Getter;

import java.util.List;

/**
 * 拼装后的文档文本
 * fullText 为各行文本以换行符连接的结果，confidence 为保留下来的文本片段的平均置信度
 */
@Getter
public class AssembledDocument {
    private final String fullText;
    private final List<String> lineTexts;
    private final double confidence;

    public AssembledDocument(String fullText, List<String> lineTexts, double confidence) {
        this.fullText = fullText;
        this.lineTexts = List.copyOf(lineTexts);
        this.confidence = confidence;
    }
}
