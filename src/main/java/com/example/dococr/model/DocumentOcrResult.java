package com.example.dococr.model;

import lombok.Getter;

import java.util.List;

/**
 * 单个文档的完整处理结果
 * 包含校正前后的全文、校正日志、识别置信度和结构化字段
 */
@Getter
public class DocumentOcrResult {
    private final DocumentType documentType;
    private final String rawText;
    private final String correctedText;
    private final List<CorrectionDetail> corrections;
    private final double correctionConfidence;
    private final double ocrConfidence;
    private final int boxCount;
    private final FieldRecord fields;

    public DocumentOcrResult(DocumentType documentType,
                             AssembledDocument assembled,
                             CorrectionResult correction,
                             int boxCount,
                             FieldRecord fields) {
        this.documentType = documentType;
        this.rawText = assembled.getFullText();
        this.correctedText = correction.getCorrected();
        this.corrections = correction.getCorrections();
        this.correctionConfidence = correction.getConfidence();
        this.ocrConfidence = assembled.getConfidence();
        this.boxCount = boxCount;
        this.fields = fields;
    }
}
