package com.example.dococr.model;

/**
 * 文档类型
 * 由外部分类器给出，决定检测阈值和字段解析器
 */
public enum DocumentType {
    BUSINESS_REGISTRATION,
    ID_CARD,
    DRIVER_LICENSE,
    UNKNOWN;

    /**
     * 宽松解析外部传入的类型字符串，无法识别时返回 UNKNOWN
     */
    public static DocumentType fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return UNKNOWN;
        }
        try {
            return DocumentType.valueOf(hint.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
