package com.example.dococr.model;

/**
 * 文本校正方式
 */
public enum CorrectionMethod {
    DICTIONARY,
    NGRAM,
    CONFUSION,
    KEYWORD,
    MERGE,
    PREFIX
}
