package com.example.dococr.exception;

/**
 * 文档无法处理时抛出：检测/识别信号缺失、输入不可读、符号字典缺失等
 */
public class OcrProcessingException extends RuntimeException {

    public OcrProcessingException(String message) {
        super(message);
    }

    public OcrProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
