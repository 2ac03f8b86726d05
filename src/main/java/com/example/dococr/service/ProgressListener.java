package com.example.dococr.service;

/**
 * 处理进度回调
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = message -> {
    };

    void onProgress(String message);

    /**
     * 每识别完成一个文本区域调用一次
     */
    default void onRegionRecognized(int completed, int total) {
        onProgress("识别文本区域 (" + completed + "/" + total + ")");
    }
}
