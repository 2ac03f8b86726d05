package com.example.dococr.model;

import lombok.Getter;

/**
 * 识别模型输入：单个文本区域裁剪并归一化后的 CHW 张量
 */
@Getter
public class RecognitionInput {
    private final float[] data;
    private final int width;
    private final int height;

    public RecognitionInput(float[] data, int width, int height) {
        this.data = data;
        this.width = width;
        this.height = height;
    }
}
