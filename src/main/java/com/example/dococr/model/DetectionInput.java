package com.example.dococr.model;

import lombok.Getter;

/**
 * 检测模型输入
 * CHW 排列的归一化张量，以及缩放前后的尺寸
 */
@Getter
public class DetectionInput {
    private final float[] data;
    private final int width;
    private final int height;
    private final int sourceWidth;
    private final int sourceHeight;
    private final double ratio;

    public DetectionInput(float[] data, int width, int height,
                          int sourceWidth, int sourceHeight, double ratio) {
        this.data = data;
        this.width = width;
        this.height = height;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        this.ratio = ratio;
    }
}
