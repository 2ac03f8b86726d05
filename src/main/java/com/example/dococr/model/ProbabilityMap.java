package com.example.dococr.model;

/**
 * 检测模型输出的逐像素文本概率图(行优先 H×W，取值 [0,1])
 */
public class ProbabilityMap {
    private final float[] data;
    private final int width;
    private final int height;

    public ProbabilityMap(float[] data, int width, int height) {
        if (data == null || data.length != width * height) {
            throw new IllegalArgumentException(
                    "概率图尺寸不匹配: 期望 " + (width * height) + ", 实际 " + (data == null ? 0 : data.length));
        }
        this.data = data;
        this.width = width;
        this.height = height;
    }

    public float[] getData() {
        return data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float get(int x, int y) {
        return data[y * width + x];
    }
}
