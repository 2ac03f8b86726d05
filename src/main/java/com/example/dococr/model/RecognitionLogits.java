package com.example.dococr.model;

/**
 * 识别模型对单个文本区域的输出，对应 (1, T, C) 张量
 */
public class RecognitionLogits {
    private final float[] data;
    private final int timeSteps;
    private final int numClasses;

    public RecognitionLogits(float[] data, int timeSteps, int numClasses) {
        if (data == null || data.length != timeSteps * numClasses) {
            throw new IllegalArgumentException(
                    "识别张量尺寸不匹配: T=" + timeSteps + ", C=" + numClasses);
        }
        this.data = data;
        this.timeSteps = timeSteps;
        this.numClasses = numClasses;
    }

    /**
     * 由 [T][C] 二维数组构建
     */
    public static RecognitionLogits of(float[][] scores) {
        int t = scores.length;
        int c = t == 0 ? 0 : scores[0].length;
        float[] flat = new float[t * c];
        for (int i = 0; i < t; i++) {
            System.arraycopy(scores[i], 0, flat, i * c, c);
        }
        return new RecognitionLogits(flat, t, c);
    }

    public float[] getData() {
        return data;
    }

    public int getTimeSteps() {
        return timeSteps;
    }

    public int getNumClasses() {
        return numClasses;
    }
}
