package com.example.dococr.service;

import com.example.dococr.dictionary.SymbolDictionary;
import com.example.dococr.model.DecodedSpan;
import com.example.dococr.model.RecognitionLogits;

/**
 * 贪心 CTC 解码
 *
 * <p>每个时间步取 argmax；非空白(0)且与上一时间步 argmax 不同时输出对应符号。
 * 上一时间步的 argmax 在空白步上同样更新，因此空白会打断重复折叠。
 */
public class SequenceDecoder {

    private static final int BLANK_INDEX = 0;

    private final SymbolDictionary dictionary;

    public SequenceDecoder(SymbolDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public DecodedSpan decode(RecognitionLogits logits) {
        float[] data = logits.getData();
        int timeSteps = logits.getTimeSteps();
        int numClasses = logits.getNumClasses();

        StringBuilder sb = new StringBuilder();
        int charCount = 0;
        int lastIndex = -1;

        for (int t = 0; t < timeSteps; t++) {
            int offset = t * numClasses;
            int maxIdx = -1;
            float maxVal = Float.NEGATIVE_INFINITY;

            for (int c = 0; c < numClasses; c++) {
                if (data[offset + c] > maxVal) {
                    maxVal = data[offset + c];
                    maxIdx = c;
                }
            }

            if (maxIdx != -1 && maxIdx != BLANK_INDEX && maxIdx != lastIndex) {
                String symbol = dictionary.symbolForClass(maxIdx);
                if (symbol != null) {
                    sb.append(symbol);
                    charCount++;
                }
            }
            lastIndex = maxIdx;
        }

        return new DecodedSpan(sb.toString(), charCount > 0 ? 1.0 : 0.0);
    }
}
