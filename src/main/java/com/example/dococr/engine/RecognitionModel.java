package com.example.dococr.engine;

import com.example.dococr.model.RecognitionInput;
import com.example.dococr.model.RecognitionLogits;

/**
 * 文本识别模型接口(外部实现)
 * 实现需可被多个线程同时调用
 */
public interface RecognitionModel {

    /**
     * 识别单个文本区域
     *
     * @param input 裁剪后的区域张量
     * @return (1, T, C) 逐时间步类别分数
     * @throws Exception 推理失败，由调用方降级为空结果
     */
    RecognitionLogits recognize(RecognitionInput input) throws Exception;
}
