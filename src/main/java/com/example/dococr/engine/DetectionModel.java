package com.example.dococr.engine;

import com.example.dococr.model.DetectionInput;
import com.example.dococr.model.ProbabilityMap;

/**
 * 文本检测模型接口(外部实现)：
 * - 输入归一化后的整图张量；
 * - 输出与输入同尺寸的逐像素文本概率图。
 */
public interface DetectionModel {

    /**
     * @param input 检测输入张量
     * @return 概率图，尺寸为 input.width × input.height
     * @throws Exception 推理失败
     */
    ProbabilityMap detect(DetectionInput input) throws Exception;
}
