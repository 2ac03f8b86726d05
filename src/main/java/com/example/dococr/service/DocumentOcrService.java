package com.example.dococr.service;

import com.example.dococr.dictionary.SymbolDictionaryProvider;
import com.example.dococr.engine.DetectionModel;
import com.example.dococr.engine.RecognitionModel;
import com.example.dococr.exception.OcrProcessingException;
import com.example.dococr.model.*;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 文档 OCR 后处理主流程
 *
 * <p>检测概率图 → 文本框 → 文本行 → 并行识别解码 → 全文拼装 → 文本校正 → 字段提取。
 * 检测与几何计算在调用线程执行，识别在 {@link RecognitionExecutor} 中并行执行。
 */
@Service
@Slf4j
public class DocumentOcrService {

    private final ObjectProvider<DetectionModel> detectionModel;
    private final ObjectProvider<RecognitionModel> recognitionModel;
    private final SymbolDictionaryProvider symbolDictionary;
    private final ImageTensorService imageTensorService;
    private final BoxDecoder boxDecoder;
    private final LineAssembler lineAssembler;
    private final TextAssembler textAssembler;
    private final TextCorrector textCorrector;
    private final FuzzyFieldExtractor fieldExtractor;
    private final RecognitionExecutor recognitionExecutor;

    public DocumentOcrService(ObjectProvider<DetectionModel> detectionModel,
                              ObjectProvider<RecognitionModel> recognitionModel,
                              SymbolDictionaryProvider symbolDictionary,
                              ImageTensorService imageTensorService,
                              BoxDecoder boxDecoder,
                              LineAssembler lineAssembler,
                              TextAssembler textAssembler,
                              TextCorrector textCorrector,
                              FuzzyFieldExtractor fieldExtractor,
                              RecognitionExecutor recognitionExecutor) {
        this.detectionModel = detectionModel;
        this.recognitionModel = recognitionModel;
        this.symbolDictionary = symbolDictionary;
        this.imageTensorService = imageTensorService;
        this.boxDecoder = boxDecoder;
        this.lineAssembler = lineAssembler;
        this.textAssembler = textAssembler;
        this.textCorrector = textCorrector;
        this.fieldExtractor = fieldExtractor;
        this.recognitionExecutor = recognitionExecutor;
    }

    /**
     * 检测和识别模型是否都已配置
     */
    public boolean isModelAvailable() {
        return detectionModel.getIfAvailable() != null && recognitionModel.getIfAvailable() != null;
    }

    // ==================== 图像入口 ====================

    /**
     * 处理一张文档图像
     *
     * @param image    原图
     * @param type     文档类型
     * @param listener 进度回调
     */
    public DocumentOcrResult process(BufferedImage image, DocumentType type, ProgressListener listener) {
        DetectionModel detector = detectionModel.getIfAvailable();
        RecognitionModel recognizer = recognitionModel.getIfAvailable();
        if (detector == null || recognizer == null) {
            throw new OcrProcessingException("检测或识别模型未配置");
        }
        if (image == null) {
            throw new OcrProcessingException("图像为空");
        }

        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        SequenceDecoder decoder = new SequenceDecoder(symbolDictionary.get());
        long startTime = System.currentTimeMillis();

        Mat rgb = imageTensorService.toRgbMat(image);
        try {
            // 1. 检测
            progress.onProgress("检测文本区域...");
            DetectionInput input = imageTensorService.prepareDetectionInput(rgb);
            ProbabilityMap map;
            try {
                map = detector.detect(input);
            } catch (Exception e) {
                throw new OcrProcessingException("文本检测失败", e);
            }
            if (map == null) {
                throw new OcrProcessingException("检测模型未返回概率图");
            }

            // 2. 文本框与行
            List<Line> lines = layout(map, input.getSourceWidth(), input.getSourceHeight(), type);
            List<TextRegionBox> ordered = flatten(lines);

            // 3. 裁剪 + 并行识别
            progress.onProgress("准备 " + ordered.size() + " 个文本区域...");
            List<RecognitionInput> crops = new ArrayList<>(ordered.size());
            for (TextRegionBox box : ordered) {
                crops.add(imageTensorService.cropRegion(rgb, box));
            }

            RecognitionBatch batch = recognitionExecutor.submitBatch(crops, recognizer::recognize, decoder, progress);
            List<DecodedSpan> spans = batch.join();

            return finish(type, lines, spans, progress, startTime);
        } finally {
            rgb.release();
        }
    }

    // ==================== 信号入口 ====================

    /**
     * 直接处理模型输出信号
     *
     * @param map          检测概率图
     * @param sourceWidth  原图宽
     * @param sourceHeight 原图高
     * @param type         文档类型
     * @param recognizer   文本框 → 识别输出
     */
    public DocumentOcrResult processSignals(ProbabilityMap map, int sourceWidth, int sourceHeight,
                                            DocumentType type,
                                            Function<TextRegionBox, RecognitionLogits> recognizer) {
        if (map == null) {
            throw new OcrProcessingException("检测概率图为空");
        }
        if (recognizer == null) {
            throw new OcrProcessingException("识别信号来源为空");
        }

        long startTime = System.currentTimeMillis();
        SequenceDecoder decoder = new SequenceDecoder(symbolDictionary.get());

        List<Line> lines = layout(map, sourceWidth, sourceHeight, type);
        RecognitionBatch batch = recognitionExecutor.submitBatch(
                flatten(lines), recognizer::apply, decoder, ProgressListener.NONE);

        return finish(type, lines, batch.join(), ProgressListener.NONE, startTime);
    }

    // ==================== 文本入口 ====================

    public CorrectionResult correctText(String text) {
        return textCorrector.correct(text);
    }

    /**
     * 解析营业执照文本
     *
     * @param correct 解析前是否先做文本校正
     */
    public FieldRecord parseText(String text, boolean correct) {
        String source = correct ? textCorrector.correct(text).getCorrected() : text;
        return fieldExtractor.extract(source);
    }

    // ==================== 内部步骤 ====================

    private List<Line> layout(ProbabilityMap map, int sourceWidth, int sourceHeight, DocumentType type) {
        double threshold = boxDecoder.thresholdFor(type);
        log.debug("文档类型 {} 使用检测阈值 {}", type, threshold);

        List<TextRegionBox> boxes = boxDecoder.decode(map, threshold);
        List<TextRegionBox> rescaled = boxDecoder.rescaleAll(
                boxes, sourceWidth, sourceHeight, map.getWidth(), map.getHeight());

        List<Line> lines = lineAssembler.assemble(rescaled);
        log.info("检测到 {} 个文本框，组成 {} 行", rescaled.size(), lines.size());
        return lines;
    }

    private DocumentOcrResult finish(DocumentType type, List<Line> lines, List<DecodedSpan> spans,
                                     ProgressListener progress, long startTime) {
        progress.onProgress("拼装识别结果...");
        AssembledDocument assembled = textAssembler.assemble(lines, spans);

        progress.onProgress("校正文本...");
        CorrectionResult correction = textCorrector.correct(assembled.getFullText());

        progress.onProgress("提取字段...");
        FieldRecord fields = parseFields(type, correction.getCorrected());

        log.info("文档处理完成: 类型={}, 文本框={}, 校正={} 处, 字段={}/{}, 耗时 {} ms",
                type, spans.size(), correction.getCorrections().size(),
                fields.filledCount(), FieldRecord.Field.values().length,
                System.currentTimeMillis() - startTime);
        progress.onProgress("完成");

        return new DocumentOcrResult(type, assembled, correction, spans.size(), fields);
    }

    /**
     * 按文档类型选择字段解析器，身份证和驾照暂未实现
     */
    private FieldRecord parseFields(DocumentType type, String text) {
        return switch (type) {
            case BUSINESS_REGISTRATION -> fieldExtractor.extract(text);
            case ID_CARD, DRIVER_LICENSE, UNKNOWN -> FieldRecord.empty();
        };
    }

    private static List<TextRegionBox> flatten(List<Line> lines) {
        List<TextRegionBox> ordered = new ArrayList<>();
        for (Line line : lines) {
            ordered.addAll(line.getBoxes());
        }
        return ordered;
    }
}
