package com.example.dococr.config;

import com.example.dococr.dictionary.CorrectionDictionary;
import com.example.dococr.dictionary.SymbolDictionaryProvider;
import com.example.dococr.service.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import javax.annotation.PostConstruct;

/**
 * OCR 后处理组件配置
 * 阈值、间距系数和校正参数均可通过 application.properties 覆盖
 */
@Configuration
@Slf4j
public class OcrConfig {

    // ==================== 检测 ====================

    @Value("${ocr.detection.threshold.business-registration:0.35}")
    private double businessRegistrationThreshold;

    @Value("${ocr.detection.threshold.id-card:0.33}")
    private double idCardThreshold;

    @Value("${ocr.detection.threshold.driver-license:0.33}")
    private double driverLicenseThreshold;

    @Value("${ocr.detection.threshold.default:0.30}")
    private double defaultThreshold;

    @Value("${ocr.detection.limit-side:1280}")
    private int limitSide;

    // ==================== 版面 ====================

    @Value("${ocr.line.tolerance:0.15}")
    private double lineTolerance;

    @Value("${ocr.assembly.keyword-gap:0.2}")
    private double keywordGap;

    @Value("${ocr.assembly.newline-gap:0.4}")
    private double newlineGap;

    @Value("${ocr.assembly.space-gap:0.15}")
    private double spaceGap;

    // ==================== 校正 ====================

    @Value("${ocr.correction.margin:0.3}")
    private double correctionMargin;

    @Value("${ocr.correction.max-change-ratio:0.3}")
    private double maxChangeRatio;

    // ==================== 识别 ====================

    @Value("${ocr.recognition.pool-size:0}")
    private int recognitionPoolSize;

    @Value("${ocr.recognition.queue-capacity:64}")
    private int recognitionQueueCapacity;

    @Value("${ocr.dictionary.symbols:file:models/korean_dict.txt}")
    private String symbolDictionaryLocation;

    @PostConstruct
    public void init() {
        nu.pattern.OpenCV.loadLocally();
        log.info("OpenCV库加载成功");
    }

    @Bean
    public CorrectionDictionary correctionDictionary() {
        return CorrectionDictionary.loadDefault();
    }

    @Bean
    public SymbolDictionaryProvider symbolDictionaryProvider(ResourceLoader resourceLoader) {
        return new SymbolDictionaryProvider(resourceLoader.getResource(symbolDictionaryLocation));
    }

    @Bean
    public ImageTensorService imageTensorService() {
        return new ImageTensorService(limitSide);
    }

    @Bean
    public BoxDecoder boxDecoder() {
        return new BoxDecoder(businessRegistrationThreshold, idCardThreshold, driverLicenseThreshold, defaultThreshold);
    }

    @Bean
    public LineAssembler lineAssembler() {
        return new LineAssembler(lineTolerance);
    }

    @Bean
    public TextAssembler textAssembler() {
        return new TextAssembler(keywordGap, newlineGap, spaceGap);
    }

    @Bean
    public TextCorrector textCorrector(CorrectionDictionary correctionDictionary) {
        return new TextCorrector(correctionDictionary, correctionMargin, maxChangeRatio);
    }

    @Bean
    public FuzzyFieldExtractor fuzzyFieldExtractor(CorrectionDictionary correctionDictionary) {
        return new FuzzyFieldExtractor(correctionDictionary);
    }

    @Bean
    public RecognitionExecutor recognitionExecutor() {
        return new RecognitionExecutor(recognitionPoolSize, recognitionQueueCapacity);
    }
}
