package com.example.dococr.service;

import com.example.dococr.dictionary.CorrectionDictionary;
import com.example.dococr.dictionary.SymbolDictionary;
import com.example.dococr.dictionary.SymbolDictionaryProvider;
import com.example.dococr.engine.DetectionModel;
import com.example.dococr.engine.RecognitionModel;
import com.example.dococr.exception.OcrProcessingException;
import com.example.dococr.model.*;
import nu.pattern.OpenCV;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentOcrServiceTest {

    private static final String REGISTRATION_LINE = "등록번호:123-45-67890";
    private static final String REPRESENTATIVE_LINE = "대표자:홍길동";
    private static final String DATE_LINE = "개업연월일:2020년01월01일";

    private static SymbolDictionary symbols;
    private static CorrectionDictionary correctionDictionary;

    private RecognitionExecutor executor;

    @BeforeAll
    static void loadResources() {
        OpenCV.loadLocally();
        Set<String> distinct = new LinkedHashSet<>();
        for (String line : List.of(REGISTRATION_LINE, REPRESENTATIVE_LINE, DATE_LINE)) {
            line.codePoints().forEach(cp -> distinct.add(new String(Character.toChars(cp))));
        }
        symbols = new SymbolDictionary(new ArrayList<>(distinct));
        correctionDictionary = CorrectionDictionary.loadDefault();
    }

    @BeforeEach
    void setUp() {
        executor = new RecognitionExecutor(2, 32);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void shouldProcessSignalsIntoFields() {
        DocumentOcrService service = newService(null, null);
        ProbabilityMap map = BoxDecoderTest.mapWithBlocks(400, 200, 1.0f,
                new int[]{20, 20, 200, 36},
                new int[]{20, 80, 160, 96},
                new int[]{20, 140, 220, 156});

        DocumentOcrResult result = service.processSignals(map, 400, 200,
                DocumentType.BUSINESS_REGISTRATION, byRow());

        assertThat(result.getBoxCount()).isEqualTo(3);
        assertThat(result.getRawText()).isEqualTo(
                REGISTRATION_LINE + "\n" + REPRESENTATIVE_LINE + "\n" + DATE_LINE + "\n");
        assertThat(result.getOcrConfidence()).isEqualTo(1.0);
        assertThat(result.getFields().getRegistrationNumber()).isEqualTo("123-45-67890");
        assertThat(result.getFields().getRepresentative()).isEqualTo("홍길동");
        assertThat(result.getFields().getEstablishmentDate()).isEqualTo("2020년01월01일");
    }

    @Test
    void shouldReturnEmptyFieldsForUnsupportedDocumentType() {
        DocumentOcrService service = newService(null, null);
        ProbabilityMap map = BoxDecoderTest.mapWithBlocks(400, 200, 1.0f, new int[]{20, 80, 160, 96});

        DocumentOcrResult result = service.processSignals(map, 400, 200, DocumentType.ID_CARD, byRow());

        assertThat(result.getDocumentType()).isEqualTo(DocumentType.ID_CARD);
        assertThat(result.getRawText()).isEqualTo(REPRESENTATIVE_LINE + "\n");
        assertThat(result.getFields().filledCount()).isZero();
    }

    @Test
    void shouldKeepGoingWhenRecognitionFailsForOneBox() {
        DocumentOcrService service = newService(null, null);
        ProbabilityMap map = BoxDecoderTest.mapWithBlocks(400, 200, 1.0f,
                new int[]{20, 20, 200, 36},
                new int[]{20, 80, 160, 96});

        DocumentOcrResult result = service.processSignals(map, 400, 200, DocumentType.BUSINESS_REGISTRATION,
                box -> {
                    if (box.getCenter().y < 60) {
                        throw new IllegalStateException("recognition failed");
                    }
                    return logitsFor(REPRESENTATIVE_LINE);
                });

        assertThat(result.getBoxCount()).isEqualTo(2);
        assertThat(result.getRawText()).isEqualTo(REPRESENTATIVE_LINE + "\n");
        assertThat(result.getFields().getRepresentative()).isEqualTo("홍길동");
        assertThat(result.getFields().getRegistrationNumber()).isEmpty();
    }

    @Test
    void shouldRejectMissingSignals() {
        DocumentOcrService service = newService(null, null);
        ProbabilityMap map = BoxDecoderTest.mapWithBlocks(40, 40, 0.0f);

        assertThatThrownBy(() -> service.processSignals(null, 10, 10, DocumentType.UNKNOWN, byRow()))
                .isInstanceOf(OcrProcessingException.class);
        assertThatThrownBy(() -> service.processSignals(map, 40, 40, DocumentType.UNKNOWN, null))
                .isInstanceOf(OcrProcessingException.class);
    }

    @Test
    void shouldProcessImageWithModels() throws Exception {
        DetectionModel detectionModel = mock(DetectionModel.class);
        RecognitionModel recognitionModel = mock(RecognitionModel.class);
        when(detectionModel.detect(any(DetectionInput.class))).thenAnswer(invocation -> {
            DetectionInput input = invocation.getArgument(0);
            return BoxDecoderTest.mapWithBlocks(input.getWidth(), input.getHeight(), 0.9f,
                    new int[]{20, 40, 150, 56});
        });
        when(recognitionModel.recognize(any(RecognitionInput.class))).thenReturn(logitsFor(REPRESENTATIVE_LINE));
        DocumentOcrService service = newService(detectionModel, recognitionModel);
        List<String> progress = new CopyOnWriteArrayList<>();

        DocumentOcrResult result = service.process(
                new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB),
                DocumentType.BUSINESS_REGISTRATION, progress::add);

        assertThat(service.isModelAvailable()).isTrue();
        assertThat(result.getBoxCount()).isEqualTo(1);
        assertThat(result.getFields().getRepresentative()).isEqualTo("홍길동");
        assertThat(progress).contains("识别文本区域 (1/1)", "完成");
    }

    @Test
    void shouldWrapDetectionFailure() throws Exception {
        DetectionModel detectionModel = mock(DetectionModel.class);
        when(detectionModel.detect(any(DetectionInput.class))).thenThrow(new IllegalStateException("model crashed"));
        DocumentOcrService service = newService(detectionModel, mock(RecognitionModel.class));

        assertThatThrownBy(() -> service.process(
                new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB), DocumentType.UNKNOWN, null))
                .isInstanceOf(OcrProcessingException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRefuseImageWithoutModels() {
        DocumentOcrService service = newService(null, null);

        assertThat(service.isModelAvailable()).isFalse();
        assertThatThrownBy(() -> service.process(
                new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB), DocumentType.UNKNOWN, null))
                .isInstanceOf(OcrProcessingException.class);
    }

    @Test
    void shouldParseTextWithOptionalCorrection() {
        DocumentOcrService service = newService(null, null);

        FieldRecord corrected = service.parseText("데표자 : 홍길동", true);
        FieldRecord raw = service.parseText("등록번호 : 111-22-33333", false);

        assertThat(corrected.getRepresentative()).isEqualTo("홍길동");
        assertThat(raw.getRegistrationNumber()).isEqualTo("111-22-33333");
        assertThat(service.correctText("등륵번호").getCorrected()).isEqualTo("등록번호");
    }

    private DocumentOcrService newService(DetectionModel detectionModel, RecognitionModel recognitionModel) {
        return new DocumentOcrService(
                provider(detectionModel),
                provider(recognitionModel),
                SymbolDictionaryProvider.of(symbols),
                new ImageTensorService(),
                new BoxDecoder(),
                new LineAssembler(),
                new TextAssembler(),
                new TextCorrector(correctionDictionary),
                new FuzzyFieldExtractor(correctionDictionary),
                executor);
    }

    @SuppressWarnings("unchecked")
    private static <T> ObjectProvider<T> provider(T instance) {
        ObjectProvider<T> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(instance);
        return provider;
    }

    /**
     * 按文本框纵向位置返回对应行的识别输出
     */
    private static Function<TextRegionBox, RecognitionLogits> byRow() {
        return box -> {
            double y = box.getCenter().y;
            if (y < 60) {
                return logitsFor(REGISTRATION_LINE);
            }
            return y < 120 ? logitsFor(REPRESENTATIVE_LINE) : logitsFor(DATE_LINE);
        };
    }

    /**
     * 每个字符一个时间步，相邻重复字符之间插入空白
     */
    private static RecognitionLogits logitsFor(String text) {
        int numClasses = symbols.size() + 1;
        List<float[]> steps = new ArrayList<>();
        int previous = -1;
        for (int i = 0; i < text.length(); i++) {
            int classIndex = classOf(String.valueOf(text.charAt(i)));
            if (classIndex == previous) {
                float[] blank = new float[numClasses];
                blank[0] = 1.0f;
                steps.add(blank);
            }
            float[] step = new float[numClasses];
            step[classIndex] = 1.0f;
            steps.add(step);
            previous = classIndex;
        }
        return RecognitionLogits.of(steps.toArray(new float[0][]));
    }

    private static int classOf(String symbol) {
        for (int c = 1; c <= symbols.size(); c++) {
            if (symbol.equals(symbols.symbolForClass(c))) {
                return c;
            }
        }
        throw new IllegalArgumentException("unknown symbol: " + symbol);
    }
}
