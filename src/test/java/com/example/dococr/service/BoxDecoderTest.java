package com.example.dococr.service;

import com.example.dococr.model.DocumentType;
import com.example.dococr.model.ProbabilityMap;
import com.example.dococr.model.TextRegionBox;
import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.RotatedRect;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BoxDecoderTest {

    private final BoxDecoder decoder = new BoxDecoder();

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    @Test
    void shouldUseThresholdPerDocumentType() {
        assertThat(decoder.thresholdFor(DocumentType.BUSINESS_REGISTRATION)).isEqualTo(0.35);
        assertThat(decoder.thresholdFor(DocumentType.ID_CARD)).isEqualTo(0.33);
        assertThat(decoder.thresholdFor(DocumentType.DRIVER_LICENSE)).isEqualTo(0.33);
        assertThat(decoder.thresholdFor(DocumentType.UNKNOWN)).isEqualTo(0.30);
    }

    @Test
    void shouldHonourConfiguredThresholds() {
        BoxDecoder custom = new BoxDecoder(0.5, 0.4, 0.45, 0.2);

        assertThat(custom.thresholdFor(DocumentType.BUSINESS_REGISTRATION)).isEqualTo(0.5);
        assertThat(custom.thresholdFor(DocumentType.DRIVER_LICENSE)).isEqualTo(0.45);
        assertThat(custom.thresholdFor(DocumentType.UNKNOWN)).isEqualTo(0.2);
    }

    @Test
    void shouldDecodeSingleBlockIntoOneExpandedBox() {
        ProbabilityMap map = mapWithBlocks(100, 60, 1.0f, new int[]{20, 20, 50, 30});

        List<RotatedRect> raw = decoder.findRawRects(map, 0.3);
        List<TextRegionBox> boxes = decoder.decode(map, 0.3);

        assertThat(raw).hasSize(1);
        assertThat(boxes).hasSize(1);

        double rawLong = Math.max(raw.get(0).size.width, raw.get(0).size.height);
        double rawShort = Math.min(raw.get(0).size.width, raw.get(0).size.height);
        TextRegionBox box = boxes.get(0);

        assertThat(box.getWidth()).isCloseTo(rawLong * 1.5, within(1e-6));
        assertThat(box.getHeight()).isCloseTo(rawShort * 1.4, within(1e-6));
        // 膨胀只在水平方向扩展
        assertThat(box.getCenter().x).isCloseTo(35.0, within(1.0));
        assertThat(box.getCenter().y).isCloseTo(24.5, within(1.0));
        assertThat(box.getPoints()).hasSize(4);
    }

    @Test
    void shouldKeepLongAxisAsWidthForVerticalBlocks() {
        ProbabilityMap map = mapWithBlocks(100, 80, 1.0f, new int[]{40, 10, 50, 50});

        List<TextRegionBox> boxes = decoder.decode(map, 0.3);

        assertThat(boxes).hasSize(1);
        assertThat(boxes.get(0).getWidth()).isGreaterThanOrEqualTo(boxes.get(0).getHeight());
    }

    @Test
    void shouldApplyDocumentTypeThreshold() {
        ProbabilityMap map = mapWithBlocks(100, 60, 0.34f, new int[]{20, 20, 50, 30});

        assertThat(decoder.decode(map, DocumentType.BUSINESS_REGISTRATION)).isEmpty();
        assertThat(decoder.decode(map, DocumentType.UNKNOWN)).hasSize(1);
    }

    @Test
    void shouldDecodeComponentWithHoleIntoOneBox() {
        ProbabilityMap map = mapWithBlocks(120, 120, 1.0f, new int[]{20, 20, 100, 100});
        float[] data = map.getData();
        for (int y = 40; y < 80; y++) {
            for (int x = 40; x < 80; x++) {
                data[y * 120 + x] = 0f;
            }
        }

        assertThat(decoder.findRawRects(map, 0.3)).hasSize(1);
        assertThat(decoder.decode(map, 0.3)).hasSize(1);
    }

    @Test
    void shouldDropSmallComponents() {
        ProbabilityMap map = mapWithBlocks(60, 60, 1.0f, new int[]{10, 10, 13, 13});

        assertThat(decoder.decode(map, 0.3)).isEmpty();
    }

    @Test
    void shouldSeparateDistantBlocksOnSameRow() {
        ProbabilityMap map = mapWithBlocks(120, 50, 1.0f,
                new int[]{10, 15, 40, 30},
                new int[]{60, 15, 90, 30});

        assertThat(decoder.decode(map, 0.3)).hasSize(2);
    }

    @Test
    void shouldReturnNothingForEmptyMap() {
        ProbabilityMap map = new ProbabilityMap(new float[40 * 30], 40, 30);

        assertThat(decoder.decode(map, 0.3)).isEmpty();
    }

    @Test
    void shouldRescaleToSourceCoordinates() {
        TextRegionBox box = TextRegionBox.axisAligned(50, 25, 40, 10);

        List<TextRegionBox> rescaled = decoder.rescaleAll(List.of(box), 200, 100, 100, 50);

        TextRegionBox result = rescaled.get(0);
        assertThat(result.getCenter().x).isCloseTo(100.0, within(1e-6));
        assertThat(result.getCenter().y).isCloseTo(50.0, within(1e-6));
        assertThat(result.getWidth()).isCloseTo(80.0, within(1e-6));
        assertThat(result.getHeight()).isCloseTo(20.0, within(1e-6));
        // 原框不变
        assertThat(box.getWidth()).isCloseTo(40.0, within(1e-6));
    }

    /**
     * 构建概率图，blocks 为 {x0, y0, x1, y1}(右下不含)
     */
    static ProbabilityMap mapWithBlocks(int width, int height, float value, int[]... blocks) {
        float[] data = new float[width * height];
        for (int[] block : blocks) {
            for (int y = block[1]; y < block[3]; y++) {
                for (int x = block[0]; x < block[2]; x++) {
                    data[y * width + x] = value;
                }
            }
        }
        return new ProbabilityMap(data, width, height);
    }
}
