package com.example.dococr.service;

import com.example.dococr.model.AssembledDocument;
import com.example.dococr.model.DecodedSpan;
import com.example.dococr.model.Line;
import com.example.dococr.model.TextRegionBox;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 识别片段 → 全文
 *
 * <p>按行遍历文本框，根据与上一个保留框之间的水平间距决定分隔方式：
 * <ul>
 *   <li>片段像字段标签且间距 &gt; keywordGap × 上一框高度：换行</li>
 *   <li>间距 &gt; newlineGap × 上一框高度：换行</li>
 *   <li>间距 &gt; spaceGap × 上一框高度：空格</li>
 *   <li>其余情况直接拼接</li>
 * </ul>
 * 置信度不超过 0.5 的片段(即未解码出任何符号)被丢弃。
 */
@Slf4j
public class TextAssembler {

    public static final double DEFAULT_KEYWORD_GAP = 0.2;
    public static final double DEFAULT_NEWLINE_GAP = 0.4;
    public static final double DEFAULT_SPACE_GAP = 0.15;

    private static final double MIN_SPAN_CONFIDENCE = 0.5;

    // 包含 OCR 常见误识别形式，用于判断片段是否为字段起点
    static final List<String> FIELD_START_KEYWORDS = List.of(
            "법인등록번호", "법인들록번호", "번인등록번호",
            "본점소재지", "본정소재지", "본정소재",
            "사업장소재지", "사업장소재", "사업장",
            "개업연월일", "개업연", "등록번호",
            "대표자", "법인명", "단체명"
    );

    private final double keywordGap;
    private final double newlineGap;
    private final double spaceGap;

    public TextAssembler() {
        this(DEFAULT_KEYWORD_GAP, DEFAULT_NEWLINE_GAP, DEFAULT_SPACE_GAP);
    }

    public TextAssembler(double keywordGap, double newlineGap, double spaceGap) {
        this.keywordGap = keywordGap;
        this.newlineGap = newlineGap;
        this.spaceGap = spaceGap;
    }

    /**
     * 拼装全文
     *
     * @param lines 阅读顺序的文本行
     * @param spans 识别结果，顺序与按行展开后的文本框一一对应
     */
    public AssembledDocument assemble(List<Line> lines, List<DecodedSpan> spans) {
        int boxCount = lines.stream().mapToInt(Line::size).sum();
        if (boxCount != spans.size()) {
            throw new IllegalArgumentException(
                    "识别结果数量与文本框数量不一致: boxes=" + boxCount + ", spans=" + spans.size());
        }

        StringBuilder fullText = new StringBuilder();
        List<String> lineTexts = new ArrayList<>();
        double totalConfidence = 0.0;
        int kept = 0;
        int spanIndex = 0;

        for (Line line : lines) {
            StringBuilder lineText = new StringBuilder();
            double lastBoxMaxX = -1.0;
            double lastBoxHeight = 0.0;

            for (TextRegionBox box : line.getBoxes()) {
                DecodedSpan span = spans.get(spanIndex++);
                if (span.getConfidence() <= MIN_SPAN_CONFIDENCE) {
                    continue;
                }

                if (lineText.length() > 0) {
                    lineText.append(separator(span.getText(), box.getMinX() - lastBoxMaxX, lastBoxHeight));
                }
                lineText.append(span.getText());

                lastBoxMaxX = box.getMaxX();
                lastBoxHeight = box.getHeight();
                totalConfidence += span.getConfidence();
                kept++;
            }

            if (lineText.length() > 0) {
                lineTexts.add(lineText.toString());
                fullText.append(lineText).append('\n');
            }
        }

        double confidence = kept > 0 ? totalConfidence / kept : 0.0;
        log.debug("拼装完成: 保留片段 {}/{}, 输出 {} 行, 平均置信度 {}",
                kept, spans.size(), lineTexts.size(), String.format("%.2f", confidence));
        return new AssembledDocument(fullText.toString(), lineTexts, confidence);
    }

    private String separator(String text, double gap, double lastBoxHeight) {
        if (isFieldStart(text) && gap > lastBoxHeight * keywordGap) {
            return "\n";
        } else if (gap > lastBoxHeight * newlineGap) {
            return "\n";
        } else if (gap > lastBoxHeight * spaceGap) {
            return " ";
        }
        return "";
    }

    /**
     * 片段包含字段关键词，或去空白后以关键词前两个字开头
     */
    static boolean isFieldStart(String text) {
        String compact = text.replaceAll("\\s", "");
        for (String keyword : FIELD_START_KEYWORDS) {
            if (text.contains(keyword) || compact.startsWith(keyword.substring(0, 2))) {
                return true;
            }
        }
        return false;
    }
}
