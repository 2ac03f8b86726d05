package com.example.dococr.service;

import com.example.dococr.model.Line;
import com.example.dococr.model.TextRegionBox;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 文本框 → 阅读顺序的文本行
 *
 * <p>按纵向中心排序后顺序扫描：与当前行首框的纵向中心差小于
 * tolerance × 两者较小高度时并入当前行，否则断行。
 * 行内按横向中心从左到右排序，行间自上而下。
 */
@Slf4j
public class LineAssembler {

    public static final double DEFAULT_TOLERANCE = 0.15;

    private final double tolerance;

    public LineAssembler() {
        this(DEFAULT_TOLERANCE);
    }

    public LineAssembler(double tolerance) {
        this.tolerance = tolerance;
    }

    public List<Line> assemble(List<TextRegionBox> boxes) {
        List<TextRegionBox> sorted = new ArrayList<>(boxes);
        sorted.sort(Comparator.comparingDouble(b -> b.getCenter().y));

        List<Line> lines = new ArrayList<>();
        List<TextRegionBox> current = new ArrayList<>();

        for (TextRegionBox box : sorted) {
            if (current.isEmpty()) {
                current.add(box);
                continue;
            }

            TextRegionBox first = current.get(0);
            double yDiff = Math.abs(box.getCenter().y - first.getCenter().y);
            double height = Math.min(box.getHeight(), first.getHeight());

            if (yDiff < height * tolerance) {
                current.add(box);
            } else {
                lines.add(closeLine(current));
                current = new ArrayList<>();
                current.add(box);
            }
        }
        if (!current.isEmpty()) {
            lines.add(closeLine(current));
        }

        log.debug("{} 个文本框组成 {} 行", boxes.size(), lines.size());
        return lines;
    }

    private Line closeLine(List<TextRegionBox> boxes) {
        boxes.sort(Comparator.comparingDouble(b -> b.getCenter().x));
        return new Line(boxes);
    }
}
