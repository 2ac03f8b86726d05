package com.example.dococr.model;

import java.util.Collections;
import java.util.List;

/**
 * 文本行
 * 纵向中心相近的一组文本框，行内按横向位置从左到右排列
 */
public class Line {
    private final List<TextRegionBox> boxes;

    public Line(List<TextRegionBox> boxes) {
        this.boxes = List.copyOf(boxes);
    }

    public List<TextRegionBox> getBoxes() {
        return Collections.unmodifiableList(boxes);
    }

    public int size() {
        return boxes.size();
    }

    public double getCenterY() {
        return boxes.isEmpty() ? 0.0 : boxes.get(0).getCenter().y;
    }
}
