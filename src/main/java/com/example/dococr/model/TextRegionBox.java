package com.example.dococr.model;

import lombok.Getter;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Size;

import java.util.Arrays;

/**
 * 文本区域框
 * 由检测概率图中的一个连通域生成的旋转矩形，包含四个角点、中心点、未旋转时的宽高以及旋转角度。
 * width 始终是长轴，height 始终是短轴，与角点的环绕顺序无关。
 */
@Getter
public class TextRegionBox {
    private final Point[] points;
    private final Point center;
    private final double width;
    private final double height;
    private final double angle;

    private TextRegionBox(Point[] points, Point center, double width, double height, double angle) {
        this.points = points;
        this.center = center;
        this.width = width;
        this.height = height;
        this.angle = angle;
    }

    /**
     * 由旋转矩形构建，宽高归一化为长轴/短轴
     */
    public static TextRegionBox fromRotatedRect(RotatedRect rect) {
        RotatedRect normalized = normalize(rect);
        Point[] corners = new Point[4];
        normalized.points(corners);
        return new TextRegionBox(
                corners,
                new Point(normalized.center.x, normalized.center.y),
                normalized.size.width,
                normalized.size.height,
                normalized.angle);
    }

    /**
     * 按中心点和宽高直接构建一个水平框(主要用于上游已给出轴对齐框的场景)
     */
    public static TextRegionBox axisAligned(double centerX, double centerY, double width, double height) {
        return fromRotatedRect(new RotatedRect(new Point(centerX, centerY), new Size(width, height), 0.0));
    }

    /**
     * 坐标缩放：检测图坐标 → 原图坐标
     * 返回新的框，中心点与宽高由缩放后的角点重新计算
     */
    public TextRegionBox rescale(double scaleX, double scaleY) {
        Point[] scaled = new Point[4];
        double cx = 0.0;
        double cy = 0.0;
        for (int i = 0; i < 4; i++) {
            scaled[i] = new Point(points[i].x * scaleX, points[i].y * scaleY);
            cx += scaled[i].x;
            cy += scaled[i].y;
        }

        double side1 = distance(scaled[0], scaled[1]);
        double side2 = distance(scaled[1], scaled[2]);
        double newWidth = Math.max(side1, side2);
        double newHeight = Math.min(side1, side2);

        return new TextRegionBox(scaled, new Point(cx / 4.0, cy / 4.0), newWidth, newHeight, angle);
    }

    public double getMinX() {
        return center.x - width / 2.0;
    }

    public double getMaxX() {
        return center.x + width / 2.0;
    }

    public Point[] getPoints() {
        return Arrays.copyOf(points, points.length);
    }

    private static RotatedRect normalize(RotatedRect rect) {
        double w = rect.size.width;
        double h = rect.size.height;
        double a = rect.angle;

        if (w < h) {
            double tmp = w;
            w = h;
            h = tmp;
            a -= 90.0;
        }
        while (a > 90.0) a -= 180.0;
        while (a <= -90.0) a += 180.0;

        return new RotatedRect(new Point(rect.center.x, rect.center.y), new Size(w, h), a);
    }

    private static double distance(Point p1, Point p2) {
        return Math.hypot(p1.x - p2.x, p1.y - p2.y);
    }

    @Override
    public String toString() {
        return "TextRegionBox{" +
                "center=(" + String.format("%.1f", center.x) + ", " + String.format("%.1f", center.y) + ")" +
                ", size=" + String.format("%.1f", width) + "x" + String.format("%.1f", height) +
                ", angle=" + String.format("%.1f", angle) +
                '}';
    }
}
