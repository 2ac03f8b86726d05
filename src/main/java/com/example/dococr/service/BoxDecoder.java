package com.example.dococr.service;

import com.example.dococr.model.DocumentType;
import com.example.dococr.model.ProbabilityMap;
import com.example.dococr.model.TextRegionBox;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * 检测概率图 → 文本区域框
 *
 * <p>处理流程：
 * <ol>
 *   <li>按阈值二值化</li>
 *   <li>6×1 水平膨胀，连接字内断裂而不合并相邻栏位</li>
 *   <li>提取连通域轮廓，过滤面积小于 100 的噪点</li>
 *   <li>最小外接旋转矩形</li>
 *   <li>非对称扩张：宽 ×1.5，高 ×1.4</li>
 * </ol>
 * 输出坐标位于检测图坐标系，不保证顺序。
 */
@Slf4j
public class BoxDecoder {

    // ==================== 常量定义 ====================

    static final int DILATE_KERNEL_WIDTH = 6;
    static final int DILATE_KERNEL_HEIGHT = 1;
    static final double MIN_COMPONENT_AREA = 100.0;
    static final double UNCLIP_WIDTH_RATIO = 1.5;
    static final double UNCLIP_HEIGHT_RATIO = 1.4;

    public static final double BUSINESS_REGISTRATION_THRESHOLD = 0.35;
    public static final double ID_DOCUMENT_THRESHOLD = 0.33;
    public static final double DEFAULT_THRESHOLD = 0.30;

    private final double businessRegistrationThreshold;
    private final double idCardThreshold;
    private final double driverLicenseThreshold;
    private final double defaultThreshold;

    public BoxDecoder() {
        this(BUSINESS_REGISTRATION_THRESHOLD, ID_DOCUMENT_THRESHOLD, ID_DOCUMENT_THRESHOLD, DEFAULT_THRESHOLD);
    }

    public BoxDecoder(double businessRegistrationThreshold, double idCardThreshold,
                      double driverLicenseThreshold, double defaultThreshold) {
        this.businessRegistrationThreshold = businessRegistrationThreshold;
        this.idCardThreshold = idCardThreshold;
        this.driverLicenseThreshold = driverLicenseThreshold;
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * 按文档类型选择二值化阈值
     */
    public double thresholdFor(DocumentType type) {
        return switch (type) {
            case BUSINESS_REGISTRATION -> businessRegistrationThreshold;
            case ID_CARD -> idCardThreshold;
            case DRIVER_LICENSE -> driverLicenseThreshold;
            case UNKNOWN -> defaultThreshold;
        };
    }

    /**
     * 按文档类型阈值解码
     */
    public List<TextRegionBox> decode(ProbabilityMap map, DocumentType type) {
        return decode(map, thresholdFor(type));
    }

    /**
     * 解码概率图
     *
     * @param map       检测概率图
     * @param threshold 二值化阈值
     * @return 检测图坐标系下的文本框
     */
    public List<TextRegionBox> decode(ProbabilityMap map, double threshold) {
        List<RotatedRect> rawRects = findRawRects(map, threshold);
        List<TextRegionBox> boxes = new ArrayList<>(rawRects.size());

        for (RotatedRect raw : rawRects) {
            boxes.add(unclip(raw));
        }

        log.debug("概率图 {}x{} 阈值 {} → {} 个文本框",
                map.getWidth(), map.getHeight(), threshold, boxes.size());
        return boxes;
    }

    /**
     * 检测图坐标 → 原图坐标
     */
    public List<TextRegionBox> rescaleAll(List<TextRegionBox> boxes,
                                          int originalWidth, int originalHeight,
                                          int detectionWidth, int detectionHeight) {
        double scaleX = (double) originalWidth / detectionWidth;
        double scaleY = (double) originalHeight / detectionHeight;

        List<TextRegionBox> rescaled = new ArrayList<>(boxes.size());
        for (TextRegionBox box : boxes) {
            rescaled.add(box.rescale(scaleX, scaleY));
        }
        return rescaled;
    }

    /**
     * 二值化 + 膨胀 + 轮廓 + 最小外接矩形，不做扩张
     */
    List<RotatedRect> findRawRects(ProbabilityMap map, double threshold) {
        Mat prob = null;
        Mat binary = null;
        Mat hierarchy = null;
        List<MatOfPoint> contours = new ArrayList<>();

        try {
            // 1. 概率图 → Mat
            prob = new Mat(map.getHeight(), map.getWidth(), CvType.CV_32FC1);
            prob.put(0, 0, map.getData());

            // 2. 二值化
            binary = new Mat();
            Imgproc.threshold(prob, binary, threshold, 1.0, Imgproc.THRESH_BINARY);
            binary.convertTo(binary, CvType.CV_8UC1, 255);

            // 3. 水平膨胀
            Mat kernel = Imgproc.getStructuringElement(
                    Imgproc.MORPH_RECT, new Size(DILATE_KERNEL_WIDTH, DILATE_KERNEL_HEIGHT));
            Imgproc.dilate(binary, binary, kernel);
            kernel.release();

            // 4. 连通域外轮廓，内部空洞不单独成框
            hierarchy = new Mat();
            Imgproc.findContours(binary, contours, hierarchy,
                    Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            List<RotatedRect> rects = new ArrayList<>();
            int dropped = 0;
            for (MatOfPoint contour : contours) {
                if (Imgproc.contourArea(contour) < MIN_COMPONENT_AREA) {
                    dropped++;
                    continue;
                }
                MatOfPoint2f contour2f = new MatOfPoint2f(contour.toArray());
                rects.add(Imgproc.minAreaRect(contour2f));
                contour2f.release();
            }

            log.trace("轮廓总数={}, 噪点过滤={}, 保留={}", contours.size(), dropped, rects.size());
            return rects;

        } finally {
            releaseMat(prob, binary, hierarchy);
            contours.forEach(MatOfPoint::release);
        }
    }

    /**
     * 按长轴/短轴扩张，中心与角度不变
     */
    private TextRegionBox unclip(RotatedRect raw) {
        TextRegionBox normalized = TextRegionBox.fromRotatedRect(raw);
        RotatedRect expanded = new RotatedRect(
                new Point(normalized.getCenter().x, normalized.getCenter().y),
                new Size(normalized.getWidth() * UNCLIP_WIDTH_RATIO,
                        normalized.getHeight() * UNCLIP_HEIGHT_RATIO),
                normalized.getAngle());
        return TextRegionBox.fromRotatedRect(expanded);
    }

    /**
     * 释放Mat资源
     */
    private void releaseMat(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null && !mat.empty()) {
                mat.release();
            }
        }
    }
}
