package com.example.dococr.service;

import com.example.dococr.model.DetectionInput;
import com.example.dococr.model.RecognitionInput;
import com.example.dococr.model.TextRegionBox;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.*;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;
import java.util.Comparator;

/**
 * 图像 → 模型输入张量
 *
 * <p>负责检测输入的缩放与归一化，以及按文本框做透视裁剪得到识别输入。
 * 所有输出均为 CHW 排列的 float 数组。
 */
@Slf4j
public class ImageTensorService {

    // ==================== 常量定义 ====================

    public static final int DEFAULT_LIMIT_SIDE = 1280;
    static final int SIZE_ALIGN = 32;
    static final int RECOGNITION_HEIGHT = 48;

    private static final double[] DETECTION_MEAN = {0.485, 0.456, 0.406};
    private static final double[] DETECTION_STD = {0.229, 0.224, 0.225};
    private static final double[] RECOGNITION_MEAN = {0.5, 0.5, 0.5};
    private static final double[] RECOGNITION_STD = {0.5, 0.5, 0.5};

    private final int limitSide;

    public ImageTensorService() {
        this(DEFAULT_LIMIT_SIDE);
    }

    public ImageTensorService(int limitSide) {
        this.limitSide = limitSide;
    }

    /**
     * BufferedImage转RGB Mat
     */
    public Mat toRgbMat(BufferedImage image) {
        if (image == null) return new Mat();

        BufferedImage converted = new BufferedImage(
                image.getWidth(), image.getHeight(),
                BufferedImage.TYPE_3BYTE_BGR);

        Graphics2D g = converted.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();

        byte[] pixels = ((DataBufferByte) converted.getRaster()
                .getDataBuffer()).getData();

        Mat bgr = new Mat(converted.getHeight(), converted.getWidth(), CvType.CV_8UC3);
        bgr.put(0, 0, pixels);

        Mat rgb = new Mat();
        Imgproc.cvtColor(bgr, rgb, Imgproc.COLOR_BGR2RGB);
        bgr.release();
        return rgb;
    }

    // ==================== 检测输入 ====================

    /**
     * 长边限制在 limitSide 以内，两边对齐到 32 的倍数，按 ImageNet 均值方差归一化
     */
    public DetectionInput prepareDetectionInput(Mat rgb) {
        int w = rgb.cols();
        int h = rgb.rows();

        double ratio = 1.0;
        if (Math.max(h, w) > limitSide) {
            ratio = h > w ? (double) limitSide / h : (double) limitSide / w;
        }

        int resizeH = alignToStride(Math.round(h * ratio));
        int resizeW = alignToStride(Math.round(w * ratio));

        Mat resized = new Mat();
        try {
            Imgproc.resize(rgb, resized, new Size(resizeW, resizeH));
            float[] data = toChw(resized, DETECTION_MEAN, DETECTION_STD);

            log.debug("检测输入: 原图 {}x{} → {}x{} (ratio={})",
                    w, h, resizeW, resizeH, String.format("%.3f", ratio));
            return new DetectionInput(data, resizeW, resizeH, w, h, ratio);
        } finally {
            releaseMat(resized);
        }
    }

    private static int alignToStride(long size) {
        int aligned = (int) (Math.round(size / (double) SIZE_ALIGN) * SIZE_ALIGN);
        return Math.max(aligned, SIZE_ALIGN);
    }

    // ==================== 识别输入 ====================

    /**
     * 按文本框透视裁剪，缩放到高 48 并保持宽高比
     */
    public RecognitionInput cropRegion(Mat rgb, TextRegionBox box) {
        int boxW = Math.max(1, (int) Math.round(box.getWidth()));
        int boxH = Math.max(1, (int) Math.round(box.getHeight()));

        Point[] ordered = orderPoints(box.getPoints());
        MatOfPoint2f src = new MatOfPoint2f(ordered);
        MatOfPoint2f dst = new MatOfPoint2f(
                new Point(0, 0),
                new Point(boxW, 0),
                new Point(boxW, boxH),
                new Point(0, boxH));

        Mat transform = null;
        Mat patch = new Mat();
        Mat resized = new Mat();

        try {
            transform = Imgproc.getPerspectiveTransform(src, dst);
            Imgproc.warpPerspective(rgb, patch, transform, new Size(boxW, boxH),
                    Imgproc.INTER_CUBIC, Core.BORDER_REPLICATE);

            int recW = Math.max(1, (int) Math.round(RECOGNITION_HEIGHT * ((double) boxW / boxH)));
            Imgproc.resize(patch, resized, new Size(recW, RECOGNITION_HEIGHT), 0, 0, Imgproc.INTER_CUBIC);

            return new RecognitionInput(toChw(resized, RECOGNITION_MEAN, RECOGNITION_STD), recW, RECOGNITION_HEIGHT);
        } finally {
            releaseMat(src, dst, transform, patch, resized);
        }
    }

    /**
     * 角点排序为 左上、右上、右下、左下
     */
    static Point[] orderPoints(Point[] points) {
        Point[] byY = Arrays.copyOf(points, points.length);
        Arrays.sort(byY, Comparator.comparingDouble(p -> p.y));

        Point[] top = {byY[0], byY[1]};
        Point[] bottom = {byY[2], byY[3]};
        Arrays.sort(top, Comparator.comparingDouble(p -> p.x));
        Arrays.sort(bottom, Comparator.comparingDouble(p -> p.x));

        return new Point[]{top[0], top[1], bottom[1], bottom[0]};
    }

    // ==================== 工具方法 ====================

    /**
     * HWC uint8 → CHW float，先缩放到 [0,1] 再做 (x - mean) / std
     */
    private float[] toChw(Mat rgb, double[] mean, double[] std) {
        Mat scaled = new Mat();
        try {
            rgb.convertTo(scaled, CvType.CV_32FC3, 1.0 / 255.0);

            int h = scaled.rows();
            int w = scaled.cols();
            int area = h * w;
            float[] hwc = new float[area * 3];
            scaled.get(0, 0, hwc);

            float[] chw = new float[area * 3];
            for (int i = 0; i < area; i++) {
                for (int c = 0; c < 3; c++) {
                    chw[c * area + i] = (float) ((hwc[i * 3 + c] - mean[c]) / std[c]);
                }
            }
            return chw;
        } finally {
            releaseMat(scaled);
        }
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
