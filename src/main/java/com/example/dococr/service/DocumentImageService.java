package com.example.dococr.service;

import com.example.dococr.exception.OcrProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 文档图像加载
 * 支持 PNG/JPEG 等 ImageIO 可读格式，PDF 只渲染第一页
 */
@Service
@Slf4j
public class DocumentImageService {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final int renderDpi;

    public DocumentImageService(@Value("${ocr.render.dpi:200}") int renderDpi) {
        this.renderDpi = renderDpi;
    }

    /**
     * 读取上传的文件内容
     *
     * @param content 文件字节
     * @return RGB 图像
     */
    public BufferedImage load(byte[] content) {
        if (content == null || content.length == 0) {
            throw new OcrProcessingException("文件内容为空");
        }
        return isPdf(content) ? renderFirstPage(content) : readImage(content);
    }

    private BufferedImage readImage(byte[] content) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image == null) {
                throw new OcrProcessingException("无法识别的图像格式");
            }
            log.debug("读取图像 {}x{}", image.getWidth(), image.getHeight());
            return image;
        } catch (IOException e) {
            throw new OcrProcessingException("读取图像失败", e);
        }
    }

    private BufferedImage renderFirstPage(byte[] content) {
        try (PDDocument document = PDDocument.load(content)) {
            if (document.getNumberOfPages() == 0) {
                throw new OcrProcessingException("PDF 没有页面");
            }

            PDFRenderer renderer = new PDFRenderer(document);
            renderer.setSubsamplingAllowed(false);

            PDPage page = document.getPage(0);
            float widthPt = page.getMediaBox().getWidth();
            int adaptiveDpi = adaptDpi(widthPt);

            BufferedImage image = renderer.renderImageWithDPI(0, adaptiveDpi, ImageType.RGB);
            log.debug("PDF 第一页渲染完成 (DPI: {}, {}x{})", adaptiveDpi, image.getWidth(), image.getHeight());
            return image;
        } catch (IOException e) {
            throw new OcrProcessingException("PDF 渲染失败", e);
        }
    }

    /**
     * 根据页面宽度动态调整渲染DPI
     *
     * @param widthPt 页面宽度(点)
     * @return 调整后的DPI值
     */
    int adaptDpi(float widthPt) {
        if (widthPt > 800) {
            return Math.min(renderDpi, 180); // A3或更大
        }
        if (widthPt < 400) {
            return Math.max(renderDpi, 220); // 小页略提DPI
        }
        return renderDpi;
    }

    private static boolean isPdf(byte[] content) {
        if (content.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
