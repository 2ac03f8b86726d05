package com.example.dococr.controller;

import com.example.dococr.exception.OcrProcessingException;
import com.example.dococr.model.CorrectionResult;
import com.example.dococr.model.DocumentOcrResult;
import com.example.dococr.model.DocumentType;
import com.example.dococr.model.FieldRecord;
import com.example.dococr.service.DocumentImageService;
import com.example.dococr.service.DocumentOcrService;
import com.example.dococr.service.ProgressService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.awt.image.BufferedImage;

@RestController
@RequestMapping("/api/ocr")
@CrossOrigin(origins = "*")
@Slf4j
public class OcrController {

    @Autowired
    private DocumentOcrService documentOcrService;

    @Autowired
    private DocumentImageService documentImageService;

    @Autowired
    private ProgressService progressService;

    @PostMapping(value = "/correct", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<ApiResponse<CorrectionResult>> correct(@RequestBody(required = false) String text) {
        if (text == null || text.isBlank()) {
            return ResponseEntity.badRequest().body(ApiResponse.fail("文本不能为空"));
        }
        try {
            return ResponseEntity.ok(ApiResponse.ok("校正完成", documentOcrService.correctText(text)));
        } catch (Exception e) {
            log.error("文本校正失败", e);
            return ResponseEntity.internalServerError().body(ApiResponse.fail("处理失败: " + e.getMessage()));
        }
    }

    @PostMapping(value = "/parse", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<ApiResponse<FieldRecord>> parse(@RequestBody(required = false) String text,
                                                          @RequestParam(value = "correct", defaultValue = "true") boolean correct) {
        if (text == null || text.isBlank()) {
            return ResponseEntity.badRequest().body(ApiResponse.fail("文本不能为空"));
        }
        try {
            return ResponseEntity.ok(ApiResponse.ok("解析完成", documentOcrService.parseText(text, correct)));
        } catch (Exception e) {
            log.error("字段解析失败", e);
            return ResponseEntity.internalServerError().body(ApiResponse.fail("处理失败: " + e.getMessage()));
        }
    }

    @PostMapping("/upload")
    public ResponseEntity<ApiResponse<DocumentOcrResult>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "documentType", required = false) String documentType) {

        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.fail("文件不能为空"));
        }
        if (!documentOcrService.isModelAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.fail("OCR 模型未配置"));
        }

        BufferedImage image;
        try {
            image = documentImageService.load(file.getBytes());
        } catch (OcrProcessingException e) {
            log.warn("无法读取上传文件 {}: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.fail("无法读取文件: " + e.getMessage()));
        } catch (Exception e) {
            log.error("读取上传文件失败", e);
            return ResponseEntity.internalServerError().body(ApiResponse.fail("处理失败: " + e.getMessage()));
        }

        try {
            DocumentType type = DocumentType.fromHint(documentType);
            DocumentOcrResult result = documentOcrService.process(image, type, progressService);
            return ResponseEntity.ok(ApiResponse.ok("识别完成", result));
        } catch (Exception e) {
            log.error("文档处理失败: {}", file.getOriginalFilename(), e);
            return ResponseEntity.internalServerError().body(ApiResponse.fail("处理失败: " + e.getMessage()));
        }
    }

    @GetMapping("/progress")
    public SseEmitter progress() {
        return progressService.createEmitter();
    }

    static class ApiResponse<T> {
        private boolean success;
        private String message;
        private T data;

        public ApiResponse(boolean success, String message, T data) {
            this.success = success;
            this.message = message;
            this.data = data;
        }

        static <T> ApiResponse<T> ok(String message, T data) {
            return new ApiResponse<>(true, message, data);
        }

        static <T> ApiResponse<T> fail(String message) {
            return new ApiResponse<>(false, message, null);
        }

        public boolean isSuccess() {
            return success;
        }

        public void setSuccess(boolean success) {
            this.success = success;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public T getData() {
            return data;
        }

        public void setData(T data) {
            this.data = data;
        }
    }
}
