package com.example.dococr.service;

import com.example.dococr.exception.OcrProcessingException;
import com.example.dococr.model.DecodedSpan;
import com.example.dococr.model.RecognitionLogits;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 文本区域识别线程池
 *
 * <p>每个区域一个任务：调用识别模型 → CTC 解码。
 * 单个区域失败时记录 WARN 并降级为空结果，不影响同批次其他区域。
 * 不做自动重试。
 */
@Slf4j
public class RecognitionExecutor {

    private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

    private final ThreadPoolExecutor executorService;

    public RecognitionExecutor(int poolSize, int queueCapacity) {
        this.executorService = createThreadPool(poolSize, queueCapacity);
        log.info("识别线程池已创建: 线程数={}, 队列容量={}", executorService.getCorePoolSize(), queueCapacity);
    }

    /**
     * 创建自定义线程池
     */
    private ThreadPoolExecutor createThreadPool(int poolSize, int queueCapacity) {
        int corePoolSize = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        BlockingQueue<Runnable> workQueue = new ArrayBlockingQueue<>(queueCapacity);

        int poolNumber = POOL_NUMBER.getAndIncrement();
        AtomicInteger threadNumber = new AtomicInteger(1);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r,
                    "ocr-recognition-pool-" + poolNumber + "-thread-" + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        };

        RejectedExecutionHandler handler = new ThreadPoolExecutor.CallerRunsPolicy();

        return new ThreadPoolExecutor(
                corePoolSize,
                corePoolSize,
                60L,
                TimeUnit.SECONDS,
                workQueue,
                threadFactory,
                handler
        );
    }

    /**
     * 单个区域的识别调用
     */
    @FunctionalInterface
    public interface RegionRecognizer<T> {
        RecognitionLogits recognize(T region) throws Exception;
    }

    /**
     * 提交一个文档的所有区域
     *
     * @param regions    识别输入，顺序即结果顺序
     * @param recognizer 识别模型调用
     * @param decoder    CTC 解码器
     * @param listener   每完成一个区域通知一次
     */
    public <T> RecognitionBatch submitBatch(List<T> regions,
                                            RegionRecognizer<T> recognizer,
                                            SequenceDecoder decoder,
                                            ProgressListener listener) {
        if (recognizer == null) {
            throw new OcrProcessingException("识别模型未配置");
        }
        if (executorService.isShutdown()) {
            throw new OcrProcessingException("识别线程池已关闭");
        }

        int total = regions.size();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicInteger completed = new AtomicInteger(0);
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;

        List<CompletableFuture<DecodedSpan>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int index = i;
            final T region = regions.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (cancelled.get()) {
                    return DecodedSpan.empty();
                }
                DecodedSpan span = recognizeRegion(index, region, recognizer, decoder);
                progress.onRegionRecognized(completed.incrementAndGet(), total);
                return span;
            }, executorService));
        }

        log.debug("提交识别批次: {} 个区域", total);
        return new RecognitionBatch(futures, cancelled);
    }

    private <T> DecodedSpan recognizeRegion(int index, T region,
                                            RegionRecognizer<T> recognizer,
                                            SequenceDecoder decoder) {
        try {
            RecognitionLogits logits = recognizer.recognize(region);
            if (logits == null) {
                log.warn("第 {} 个文本区域识别结果为空", index);
                return DecodedSpan.empty();
            }
            DecodedSpan span = decoder.decode(logits);
            log.trace("区域 {} → {}", index, span);
            return span;
        } catch (Exception e) {
            log.warn("第 {} 个文本区域识别失败，按空结果处理: {}", index, e.getMessage());
            return DecodedSpan.empty();
        }
    }

    /**
     * 服务销毁
     */
    @PreDestroy
    public void shutdown() {
        log.info("正在关闭识别线程池...");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("线程池未能在10秒内关闭，强制关闭");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("线程池关闭被中断", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("识别线程池已关闭");
    }

    public boolean isShutdown() {
        return executorService.isShutdown();
    }
}
