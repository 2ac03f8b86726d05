package com.example.dococr.service;

import com.example.dococr.exception.OcrProcessingException;
import com.example.dococr.model.DecodedSpan;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 一个文档的识别批次
 * 第 i 个 future 对应第 i 个提交的文本区域；取消作用于整个批次
 */
public class RecognitionBatch {

    private final List<CompletableFuture<DecodedSpan>> futures;
    private final AtomicBoolean cancelled;

    RecognitionBatch(List<CompletableFuture<DecodedSpan>> futures, AtomicBoolean cancelled) {
        this.futures = List.copyOf(futures);
        this.cancelled = cancelled;
    }

    public int size() {
        return futures.size();
    }

    public CompletableFuture<DecodedSpan> get(int index) {
        return futures.get(index);
    }

    public List<CompletableFuture<DecodedSpan>> getFutures() {
        return futures;
    }

    /**
     * 等待全部完成，按提交顺序返回
     *
     * @throws OcrProcessingException 批次已被取消
     */
    public List<DecodedSpan> join() {
        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } catch (CancellationException e) {
            throw new OcrProcessingException("识别批次已取消", e);
        } catch (CompletionException e) {
            throw new OcrProcessingException("识别批次执行失败", e.getCause());
        }
    }

    /**
     * 取消所有未完成的区域，已开始的任务在返回前丢弃结果
     */
    public void cancel() {
        cancelled.set(true);
        futures.forEach(f -> f.cancel(true));
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
