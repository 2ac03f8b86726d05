package com.example.dococr.dictionary;

import com.example.dococr.exception.OcrProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * 符号字典的延迟加载
 * 首次使用时读取一次，之后复用；资源不存在时抛出 OcrProcessingException
 */
@Slf4j
public class SymbolDictionaryProvider {

    private final Resource resource;
    private volatile SymbolDictionary dictionary;

    public SymbolDictionaryProvider(Resource resource) {
        this.resource = resource;
    }

    private SymbolDictionaryProvider(SymbolDictionary dictionary) {
        this.resource = null;
        this.dictionary = dictionary;
    }

    /**
     * 使用已加载好的字典
     */
    public static SymbolDictionaryProvider of(SymbolDictionary dictionary) {
        return new SymbolDictionaryProvider(dictionary);
    }

    public SymbolDictionary get() {
        SymbolDictionary loaded = dictionary;
        if (loaded == null) {
            synchronized (this) {
                loaded = dictionary;
                if (loaded == null) {
                    loaded = load();
                    dictionary = loaded;
                }
            }
        }
        return loaded;
    }

    public boolean isAvailable() {
        return dictionary != null || (resource != null && resource.exists());
    }

    private SymbolDictionary load() {
        if (resource == null || !resource.exists()) {
            throw new OcrProcessingException("符号字典不存在: " + resource);
        }
        log.info("加载符号字典: {}", resource);
        try (InputStream in = resource.getInputStream()) {
            return SymbolDictionary.load(in);
        } catch (IOException e) {
            throw new OcrProcessingException("读取符号字典失败: " + resource, e);
        }
    }
}
