package com.example.dococr.dictionary;

import com.example.dococr.exception.OcrProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 识别符号字典
 *
 * <p>按行读取，每行一个符号(去除首尾空白)，末尾追加一个字面空格符号。
 * 类别下标 c(c ≥ 1) 对应第 c-1 个符号，下标 0 保留为 CTC 空白。
 */
@Slf4j
public class SymbolDictionary {

    private final List<String> symbols;

    public SymbolDictionary(List<String> baseSymbols) {
        List<String> all = new ArrayList<>(baseSymbols);
        all.add(" ");
        this.symbols = List.copyOf(all);
    }

    public static SymbolDictionary load(InputStream in) {
        if (in == null) {
            throw new OcrProcessingException("符号字典不存在");
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String> lines = reader.lines()
                    .map(String::trim)
                    .collect(Collectors.toList());
            SymbolDictionary dictionary = new SymbolDictionary(lines);
            log.info("符号字典加载完成: {} 个符号(含空格)", dictionary.size());
            return dictionary;
        } catch (IOException | RuntimeException e) {
            throw new OcrProcessingException("读取符号字典失败", e);
        }
    }

    /**
     * 类别下标 → 符号，空白或越界时返回 null
     */
    public String symbolForClass(int classIndex) {
        int realIndex = classIndex - 1;
        if (realIndex < 0 || realIndex >= symbols.size()) {
            return null;
        }
        return symbols.get(realIndex);
    }

    public int size() {
        return symbols.size();
    }
}
