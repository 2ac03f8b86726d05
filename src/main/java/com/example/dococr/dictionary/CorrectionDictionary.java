package com.example.dococr.dictionary;

import com.example.dococr.exception.OcrProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 校正词典
 *
 * <p>包含：
 * <ul>
 *   <li>字形混淆组(OCR 易混的音节)</li>
 *   <li>拉丁字母幻觉 → 韩文映射</li>
 *   <li>整词纠错表(按长度降序)</li>
 *   <li>二元/三元组频率表</li>
 *   <li>字段关键词与行政区地名表</li>
 * </ul>
 * 加载后不可变，可在多个线程间共享。
 */
@Slf4j
public class CorrectionDictionary {

    public static final String DEFAULT_RESOURCE = "/dictionary/correction-dictionary.json";

    private final Map<Character, List<Character>> confusions;
    private final Map<String, String> latinConfusions;
    private final List<Map.Entry<String, String>> wordCorrections;
    private final Map<String, Double> bigramFrequencies;
    private final Map<String, Double> trigramFrequencies;
    private final List<String> fieldKeywords;
    private final List<String> regions;

    private CorrectionDictionary(DictionaryFile file) {
        this.confusions = buildConfusionMap(file.confusionGroups);
        this.latinConfusions = Collections.unmodifiableMap(new LinkedHashMap<>(file.latinConfusions));

        List<Map.Entry<String, String>> sorted = new ArrayList<>();
        file.wordCorrections.forEach((wrong, right) -> sorted.add(Map.entry(wrong, right)));
        sorted.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        this.wordCorrections = List.copyOf(sorted);

        this.bigramFrequencies = Map.copyOf(file.bigramFrequencies);
        this.trigramFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(file.trigramFrequencies));
        this.fieldKeywords = List.copyOf(file.fieldKeywords);
        this.regions = List.copyOf(file.regions);
    }

    /**
     * 从类路径加载默认词典
     */
    public static CorrectionDictionary loadDefault() {
        try (InputStream in = CorrectionDictionary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new OcrProcessingException("校正词典不存在: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new OcrProcessingException("读取校正词典失败: " + DEFAULT_RESOURCE, e);
        }
    }

    public static CorrectionDictionary load(InputStream in) throws IOException {
        DictionaryFile file = new ObjectMapper().readValue(in, DictionaryFile.class);
        CorrectionDictionary dictionary = new CorrectionDictionary(file);
        log.info("校正词典加载完成: 混淆字 {} 个, 纠错词 {} 条, 二元组 {} 条, 三元组 {} 条, 地名 {} 个",
                dictionary.confusions.size(), dictionary.wordCorrections.size(),
                dictionary.bigramFrequencies.size(), dictionary.trigramFrequencies.size(),
                dictionary.regions.size());
        return dictionary;
    }

    /**
     * 同一混淆组内的字两两互为候选，一个字可属于多个组
     */
    private static Map<Character, List<Character>> buildConfusionMap(List<List<String>> groups) {
        Map<Character, LinkedHashSet<Character>> merged = new HashMap<>();
        for (List<String> group : groups) {
            for (String member : group) {
                char c = member.charAt(0);
                LinkedHashSet<Character> alternatives = merged.computeIfAbsent(c, k -> new LinkedHashSet<>());
                for (String other : group) {
                    if (other.charAt(0) != c) {
                        alternatives.add(other.charAt(0));
                    }
                }
            }
        }

        Map<Character, List<Character>> result = new HashMap<>();
        merged.forEach((c, alternatives) -> result.put(c, List.copyOf(alternatives)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * 某个字的混淆候选(不含自身)，无候选时返回空列表
     */
    public List<Character> confusionsOf(char c) {
        return confusions.getOrDefault(c, List.of());
    }

    public Map<String, String> getLatinConfusions() {
        return latinConfusions;
    }

    public List<Map.Entry<String, String>> getWordCorrections() {
        return wordCorrections;
    }

    public Double bigramFrequency(String bigram) {
        return bigramFrequencies.get(bigram);
    }

    public Double trigramFrequency(String trigram) {
        return trigramFrequencies.get(trigram);
    }

    public Map<String, Double> getTrigramFrequencies() {
        return trigramFrequencies;
    }

    public List<String> getFieldKeywords() {
        return fieldKeywords;
    }

    public List<String> getRegions() {
        return regions;
    }

    /**
     * JSON 文件结构
     */
    static class DictionaryFile {
        public List<List<String>> confusionGroups = new ArrayList<>();
        public Map<String, String> latinConfusions = new LinkedHashMap<>();
        public Map<String, String> wordCorrections = new LinkedHashMap<>();
        public Map<String, Double> bigramFrequencies = new HashMap<>();
        public Map<String, Double> trigramFrequencies = new LinkedHashMap<>();
        public List<String> fieldKeywords = new ArrayList<>();
        public List<String> regions = new ArrayList<>();
    }
}
