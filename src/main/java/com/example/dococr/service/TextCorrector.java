package com.example.dococr.service;

import com.example.dococr.dictionary.CorrectionDictionary;
import com.example.dococr.model.CorrectionDetail;
import com.example.dococr.model.CorrectionMethod;
import com.example.dococr.model.CorrectionResult;
import com.example.dococr.util.EditDistance;
import com.example.dococr.util.HangulUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCR 文本校正
 *
 * <p>按顺序执行以下步骤，每一步处理上一步的输出：
 * <ol>
 *   <li>合并被拆开的字段标签</li>
 *   <li>去除标签前的垃圾前缀</li>
 *   <li>拉丁字母幻觉 → 韩文</li>
 *   <li>整词词典纠错(长词优先)</li>
 *   <li>二元组/三元组频率纠错</li>
 *   <li>字段关键词模糊归一</li>
 * </ol>
 * 每次调用使用独立的校正日志，实例本身无状态，可并发调用。
 */
@Slf4j
public class TextCorrector {

    public static final double DEFAULT_MARGIN = 0.3;
    public static final double DEFAULT_MAX_CHANGE_RATIO = 0.3;

    // ==================== 各步骤的置信度 ====================

    private static final double MERGE_CONFIDENCE = 0.9;
    private static final double PREFIX_CONFIDENCE = 0.88;
    private static final double CONFUSION_CONFIDENCE = 0.9;
    private static final double DICTIONARY_CONFIDENCE = 0.95;
    private static final double KEYWORD_CONFIDENCE = 0.85;
    private static final double DEFAULT_CHANGED_CONFIDENCE = 0.8;

    // ==================== n-gram 参数 ====================

    private static final double LOW_FREQUENCY = 0.1;
    private static final double CANONICAL_FREQUENCY = 0.5;
    private static final double MIN_TRIGRAM_SIMILARITY = 0.6;
    private static final int MAX_KEYWORD_DISTANCE = 2;

    // ==================== 固定模式 ====================

    private static final Pattern LONE_DAE_LINE = Pattern.compile("(^|\\n)대[ \\t]*\\n+[ \\t]*표자");

    private static final List<RegexRule> FRAGMENT_RULES = List.of(
            new RegexRule("대\\s+표자", "대표자"),
            new RegexRule("법\\s+인명", "법인명"),
            new RegexRule("등\\s+록번호", "등록번호"),
            new RegexRule("소\\s+재지", "소재지"),
            new RegexRule("개\\s+업연월일", "개업연월일"),
            new RegexRule("사\\s+업장", "사업장"),
            new RegexRule("본\\s+점", "본점")
    );

    // 2015년12월01일법인등록번호 → 2015년12월01일\n법인등록번호
    private static final RegexRule DATE_SUFFIX_RULE = new RegexRule("(\\d{1,2}일)([법본사개])", "$1\n$2");

    private static final List<RegexRule> PREFIX_RULES = List.of(
            DATE_SUFFIX_RULE,
            // 일법인등록번호 → 법인등록번호
            new RegexRule("(?:^|\\n|\\s)(일)([법번]인등[록롤]번호)", "\n$2"),
            new RegexRule("([법번]인등)롤([번빈]호)", "$1록$2"),
            new RegexRule("등롤번호", "등록번호"),
            new RegexRule("(?:^|\\s)([일인])([법번]인명)", " $2")
    );

    private final CorrectionDictionary dictionary;
    private final double margin;
    private final double maxChangeRatio;
    private final List<Map.Entry<Pattern, String>> latinRules;
    private final List<Map.Entry<Pattern, String>> keywordRules;

    public TextCorrector(CorrectionDictionary dictionary) {
        this(dictionary, DEFAULT_MARGIN, DEFAULT_MAX_CHANGE_RATIO);
    }

    /**
     * @param margin         n-gram 替换必须超过原频率的幅度
     * @param maxChangeRatio 变化比例超过该值时置信度封顶 0.5
     */
    public TextCorrector(CorrectionDictionary dictionary, double margin, double maxChangeRatio) {
        this.dictionary = dictionary;
        this.margin = margin;
        this.maxChangeRatio = maxChangeRatio;
        this.latinRules = buildLatinRules(dictionary);
        this.keywordRules = buildKeywordRules(dictionary);
    }

    /**
     * 校正全文
     */
    public CorrectionResult correct(String text) {
        if (text == null) {
            text = "";
        }
        CorrectionSession session = new CorrectionSession();

        String corrected = mergeFragments(text, session);
        corrected = removeGarbagePrefix(corrected, session);
        corrected = correctLatinConfusion(corrected, session);
        corrected = correctByDictionary(corrected, session);
        corrected = correctByNgram(corrected, session);
        corrected = correctFieldKeywords(corrected, session);
        // 关键词修正后标签首字可能才变为可识别的形式
        corrected = applyRule(DATE_SUFFIX_RULE.pattern, DATE_SUFFIX_RULE.replacement, corrected,
                CorrectionMethod.PREFIX, PREFIX_CONFIDENCE, session);

        double confidence = calculateConfidence(text, corrected, session.details);
        if (!session.details.isEmpty()) {
            log.debug("文本校正: {} 处修改, 置信度 {}", session.details.size(), String.format("%.2f", confidence));
            session.details.forEach(detail -> log.trace("  {}", detail));
        }
        return new CorrectionResult(text, corrected, session.details, confidence);
    }

    // ==================== 1. 合并拆分标签 ====================

    private String mergeFragments(String text, CorrectionSession session) {
        String result = applyRule(LONE_DAE_LINE, "$1대표자", text, CorrectionMethod.MERGE, MERGE_CONFIDENCE, session);
        for (RegexRule rule : FRAGMENT_RULES) {
            result = applyRule(rule.pattern, rule.replacement, result, CorrectionMethod.MERGE, MERGE_CONFIDENCE, session);
        }
        return result;
    }

    // ==================== 2. 垃圾前缀 ====================

    private String removeGarbagePrefix(String text, CorrectionSession session) {
        String result = text;
        for (RegexRule rule : PREFIX_RULES) {
            result = applyRule(rule.pattern, rule.replacement, result, CorrectionMethod.PREFIX, PREFIX_CONFIDENCE, session);
        }
        return result;
    }

    // ==================== 3. 拉丁字母混淆 ====================

    private String correctLatinConfusion(String text, CorrectionSession session) {
        String result = text;
        for (Map.Entry<Pattern, String> rule : latinRules) {
            result = applyRule(rule.getKey(), Matcher.quoteReplacement(rule.getValue()), result,
                    CorrectionMethod.CONFUSION, CONFUSION_CONFIDENCE, session);
        }
        return result;
    }

    // ==================== 4. 词典纠错 ====================

    private String correctByDictionary(String text, CorrectionSession session) {
        String result = text;
        for (Map.Entry<String, String> entry : dictionary.getWordCorrections()) {
            String wrong = entry.getKey();
            int position = result.indexOf(wrong);
            if (position < 0) {
                continue;
            }
            result = result.replace(wrong, entry.getValue());
            session.record(position, wrong, entry.getValue(), CorrectionMethod.DICTIONARY, DICTIONARY_CONFIDENCE);
        }
        return result;
    }

    // ==================== 5. n-gram ====================

    private String correctByNgram(String text, CorrectionSession session) {
        char[] chars = text.toCharArray();

        for (int i = 0; i < chars.length - 1; i++) {
            String bigram = new String(chars, i, 2);
            Double freq = dictionary.bigramFrequency(bigram);
            if (freq == null || freq >= LOW_FREQUENCY) {
                continue;
            }

            BigramCandidate candidate = findBigramCorrection(chars[i], chars[i + 1], freq);
            if (candidate != null) {
                chars[i] = candidate.first;
                chars[i + 1] = candidate.second;
                session.record(i, bigram, candidate.text(), CorrectionMethod.NGRAM, candidate.frequency);
            }
        }

        for (int i = 0; i < chars.length - 2; i++) {
            String trigram = new String(chars, i, 3);
            Double freq = dictionary.trigramFrequency(trigram);
            if (freq == null || freq >= LOW_FREQUENCY) {
                continue;
            }

            TrigramCandidate candidate = findTrigramCorrection(trigram, freq);
            if (candidate != null) {
                candidate.text.getChars(0, 3, chars, i);
                session.record(i, trigram, candidate.text, CorrectionMethod.NGRAM, candidate.similarity);
            }
        }

        return new String(chars);
    }

    private BigramCandidate findBigramCorrection(char first, char second, double originalFrequency) {
        BigramCandidate best = null;

        for (char c1 : withConfusions(first)) {
            for (char c2 : withConfusions(second)) {
                Double freq = dictionary.bigramFrequency("" + c1 + c2);
                if (freq != null && (best == null || freq > best.frequency)) {
                    best = new BigramCandidate(c1, c2, freq);
                }
            }
        }

        if (best != null && best.frequency > originalFrequency + margin) {
            return best;
        }
        return null;
    }

    private TrigramCandidate findTrigramCorrection(String trigram, double originalFrequency) {
        TrigramCandidate best = null;
        double bestScore = 0.0;

        for (Map.Entry<String, Double> entry : dictionary.getTrigramFrequencies().entrySet()) {
            double freq = entry.getValue();
            if (freq < CANONICAL_FREQUENCY) {
                continue;
            }

            double similarity = trigramSimilarity(trigram, entry.getKey());
            if (similarity > MIN_TRIGRAM_SIMILARITY && similarity * freq > bestScore) {
                bestScore = similarity * freq;
                best = new TrigramCandidate(entry.getKey(), freq, similarity);
            }
        }

        if (best != null && best.frequency > originalFrequency + margin) {
            return best;
        }
        return null;
    }

    /**
     * 逐位比较：相同记 1，不同但均为韩文音节时记字母相似度
     */
    static double trigramSimilarity(String a, String b) {
        if (a.length() != 3 || b.length() != 3) {
            return 0.0;
        }
        double score = 0.0;
        for (int i = 0; i < 3; i++) {
            char ca = a.charAt(i);
            char cb = b.charAt(i);
            if (ca == cb) {
                score += 1.0;
            } else if (HangulUtils.isHangul(ca) && HangulUtils.isHangul(cb)) {
                score += HangulUtils.jamoSimilarity(ca, cb);
            }
        }
        return score / 3.0;
    }

    private List<Character> withConfusions(char c) {
        List<Character> all = new ArrayList<>();
        all.add(c);
        all.addAll(dictionary.confusionsOf(c));
        return all;
    }

    // ==================== 6. 字段关键词 ====================

    private String correctFieldKeywords(String text, CorrectionSession session) {
        String result = text;

        for (Map.Entry<Pattern, String> rule : keywordRules) {
            String keyword = rule.getValue();
            Matcher matcher = rule.getKey().matcher(result);
            StringBuilder sb = new StringBuilder();
            boolean changed = false;

            while (matcher.find()) {
                String match = matcher.group();
                if (!match.equals(keyword) && EditDistance.distance(match, keyword) <= MAX_KEYWORD_DISTANCE) {
                    session.record(matcher.start(), match, keyword, CorrectionMethod.KEYWORD, KEYWORD_CONFIDENCE);
                    matcher.appendReplacement(sb, Matcher.quoteReplacement(keyword));
                    changed = true;
                }
            }
            if (changed) {
                matcher.appendTail(sb);
                result = sb.toString();
            }
        }
        return result;
    }

    // ==================== 置信度 ====================

    private double calculateConfidence(String original, String corrected, List<CorrectionDetail> details) {
        if (original.equals(corrected)) {
            return 1.0;
        }

        int distance = EditDistance.distance(original, corrected);
        int maxLength = Math.max(original.length(), corrected.length());
        double changeRatio = (double) distance / maxLength;

        if (changeRatio > maxChangeRatio) {
            log.warn("校正变化比例过高: {}，置信度降为 0.5", String.format("%.2f", changeRatio));
            return 0.5;
        }

        if (!details.isEmpty()) {
            double average = details.stream().mapToDouble(CorrectionDetail::getConfidence).average().orElse(0.0);
            return average * (1.0 - changeRatio * 0.5);
        }
        return DEFAULT_CHANGED_CONFIDENCE;
    }

    // ==================== 工具方法 ====================

    private static String applyRule(Pattern pattern, String replacement, String text,
                                    CorrectionMethod method, double confidence, CorrectionSession session) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        int position = matcher.start();
        String original = matcher.group();
        String result = matcher.replaceAll(replacement);
        session.record(position, original, pattern.matcher(original).replaceFirst(replacement).strip(), method, confidence);
        return result;
    }

    /**
     * 整词匹配的拉丁字母规则，前后不能紧邻其他拉丁字母
     */
    private static List<Map.Entry<Pattern, String>> buildLatinRules(CorrectionDictionary dictionary) {
        List<Map.Entry<Pattern, String>> rules = new ArrayList<>();
        dictionary.getLatinConfusions().forEach((latin, hangul) -> rules.add(Map.entry(
                Pattern.compile("(?<![A-Za-z])" + Pattern.quote(latin) + "(?![A-Za-z])"), hangul)));
        return List.copyOf(rules);
    }

    /**
     * 每个关键词生成一个模糊正则，每个字允许匹配其混淆字
     */
    private static List<Map.Entry<Pattern, String>> buildKeywordRules(CorrectionDictionary dictionary) {
        List<Map.Entry<Pattern, String>> rules = new ArrayList<>();
        for (String keyword : dictionary.getFieldKeywords()) {
            StringBuilder regex = new StringBuilder();
            for (char c : keyword.toCharArray()) {
                List<Character> alternatives = dictionary.confusionsOf(c);
                if (alternatives.isEmpty()) {
                    regex.append(escape(c));
                } else {
                    regex.append('[').append(escape(c));
                    alternatives.forEach(alt -> regex.append(escape(alt)));
                    regex.append(']');
                }
            }
            rules.add(Map.entry(Pattern.compile(regex.toString()), keyword));
        }
        return List.copyOf(rules);
    }

    private static String escape(char c) {
        return Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c;
    }

    // ==================== 内部类型 ====================

    /**
     * 单次 correct 调用的校正日志
     */
    private static final class CorrectionSession {
        private final List<CorrectionDetail> details = new ArrayList<>();

        void record(int position, String original, String corrected, CorrectionMethod method, double confidence) {
            details.add(new CorrectionDetail(position, original, corrected, method, confidence));
        }
    }

    private static final class RegexRule {
        private final Pattern pattern;
        private final String replacement;

        RegexRule(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }
    }

    private static final class BigramCandidate {
        private final char first;
        private final char second;
        private final double frequency;

        BigramCandidate(char first, char second, double frequency) {
            this.first = first;
            this.second = second;
            this.frequency = frequency;
        }

        String text() {
            return "" + first + second;
        }
    }

    private static final class TrigramCandidate {
        private final String text;
        private final double frequency;
        private final double similarity;

        TrigramCandidate(String text, double frequency, double similarity) {
            this.text = text;
            this.frequency = frequency;
            this.similarity = similarity;
        }
    }
}
