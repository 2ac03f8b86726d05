package com.example.dococr.service;

import com.example.dococr.dictionary.CorrectionDictionary;
import com.example.dococr.model.FieldRecord;
import com.example.dococr.model.FieldRecord.Field;
import com.example.dococr.util.HangulUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 营业执照字段提取
 *
 * <p>处理流程：
 * <ol>
 *   <li>结构预处理：找出 "标签:值" 片段，模糊校验标签后在其前面补换行，拆开被合并到同一行的多个字段</li>
 *   <li>逐行规范化：(F)→(주)、去方括号、地名纠正</li>
 *   <li>两轮匹配：第一轮编辑距离阈值 1，第二轮阈值 2，每个字段只写入一次</li>
 *   <li>法人登记号独立扫描</li>
 *   <li>地址兜底：两个地址都为空时取第一行含地名的文本</li>
 * </ol>
 * 解析歧义不会抛异常，无法识别的字段保持空串。
 */
@Slf4j
public class FuzzyFieldExtractor {

    private static final int[] PASS_THRESHOLDS = {1, 2};

    // ==================== 标签 ====================

    static final List<String> STRUCTURAL_KEYWORDS = List.of(
            "사업장소재지", "본점소재지", "법인등록번호", "개업연월일", "등록번호", "대표자", "법인명", "단체명");

    private static final List<String> REGISTRATION_KEYS = List.of("등록번호", "등륵번호", "등록번오");
    private static final List<String> CORPORATE_NAME_KEYS = List.of("법인명", "단체명", "상호");
    private static final List<String> REPRESENTATIVE_KEYS = List.of("대표자", "성명");
    private static final List<String> DATE_KEYS = List.of("개업연월일", "개업일", "개업년월일");
    private static final List<String> ADDRESS_KEYS = List.of("소재지", "사업장", "주소");
    private static final String HEAD_OFFICE_PREFIX = "본점소재";

    static final List<String> TRUNCATION_KEYS = Stream.of(
                    REGISTRATION_KEYS, CORPORATE_NAME_KEYS, REPRESENTATIVE_KEYS, DATE_KEYS, ADDRESS_KEYS,
                    List.of("법인등록번호", "본점소재지", "사업장소재지"))
            .flatMap(List::stream)
            .distinct()
            .collect(Collectors.toUnmodifiableList());

    private static final String ADMIN_SUFFIXES = "시도군구";

    // ==================== 正则 ====================

    private static final Pattern NEWLINES = Pattern.compile("\\r\\n|\\n|\\r");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DATE_SUFFIX = Pattern.compile("(\\d{1,2}일)([가-힣])");
    private static final Pattern SPLIT_HO = Pattern.compile("등록번\\s+호\\s*:");
    private static final Pattern KEY_VALUE = Pattern.compile("([가-힣]{2,8})\\s*:");
    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^가-힣a-zA-Z0-9]");
    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^가-힣a-zA-Z0-9\\s]");

    private static final Pattern REG_NUMBER = Pattern.compile("(?<!\\d)\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{5}(?!\\d)");
    private static final Pattern REG_NUMBER_DASHED = Pattern.compile("\\d{3}-\\d{2}-\\d{5}");
    private static final Pattern DATE = Pattern.compile("\\d{4}\\s?년\\s?\\d{2}\\s?월\\s?\\d{2}\\s?일");
    private static final Pattern CORP_REG_KEY = Pattern.compile("법인[등들둥][록녹륙롤][번빈]호");
    private static final List<Pattern> CORP_REG_NUMBERS = List.of(
            Pattern.compile(":\\s*(\\d{6})[-\\s]?(\\d{7})"),
            Pattern.compile("(\\d{6})[-\\s]?(\\d{7})"),
            Pattern.compile("(\\d{6})\\D?(\\d{7})"),
            Pattern.compile("(\\d{13})")
    );

    private static final Pattern CORPORATE_LABELS = Pattern.compile("\\(단체명\\)|\\(법인명\\)|법인명|단체명|상호|:");
    private static final Pattern CORPORATE_PAREN = Pattern.compile("\\(법인명\\)|\\(단체명\\)");
    private static final Pattern REPRESENTATIVE_LABELS = Pattern.compile("대표자|내표자|성명");
    private static final Pattern ADDRESS_LABELS = Pattern.compile("본점소재지|본정소재지|사업장소재지|소재지|사업장|본점|본정|주소|:");
    private static final Pattern FALLBACK_LABELS = Pattern.compile("본점소재지|사업장소재지|소재지|:");

    private final CorrectionDictionary dictionary;

    public FuzzyFieldExtractor(CorrectionDictionary dictionary) {
        this.dictionary = dictionary;
    }

    /**
     * 解析校正后的全文
     */
    public FieldRecord extract(String text) {
        FieldRecord record = new FieldRecord();
        if (text == null || text.isBlank()) {
            return record;
        }

        ParseContext ctx = newContext();
        String prepared = preprocess(text, ctx);

        List<LineView> lines = new ArrayList<>();
        for (String raw : NEWLINES.split(prepared)) {
            String normalized = normalizeLine(raw, ctx);
            if (!normalized.isEmpty()) {
                lines.add(new LineView(normalized));
            }
        }

        for (int threshold : PASS_THRESHOLDS) {
            for (LineView line : lines) {
                matchLine(line, threshold, record, ctx);
            }
        }

        extractCorporateRegistrationNumber(lines, record);
        applyAddressFallback(lines, record, ctx);

        log.debug("字段解析完成: {} 行, 命中 {}/{} 个字段, 距离缓存 {} 项",
                lines.size(), record.filledCount(), Field.values().length, ctx.cacheSize());
        return record;
    }

    // ==================== 结构预处理 ====================

    String preprocess(String text, ParseContext ctx) {
        String result = text.replace('：', ':');

        // 2015년12월01일법인등록번호 → 2015년12월01일 법인등록번호
        result = DATE_SUFFIX.matcher(result).replaceAll("$1 $2");
        result = SPLIT_HO.matcher(result).replaceAll("등록번호:");

        List<Integer> boundaries = new ArrayList<>();
        Matcher matcher = KEY_VALUE.matcher(result);
        while (matcher.find()) {
            String key = matcher.group(1);
            int start = matcher.start();
            if (start == 0 || isLineBreak(result.charAt(start - 1))) {
                continue;
            }
            // "법인명(단체명):" 括号内的别名属于同一个标签
            if (previousNonBlank(result, start) == '(') {
                continue;
            }
            if (!isStructuralKeyword(key, ctx)) {
                continue;
            }
            // "사업장 소재지:" 这类被空格拆开的标签不断行
            if (isSplitLabel(result, start, key, ctx)) {
                continue;
            }
            boundaries.add(start);
        }

        if (boundaries.isEmpty()) {
            return result;
        }
        StringBuilder sb = new StringBuilder(result);
        for (int i = boundaries.size() - 1; i >= 0; i--) {
            sb.insert((int) boundaries.get(i), '\n');
        }
        log.trace("结构预处理插入 {} 处换行", boundaries.size());
        return sb.toString();
    }

    /**
     * 候选标签与字段关键词模糊匹配，允许 0~2 个字的垃圾前缀
     */
    boolean isStructuralKeyword(String candidate, ParseContext ctx) {
        String normalized = WHITESPACE.matcher(candidate).replaceAll("");

        for (int skip = 0; skip <= 2; skip++) {
            if (normalized.length() - skip < 2) {
                break;
            }
            String attempt = normalized.substring(skip);

            for (String keyword : STRUCTURAL_KEYWORDS) {
                if (attempt.contains(keyword)) {
                    return true;
                }
                int allowed = Math.min(2, keyword.length() / 2);
                if (Math.abs(attempt.length() - keyword.length()) <= allowed
                        && ctx.within(attempt, keyword, allowed)) {
                    return true;
                }
                if (attempt.length() >= keyword.length()
                        && ctx.within(attempt.substring(0, keyword.length()), keyword, allowed)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isSplitLabel(String text, int start, String key, ParseContext ctx) {
        int lineStart = Math.max(text.lastIndexOf('\n', start - 1), text.lastIndexOf('\r', start - 1)) + 1;
        String prefix = WHITESPACE.matcher(text.substring(lineStart, start)).replaceAll("");
        if (prefix.isEmpty() || prefix.length() > 3) {
            return false;
        }
        String combined = prefix + key;
        for (String keyword : STRUCTURAL_KEYWORDS) {
            if (ctx.within(combined, keyword, 1)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private static char previousNonBlank(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return c;
            }
        }
        return '\0';
    }

    // ==================== 行规范化 ====================

    String normalizeLine(String line, ParseContext ctx) {
        String clean = line.replace("(F)", "(주)")
                .replace("(f)", "(주)")
                .replace("[", "")
                .replace("]", "")
                .trim();
        if (clean.isEmpty()) {
            return clean;
        }

        return Arrays.stream(WHITESPACE.split(clean))
                .map(word -> correctRegion(word, ctx))
                .collect(Collectors.joining(" "));
    }

    /**
     * 地名纠正：精确匹配 → 拉丁字母幻觉表 → 同后缀的有界编辑距离
     */
    private String correctRegion(String word, ParseContext ctx) {
        if (ctx.isRegion(word)) {
            return word;
        }

        String latin = dictionary.getLatinConfusions().get(word);
        if (latin != null) {
            return latin;
        }

        if (word.length() < 3 || word.length() > 6 || !HangulUtils.containsHangul(word)) {
            return word;
        }
        char suffix = word.charAt(word.length() - 1);
        if (ADMIN_SUFFIXES.indexOf(suffix) < 0) {
            return word;
        }

        int threshold = word.length() <= 3 ? 1 : 2;
        String best = null;
        int bestDistance = threshold + 1;
        for (String region : ctx.regions()) {
            if (region.charAt(region.length() - 1) != suffix
                    || Math.abs(region.length() - word.length()) > threshold) {
                continue;
            }
            int distance = ctx.distance(word, region, threshold);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = region;
            }
        }

        if (best != null) {
            log.trace("地名纠正: {} → {}", word, best);
            return best;
        }
        return word;
    }

    // ==================== 字段匹配 ====================

    private void matchLine(LineView line, int threshold, FieldRecord record, ParseContext ctx) {
        boolean corporateRegistrationLine = line.isCorporateRegistrationLine();

        // 1. 사업자 등록번호
        if (record.isEmpty(Field.REGISTRATION_NUMBER)) {
            boolean keyed = !corporateRegistrationLine
                    && matchKey(line.cleanKey, REGISTRATION_KEYS, threshold, ctx) != KeyMatch.NONE;
            if (keyed || REG_NUMBER_DASHED.matcher(line.text).find()) {
                Matcher m = REG_NUMBER.matcher(line.text);
                if (m.find()) {
                    record.fill(Field.REGISTRATION_NUMBER, m.group());
                }
            }
        }

        // 2. 법인명，排除 "법인사업자" 这类表头
        if (record.isEmpty(Field.CORPORATE_NAME) && !corporateRegistrationLine
                && !line.cleanKey.startsWith("법인사업") && !line.cleanKey.startsWith("사업자")) {
            KeyMatch match = matchKey(line.cleanKey, CORPORATE_NAME_KEYS, threshold, ctx);
            if (match != KeyMatch.NONE) {
                record.fill(Field.CORPORATE_NAME, corporateNameValue(line, match, ctx));
            }
        }

        // 3. 대표자
        if (record.isEmpty(Field.REPRESENTATIVE)) {
            KeyMatch match = matchKey(line.cleanKey, REPRESENTATIVE_KEYS, threshold, ctx);
            if (match != KeyMatch.NONE) {
                record.fill(Field.REPRESENTATIVE, representativeValue(line, match, ctx));
            }
        }

        // 4. 개업연월일
        if (record.isEmpty(Field.ESTABLISHMENT_DATE)
                && matchKey(line.cleanKey, DATE_KEYS, threshold, ctx) != KeyMatch.NONE) {
            Matcher m = DATE.matcher(line.text);
            if (m.find()) {
                record.fill(Field.ESTABLISHMENT_DATE, m.group());
            } else if (!line.valuePart.isEmpty()) {
                record.fill(Field.ESTABLISHMENT_DATE, truncateAtNextKey(line.valuePart, ctx));
            }
        }

        // 5. 소재지
        if (record.isEmpty(Field.HEAD_ADDRESS) || record.isEmpty(Field.BUSINESS_ADDRESS)) {
            matchAddress(line, threshold, record, ctx);
        }
    }

    private String corporateNameValue(LineView line, KeyMatch match, ParseContext ctx) {
        String value = line.valuePart;
        if (value.isEmpty()) {
            String stripped = CORPORATE_LABELS.matcher(line.text).replaceAll("").trim();
            value = stripped.equals(line.text) && match == KeyMatch.FUZZY ? dropFirstToken(stripped) : stripped;
        }
        value = CORPORATE_PAREN.matcher(value).replaceAll("");
        return truncateAtNextKey(value, ctx).trim();
    }

    private String representativeValue(LineView line, KeyMatch match, ParseContext ctx) {
        if (!line.valuePart.isEmpty()) {
            return truncateAtNextKey(cutAtRegion(line.valuePart, ctx), ctx);
        }

        String temp = NON_NAME_CHARS.matcher(line.text).replaceAll(" ").trim();
        String stripped = REPRESENTATIVE_LABELS.matcher(temp).replaceAll("").trim();
        if (stripped.equals(temp) && match == KeyMatch.FUZZY) {
            stripped = dropFirstToken(stripped);
        }
        return truncateAtNextKey(cutAtRegion(stripped, ctx), ctx);
    }

    private void matchAddress(LineView line, int threshold, FieldRecord record, ParseContext ctx) {
        KeyMatch match = matchKey(line.cleanKey, ADDRESS_KEYS, threshold, ctx);
        if (match == KeyMatch.NONE) {
            return;
        }

        boolean headOffice = isHeadOffice(line.cleanKey, ctx);
        boolean businessPlace = line.cleanKey.contains("사업장");

        String value = line.valuePart;
        if (value.isEmpty() && ctx.firstRegionIn(line.text) != null) {
            value = ADDRESS_LABELS.matcher(line.text).replaceAll("").trim();
        }
        if (value.isEmpty()) {
            return;
        }
        // 仅靠模糊匹配命中的标签，值里必须有地名
        if (match == KeyMatch.FUZZY && ctx.firstRegionIn(value) == null) {
            return;
        }

        if (headOffice && record.isEmpty(Field.HEAD_ADDRESS)) {
            record.fill(Field.HEAD_ADDRESS, value);
        } else if (record.isEmpty(Field.BUSINESS_ADDRESS) && (!headOffice || businessPlace)) {
            record.fill(Field.BUSINESS_ADDRESS, value);
        }
    }

    private boolean isHeadOffice(String cleanKey, ParseContext ctx) {
        if (cleanKey.contains("본점") || cleanKey.contains("본정")) {
            return true;
        }
        if (cleanKey.length() < HEAD_OFFICE_PREFIX.length() - 1) {
            return false;
        }
        String head = cleanKey.substring(0, Math.min(cleanKey.length(), HEAD_OFFICE_PREFIX.length()));
        return ctx.within(head, HEAD_OFFICE_PREFIX, 1);
    }

    /**
     * 标签比较：先看是否包含同义词，再用同义词长度的前缀做有界编辑距离。
     * 两个字以内的同义词只接受精确包含。
     */
    private KeyMatch matchKey(String cleanKey, List<String> synonyms, int threshold, ParseContext ctx) {
        if (cleanKey.isEmpty()) {
            return KeyMatch.NONE;
        }
        for (String synonym : synonyms) {
            if (cleanKey.contains(synonym)) {
                return KeyMatch.EXACT;
            }
        }
        for (String synonym : synonyms) {
            int allowed = synonym.length() <= 2 ? 0 : Math.min(threshold, synonym.length() / 2);
            if (allowed == 0 || cleanKey.length() < synonym.length() - allowed) {
                continue;
            }
            String head = cleanKey.substring(0, Math.min(cleanKey.length(), synonym.length()));
            if (ctx.within(head, synonym, allowed)) {
                return KeyMatch.FUZZY;
            }
        }
        return KeyMatch.NONE;
    }

    // ==================== 법인등록번호 ====================

    private void extractCorporateRegistrationNumber(List<LineView> lines, FieldRecord record) {
        for (LineView line : lines) {
            if (!record.isEmpty(Field.CORPORATE_REGISTRATION_NUMBER)) {
                return;
            }
            if (!line.isCorporateRegistrationLine()) {
                continue;
            }

            for (Pattern pattern : CORP_REG_NUMBERS) {
                Matcher m = pattern.matcher(line.text);
                if (!m.find()) {
                    continue;
                }
                if (m.groupCount() >= 2) {
                    record.fill(Field.CORPORATE_REGISTRATION_NUMBER, m.group(1) + "-" + m.group(2));
                } else {
                    String digits = m.group(1);
                    record.fill(Field.CORPORATE_REGISTRATION_NUMBER, digits.substring(0, 6) + "-" + digits.substring(6));
                }
                break;
            }
        }
    }

    // ==================== 兜底 ====================

    private void applyAddressFallback(List<LineView> lines, FieldRecord record, ParseContext ctx) {
        if (!record.isEmpty(Field.BUSINESS_ADDRESS) || !record.isEmpty(Field.HEAD_ADDRESS)) {
            return;
        }
        for (LineView line : lines) {
            if (ctx.firstRegionIn(line.text) != null) {
                String value = FALLBACK_LABELS.matcher(line.text).replaceAll("").trim();
                if (record.fill(Field.BUSINESS_ADDRESS, value)) {
                    log.debug("地址兜底: {}", value);
                    return;
                }
            }
        }
    }

    // ==================== 截断 ====================

    /**
     * 值中混入下一个字段的标签时截断
     */
    public String truncateAtNextKey(String value) {
        return truncateAtNextKey(value, newContext());
    }

    String truncateAtNextKey(String value, ParseContext ctx) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        // 1. 精确出现在下标 > 1 处
        int cut = -1;
        for (String key : TRUNCATION_KEYS) {
            int idx = value.indexOf(key, 2);
            if (idx >= 0 && (cut < 0 || idx < cut)) {
                cut = idx;
            }
        }
        if (cut >= 0) {
            return value.substring(0, cut).trim();
        }

        // 2. 逐词模糊匹配，从第二个词开始
        String[] words = WHITESPACE.split(value.trim());
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            if (word.length() < 2) {
                continue;
            }
            for (String key : TRUNCATION_KEYS) {
                if (key.length() >= 3 && Math.abs(key.length() - word.length()) <= 1 && ctx.within(word, key, 1)) {
                    return String.join(" ", Arrays.asList(words).subList(0, i)).trim();
                }
            }
        }
        return value.trim();
    }

    // ==================== 工具方法 ====================

    private String cutAtRegion(String value, ParseContext ctx) {
        int cut = -1;
        for (String region : ctx.regions()) {
            int idx = value.indexOf(region);
            if (idx >= 0 && (cut < 0 || idx < cut)) {
                cut = idx;
            }
        }
        return cut >= 0 ? value.substring(0, cut).trim() : value;
    }

    private static String dropFirstToken(String value) {
        String[] tokens = WHITESPACE.split(value.trim(), 2);
        return tokens.length > 1 ? tokens[1].trim() : "";
    }

    private ParseContext newContext() {
        return new ParseContext(dictionary.getRegions());
    }

    // ==================== 内部类型 ====================

    private enum KeyMatch {
        NONE,
        EXACT,
        FUZZY
    }

    /**
     * 单行的预计算视图
     */
    private static final class LineView {
        private final String text;
        private final String cleanKey;
        private final String valuePart;
        private final String compact;

        LineView(String text) {
            this.text = text;
            int colon = text.indexOf(':');
            String keySegment = colon >= 0 ? text.substring(0, colon) : text;
            this.cleanKey = NON_KEY_CHARS.matcher(keySegment).replaceAll("");
            this.valuePart = colon >= 0 ? text.substring(colon + 1).trim() : "";
            this.compact = WHITESPACE.matcher(text).replaceAll("");
        }

        boolean isCorporateRegistrationLine() {
            return CORP_REG_KEY.matcher(compact).find();
        }
    }
}
