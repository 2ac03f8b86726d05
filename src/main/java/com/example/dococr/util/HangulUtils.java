package com.example.dococr.util;

/**
 * 韩文字母(자모)拆分/组合工具
 *
 * <p>Unicode 完成型韩文音节 = 0xAC00 + (初声 × 588) + (中声 × 28) + 终声，
 * 范围 가(0xAC00) ~ 힣(0xD7A3)。
 */
public final class HangulUtils {

    public static final char[] CHO = {
            'ㄱ', 'ㄲ', 'ㄴ', 'ㄷ', 'ㄸ', 'ㄹ', 'ㅁ', 'ㅂ', 'ㅃ', 'ㅅ',
            'ㅆ', 'ㅇ', 'ㅈ', 'ㅉ', 'ㅊ', 'ㅋ', 'ㅌ', 'ㅍ', 'ㅎ'
    };

    public static final char[] JUNG = {
            'ㅏ', 'ㅐ', 'ㅑ', 'ㅒ', 'ㅓ', 'ㅔ', 'ㅕ', 'ㅖ', 'ㅗ', 'ㅘ',
            'ㅙ', 'ㅚ', 'ㅛ', 'ㅜ', 'ㅝ', 'ㅞ', 'ㅟ', 'ㅠ', 'ㅡ', 'ㅢ', 'ㅣ'
    };

    // 第一个元素表示无终声
    public static final char[] JONG = {
            '\0', 'ㄱ', 'ㄲ', 'ㄳ', 'ㄴ', 'ㄵ', 'ㄶ', 'ㄷ', 'ㄹ', 'ㄺ',
            'ㄻ', 'ㄼ', 'ㄽ', 'ㄾ', 'ㄿ', 'ㅀ', 'ㅁ', 'ㅂ', 'ㅄ', 'ㅅ',
            'ㅆ', 'ㅇ', 'ㅈ', 'ㅊ', 'ㅋ', 'ㅌ', 'ㅍ', 'ㅎ'
    };

    private static final int HANGUL_START = 0xAC00;
    private static final int HANGUL_END = 0xD7A3;

    private HangulUtils() {
    }

    /**
     * 是否为完成型韩文音节
     */
    public static boolean isHangul(char c) {
        return c >= HANGUL_START && c <= HANGUL_END;
    }

    public static boolean containsHangul(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isHangul(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 拆分为 [初声下标, 中声下标, 终声下标]，非韩文音节返回 null
     */
    public static int[] decompose(char c) {
        if (!isHangul(c)) return null;
        int code = c - HANGUL_START;
        return new int[]{code / 588, (code % 588) / 28, code % 28};
    }

    /**
     * 由字母下标组合为音节
     */
    public static char compose(int cho, int jung, int jong) {
        if (cho < 0 || cho >= CHO.length || jung < 0 || jung >= JUNG.length || jong < 0 || jong >= JONG.length) {
            throw new IllegalArgumentException("无效的字母下标: " + cho + "/" + jung + "/" + jong);
        }
        return (char) (HANGUL_START + cho * 588 + jung * 28 + jong);
    }

    /**
     * 整串拆分为字母序列，非韩文字符原样保留
     */
    public static String decomposeString(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 3);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int[] jamo = decompose(c);
            if (jamo == null) {
                sb.append(c);
                continue;
            }
            sb.append(CHO[jamo[0]]).append(JUNG[jamo[1]]);
            if (jamo[2] != 0) {
                sb.append(JONG[jamo[2]]);
            }
        }
        return sb.toString();
    }

    /**
     * 两个音节的字母相似度(0.0 ~ 1.0)
     * 初声 0.4，中声 0.4，终声 0.2
     */
    public static double jamoSimilarity(char c1, char c2) {
        int[] j1 = decompose(c1);
        int[] j2 = decompose(c2);
        if (j1 == null || j2 == null) return 0.0;

        double score = 0.0;
        if (j1[0] == j2[0]) score += 0.4;
        if (j1[1] == j2[1]) score += 0.4;
        if (j1[2] == j2[2]) score += 0.2;
        return score;
    }
}
