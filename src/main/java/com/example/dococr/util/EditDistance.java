package com.example.dococr.util;

/**
 * Levenshtein 编辑距离
 */
public final class EditDistance {

    private EditDistance() {
    }

    /**
     * 完整编辑距离，两行滚动数组实现
     */
    public static int distance(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    curr[j] = prev[j - 1];
                } else {
                    curr[j] = 1 + Math.min(prev[j - 1], Math.min(prev[j], curr[j - 1]));
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * 有界编辑距离
     *
     * <p>结果不超过 maxThreshold 时是精确值；超过时只保证返回值大于 maxThreshold，
     * 调用方只能用于"是否在阈值内"的判断。
     */
    public static int bounded(String a, String b, int maxThreshold) {
        if (a.equals(b)) return 0;

        int lengthDiff = Math.abs(a.length() - b.length());
        if (lengthDiff > maxThreshold) return lengthDiff;

        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        String shorter = a.length() < b.length() ? a : b;
        String longer = a.length() < b.length() ? b : a;
        int m = shorter.length();
        int n = longer.length();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= n; i++) {
            curr[0] = i;
            int rowMin = curr[0];
            char cl = longer.charAt(i - 1);

            for (int j = 1; j <= m; j++) {
                if (cl == shorter.charAt(j - 1)) {
                    curr[j] = prev[j - 1];
                } else {
                    curr[j] = 1 + Math.min(prev[j - 1], Math.min(prev[j], curr[j - 1]));
                }
                rowMin = Math.min(rowMin, curr[j]);
            }

            // 整行都已超过阈值，后续只会更大
            if (rowMin > maxThreshold) {
                return rowMin;
            }

            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[m];
    }
}
