package com.example.dococr.service;

import com.example.dococr.util.EditDistance;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次字段解析的上下文
 * 持有编辑距离缓存和地名集合，随 extract 调用创建、随调用结束丢弃
 */
class ParseContext {

    private final Map<String, Integer> distanceCache = new HashMap<>();
    private final Set<String> regionSet;
    private final List<String> regions;

    ParseContext(List<String> regions) {
        this.regions = regions;
        this.regionSet = new HashSet<>(regions);
    }

    /**
     * 带缓存的有界编辑距离，缓存键包含阈值
     */
    int distance(String a, String b, int maxThreshold) {
        if (a.equals(b)) {
            return 0;
        }
        String key = (a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a) + "|" + maxThreshold;
        return distanceCache.computeIfAbsent(key, k -> EditDistance.bounded(a, b, maxThreshold));
    }

    boolean within(String a, String b, int maxThreshold) {
        return distance(a, b, maxThreshold) <= maxThreshold;
    }

    boolean isRegion(String word) {
        return regionSet.contains(word);
    }

    List<String> regions() {
        return regions;
    }

    /**
     * 行内首个出现的地名，不存在时返回 null
     */
    String firstRegionIn(String text) {
        for (String region : regions) {
            if (text.contains(region)) {
                return region;
            }
        }
        return null;
    }

    int cacheSize() {
        return distanceCache.size();
    }
}
