package cn.bafuka.knowsearch.cache;

import cn.bafuka.knowsearch.core.CacheStats;
import com.alibaba.fastjson.JSON;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 缓存健康报告
 * 汇总各命名空间命中率并给出调优建议，可导出为 JSON
 */
@Data
public class CacheHealthReport {

    /**
     * 查询缓存命中率高于该值评为 excellent
     */
    static final double EXCELLENT_HIT_RATE = 0.5;

    /**
     * 查询缓存命中率低于该值建议调优
     */
    static final double LOW_HIT_RATE = 0.3;

    private String generatedAt;

    private int totalSize;

    private double queryCacheHitRate;

    private double semanticCacheHitRate;

    private double knowledgeCacheHitRate;

    /**
     * excellent / good
     */
    private String overallPerformance;

    private List<String> recommendations = new ArrayList<>();

    public static CacheHealthReport from(CacheManagerStats stats) {
        CacheHealthReport report = new CacheHealthReport();
        report.setGeneratedAt(LocalDateTime.now().toString());
        report.setTotalSize(stats.getTotalSize());
        report.setQueryCacheHitRate(hitRate(stats, CacheNamespace.QUERY));
        report.setSemanticCacheHitRate(hitRate(stats, CacheNamespace.SEMANTIC));
        report.setKnowledgeCacheHitRate(hitRate(stats, CacheNamespace.KNOWLEDGE));
        report.setOverallPerformance(report.getQueryCacheHitRate() > EXCELLENT_HIT_RATE ? "excellent" : "good");

        if (report.getQueryCacheHitRate() < LOW_HIT_RATE) {
            report.getRecommendations().add("建议：增加缓存容量或优化缓存策略");
        }
        CacheStats query = stats.get(CacheNamespace.QUERY);
        if (query != null && query.getEvictionCount() > query.getCapacity()) {
            report.getRecommendations().add("建议：查询缓存淘汰频繁，考虑提高 query 命名空间容量");
        }
        if (report.getRecommendations().isEmpty()) {
            report.getRecommendations().add("缓存运行良好，保持当前状态");
        }
        return report;
    }

    private static double hitRate(CacheManagerStats stats, CacheNamespace namespace) {
        CacheStats cacheStats = stats.get(namespace);
        return cacheStats == null ? 0.0 : cacheStats.getHitRate();
    }

    public String toJson() {
        return JSON.toJSONString(this);
    }
}
