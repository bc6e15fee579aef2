package cn.bafuka.knowsearch.model;

import cn.bafuka.knowsearch.cache.CacheManagerStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存预热结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmupResult {

    private int requested;

    private int warmedCount;

    private int failedCount;

    private double totalMs;

    private CacheManagerStats cacheStatsAfter;
}
