package cn.bafuka.knowsearch.cache;

import java.time.Duration;

/**
 * 缓存命名空间
 * 每个命名空间对应一个独立配置的有界缓存
 */
public enum CacheNamespace {

    /**
     * 检索结果缓存
     */
    QUERY("query", 200, Duration.ofHours(1)),

    /**
     * 语义检索原始结果缓存
     */
    SEMANTIC("semantic", 100, Duration.ofHours(2)),

    /**
     * 知识内容缓存
     */
    KNOWLEDGE("knowledge", 50, Duration.ofDays(1));

    private final String cacheName;

    private final int defaultCapacity;

    private final Duration defaultTtl;

    CacheNamespace(String cacheName, int defaultCapacity, Duration defaultTtl) {
        this.cacheName = cacheName;
        this.defaultCapacity = defaultCapacity;
        this.defaultTtl = defaultTtl;
    }

    public String getCacheName() {
        return cacheName;
    }

    public int getDefaultCapacity() {
        return defaultCapacity;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
