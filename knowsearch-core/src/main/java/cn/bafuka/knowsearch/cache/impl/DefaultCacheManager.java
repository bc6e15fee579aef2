package cn.bafuka.knowsearch.cache.impl;

import cn.bafuka.knowsearch.cache.CacheManager;
import cn.bafuka.knowsearch.cache.CacheManagerStats;
import cn.bafuka.knowsearch.cache.CacheNamespace;
import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.core.BoundedCache;
import cn.bafuka.knowsearch.core.CacheKey;
import cn.bafuka.knowsearch.core.CacheStats;
import cn.bafuka.knowsearch.core.impl.LruBoundedCache;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.SemanticMatches;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 缓存管理器默认实现
 * 每个命名空间一个 {@link LruBoundedCache}，生命周期与进程一致，不做任何 I/O
 */
@Slf4j
public class DefaultCacheManager implements CacheManager {

    private final BoundedCache<CacheKey, SearchResponse> queryCache;

    private final BoundedCache<CacheKey, SemanticMatches> semanticCache;

    private final BoundedCache<CacheKey, String> knowledgeCache;

    /**
     * 各命名空间默认过期时间，null 表示永不过期
     */
    private final Map<CacheNamespace, Duration> defaultTtls = new EnumMap<>(CacheNamespace.class);

    public DefaultCacheManager() {
        this(new KnowSearchProperties.CacheConfig());
    }

    public DefaultCacheManager(KnowSearchProperties.CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public DefaultCacheManager(KnowSearchProperties.CacheConfig config, Ticker ticker) {
        this.queryCache = buildCache(CacheNamespace.QUERY, config, ticker);
        this.semanticCache = buildCache(CacheNamespace.SEMANTIC, config, ticker);
        this.knowledgeCache = buildCache(CacheNamespace.KNOWLEDGE, config, ticker);
    }

    private <V> BoundedCache<CacheKey, V> buildCache(CacheNamespace namespace,
                                                      KnowSearchProperties.CacheConfig config,
                                                      Ticker ticker) {
        KnowSearchProperties.NamespaceConfig nsConfig = config.forNamespace(namespace);
        long ttlSeconds = nsConfig.getDefaultTtlSeconds();
        defaultTtls.put(namespace, ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : null);

        log.info("构建缓存命名空间: namespace={}, capacity={}, defaultTtlSeconds={}",
                namespace.getCacheName(), nsConfig.getCapacity(), ttlSeconds);
        return new LruBoundedCache<>(namespace.getCacheName(), nsConfig.getCapacity(), ticker);
    }

    @Override
    public CacheKey deriveKey(CacheNamespace namespace, Object... args) {
        return CacheKey.of(namespace.getCacheName(), args);
    }

    @Override
    public void cacheQuery(String query, SearchMode mode, int topK, SearchResponse result,
                           Duration ttl, Object... qualifiers) {
        CacheKey key = queryKey(query, mode, topK, qualifiers);
        queryCache.put(key, result, ttlOrDefault(CacheNamespace.QUERY, ttl));
    }

    @Override
    public Optional<SearchResponse> getCachedQuery(String query, SearchMode mode, int topK, Object... qualifiers) {
        return queryCache.get(queryKey(query, mode, topK, qualifiers));
    }

    private CacheKey queryKey(String query, SearchMode mode, int topK, Object... qualifiers) {
        int extra = qualifiers == null ? 0 : qualifiers.length;
        Object[] args = new Object[3 + extra];
        args[0] = query;
        args[1] = mode;
        args[2] = topK;
        if (extra > 0) {
            System.arraycopy(qualifiers, 0, args, 3, extra);
        }
        return deriveKey(CacheNamespace.QUERY, args);
    }

    @Override
    public void cacheSemantic(String query, int nResults, SemanticMatches result, Duration ttl) {
        semanticCache.put(deriveKey(CacheNamespace.SEMANTIC, query, nResults), result,
                ttlOrDefault(CacheNamespace.SEMANTIC, ttl));
    }

    @Override
    public Optional<SemanticMatches> getCachedSemantic(String query, int nResults) {
        return semanticCache.get(deriveKey(CacheNamespace.SEMANTIC, query, nResults));
    }

    @Override
    public void cacheKnowledge(String id, String content, Duration ttl) {
        knowledgeCache.put(deriveKey(CacheNamespace.KNOWLEDGE, id), content,
                ttlOrDefault(CacheNamespace.KNOWLEDGE, ttl));
    }

    @Override
    public Optional<String> getCachedKnowledge(String id) {
        return knowledgeCache.get(deriveKey(CacheNamespace.KNOWLEDGE, id));
    }

    private Duration ttlOrDefault(CacheNamespace namespace, Duration ttl) {
        return ttl != null ? ttl : defaultTtls.get(namespace);
    }

    @Override
    public void clearAll() {
        queryCache.clear();
        semanticCache.clear();
        knowledgeCache.clear();
        log.info("所有缓存命名空间已清空");
    }

    @Override
    public int purgeExpired() {
        return queryCache.purgeExpired() + semanticCache.purgeExpired() + knowledgeCache.purgeExpired();
    }

    @Override
    public CacheManagerStats stats() {
        Map<String, CacheStats> namespaces = new LinkedHashMap<>();
        namespaces.put(CacheNamespace.QUERY.getCacheName(), queryCache.stats());
        namespaces.put(CacheNamespace.SEMANTIC.getCacheName(), semanticCache.stats());
        namespaces.put(CacheNamespace.KNOWLEDGE.getCacheName(), knowledgeCache.stats());

        int totalSize = 0;
        for (CacheStats stats : namespaces.values()) {
            totalSize += stats.getSize();
        }
        return new CacheManagerStats(namespaces, totalSize);
    }
}
