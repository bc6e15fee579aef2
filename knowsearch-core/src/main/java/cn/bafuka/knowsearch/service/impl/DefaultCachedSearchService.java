package cn.bafuka.knowsearch.service.impl;

import cn.bafuka.knowsearch.cache.CacheHealthReport;
import cn.bafuka.knowsearch.cache.CacheManager;
import cn.bafuka.knowsearch.cache.CacheManagerStats;
import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.exception.CacheException;
import cn.bafuka.knowsearch.exception.SearchCancelledException;
import cn.bafuka.knowsearch.exception.SearchException;
import cn.bafuka.knowsearch.model.BatchSearchResult;
import cn.bafuka.knowsearch.model.FusedResult;
import cn.bafuka.knowsearch.model.HotQuery;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.SearchSource;
import cn.bafuka.knowsearch.model.SearchTiming;
import cn.bafuka.knowsearch.model.WarmupResult;
import cn.bafuka.knowsearch.search.HybridSearchEngine;
import cn.bafuka.knowsearch.service.CachedSearchService;
import cn.bafuka.knowsearch.service.HotQueryTracker;
import cn.bafuka.knowsearch.spi.KnowledgeContentPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * 带缓存的检索服务默认实现
 * <p>
 * 缓存未命中时在锁外调用检索引擎，再写回缓存；同一键的并发未命中可能各自计算并先后写入，
 * 以最后一次写入为准。降级（单路失败）的结果不写入缓存。
 */
@Slf4j
public class DefaultCachedSearchService implements CachedSearchService {

    /**
     * 高级检索缓存键标记
     */
    static final String ADVANCED_KEY_TAG = "advanced";

    private final HybridSearchEngine searchEngine;

    private final CacheManager cacheManager;

    private final HotQueryTracker hotQueryTracker;

    /**
     * 可选，未配置时 getKnowledge 不可用
     */
    private final KnowledgeContentPort knowledgeContentPort;

    /**
     * 批量检索线程池，为 null 时在调用线程上顺序执行
     */
    private final ExecutorService batchExecutor;

    private final KnowSearchProperties.SearchConfig config;

    public DefaultCachedSearchService(HybridSearchEngine searchEngine,
                                      CacheManager cacheManager,
                                      HotQueryTracker hotQueryTracker,
                                      KnowledgeContentPort knowledgeContentPort,
                                      ExecutorService batchExecutor,
                                      KnowSearchProperties.SearchConfig config) {
        this.searchEngine = searchEngine;
        this.cacheManager = cacheManager;
        this.hotQueryTracker = hotQueryTracker;
        this.knowledgeContentPort = knowledgeContentPort;
        this.batchExecutor = batchExecutor;
        this.config = config;
    }

    @Override
    public SearchResponse search(String query, int topK, SearchMode mode, double alpha, boolean useCache) {
        return cachedSearch(query, topK, mode, useCache,
                () -> searchEngine.search(query, topK, mode, alpha),
                alpha);
    }

    @Override
    public SearchResponse advancedSearch(String query, String category, String level,
                                         int topK, SearchMode mode, double alpha, boolean useCache) {
        return cachedSearch(query, topK, mode, useCache,
                () -> searchEngine.advancedSearch(query, category, level, topK, mode, alpha),
                alpha, ADVANCED_KEY_TAG, category, level);
    }

    /**
     * 缓存检查 → 检索 → 写回
     *
     * @param qualifiers 除 (query, mode, topK) 外参与缓存键的参数
     */
    private SearchResponse cachedSearch(String query, int topK, SearchMode mode, boolean useCache,
                                        Supplier<SearchResponse> compute, Object... qualifiers) {
        long start = System.nanoTime();
        hotQueryTracker.record(query);

        double lookupMs = 0;
        if (useCache) {
            Optional<SearchResponse> cached = lookup(query, mode, topK, qualifiers);
            lookupMs = SearchTiming.elapsedMs(start);
            if (cached.isPresent()) {
                log.debug("检索缓存命中: query={}, mode={}, topK={}, lookupMs={}", query, mode, topK, lookupMs);
                return cached.get().toBuilder()
                        .fromCache(true)
                        .timing(SearchTiming.builder()
                                .cacheLookupMs(lookupMs)
                                .totalMs(lookupMs)
                                .build())
                        .build();
            }
        }

        SearchResponse computed = compute.get();
        SearchTiming.SearchTimingBuilder timingBuilder = computed.getTiming() == null
                ? SearchTiming.builder()
                : computed.getTiming().toBuilder();
        SearchTiming timing = timingBuilder
                .cacheLookupMs(lookupMs)
                .totalMs(SearchTiming.elapsedMs(start))
                .build();
        SearchResponse response = computed.toBuilder()
                .results(immutableResults(computed.getResults()))
                .failedSources(immutableSources(computed.getFailedSources()))
                .fromCache(false)
                .timing(timing)
                .build();

        if (useCache) {
            if (response.isDegraded()) {
                log.warn("降级结果不写入缓存: query={}, mode={}, failedSources={}",
                        query, mode, response.getFailedSources());
            } else {
                store(query, mode, topK, response, qualifiers);
            }
        }

        // 返回副本，调用方修改不影响缓存中的对象；列表与统计不可变，可共用
        return response.toBuilder()
                .timing(timing.toBuilder().build())
                .build();
    }

    private static List<FusedResult> immutableResults(List<FusedResult> results) {
        if (results == null || results.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    private static Set<SearchSource> immutableSources(Set<SearchSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(sources));
    }

    /**
     * 结果缓存 TTL，配置值不大于 0 时返回 null，沿用 query 命名空间的默认 TTL
     */
    private Duration resultTtl() {
        long seconds = config.getResultTtlSeconds();
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    private Optional<SearchResponse> lookup(String query, SearchMode mode, int topK, Object... qualifiers) {
        try {
            return cacheManager.getCachedQuery(query, mode, topK, qualifiers);
        } catch (CacheException e) {
            log.warn("检索缓存读取失败，绕过缓存: query={}, mode={}, error={}", query, mode, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String query, SearchMode mode, int topK, SearchResponse response, Object... qualifiers) {
        try {
            cacheManager.cacheQuery(query, mode, topK, response, resultTtl(), qualifiers);
            log.debug("检索结果写入缓存: query={}, mode={}, topK={}", query, mode, topK);
        } catch (CacheException e) {
            log.warn("检索缓存写入失败，绕过缓存: query={}, mode={}, error={}", query, mode, e.getMessage());
        }
    }

    @Override
    public BatchSearchResult batchSearch(List<String> queries, int topK, SearchMode mode, boolean useCache) {
        if (queries == null) {
            throw new IllegalArgumentException("查询列表不能为空");
        }
        double alpha = config.getDefaultAlpha();
        long start = System.nanoTime();

        List<SearchResponse> results = batchExecutor == null || queries.size() <= 1
                ? searchSequentially(queries, topK, mode, alpha, useCache)
                : searchInParallel(queries, topK, mode, alpha, useCache);

        int cacheHits = 0;
        for (SearchResponse response : results) {
            if (response.isFromCache()) {
                cacheHits++;
            }
        }
        int total = results.size();
        double totalMs = SearchTiming.elapsedMs(start);

        log.info("批量检索完成: total={}, cacheHits={}, totalMs={}", total, cacheHits, totalMs);
        return BatchSearchResult.builder()
                .results(Collections.unmodifiableList(results))
                .total(total)
                .cacheHits(cacheHits)
                .cacheHitRate(total == 0 ? 0.0 : (double) cacheHits / total)
                .totalMs(totalMs)
                .avgMs(total == 0 ? 0.0 : totalMs / total)
                .build();
    }

    private List<SearchResponse> searchSequentially(List<String> queries, int topK, SearchMode mode,
                                                    double alpha, boolean useCache) {
        List<SearchResponse> results = new ArrayList<>(queries.size());
        for (String query : queries) {
            results.add(search(query, topK, mode, alpha, useCache));
        }
        return results;
    }

    private List<SearchResponse> searchInParallel(List<String> queries, int topK, SearchMode mode,
                                                  double alpha, boolean useCache) {
        List<Future<SearchResponse>> futures = new ArrayList<>(queries.size());
        for (String query : queries) {
            futures.add(batchExecutor.submit(() -> search(query, topK, mode, alpha, useCache)));
        }

        List<SearchResponse> results = new ArrayList<>(queries.size());
        try {
            for (Future<SearchResponse> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("批量检索被中断", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("批量检索任务异常", cause);
        }
        return results;
    }

    private static void cancelAll(List<Future<SearchResponse>> futures) {
        for (Future<SearchResponse> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public WarmupResult warmupCache(List<String> commonQueries, int topK, SearchMode mode) {
        List<String> queries = commonQueries == null ? Collections.emptyList() : commonQueries;
        double alpha = config.getDefaultAlpha();
        long start = System.nanoTime();

        log.info("开始缓存预热: queries={}, topK={}, mode={}", queries.size(), topK, mode);

        int warmed = 0;
        int failed = 0;
        for (String query : queries) {
            try {
                search(query, topK, mode, alpha, true);
                warmed++;
            } catch (SearchException | IllegalArgumentException e) {
                failed++;
                log.warn("缓存预热失败，继续下一个查询: query={}, error={}", query, e.getMessage());
            }
        }

        double totalMs = SearchTiming.elapsedMs(start);
        log.info("缓存预热完成: warmed={}, failed={}, totalMs={}", warmed, failed, totalMs);

        return WarmupResult.builder()
                .requested(queries.size())
                .warmedCount(warmed)
                .failedCount(failed)
                .totalMs(totalMs)
                .cacheStatsAfter(cacheManager.stats())
                .build();
    }

    @Override
    public Optional<String> getKnowledge(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("知识 ID 不能为空");
        }
        if (knowledgeContentPort == null) {
            throw new IllegalStateException("未配置 KnowledgeContentPort");
        }

        try {
            Optional<String> cached = cacheManager.getCachedKnowledge(id);
            if (cached.isPresent()) {
                return cached;
            }
        } catch (CacheException e) {
            log.warn("知识缓存读取失败，绕过缓存: id={}, error={}", id, e.getMessage());
        }

        Optional<String> content = knowledgeContentPort.load(id);
        if (content.isPresent()) {
            try {
                cacheManager.cacheKnowledge(id, content.get(), null);
            } catch (CacheException e) {
                log.warn("知识缓存写入失败，绕过缓存: id={}, error={}", id, e.getMessage());
            }
        }
        return content;
    }

    @Override
    public List<HotQuery> getHotQueries(int limit) {
        return hotQueryTracker.hotQueries(limit);
    }

    @Override
    public CacheManagerStats getCacheStats() {
        return cacheManager.stats();
    }

    @Override
    public CacheHealthReport getCacheHealthReport() {
        return cacheManager.healthReport();
    }

    @Override
    public void clearCache() {
        cacheManager.clearAll();
    }
}
