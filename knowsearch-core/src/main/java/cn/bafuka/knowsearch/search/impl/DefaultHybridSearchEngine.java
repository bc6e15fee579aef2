package cn.bafuka.knowsearch.search.impl;

import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.exception.KeywordSearchException;
import cn.bafuka.knowsearch.exception.KnowSearchException;
import cn.bafuka.knowsearch.exception.SearchCancelledException;
import cn.bafuka.knowsearch.exception.SearchException;
import cn.bafuka.knowsearch.exception.SemanticSearchException;
import cn.bafuka.knowsearch.model.FusedResult;
import cn.bafuka.knowsearch.model.KeywordMatch;
import cn.bafuka.knowsearch.model.KnowledgeMetadata;
import cn.bafuka.knowsearch.model.SearchHit;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.SearchSource;
import cn.bafuka.knowsearch.model.SearchTiming;
import cn.bafuka.knowsearch.model.SemanticMatches;
import cn.bafuka.knowsearch.model.SourceStats;
import cn.bafuka.knowsearch.search.HybridSearchEngine;
import cn.bafuka.knowsearch.search.PartialFailurePolicy;
import cn.bafuka.knowsearch.search.RankFusion;
import cn.bafuka.knowsearch.spi.KeywordSearchPort;
import cn.bafuka.knowsearch.spi.SemanticSearchPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 混合检索引擎默认实现
 * <p>
 * 混合模式下两路端口在线程池上并发执行，各取 2 * topK 条候选后融合。
 * 调用线程被中断时取消两路任务（cancel(true) 中断端口线程）并中止融合。
 */
@Slf4j
public class DefaultHybridSearchEngine implements HybridSearchEngine {

    /**
     * 混合模式下每路候选数相对 topK 的倍数
     */
    static final int HYBRID_FETCH_FACTOR = 2;

    /**
     * 高级检索过采样倍数
     */
    static final int ADVANCED_OVERSAMPLE_FACTOR = 3;

    private final KeywordSearchPort keywordPort;

    private final SemanticSearchPort semanticPort;

    /**
     * 端口调用线程池
     */
    private final ExecutorService executor;

    private final KnowSearchProperties.SearchConfig config;

    public DefaultHybridSearchEngine(KeywordSearchPort keywordPort,
                                     SemanticSearchPort semanticPort,
                                     ExecutorService executor,
                                     KnowSearchProperties.SearchConfig config) {
        this.keywordPort = keywordPort;
        this.semanticPort = semanticPort;
        this.executor = executor;
        this.config = config;
    }

    @Override
    public SearchResponse search(String query, int topK, SearchMode mode, double alpha) {
        validate(query, topK, mode, alpha);
        long start = System.nanoTime();

        SearchResponse response;
        switch (mode) {
            case KEYWORD:
                response = keywordOnly(query, topK, alpha);
                break;
            case SEMANTIC:
                response = semanticOnly(query, topK, alpha);
                break;
            case HYBRID:
                response = hybrid(query, topK, alpha);
                break;
            default:
                throw new IllegalStateException("未处理的检索模式: " + mode);
        }

        response.getTiming().setTotalMs(SearchTiming.elapsedMs(start));
        log.debug("检索完成: query={}, mode={}, topK={}, alpha={}, results={}, degraded={}",
                query, mode, topK, alpha, response.getResults().size(), response.isDegraded());
        return response;
    }

    private SearchResponse keywordOnly(String query, int topK, double alpha) {
        long start = System.nanoTime();
        List<SearchHit> hits = truncate(keywordHits(query, topK), topK);
        double keywordMs = SearchTiming.elapsedMs(start);

        List<FusedResult> results = RankFusion.fromSingleSource(hits);
        return baseResponse(query, SearchMode.KEYWORD, alpha, results)
                .timing(SearchTiming.builder().keywordMs(keywordMs).build())
                .build();
    }

    private SearchResponse semanticOnly(String query, int topK, double alpha) {
        long start = System.nanoTime();
        List<SearchHit> hits = truncate(semanticHits(query, topK), topK);
        double semanticMs = SearchTiming.elapsedMs(start);

        List<FusedResult> results = RankFusion.fromSingleSource(hits);
        return baseResponse(query, SearchMode.SEMANTIC, alpha, results)
                .timing(SearchTiming.builder().semanticMs(semanticMs).build())
                .build();
    }

    private SearchResponse hybrid(String query, int topK, double alpha) {
        HybridFetch fetch = fetchBothSources(query, scaled(topK, HYBRID_FETCH_FACTOR));

        long fusionStart = System.nanoTime();
        List<FusedResult> results = RankFusion.fuse(fetch.keywordHits, fetch.semanticHits, alpha, topK);
        double fusionMs = SearchTiming.elapsedMs(fusionStart);

        return baseResponse(query, SearchMode.HYBRID, alpha, results)
                .degraded(!fetch.failures.isEmpty())
                .failedSources(Collections.unmodifiableSet(
                        fetch.failures.isEmpty()
                                ? EnumSet.noneOf(SearchSource.class)
                                : EnumSet.copyOf(fetch.failures.keySet())))
                .timing(SearchTiming.builder()
                        .keywordMs(fetch.keywordMs)
                        .semanticMs(fetch.semanticMs)
                        .fusionMs(fusionMs)
                        .build())
                .build();
    }

    /**
     * 并发调用两路端口
     * 首个失败在 FAIL_FAST 下立即取消另一路；超时的端口被取消并按失败处理
     */
    private HybridFetch fetchBothSources(String query, int fetchK) {
        CompletionService<PortOutcome> completion = new ExecutorCompletionService<>(executor);
        Map<SearchSource, Future<PortOutcome>> futures = new EnumMap<>(SearchSource.class);
        futures.put(SearchSource.KEYWORD, completion.submit(
                () -> timed(SearchSource.KEYWORD, () -> keywordHits(query, fetchK))));
        futures.put(SearchSource.SEMANTIC, completion.submit(
                () -> timed(SearchSource.SEMANTIC, () -> semanticHits(query, fetchK))));

        HybridFetch fetch = new HybridFetch();
        EnumSet<SearchSource> pending = EnumSet.allOf(SearchSource.class);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getPortTimeoutMs());

        try {
            while (!pending.isEmpty()) {
                Future<PortOutcome> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    for (SearchSource source : pending) {
                        futures.get(source).cancel(true);
                        fetch.failures.put(source, timeoutFailure(source, query));
                    }
                    pending.clear();
                    break;
                }

                try {
                    PortOutcome outcome = done.get();
                    pending.remove(outcome.source);
                    fetch.accept(outcome);
                } catch (ExecutionException e) {
                    SearchException failure = unwrapFailure(e);
                    pending.remove(failure.getSource());
                    fetch.failures.put(failure.getSource(), failure);
                    if (config.getPartialFailurePolicy() == PartialFailurePolicy.FAIL_FAST) {
                        cancelAll(futures);
                        break;
                    }
                } catch (CancellationException e) {
                    cancelAll(futures);
                    throw new SearchCancelledException("端口任务已被取消，中止融合: query=" + query, e);
                }
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            log.warn("混合检索被中断，已取消两路端口: query={}", query);
            throw new SearchCancelledException("混合检索被中断: query=" + query, e);
        }

        resolveFailures(query, fetch);
        return fetch;
    }

    /**
     * 按失败策略决定抛出还是降级
     */
    private void resolveFailures(String query, HybridFetch fetch) {
        if (fetch.failures.isEmpty()) {
            return;
        }

        SearchException keywordFailure = fetch.failures.get(SearchSource.KEYWORD);
        SearchException semanticFailure = fetch.failures.get(SearchSource.SEMANTIC);

        if (keywordFailure != null && semanticFailure != null) {
            keywordFailure.addSuppressed(semanticFailure);
            log.error("混合检索两路均失败: query={}, keyword={}, semantic={}",
                    query, keywordFailure.getMessage(), semanticFailure.getMessage());
            throw keywordFailure;
        }

        SearchException failure = keywordFailure != null ? keywordFailure : semanticFailure;
        if (config.getPartialFailurePolicy() == PartialFailurePolicy.FAIL_FAST) {
            log.error("混合检索单路失败，快速失败: query={}, source={}, reason={}",
                    query, failure.getSource(), failure.getReason(), failure);
            throw failure;
        }

        log.warn("混合检索单路失败，降级为单路排序: query={}, source={}, reason={}, message={}",
                query, failure.getSource(), failure.getReason(), failure.getMessage());
    }

    private static void cancelAll(Map<SearchSource, Future<PortOutcome>> futures) {
        for (Future<PortOutcome> future : futures.values()) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }

    private static SearchException unwrapFailure(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SearchException) {
            return (SearchException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new KnowSearchException("端口任务异常", cause);
    }

    private static SearchException timeoutFailure(SearchSource source, String query) {
        TimeoutException timeout = new TimeoutException("端口响应超时");
        if (source == SearchSource.KEYWORD) {
            return new KeywordSearchException("关键词检索超时: query=" + query, timeout,
                    SearchException.FailureReason.TIMEOUT);
        }
        return new SemanticSearchException("语义检索超时: query=" + query, timeout,
                SearchException.FailureReason.TIMEOUT);
    }

    private static PortOutcome timed(SearchSource source, PortCall call) {
        long start = System.nanoTime();
        List<SearchHit> hits = call.invoke();
        return new PortOutcome(source, hits, SearchTiming.elapsedMs(start));
    }

    /**
     * 调用关键词端口，名次 = 位置 + 1
     */
    private List<SearchHit> keywordHits(String query, int topK) {
        List<KeywordMatch> matches;
        try {
            matches = keywordPort.search(query, topK);
        } catch (KeywordSearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeywordSearchException("关键词检索失败: query=" + query, e);
        }
        if (matches == null) {
            return Collections.emptyList();
        }

        List<SearchHit> hits = new ArrayList<>(matches.size());
        for (int i = 0; i < matches.size(); i++) {
            KeywordMatch match = matches.get(i);
            hits.add(SearchHit.builder()
                    .title(match.getTitle())
                    .category(match.getCategory())
                    .level(match.getLevel())
                    .score(match.getMatchScore())
                    .rank(i + 1)
                    .source(SearchSource.KEYWORD)
                    .build());
        }
        return hits;
    }

    /**
     * 调用语义端口，得分 = 1 - distance
     */
    private List<SearchHit> semanticHits(String query, int nResults) {
        SemanticMatches matches;
        try {
            matches = semanticPort.search(query, nResults);
        } catch (SemanticSearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SemanticSearchException("语义检索失败: query=" + query, e);
        }
        if (matches == null || matches.getIds() == null) {
            return Collections.emptyList();
        }

        List<String> ids = matches.getIds();
        List<KnowledgeMetadata> metadatas = matches.getMetadatas();
        List<Double> distances = matches.getDistances();
        if (metadatas == null || distances == null
                || metadatas.size() != ids.size() || distances.size() != ids.size()) {
            throw new SemanticSearchException(
                    String.format("语义检索返回数据不一致: query=%s, ids=%d, metadatas=%s, distances=%s",
                            query, ids.size(),
                            metadatas == null ? "null" : String.valueOf(metadatas.size()),
                            distances == null ? "null" : String.valueOf(distances.size())),
                    null, SearchException.FailureReason.MALFORMED_RESPONSE);
        }

        List<SearchHit> hits = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            KnowledgeMetadata metadata = metadatas.get(i);
            Double distance = distances.get(i);
            if (distance == null) {
                throw new SemanticSearchException("语义检索距离为空: query=" + query + ", id=" + ids.get(i),
                        null, SearchException.FailureReason.MALFORMED_RESPONSE);
            }
            String title = metadata != null && metadata.getTitle() != null ? metadata.getTitle() : ids.get(i);
            hits.add(SearchHit.builder()
                    .title(title)
                    .category(metadata != null ? metadata.getCategory() : null)
                    .level(metadata != null ? metadata.getLevel() : null)
                    .score(1 - distance)
                    .rank(i + 1)
                    .source(SearchSource.SEMANTIC)
                    .build());
        }
        return hits;
    }

    @Override
    public SearchResponse advancedSearch(String query, String category, String level,
                                         int topK, SearchMode mode, double alpha) {
        validate(query, topK, mode, alpha);
        long start = System.nanoTime();

        SearchResponse oversampled = search(query, scaled(topK, ADVANCED_OVERSAMPLE_FACTOR), mode, alpha);

        List<FusedResult> filtered = new ArrayList<>();
        for (FusedResult result : oversampled.getResults()) {
            if (matchesCategory(result, category) && matchesLevel(result, level)) {
                filtered.add(result);
                if (filtered.size() >= topK) {
                    break;
                }
            }
        }

        log.debug("高级检索过滤: query={}, category={}, level={}, candidates={}, kept={}",
                query, category, level, oversampled.getResults().size(), filtered.size());

        SearchTiming timing = oversampled.getTiming().toBuilder()
                .totalMs(SearchTiming.elapsedMs(start))
                .build();
        return oversampled.toBuilder()
                .category(category)
                .level(level)
                .results(Collections.unmodifiableList(filtered))
                .stats(SourceStats.of(filtered))
                .timing(timing)
                .build();
    }

    private static boolean matchesCategory(FusedResult result, String category) {
        if (category == null || category.isEmpty()) {
            return true;
        }
        return result.getCategory() != null && result.getCategory().contains(category);
    }

    private static boolean matchesLevel(FusedResult result, String level) {
        if (level == null || level.isEmpty()) {
            return true;
        }
        return level.equals(result.getLevel());
    }

    @Override
    public SearchResponse multiQuerySearch(List<String> queries, int topK, SearchMode mode) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("查询列表不能为空");
        }
        double alpha = config.getDefaultAlpha();
        long start = System.nanoTime();

        List<List<FusedResult>> groups = new ArrayList<>(queries.size());
        EnumSet<SearchSource> failedSources = EnumSet.noneOf(SearchSource.class);
        for (String query : queries) {
            SearchResponse response = search(query, topK, mode, alpha);
            groups.add(response.getResults());
            failedSources.addAll(response.getFailedSources());
        }

        List<FusedResult> merged = RankFusion.mergeByMaxScore(groups, topK);
        return baseResponse(String.join(" | ", queries), mode, alpha, merged)
                .degraded(!failedSources.isEmpty())
                .failedSources(Collections.unmodifiableSet(failedSources))
                .timing(SearchTiming.builder().totalMs(SearchTiming.elapsedMs(start)).build())
                .build();
    }

    private static SearchResponse.SearchResponseBuilder baseResponse(String query, SearchMode mode,
                                                                     double alpha, List<FusedResult> results) {
        return SearchResponse.builder()
                .query(query)
                .mode(mode)
                .alpha(alpha)
                .results(results)
                .stats(SourceStats.of(results))
                .fromCache(false);
    }

    private static List<SearchHit> truncate(List<SearchHit> hits, int topK) {
        return hits.size() > topK ? hits.subList(0, topK) : hits;
    }

    /**
     * 按倍数放大候选数，溢出时取 Integer.MAX_VALUE
     */
    static int scaled(int topK, int factor) {
        return (int) Math.min(Integer.MAX_VALUE, (long) topK * factor);
    }

    static void validate(String query, int topK, SearchMode mode, double alpha) {
        if (query == null || query.trim().isEmpty()) {
            throw new IllegalArgumentException("查询不能为空");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK 必须为正: " + topK);
        }
        if (mode == null) {
            throw new IllegalArgumentException("检索模式不能为空");
        }
        if (Double.isNaN(alpha) || alpha < 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha 必须在 [0, 1] 之间: " + alpha);
        }
    }

    @FunctionalInterface
    private interface PortCall {
        List<SearchHit> invoke();
    }

    private static final class PortOutcome {

        private final SearchSource source;
        private final List<SearchHit> hits;
        private final double elapsedMs;

        private PortOutcome(SearchSource source, List<SearchHit> hits, double elapsedMs) {
            this.source = source;
            this.hits = hits;
            this.elapsedMs = elapsedMs;
        }
    }

    /**
     * 两路端口的收集结果，失败的一路候选为空列表
     */
    private static final class HybridFetch {

        private List<SearchHit> keywordHits = Collections.emptyList();
        private List<SearchHit> semanticHits = Collections.emptyList();
        private double keywordMs;
        private double semanticMs;
        private final Map<SearchSource, SearchException> failures = new EnumMap<>(SearchSource.class);

        private void accept(PortOutcome outcome) {
            if (outcome.source == SearchSource.KEYWORD) {
                keywordHits = outcome.hits;
                keywordMs = outcome.elapsedMs;
            } else {
                semanticHits = outcome.hits;
                semanticMs = outcome.elapsedMs;
            }
        }
    }
}
