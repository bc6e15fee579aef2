package cn.bafuka.knowsearch.cache;

import cn.bafuka.knowsearch.core.CacheKey;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.SemanticMatches;

import java.time.Duration;
import java.util.Optional;

/**
 * 缓存管理器
 * 持有 query / semantic / knowledge 三个命名空间的有界缓存，并从异构参数派生缓存键
 * <p>
 * 所有 ttl 参数为 null 时使用命名空间的默认过期时间。
 */
public interface CacheManager {

    /**
     * 派生缓存键：参数保持顺序且带类型标记，相同参数序列总是得到相同的键
     *
     * @param namespace 命名空间
     * @param args      参数
     * @return 缓存键
     * @throws cn.bafuka.knowsearch.exception.CacheException 参数类型不支持
     */
    CacheKey deriveKey(CacheNamespace namespace, Object... args);

    /**
     * 缓存检索结果
     *
     * @param query      查询
     * @param mode       检索模式
     * @param topK       返回数量
     * @param result     检索结果
     * @param ttl        过期时间
     * @param qualifiers 追加到键上的限定参数（如 alpha、过滤条件）
     */
    void cacheQuery(String query, SearchMode mode, int topK, SearchResponse result,
                    Duration ttl, Object... qualifiers);

    Optional<SearchResponse> getCachedQuery(String query, SearchMode mode, int topK, Object... qualifiers);

    void cacheSemantic(String query, int nResults, SemanticMatches result, Duration ttl);

    Optional<SemanticMatches> getCachedSemantic(String query, int nResults);

    void cacheKnowledge(String id, String content, Duration ttl);

    Optional<String> getCachedKnowledge(String id);

    /**
     * 清空所有命名空间
     */
    void clearAll();

    /**
     * 清理所有命名空间中的过期条目
     *
     * @return 清理的条目总数
     */
    int purgeExpired();

    CacheManagerStats stats();

    /**
     * 生成缓存健康报告
     *
     * @return 报告
     */
    default CacheHealthReport healthReport() {
        return CacheHealthReport.from(stats());
    }
}
