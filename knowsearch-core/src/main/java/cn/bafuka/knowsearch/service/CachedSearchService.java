package cn.bafuka.knowsearch.service;

import cn.bafuka.knowsearch.cache.CacheHealthReport;
import cn.bafuka.knowsearch.cache.CacheManagerStats;
import cn.bafuka.knowsearch.model.BatchSearchResult;
import cn.bafuka.knowsearch.model.HotQuery;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.WarmupResult;

import java.util.List;
import java.util.Optional;

/**
 * 带缓存的检索服务
 * 混合检索引擎之上的缓存门面：单次/高级/批量检索、缓存预热与命中率统计
 * <p>
 * 缓存本身出错时只记录日志并绕过缓存，检索照常完成
 */
public interface CachedSearchService {

    /**
     * 检索
     * 命中缓存时返回标注 fromCache=true 的副本，耗时只含查找；未命中时检索并写回缓存
     *
     * @param query    查询
     * @param topK     返回数量
     * @param mode     检索模式
     * @param alpha    关键词权重
     * @param useCache 是否读写缓存
     * @return 检索响应
     */
    SearchResponse search(String query, int topK, SearchMode mode, double alpha, boolean useCache);

    /**
     * 带分类/层级过滤的检索，缓存键额外包含过滤条件
     */
    SearchResponse advancedSearch(String query, String category, String level,
                                  int topK, SearchMode mode, double alpha, boolean useCache);

    /**
     * 批量检索，每个查询独立判断缓存，结果顺序与输入一致
     *
     * @param queries  查询列表
     * @param topK     返回数量
     * @param mode     检索模式
     * @param useCache 是否读写缓存
     * @return 批量结果与缓存命中率
     */
    BatchSearchResult batchSearch(List<String> queries, int topK, SearchMode mode, boolean useCache);

    /**
     * 缓存预热
     * 逐个执行检索只为写入缓存，单个查询失败不会中断预热
     *
     * @param commonQueries 常用查询
     * @param topK          返回数量
     * @param mode          检索模式
     * @return 预热结果
     */
    WarmupResult warmupCache(List<String> commonQueries, int topK, SearchMode mode);

    /**
     * 按 ID 获取知识内容（优先读 knowledge 缓存）
     *
     * @param id 知识 ID
     * @return 内容，不存在返回 empty
     */
    Optional<String> getKnowledge(String id);

    /**
     * @param limit 最多返回条数
     * @return 统计窗口内的热点查询
     */
    List<HotQuery> getHotQueries(int limit);

    CacheManagerStats getCacheStats();

    CacheHealthReport getCacheHealthReport();

    void clearCache();
}
