package cn.bafuka.knowsearch.search;

import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;

import java.util.List;

/**
 * 混合检索引擎
 * 组合关键词与语义两路检索，按名次归一化后加权融合、按标题去重
 */
public interface HybridSearchEngine {

    /**
     * 检索
     *
     * @param query 查询
     * @param topK  返回数量，必须为正
     * @param mode  检索模式
     * @param alpha 关键词权重，取值 [0, 1]；1 等价于纯关键词排序，0 等价于纯语义排序
     * @return 检索响应
     * @throws cn.bafuka.knowsearch.exception.KeywordSearchException  关键词端口失败
     * @throws cn.bafuka.knowsearch.exception.SemanticSearchException 语义端口失败
     * @throws cn.bafuka.knowsearch.exception.SearchCancelledException 检索被取消
     */
    SearchResponse search(String query, int topK, SearchMode mode, double alpha);

    /**
     * 带分类/层级过滤的检索
     * 先以 topK * 3 过采样，再按分类（子串匹配）和层级（精确匹配）过滤，收集满 topK 条即停止
     *
     * @param query    查询
     * @param category 分类过滤，null 或空串表示不过滤
     * @param level    层级过滤，null 或空串表示不过滤
     * @param topK     返回数量
     * @param mode     检索模式
     * @param alpha    关键词权重
     * @return 检索响应
     */
    SearchResponse advancedSearch(String query, String category, String level,
                                  int topK, SearchMode mode, double alpha);

    /**
     * 多查询检索
     * 逐个查询检索后按标题合并，同一标题保留最高 combinedScore，重新排序后截断
     *
     * @param queries 查询列表
     * @param topK    返回数量
     * @param mode    检索模式
     * @return 检索响应
     */
    SearchResponse multiQuerySearch(List<String> queries, int topK, SearchMode mode);
}
