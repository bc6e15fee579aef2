package cn.bafuka.knowsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;

/**
 * 结果来源分布统计（不可变，缓存中的响应与返回给调用方的副本共用同一实例）
 */
@Value
@Builder
public class SourceStats {

    int keywordOnly;

    int semanticOnly;

    int both;

    /**
     * 统计一组融合结果的来源分布
     *
     * @param results 融合结果
     * @return 来源统计
     */
    public static SourceStats of(Collection<FusedResult> results) {
        int keywordOnly = 0;
        int semanticOnly = 0;
        int both = 0;
        for (FusedResult result : results) {
            boolean keyword = result.hasSource(SearchSource.KEYWORD);
            boolean semantic = result.hasSource(SearchSource.SEMANTIC);
            if (keyword && semantic) {
                both++;
            } else if (keyword) {
                keywordOnly++;
            } else if (semantic) {
                semanticOnly++;
            }
        }
        return new SourceStats(keywordOnly, semanticOnly, both);
    }
}
