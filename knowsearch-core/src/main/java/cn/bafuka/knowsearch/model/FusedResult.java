package cn.bafuka.knowsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 融合后的检索结果
 * <p>
 * 混合模式下 keywordScore / semanticScore 为名次归一化得分 1/(r+1)；
 * 单路模式下为端口原始得分。combinedScore 是最终排序依据。
 */
@Value
@Builder(toBuilder = true)
public class FusedResult {

    String title;

    String category;

    String level;

    double keywordScore;

    double semanticScore;

    /**
     * 关键词名次，未被关键词检索命中时为 null
     */
    Integer keywordRank;

    /**
     * 语义名次，未被语义检索命中时为 null
     */
    Integer semanticRank;

    /**
     * 贡献了该标题的检索来源（不可变）
     */
    Set<SearchSource> sources;

    double combinedScore;

    public boolean hasSource(SearchSource source) {
        return sources != null && sources.contains(source);
    }
}
