package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 检索响应
 * 写入缓存后视为只读，命中缓存时以 toBuilder 复制后再标注
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private String query;

    private SearchMode mode;

    private double alpha;

    /**
     * 高级检索的分类过滤条件
     */
    private String category;

    /**
     * 高级检索的层级过滤条件
     */
    private String level;

    @Builder.Default
    private List<FusedResult> results = Collections.emptyList();

    private SourceStats stats;

    private boolean fromCache;

    /**
     * 混合检索中有一路端口失败、结果仅来自另一路
     */
    private boolean degraded;

    @Builder.Default
    private Set<SearchSource> failedSources = Collections.emptySet();

    private SearchTiming timing;
}
