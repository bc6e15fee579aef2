package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量检索结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSearchResult {

    /**
     * 与输入查询顺序一致
     */
    private List<SearchResponse> results;

    private int total;

    private int cacheHits;

    private double cacheHitRate;

    private double totalMs;

    private double avgMs;
}
