package cn.bafuka.knowsearch.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单路检索命中项
 * 每次检索调用新建，不持久化
 */
@Value
@Builder
public class SearchHit {

    String title;

    String category;

    String level;

    /**
     * 端口原始得分：关键词为 matchScore，语义为 1 - distance
     */
    double score;

    /**
     * 名次，从 1 开始
     */
    int rank;

    SearchSource source;
}
