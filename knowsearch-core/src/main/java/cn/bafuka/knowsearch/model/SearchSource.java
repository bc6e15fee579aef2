package cn.bafuka.knowsearch.model;

/**
 * 检索结果来源
 */
public enum SearchSource {
    KEYWORD,
    SEMANTIC
}
