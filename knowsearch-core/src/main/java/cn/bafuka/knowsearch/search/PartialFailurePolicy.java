package cn.bafuka.knowsearch.search;

/**
 * 混合检索中单路端口失败时的处理策略
 */
public enum PartialFailurePolicy {

    /**
     * 任一路失败即取消另一路并向调用方抛出该路的异常
     */
    FAIL_FAST,

    /**
     * 一路失败时仅用另一路结果排序，响应标记为 degraded；两路都失败时抛出关键词异常
     */
    DEGRADE
}
