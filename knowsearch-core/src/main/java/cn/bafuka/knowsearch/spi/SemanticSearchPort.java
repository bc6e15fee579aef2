package cn.bafuka.knowsearch.spi;

import cn.bafuka.knowsearch.model.SemanticMatches;

/**
 * 语义（向量）检索端口
 * 对接向量库的近邻检索
 * <p>
 * 实现应将线程中断视为取消信号，尽快结束并抛出异常或返回
 */
public interface SemanticSearchPort {

    /**
     * 语义检索
     *
     * @param query    查询
     * @param nResults 最多返回条数
     * @return 按距离升序排列的近邻结果
     * @throws cn.bafuka.knowsearch.exception.SemanticSearchException 后端失败
     */
    SemanticMatches search(String query, int nResults);
}
