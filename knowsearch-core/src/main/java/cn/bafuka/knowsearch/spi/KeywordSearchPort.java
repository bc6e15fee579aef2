package cn.bafuka.knowsearch.spi;

import cn.bafuka.knowsearch.model.KeywordMatch;

import java.util.List;

/**
 * 关键词（全文）检索端口
 * 对接知识库的标题/内容检索后端
 * <p>
 * 实现应将线程中断视为取消信号，尽快结束并抛出异常或返回
 */
public interface KeywordSearchPort {

    /**
     * 关键词检索
     *
     * @param query 查询
     * @param topK  最多返回条数
     * @return 按相关度降序排列的匹配项
     * @throws cn.bafuka.knowsearch.exception.KeywordSearchException 后端失败
     */
    List<KeywordMatch> search(String query, int topK);
}
