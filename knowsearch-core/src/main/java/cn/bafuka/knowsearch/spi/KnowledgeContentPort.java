package cn.bafuka.knowsearch.spi;

import java.util.Optional;

/**
 * 知识内容端口
 * 按 ID 读取知识条目正文
 */
public interface KnowledgeContentPort {

    /**
     * @param id 知识 ID
     * @return 正文，不存在返回 empty
     */
    Optional<String> load(String id);
}
