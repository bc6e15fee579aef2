package cn.bafuka.knowsearch.example.port;

import cn.bafuka.knowsearch.example.entity.KnowledgeItem;
import cn.bafuka.knowsearch.spi.KnowledgeContentPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 内存知识内容端口
 */
@Slf4j
@Component
public class InMemoryKnowledgeContentPort implements KnowledgeContentPort {

    private final InMemoryKnowledgeStore store;

    public InMemoryKnowledgeContentPort(InMemoryKnowledgeStore store) {
        this.store = store;
    }

    @Override
    public Optional<String> load(String id) {
        log.info("从知识库加载内容: id={}", id);
        return store.findById(id).map(KnowledgeItem::getContent);
    }
}
