package cn.bafuka.knowsearch.example.port;

import cn.bafuka.knowsearch.example.entity.KnowledgeItem;
import cn.bafuka.knowsearch.model.KnowledgeMetadata;
import cn.bafuka.knowsearch.model.SemanticMatches;
import cn.bafuka.knowsearch.spi.SemanticSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 内存语义检索
 * 用词集合的 Jaccard 距离模拟向量距离，距离取值 [0, 1]
 */
@Component
public class InMemorySemanticSearchPort implements SemanticSearchPort {

    private final InMemoryKnowledgeStore store;

    public InMemorySemanticSearchPort(InMemoryKnowledgeStore store) {
        this.store = store;
    }

    @Override
    public SemanticMatches search(String query, int nResults) {
        Set<String> queryTerms = new HashSet<>(InMemoryKnowledgeStore.tokenize(query));

        List<Scored> scored = new ArrayList<>();
        for (KnowledgeItem item : store.all()) {
            Set<String> docTerms = new HashSet<>(InMemoryKnowledgeStore.tokenize(item.getContent()));
            docTerms.addAll(InMemoryKnowledgeStore.tokenize(item.getTitle()));
            scored.add(new Scored(item, jaccardDistance(queryTerms, docTerms)));
        }
        scored.sort(Comparator.comparingDouble(s -> s.distance));

        List<String> ids = new ArrayList<>();
        List<KnowledgeMetadata> metadatas = new ArrayList<>();
        List<Double> distances = new ArrayList<>();
        for (Scored s : scored) {
            if (ids.size() >= nResults || s.distance >= 1.0) {
                break;
            }
            ids.add(s.item.getId());
            metadatas.add(new KnowledgeMetadata(s.item.getTitle(), s.item.getCategory(), s.item.getLevel()));
            distances.add(s.distance);
        }
        return SemanticMatches.builder()
                .ids(ids)
                .metadatas(metadatas)
                .distances(distances)
                .build();
    }

    static double jaccardDistance(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return 1.0 - (double) intersection.size() / union.size();
    }

    private static final class Scored {

        private final KnowledgeItem item;
        private final double distance;

        private Scored(KnowledgeItem item, double distance) {
            this.item = item;
            this.distance = distance;
        }
    }
}
