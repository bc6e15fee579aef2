package cn.bafuka.knowsearch.example.port;

import cn.bafuka.knowsearch.example.entity.KnowledgeItem;
import cn.bafuka.knowsearch.model.KeywordMatch;
import cn.bafuka.knowsearch.spi.KeywordSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 内存关键词检索
 * 得分 = 标题命中 2 分 + 正文中每个命中的查询词 1 分
 */
@Component
public class InMemoryKeywordSearchPort implements KeywordSearchPort {

    private final InMemoryKnowledgeStore store;

    public InMemoryKeywordSearchPort(InMemoryKnowledgeStore store) {
        this.store = store;
    }

    @Override
    public List<KeywordMatch> search(String query, int topK) {
        List<String> terms = InMemoryKnowledgeStore.tokenize(query);
        List<KeywordMatch> matches = new ArrayList<>();
        for (KnowledgeItem item : store.all()) {
            double score = score(item, terms);
            if (score > 0) {
                matches.add(KeywordMatch.builder()
                        .title(item.getTitle())
                        .content(item.getContent())
                        .category(item.getCategory())
                        .level(item.getLevel())
                        .matchScore(score)
                        .build());
            }
        }
        matches.sort(Comparator.comparingDouble(KeywordMatch::getMatchScore).reversed());
        return matches.size() > topK ? new ArrayList<>(matches.subList(0, topK)) : matches;
    }

    private static double score(KnowledgeItem item, List<String> terms) {
        String title = item.getTitle().toLowerCase(Locale.ROOT);
        List<String> content = InMemoryKnowledgeStore.tokenize(item.getContent());
        double score = 0;
        for (String term : terms) {
            if (title.contains(term)) {
                score += 2;
            }
            if (content.contains(term)) {
                score += 1;
            }
        }
        return score;
    }
}
