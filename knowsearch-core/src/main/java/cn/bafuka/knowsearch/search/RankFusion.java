package cn.bafuka.knowsearch.search;

import cn.bafuka.knowsearch.model.FusedResult;
import cn.bafuka.knowsearch.model.SearchHit;
import cn.bafuka.knowsearch.model.SearchSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 名次融合算法
 * <p>
 * 名次 r（从 1 开始）归一化为 1/(r+1)；关键词贡献 alpha * norm，语义贡献 (1 - alpha) * norm。
 * 以标题（区分大小写的精确匹配）为去重标识。按 combinedScore 降序稳定排序，
 * 同分时保持先关键词后语义的插入顺序。
 */
public final class RankFusion {

    /**
     * 按 combinedScore 降序；List.sort 为稳定排序
     */
    public static final Comparator<FusedResult> BY_COMBINED_SCORE_DESC =
            Comparator.comparingDouble(FusedResult::getCombinedScore).reversed();

    private RankFusion() {
    }

    public static double normalizedScore(int rank) {
        return 1.0 / (rank + 1);
    }

    /**
     * 融合两路结果
     *
     * @param keywordHits  关键词命中，按名次排列
     * @param semanticHits 语义命中，按名次排列
     * @param alpha        关键词权重
     * @param topK         截断数量
     * @return 融合结果
     */
    public static List<FusedResult> fuse(List<SearchHit> keywordHits, List<SearchHit> semanticHits,
                                         double alpha, int topK) {
        Map<String, Candidate> merged = new LinkedHashMap<>();

        for (SearchHit hit : keywordHits) {
            double norm = normalizedScore(hit.getRank());
            Candidate candidate = merged.computeIfAbsent(hit.getTitle(), t -> new Candidate(hit));
            if (candidate.sources.contains(SearchSource.KEYWORD)) {
                // 同一路内重复标题只计最靠前的一次
                continue;
            }
            candidate.keywordScore = norm;
            candidate.keywordRank = hit.getRank();
            candidate.sources.add(SearchSource.KEYWORD);
            candidate.combinedScore += alpha * norm;
        }

        for (SearchHit hit : semanticHits) {
            double norm = normalizedScore(hit.getRank());
            Candidate candidate = merged.computeIfAbsent(hit.getTitle(), t -> new Candidate(hit));
            if (candidate.sources.contains(SearchSource.SEMANTIC)) {
                continue;
            }
            candidate.fillMissing(hit);
            candidate.semanticScore = norm;
            candidate.semanticRank = hit.getRank();
            candidate.sources.add(SearchSource.SEMANTIC);
            candidate.combinedScore += (1 - alpha) * norm;
        }

        List<FusedResult> results = new ArrayList<>(merged.size());
        for (Candidate candidate : merged.values()) {
            results.add(candidate.toResult());
        }
        return sortAndTruncate(results, topK);
    }

    /**
     * 单路结果直接转换，保持端口顺序，combinedScore 取端口原始得分
     *
     * @param hits 单路命中
     * @return 融合结果
     */
    public static List<FusedResult> fromSingleSource(List<SearchHit> hits) {
        List<FusedResult> results = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            Candidate candidate = new Candidate(hit);
            candidate.sources.add(hit.getSource());
            if (hit.getSource() == SearchSource.KEYWORD) {
                candidate.keywordScore = hit.getScore();
                candidate.keywordRank = hit.getRank();
            } else {
                candidate.semanticScore = hit.getScore();
                candidate.semanticRank = hit.getRank();
            }
            candidate.combinedScore = hit.getScore();
            results.add(candidate.toResult());
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * 合并多组结果：同一标题保留 combinedScore 最高的一条，位置取首次出现的位置
     *
     * @param groups 多组结果
     * @param topK   截断数量
     * @return 合并结果
     */
    public static List<FusedResult> mergeByMaxScore(List<List<FusedResult>> groups, int topK) {
        Map<String, FusedResult> best = new LinkedHashMap<>();
        for (List<FusedResult> group : groups) {
            for (FusedResult result : group) {
                best.merge(result.getTitle(), result,
                        (current, candidate) -> candidate.getCombinedScore() > current.getCombinedScore()
                                ? candidate : current);
            }
        }
        return sortAndTruncate(new ArrayList<>(best.values()), topK);
    }

    private static List<FusedResult> sortAndTruncate(List<FusedResult> results, int topK) {
        results.sort(BY_COMBINED_SCORE_DESC);
        if (results.size() > topK) {
            results = new ArrayList<>(results.subList(0, topK));
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * 融合过程中的可变累加器
     */
    private static final class Candidate {

        private final String title;
        private String category;
        private String level;
        private double keywordScore;
        private double semanticScore;
        private Integer keywordRank;
        private Integer semanticRank;
        private final EnumSet<SearchSource> sources = EnumSet.noneOf(SearchSource.class);
        private double combinedScore;

        private Candidate(SearchHit hit) {
            this.title = hit.getTitle();
            this.category = hit.getCategory();
            this.level = hit.getLevel();
        }

        private void fillMissing(SearchHit hit) {
            if (category == null) {
                category = hit.getCategory();
            }
            if (level == null) {
                level = hit.getLevel();
            }
        }

        private FusedResult toResult() {
            return FusedResult.builder()
                    .title(title)
                    .category(category)
                    .level(level)
                    .keywordScore(keywordScore)
                    .semanticScore(semanticScore)
                    .keywordRank(keywordRank)
                    .semanticRank(semanticRank)
                    .sources(Collections.unmodifiableSet(EnumSet.copyOf(sources)))
                    .combinedScore(combinedScore)
                    .build();
        }
    }
}
