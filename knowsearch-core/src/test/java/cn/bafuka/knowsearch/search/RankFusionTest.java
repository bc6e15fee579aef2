package cn.bafuka.knowsearch.search;

import cn.bafuka.knowsearch.model.FusedResult;
import cn.bafuka.knowsearch.model.SearchHit;
import cn.bafuka.knowsearch.model.SearchSource;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * RankFusion 单元测试
 */
public class RankFusionTest {

    private static SearchHit keyword(String title, int rank) {
        return hit(title, rank, SearchSource.KEYWORD);
    }

    private static SearchHit semantic(String title, int rank) {
        return hit(title, rank, SearchSource.SEMANTIC);
    }

    private static SearchHit hit(String title, int rank, SearchSource source) {
        return SearchHit.builder()
                .title(title)
                .rank(rank)
                .score(1.0 / rank)
                .source(source)
                .build();
    }

    private static List<String> titles(List<FusedResult> results) {
        List<String> titles = new ArrayList<>();
        for (FusedResult result : results) {
            titles.add(result.getTitle());
        }
        return titles;
    }

    /**
     * 测试两路融合：两路都命中的标题排在前面
     */
    @Test
    public void testFuseBothSources() {
        List<FusedResult> results = RankFusion.fuse(
                Arrays.asList(keyword("X", 1), keyword("Y", 2)),
                Arrays.asList(semantic("Y", 1), semantic("Z", 2)),
                0.5, 10);

        assertEquals(Arrays.asList("Y", "X", "Z"), titles(results));
        assertEquals(0.5 / 3 + 0.25, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(0.25, results.get(1).getCombinedScore(), 1e-9);
        assertEquals(0.5 / 3, results.get(2).getCombinedScore(), 1e-9);

        FusedResult y = results.get(0);
        assertEquals(Integer.valueOf(2), y.getKeywordRank());
        assertEquals(Integer.valueOf(1), y.getSemanticRank());
        assertTrue(y.hasSource(SearchSource.KEYWORD));
        assertTrue(y.hasSource(SearchSource.SEMANTIC));

        FusedResult z = results.get(2);
        assertNull(z.getKeywordRank());
        assertFalse(z.hasSource(SearchSource.KEYWORD));
    }

    /**
     * 测试两路同名次命中：combinedScore = alpha/2 + (1-alpha)/2
     */
    @Test
    public void testDedupScore() {
        double alpha = 0.3;
        List<FusedResult> results = RankFusion.fuse(
                Collections.singletonList(keyword("T", 1)),
                Collections.singletonList(semantic("T", 1)),
                alpha, 10);

        assertEquals(1, results.size());
        assertEquals(alpha / 2 + (1 - alpha) / 2, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(0.5, results.get(0).getKeywordScore(), 1e-9);
        assertEquals(0.5, results.get(0).getSemanticScore(), 1e-9);
    }

    /**
     * 测试 alpha=1 时与关键词顺序一致，alpha=0 时与语义顺序一致
     */
    @Test
    public void testAlphaExtremes() {
        List<SearchHit> keywordHits = Arrays.asList(keyword("A", 1), keyword("B", 2), keyword("C", 3));
        List<SearchHit> semanticHits = Arrays.asList(semantic("C", 1), semantic("B", 2), semantic("A", 3));

        assertEquals(Arrays.asList("A", "B", "C"), titles(RankFusion.fuse(keywordHits, semanticHits, 1.0, 10)));
        assertEquals(Arrays.asList("C", "B", "A"), titles(RankFusion.fuse(keywordHits, semanticHits, 0.0, 10)));
    }

    /**
     * 测试同分时保持先关键词后语义的顺序，且结果确定
     */
    @Test
    public void testTieBreakAndDeterminism() {
        List<SearchHit> keywordHits = Collections.singletonList(keyword("K", 1));
        List<SearchHit> semanticHits = Collections.singletonList(semantic("S", 1));

        List<FusedResult> first = RankFusion.fuse(keywordHits, semanticHits, 0.5, 10);
        List<FusedResult> second = RankFusion.fuse(keywordHits, semanticHits, 0.5, 10);

        assertEquals(Arrays.asList("K", "S"), titles(first));
        assertEquals(first, second);
    }

    /**
     * 测试截断到 topK
     */
    @Test
    public void testTruncate() {
        List<FusedResult> results = RankFusion.fuse(
                Arrays.asList(keyword("A", 1), keyword("B", 2), keyword("C", 3)),
                Arrays.asList(semantic("D", 1), semantic("E", 2)),
                0.5, 2);

        assertEquals(2, results.size());
    }

    /**
     * 测试同一路内重复标题只计一次
     */
    @Test
    public void testDuplicateWithinSource() {
        List<FusedResult> results = RankFusion.fuse(
                Arrays.asList(keyword("A", 1), keyword("A", 2)),
                Collections.<SearchHit>emptyList(),
                0.5, 10);

        assertEquals(1, results.size());
        assertEquals(0.25, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(Integer.valueOf(1), results.get(0).getKeywordRank());
    }

    /**
     * 测试单路结果保持端口顺序并取原始得分
     */
    @Test
    public void testFromSingleSource() {
        List<FusedResult> results = RankFusion.fromSingleSource(Arrays.asList(
                SearchHit.builder().title("A").rank(1).score(0.3).source(SearchSource.KEYWORD).build(),
                SearchHit.builder().title("B").rank(2).score(0.9).source(SearchSource.KEYWORD).build()));

        assertEquals(Arrays.asList("A", "B"), titles(results));
        assertEquals(0.3, results.get(0).getCombinedScore(), 1e-9);
        assertEquals(0.3, results.get(0).getKeywordScore(), 1e-9);
        assertEquals(Integer.valueOf(2), results.get(1).getKeywordRank());
        assertNull(results.get(1).getSemanticRank());
    }

    /**
     * 测试多组合并保留最高分
     */
    @Test
    public void testMergeByMaxScore() {
        FusedResult a1 = FusedResult.builder().title("A").combinedScore(0.2).build();
        FusedResult b1 = FusedResult.builder().title("B").combinedScore(0.6).build();
        FusedResult a2 = FusedResult.builder().title("A").combinedScore(0.9).build();
        FusedResult c2 = FusedResult.builder().title("C").combinedScore(0.1).build();

        List<FusedResult> merged = RankFusion.mergeByMaxScore(
                Arrays.asList(Arrays.asList(a1, b1), Arrays.asList(a2, c2)), 2);

        assertEquals(2, merged.size());
        assertSame(a2, merged.get(0));
        assertSame(b1, merged.get(1));
    }
}
