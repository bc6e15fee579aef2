package cn.bafuka.knowsearch.cache.impl;

import cn.bafuka.knowsearch.cache.CacheManagerStats;
import cn.bafuka.knowsearch.cache.CacheNamespace;
import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.model.KnowledgeMetadata;
import cn.bafuka.knowsearch.model.SearchMode;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.SemanticMatches;
import cn.bafuka.knowsearch.support.FakeTicker;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * DefaultCacheManager 单元测试
 */
public class DefaultCacheManagerTest {

    private FakeTicker ticker;

    private DefaultCacheManager cacheManager;

    @Before
    public void setUp() {
        ticker = new FakeTicker();
        cacheManager = new DefaultCacheManager(new KnowSearchProperties.CacheConfig(), ticker);
    }

    private static SearchResponse response(String query) {
        return SearchResponse.builder()
                .query(query)
                .mode(SearchMode.HYBRID)
                .alpha(0.5)
                .build();
    }

    /**
     * 测试查询缓存读写
     */
    @Test
    public void testQueryRoundTrip() {
        SearchResponse response = response("明渠");
        cacheManager.cacheQuery("明渠", SearchMode.HYBRID, 5, response, null, 0.5);

        assertSame(response, cacheManager.getCachedQuery("明渠", SearchMode.HYBRID, 5, 0.5).orElse(null));
        assertFalse(cacheManager.getCachedQuery("明渠", SearchMode.HYBRID, 5, 0.7).isPresent());
        assertFalse(cacheManager.getCachedQuery("明渠", SearchMode.KEYWORD, 5, 0.5).isPresent());
        assertFalse(cacheManager.getCachedQuery("明渠", SearchMode.HYBRID, 10, 0.5).isPresent());
    }

    /**
     * 测试命名空间默认 TTL
     */
    @Test
    public void testNamespaceDefaultTtl() {
        cacheManager.cacheQuery("q", SearchMode.KEYWORD, 5, response("q"), null);
        cacheManager.cacheKnowledge("id-1", "content", null);

        ticker.advance(Duration.ofSeconds(3600));

        assertFalse(cacheManager.getCachedQuery("q", SearchMode.KEYWORD, 5).isPresent());
        assertEquals("content", cacheManager.getCachedKnowledge("id-1").orElse(null));
    }

    /**
     * 测试显式 TTL 覆盖默认值
     */
    @Test
    public void testExplicitTtl() {
        cacheManager.cacheKnowledge("id-1", "content", Duration.ofSeconds(10));

        ticker.advance(Duration.ofSeconds(10));

        assertFalse(cacheManager.getCachedKnowledge("id-1").isPresent());
    }

    /**
     * 测试默认 TTL 配置为 0 表示永不过期
     */
    @Test
    public void testZeroDefaultTtlNeverExpires() {
        KnowSearchProperties.CacheConfig config = new KnowSearchProperties.CacheConfig();
        config.setKnowledge(new KnowSearchProperties.NamespaceConfig(5, 0));
        DefaultCacheManager manager = new DefaultCacheManager(config, ticker);

        manager.cacheKnowledge("id-1", "content", null);
        ticker.advance(Duration.ofDays(30));

        assertTrue(manager.getCachedKnowledge("id-1").isPresent());
    }

    /**
     * 测试语义缓存按 (query, nResults) 区分
     */
    @Test
    public void testSemanticCache() {
        SemanticMatches matches = SemanticMatches.builder()
                .ids(Collections.singletonList("doc-1"))
                .metadatas(Collections.singletonList(new KnowledgeMetadata("水跃", "水力学", "本科")))
                .distances(Collections.singletonList(0.2))
                .build();
        cacheManager.cacheSemantic("水跃", 10, matches, null);

        assertSame(matches, cacheManager.getCachedSemantic("水跃", 10).orElse(null));
        assertFalse(cacheManager.getCachedSemantic("水跃", 5).isPresent());
    }

    /**
     * 测试统计按命名空间顺序输出并汇总总条目数
     */
    @Test
    public void testStats() {
        cacheManager.cacheQuery("q1", SearchMode.HYBRID, 5, response("q1"), null);
        cacheManager.cacheQuery("q2", SearchMode.HYBRID, 5, response("q2"), null);
        cacheManager.cacheKnowledge("id-1", "content", null);
        cacheManager.getCachedQuery("q1", SearchMode.HYBRID, 5);
        cacheManager.getCachedQuery("q3", SearchMode.HYBRID, 5);

        CacheManagerStats stats = cacheManager.stats();

        assertEquals(Arrays.asList("query", "semantic", "knowledge"),
                new ArrayList<>(stats.getNamespaces().keySet()));
        assertEquals(3, stats.getTotalSize());
        assertEquals(2, stats.get(CacheNamespace.QUERY).getSize());
        assertEquals(200, stats.get(CacheNamespace.QUERY).getCapacity());
        assertEquals(0.5, stats.get(CacheNamespace.QUERY).getHitRate(), 1e-9);
        assertEquals(100, stats.get(CacheNamespace.SEMANTIC).getCapacity());
        assertEquals(50, stats.get(CacheNamespace.KNOWLEDGE).getCapacity());
    }

    /**
     * 测试 clearAll 与 purgeExpired
     */
    @Test
    public void testClearAllAndPurge() {
        cacheManager.cacheQuery("q1", SearchMode.HYBRID, 5, response("q1"), Duration.ofSeconds(1));
        cacheManager.cacheKnowledge("id-1", "content", null);

        ticker.advance(Duration.ofSeconds(2));
        assertEquals(1, cacheManager.purgeExpired());
        assertEquals(1, cacheManager.stats().getTotalSize());

        cacheManager.clearAll();
        assertEquals(0, cacheManager.stats().getTotalSize());
    }

    /**
     * 测试命名空间容量配置生效
     */
    @Test
    public void testConfiguredCapacity() {
        KnowSearchProperties.CacheConfig config = new KnowSearchProperties.CacheConfig();
        config.setQuery(new KnowSearchProperties.NamespaceConfig(2, 60));
        DefaultCacheManager manager = new DefaultCacheManager(config, ticker);

        manager.cacheQuery("a", SearchMode.HYBRID, 5, response("a"), null);
        manager.cacheQuery("b", SearchMode.HYBRID, 5, response("b"), null);
        manager.cacheQuery("c", SearchMode.HYBRID, 5, response("c"), null);

        assertEquals(2, manager.stats().get(CacheNamespace.QUERY).getSize());
        assertFalse(manager.getCachedQuery("a", SearchMode.HYBRID, 5).isPresent());
    }
}
