package cn.bafuka.knowsearch.example.port;

import cn.bafuka.knowsearch.model.KeywordMatch;
import cn.bafuka.knowsearch.model.SemanticMatches;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * 内存检索端口测试
 */
public class InMemorySearchPortsTest {

    private InMemoryKnowledgeStore store;

    @Before
    public void setUp() {
        store = new InMemoryKnowledgeStore();
    }

    /**
     * 测试关键词检索按得分降序并截断
     */
    @Test
    public void testKeywordSearchOrderedAndTruncated() {
        InMemoryKeywordSearchPort port = new InMemoryKeywordSearchPort(store);

        List<KeywordMatch> matches = port.search("水跃 消能", 2);

        assertFalse(matches.isEmpty());
        assertTrue(matches.size() <= 2);
        assertEquals("水跃", matches.get(0).getTitle());
        for (int i = 1; i < matches.size(); i++) {
            assertTrue(matches.get(i - 1).getMatchScore() >= matches.get(i).getMatchScore());
        }
    }

    /**
     * 测试无匹配时返回空列表
     */
    @Test
    public void testKeywordSearchNoMatch() {
        InMemoryKeywordSearchPort port = new InMemoryKeywordSearchPort(store);

        assertTrue(port.search("完全无关", 5).isEmpty());
    }

    /**
     * 测试语义检索三个列表长度一致且距离递增
     */
    @Test
    public void testSemanticSearchParallelLists() {
        InMemorySemanticSearchPort port = new InMemorySemanticSearchPort(store);

        SemanticMatches matches = port.search("洪水 演算 河道", 3);

        assertTrue(matches.size() > 0);
        assertTrue(matches.size() <= 3);
        assertEquals(matches.getIds().size(), matches.getMetadatas().size());
        assertEquals(matches.getIds().size(), matches.getDistances().size());
        assertEquals("马斯京根法", matches.getMetadatas().get(0).getTitle());
        for (int i = 1; i < matches.size(); i++) {
            assertTrue(matches.getDistances().get(i - 1) <= matches.getDistances().get(i));
        }
    }

    /**
     * 测试 Jaccard 距离
     */
    @Test
    public void testJaccardDistance() {
        assertEquals(0.0, InMemorySemanticSearchPort.jaccardDistance(
                new HashSet<>(Arrays.asList("a", "b")), new HashSet<>(Arrays.asList("a", "b"))), 1e-9);
        assertEquals(1.0, InMemorySemanticSearchPort.jaccardDistance(
                new HashSet<>(Collections.singletonList("a")), new HashSet<>(Collections.singletonList("b"))), 1e-9);
        assertEquals(2.0 / 3, InMemorySemanticSearchPort.jaccardDistance(
                new HashSet<>(Arrays.asList("a", "b")), new HashSet<>(Arrays.asList("b", "c"))), 1e-9);
    }

    /**
     * 测试知识内容加载
     */
    @Test
    public void testKnowledgeContentLoad() {
        InMemoryKnowledgeContentPort port = new InMemoryKnowledgeContentPort(store);

        Optional<String> content = port.load("hyd-002");
        assertTrue(content.isPresent());
        assertTrue(content.get().contains("水跃"));
        assertFalse(port.load("missing").isPresent());
    }
}
