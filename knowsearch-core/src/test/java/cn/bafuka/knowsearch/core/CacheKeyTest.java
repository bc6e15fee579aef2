package cn.bafuka.knowsearch.core;

import cn.bafuka.knowsearch.exception.CacheException;
import cn.bafuka.knowsearch.model.SearchMode;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * CacheKey 单元测试
 */
public class CacheKeyTest {

    /**
     * 测试相同参数派生相同的键与摘要
     */
    @Test
    public void testDeterministic() {
        CacheKey k1 = CacheKey.of("query", "明渠", SearchMode.HYBRID, 5, 0.5);
        CacheKey k2 = CacheKey.of("query", "明渠", SearchMode.HYBRID, 5, 0.5);

        assertEquals(k1, k2);
        assertEquals(k1.hashCode(), k2.hashCode());
        assertEquals(k1.digest(), k2.digest());
        assertEquals(64, k1.digest().length());
    }

    /**
     * 测试参数顺序敏感
     */
    @Test
    public void testOrderSensitive() {
        CacheKey k1 = CacheKey.of("query", "a", "b");
        CacheKey k2 = CacheKey.of("query", "b", "a");

        assertNotEquals(k1, k2);
        assertNotEquals(k1.digest(), k2.digest());
    }

    /**
     * 测试类型参与比较
     */
    @Test
    public void testTypeSensitive() {
        assertNotEquals(CacheKey.of("query", 5), CacheKey.of("query", 5L));
        assertNotEquals(CacheKey.of("query", "5").digest(), CacheKey.of("query", 5).digest());
    }

    /**
     * 测试命名空间隔离
     */
    @Test
    public void testNamespaceSeparation() {
        assertNotEquals(CacheKey.of("query", "x"), CacheKey.of("semantic", "x"));
        assertNotEquals(CacheKey.of("query", "x").digest(), CacheKey.of("semantic", "x").digest());
    }

    /**
     * 测试长度前缀避免拼接歧义
     */
    @Test
    public void testNoConcatenationAmbiguity() {
        CacheKey k1 = CacheKey.of("query", "a|b", "c");
        CacheKey k2 = CacheKey.of("query", "a", "b|c");

        assertNotEquals(k1.digest(), k2.digest());
    }

    /**
     * 测试 BigDecimal 按数值归一
     */
    @Test
    public void testBigDecimalNormalized() {
        CacheKey k1 = CacheKey.of("query", new BigDecimal("1.0"));
        CacheKey k2 = CacheKey.of("query", new BigDecimal("1.00"));

        assertEquals(k1, k2);
        assertEquals(k1.digest(), k2.digest());
    }

    /**
     * 测试集合参数与 null 参数
     */
    @Test
    public void testCollectionAndNullParts() {
        CacheKey k1 = CacheKey.of("query", Arrays.asList("x", 1), null);
        CacheKey k2 = CacheKey.of("query", Arrays.asList("x", 1), null);

        assertEquals(k1, k2);
        assertEquals(k1.digest(), k2.digest());
        assertNotEquals(k1, CacheKey.of("query", Arrays.asList("x", 2), null));
    }

    /**
     * 测试不支持的参数类型
     */
    @Test(expected = CacheException.class)
    public void testUnsupportedType() {
        Map<String, String> map = new HashMap<>();
        CacheKey.of("query", map);
    }

    /**
     * 测试空命名空间
     */
    @Test(expected = CacheException.class)
    public void testEmptyNamespace() {
        CacheKey.of("", "x");
    }
}
