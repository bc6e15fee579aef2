package cn.bafuka.knowsearch.model;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * SearchMode 单元测试
 */
public class SearchModeTest {

    /**
     * 测试按名称解析（忽略大小写）
     */
    @Test
    public void testFromValue() {
        assertEquals(SearchMode.KEYWORD, SearchMode.fromValue("keyword"));
        assertEquals(SearchMode.SEMANTIC, SearchMode.fromValue(" Semantic "));
        assertEquals(SearchMode.HYBRID, SearchMode.fromValue("HYBRID"));
    }

    /**
     * 测试未知模式
     */
    @Test(expected = IllegalArgumentException.class)
    public void testUnknownValue() {
        SearchMode.fromValue("fuzzy");
    }

    /**
     * 测试 null
     */
    @Test(expected = IllegalArgumentException.class)
    public void testNullValue() {
        SearchMode.fromValue(null);
    }
}
