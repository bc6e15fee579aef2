package cn.bafuka.knowsearch.service;

import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.model.HotQuery;
import cn.bafuka.knowsearch.support.FakeTicker;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.*;

/**
 * HotQueryTracker 单元测试
 */
public class HotQueryTrackerTest {

    private FakeTicker ticker;

    private HotQueryTracker tracker;

    @Before
    public void setUp() {
        ticker = new FakeTicker();
        KnowSearchProperties.HotQueryConfig config = new KnowSearchProperties.HotQueryConfig();
        config.setWindowSeconds(10);
        config.setThreshold(2);
        tracker = new HotQueryTracker(config, ticker);
    }

    /**
     * 测试计数与热点判定
     */
    @Test
    public void testRecordAndIsHot() {
        assertEquals(1, tracker.record("水跃"));
        assertFalse(tracker.isHot("水跃"));

        assertEquals(2, tracker.record(" 水跃 "));
        assertTrue(tracker.isHot("水跃"));
        assertEquals(0, tracker.getCount("明渠"));
    }

    /**
     * 测试空查询不计数
     */
    @Test
    public void testBlankQueryIgnored() {
        assertEquals(0, tracker.record(null));
        assertEquals(0, tracker.record("   "));
    }

    /**
     * 测试热点排序：计数降序，同计数按查询排序
     */
    @Test
    public void testHotQueriesOrdering() {
        for (int i = 0; i < 3; i++) {
            tracker.record("b");
        }
        tracker.record("a");
        tracker.record("a");
        tracker.record("c");
        tracker.record("c");
        tracker.record("d");

        List<HotQuery> hot = tracker.hotQueries(10);

        assertEquals(3, hot.size());
        assertEquals("b", hot.get(0).getQuery());
        assertEquals(3, hot.get(0).getCount());
        assertEquals("a", hot.get(1).getQuery());
        assertEquals("c", hot.get(2).getQuery());

        assertEquals(1, tracker.hotQueries(1).size());
    }

    /**
     * 测试统计窗口过期后计数清零
     */
    @Test
    public void testWindowExpiry() {
        tracker.record("水跃");
        tracker.record("水跃");

        ticker.advance(Duration.ofSeconds(11));

        assertEquals(0, tracker.getCount("水跃"));
        assertTrue(tracker.hotQueries(10).isEmpty());
    }

    /**
     * 测试重置
     */
    @Test
    public void testReset() {
        tracker.record("水跃");
        tracker.reset();

        assertEquals(0, tracker.getCount("水跃"));
    }
}
