package cn.bafuka.knowsearch.service;

import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.model.HotQuery;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 热点查询统计
 * 基于 Caffeine 计数器缓存，统计时间窗口内各查询的出现次数，用于挑选预热候选
 */
@Slf4j
public class HotQueryTracker {

    /**
     * Key: 查询（去除首尾空白）
     * Value: 窗口内计数
     */
    private final Cache<String, AtomicLong> counters;

    private final int threshold;

    public HotQueryTracker(KnowSearchProperties.HotQueryConfig config) {
        this(config, Ticker.systemTicker());
    }

    public HotQueryTracker(KnowSearchProperties.HotQueryConfig config, Ticker ticker) {
        this.threshold = config.getThreshold();
        this.counters = Caffeine.newBuilder()
                .expireAfterWrite(config.getWindowSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getMaximumSize())
                .ticker(ticker)
                .build();

        log.info("构建热点查询计数器，配置: windowSeconds={}, threshold={}, maximumSize={}",
                config.getWindowSeconds(), config.getThreshold(), config.getMaximumSize());
    }

    /**
     * 记录一次查询
     *
     * @param query 查询
     * @return 窗口内当前计数
     */
    public long record(String query) {
        if (query == null || query.trim().isEmpty()) {
            return 0;
        }
        // 原子递增计数器
        AtomicLong count = counters.get(query.trim(), k -> new AtomicLong(0));
        long current = count.incrementAndGet();
        if (current == threshold) {
            log.debug("查询成为热点: query={}, count={}", query, current);
        }
        return current;
    }

    public long getCount(String query) {
        if (query == null) {
            return 0;
        }
        AtomicLong count = counters.getIfPresent(query.trim());
        return count == null ? 0 : count.get();
    }

    public boolean isHot(String query) {
        return getCount(query) >= threshold;
    }

    /**
     * 获取热点查询，按计数降序、同计数按查询字典序
     *
     * @param limit 最多返回条数
     * @return 热点查询
     */
    public List<HotQuery> hotQueries(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<HotQuery> hot = new ArrayList<>();
        for (Map.Entry<String, AtomicLong> entry : counters.asMap().entrySet()) {
            long count = entry.getValue().get();
            if (count >= threshold) {
                hot.add(new HotQuery(entry.getKey(), count));
            }
        }
        hot.sort(Comparator.comparingLong(HotQuery::getCount).reversed()
                .thenComparing(HotQuery::getQuery));
        return hot.size() > limit ? new ArrayList<>(hot.subList(0, limit)) : hot;
    }

    public void reset() {
        counters.invalidateAll();
        log.info("热点查询计数器已重置");
    }
}
