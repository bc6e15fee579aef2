package cn.bafuka.knowsearch.core.impl;

import cn.bafuka.knowsearch.core.BoundedCache;
import cn.bafuka.knowsearch.core.CacheEntry;
import cn.bafuka.knowsearch.core.CacheStats;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 有界缓存实现
 * 基于访问顺序的 LinkedHashMap，严格 LRU 淘汰，惰性 TTL 过期
 * <p>
 * 每个实例持有一把锁，锁内只做内存中的 Map/计数修改。
 * 时间取自 Caffeine {@link Ticker}，测试中可替换为模拟时钟。
 *
 * @param <K> 缓存键类型
 * @param <V> 缓存值类型
 */
@Slf4j
public class LruBoundedCache<K, V> implements BoundedCache<K, V> {

    /**
     * 缓存名称（用于日志）
     */
    private final String name;

    private final int capacity;

    private final Ticker ticker;

    /**
     * 头部为最久未使用
     */
    private final LinkedHashMap<K, CacheEntry<V>> entries;

    private final ReentrantLock lock = new ReentrantLock();

    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expirationCount;

    public LruBoundedCache(String name, int capacity) {
        this(name, capacity, Ticker.systemTicker());
    }

    public LruBoundedCache(String name, int capacity, Ticker ticker) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正整数: name=" + name + ", capacity=" + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);

        log.info("构建有界缓存: name={}, capacity={}", name, capacity);
    }

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        long now = ticker.read();

        lock.lock();
        try {
            // 访问顺序模式下 get 即提升为最近使用
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                missCount++;
                log.debug("缓存未命中: name={}, key={}", name, key);
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                missCount++;
                expirationCount++;
                log.debug("缓存已过期: name={}, key={}", name, key);
                return Optional.empty();
            }
            hitCount++;
            log.debug("缓存命中: name={}, key={}", name, key);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("TTL 必须为正: name=" + name + ", ttl=" + ttl);
        }

        long now = ticker.read();
        long expiresAt = ttl == null ? CacheEntry.NO_EXPIRY : expiresAt(now, ttl);
        CacheEntry<V> entry = new CacheEntry<>(value, now, expiresAt);

        lock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                evictEldest();
            }
            // 已存在的键：替换值，同时被视为一次访问而移到尾部
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
        log.debug("缓存写入: name={}, key={}, ttl={}", name, key, ttl);
    }

    /**
     * 计算过期时刻；TTL 超出纳秒可表示范围（约 292 年）时视为永不过期
     */
    static long expiresAt(long now, Duration ttl) {
        try {
            return now + ttl.toNanos();
        } catch (ArithmeticException e) {
            return CacheEntry.NO_EXPIRY;
        }
    }

    /**
     * 淘汰头部（最久未使用）的一个条目，调用方需持有锁
     */
    private void evictEldest() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            Map.Entry<K, CacheEntry<V>> eldest = it.next();
            it.remove();
            evictionCount++;
            log.debug("LRU 淘汰: name={}, key={}", name, eldest.getKey());
        }
    }

    @Override
    public void delete(K key) {
        if (key == null) {
            return;
        }
        lock.lock();
        try {
            if (entries.remove(key) != null) {
                log.debug("缓存删除: name={}, key={}", name, key);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hitCount = 0;
            missCount = 0;
            evictionCount = 0;
            expirationCount = 0;
        } finally {
            lock.unlock();
        }
        log.info("缓存已清空: name={}", name);
    }

    @Override
    public int purgeExpired() {
        long now = ticker.read();
        int removed = 0;

        lock.lock();
        try {
            // 迭代 entrySet 不会改变访问顺序
            Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirationCount += removed;
        } finally {
            lock.unlock();
        }

        if (removed > 0) {
            log.debug("清理过期条目: name={}, removed={}", name, removed);
        }
        return removed;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.builder()
                    .size(entries.size())
                    .capacity(capacity)
                    .hitCount(hitCount)
                    .missCount(missCount)
                    .evictionCount(evictionCount)
                    .expirationCount(expirationCount)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }
}
