package cn.bafuka.knowsearch.core;

import java.time.Duration;
import java.util.Optional;

/**
 * 有界缓存核心接口
 * 容量受限、支持单条目 TTL、按最近最少使用（LRU）淘汰，线程安全
 *
 * @param <K> 缓存键类型
 * @param <V> 缓存值类型
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     * 条目已过期时视为不存在，移除并计为未命中；否则提升为最近使用并计为命中
     *
     * @param key 缓存键
     * @return 缓存值，不存在或已过期返回 empty
     */
    Optional<V> get(K key);

    /**
     * 写入缓存（永不过期）
     *
     * @param key   缓存键
     * @param value 缓存值
     */
    default void put(K key, V value) {
        put(key, value, null);
    }

    /**
     * 写入缓存
     * 键已存在时替换并提升为最近使用；新键且已满时先淘汰一个最久未使用的条目
     *
     * @param key   缓存键
     * @param value 缓存值
     * @param ttl   存活时间，null 表示永不过期
     */
    void put(K key, V value, Duration ttl);

    /**
     * 删除缓存，键不存在时无操作
     *
     * @param key 缓存键
     */
    void delete(K key);

    /**
     * 清空所有缓存并重置命中/未命中计数
     */
    void clear();

    /**
     * 清除所有已过期条目
     *
     * @return 清除的条目数
     */
    int purgeExpired();

    /**
     * @return 当前条目数
     */
    int size();

    /**
     * @return 容量上限
     */
    int capacity();

    /**
     * 获取缓存统计信息
     *
     * @return 统计信息快照
     */
    CacheStats stats();
}
