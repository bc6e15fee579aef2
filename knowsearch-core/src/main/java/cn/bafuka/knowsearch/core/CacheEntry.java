package cn.bafuka.knowsearch.core;

import lombok.Getter;
import lombok.ToString;

/**
 * 缓存条目
 * 只替换不修改；时间戳取自缓存的 Ticker（纳秒）
 *
 * @param <V> 缓存值类型
 */
@Getter
@ToString
public final class CacheEntry<V> {

    /**
     * 永不过期
     */
    public static final long NO_EXPIRY = Long.MAX_VALUE;

    private final V value;

    private final long createdAtNanos;

    private final long expiresAtNanos;

    public CacheEntry(V value, long createdAtNanos, long expiresAtNanos) {
        this.value = value;
        this.createdAtNanos = createdAtNanos;
        this.expiresAtNanos = expiresAtNanos;
    }

    public boolean hasExpiry() {
        return expiresAtNanos != NO_EXPIRY;
    }

    /**
     * 判断在给定时刻是否已过期（到达 expiresAt 即视为过期）
     *
     * @param nowNanos 当前时刻
     * @return 是否过期
     */
    public boolean isExpired(long nowNanos) {
        return hasExpiry() && nowNanos - expiresAtNanos >= 0;
    }
}
