package cn.bafuka.knowsearch.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private int size;
    private int capacity;
    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expirationCount;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），尚无访问时为 0
     */
    public double getHitRate() {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 0.0 : (double) hitCount / requestCount;
    }
}
