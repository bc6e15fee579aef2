package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 检索耗时（毫秒）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchTiming {

    private double keywordMs;

    private double semanticMs;

    private double fusionMs;

    /**
     * 缓存查找耗时，未使用缓存时为 0
     */
    private double cacheLookupMs;

    private double totalMs;

    public static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
