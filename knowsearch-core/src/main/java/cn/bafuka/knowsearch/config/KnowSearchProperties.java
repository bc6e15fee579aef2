package cn.bafuka.knowsearch.config;

import cn.bafuka.knowsearch.cache.CacheNamespace;
import cn.bafuka.knowsearch.search.PartialFailurePolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * KnowSearch 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "knowsearch")
public class KnowSearchProperties {

    /**
     * 是否启用 KnowSearch
     */
    private boolean enabled = true;

    /**
     * 三个缓存命名空间的配置
     */
    private CacheConfig cache = new CacheConfig();

    /**
     * 检索配置
     */
    private SearchConfig search = new SearchConfig();

    /**
     * 热点查询统计配置
     */
    private HotQueryConfig hotQuery = new HotQueryConfig();

    /**
     * 缓存命名空间配置
     */
    @Data
    public static class CacheConfig {

        private NamespaceConfig query = NamespaceConfig.defaultsOf(CacheNamespace.QUERY);

        private NamespaceConfig semantic = NamespaceConfig.defaultsOf(CacheNamespace.SEMANTIC);

        private NamespaceConfig knowledge = NamespaceConfig.defaultsOf(CacheNamespace.KNOWLEDGE);

        public NamespaceConfig forNamespace(CacheNamespace namespace) {
            switch (namespace) {
                case QUERY:
                    return query;
                case SEMANTIC:
                    return semantic;
                case KNOWLEDGE:
                    return knowledge;
                default:
                    throw new IllegalArgumentException("未知的缓存命名空间: " + namespace);
            }
        }
    }

    /**
     * 单个命名空间配置
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NamespaceConfig {

        /**
         * 最大容量
         */
        private int capacity;

        /**
         * 默认过期时间（秒）
         */
        private long defaultTtlSeconds;

        public static NamespaceConfig defaultsOf(CacheNamespace namespace) {
            return new NamespaceConfig(namespace.getDefaultCapacity(), namespace.getDefaultTtl().getSeconds());
        }
    }

    /**
     * 检索配置
     */
    @Data
    public static class SearchConfig {

        private int defaultTopK = 5;

        /**
         * 关键词权重，取值 [0, 1]
         */
        private double defaultAlpha = 0.5;

        /**
         * 混合模式下单路端口失败时的处理策略
         */
        private PartialFailurePolicy partialFailurePolicy = PartialFailurePolicy.DEGRADE;

        /**
         * 混合模式下等待两路端口的超时时间（毫秒）
         */
        private long portTimeoutMs = 10000;

        /**
         * 端口调用线程数
         */
        private int portThreads = 8;

        /**
         * 检索结果写入缓存的过期时间（秒）
         */
        private long resultTtlSeconds = 3600;

        /**
         * 批量检索并行度，1 表示在调用线程上顺序执行
         */
        private int batchParallelism = 4;

        /**
         * 是否缓存语义检索端口的原始结果
         */
        private boolean semanticCacheEnabled = true;
    }

    /**
     * 热点查询统计配置
     */
    @Data
    public static class HotQueryConfig {

        /**
         * 统计时间窗口（秒）
         */
        private int windowSeconds = 600;

        /**
         * 判定为热点的次数阈值
         */
        private int threshold = 3;

        /**
         * 最多统计的查询数
         */
        private long maximumSize = 10000;
    }
}
