package cn.bafuka.knowsearch.autoconfigure;

import cn.bafuka.knowsearch.cache.CacheManager;
import cn.bafuka.knowsearch.cache.impl.DefaultCacheManager;
import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.search.CachingSemanticSearchPort;
import cn.bafuka.knowsearch.search.HybridSearchEngine;
import cn.bafuka.knowsearch.search.impl.DefaultHybridSearchEngine;
import cn.bafuka.knowsearch.service.CachedSearchService;
import cn.bafuka.knowsearch.service.HotQueryTracker;
import cn.bafuka.knowsearch.service.impl.DefaultCachedSearchService;
import cn.bafuka.knowsearch.spi.KeywordSearchPort;
import cn.bafuka.knowsearch.spi.KnowledgeContentPort;
import cn.bafuka.knowsearch.spi.SemanticSearchPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * KnowSearch 自动配置类
 * <p>
 * 关键词/语义检索端口由使用方提供；两个端口都存在时才装配检索引擎和检索服务
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(KnowSearchProperties.class)
@ConditionalOnProperty(prefix = "knowsearch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KnowSearchAutoConfiguration {

    public static final String PORT_EXECUTOR_BEAN = "knowSearchPortExecutor";

    public static final String BATCH_EXECUTOR_BEAN = "knowSearchBatchExecutor";

    public KnowSearchAutoConfiguration() {
        log.info("KnowSearch auto-configuration initializing...");
    }

    /**
     * 三命名空间缓存管理器
     */
    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    public DefaultCacheManager knowSearchCacheManager(KnowSearchProperties properties) {
        return new DefaultCacheManager(properties.getCache());
    }

    /**
     * 热点查询计数器
     */
    @Bean
    @ConditionalOnMissingBean
    public HotQueryTracker hotQueryTracker(KnowSearchProperties properties) {
        return new HotQueryTracker(properties.getHotQuery());
    }

    /**
     * 端口调用线程池（混合模式下两路并发）
     */
    @Bean(name = PORT_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = PORT_EXECUTOR_BEAN)
    public ExecutorService knowSearchPortExecutor(KnowSearchProperties properties) {
        int threads = Math.max(2, properties.getSearch().getPortThreads());
        log.info("构建端口调用线程池: threads={}", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("knowsearch-port-"));
    }

    /**
     * 批量检索线程池，线程按需创建
     */
    @Bean(name = BATCH_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = BATCH_EXECUTOR_BEAN)
    public ExecutorService knowSearchBatchExecutor(KnowSearchProperties properties) {
        int parallelism = Math.max(1, properties.getSearch().getBatchParallelism());
        return Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("knowsearch-batch-"));
    }

    /**
     * 混合检索引擎（仅当两个检索端口都存在时创建）
     */
    @Bean
    @ConditionalOnBean({KeywordSearchPort.class, SemanticSearchPort.class})
    @ConditionalOnMissingBean
    public HybridSearchEngine hybridSearchEngine(
            KeywordSearchPort keywordSearchPort,
            SemanticSearchPort semanticSearchPort,
            CacheManager cacheManager,
            @Qualifier(PORT_EXECUTOR_BEAN) ExecutorService portExecutor,
            KnowSearchProperties properties) {
        SemanticSearchPort semanticPort = semanticSearchPort;
        if (properties.getSearch().isSemanticCacheEnabled()) {
            semanticPort = new CachingSemanticSearchPort(semanticSearchPort, cacheManager);
        }
        log.info("构建混合检索引擎: policy={}, portTimeoutMs={}, semanticCacheEnabled={}",
                properties.getSearch().getPartialFailurePolicy(),
                properties.getSearch().getPortTimeoutMs(),
                properties.getSearch().isSemanticCacheEnabled());
        return new DefaultHybridSearchEngine(keywordSearchPort, semanticPort, portExecutor, properties.getSearch());
    }

    /**
     * 带缓存的检索服务（KnowledgeContentPort 为可选依赖）
     */
    @Bean
    @ConditionalOnBean(HybridSearchEngine.class)
    @ConditionalOnMissingBean
    public CachedSearchService cachedSearchService(
            HybridSearchEngine hybridSearchEngine,
            CacheManager cacheManager,
            HotQueryTracker hotQueryTracker,
            @Autowired(required = false) KnowledgeContentPort knowledgeContentPort,
            @Qualifier(BATCH_EXECUTOR_BEAN) ExecutorService batchExecutor,
            KnowSearchProperties properties) {
        ExecutorService executor = properties.getSearch().getBatchParallelism() > 1 ? batchExecutor : null;
        return new DefaultCachedSearchService(
                hybridSearchEngine,
                cacheManager,
                hotQueryTracker,
                knowledgeContentPort,
                executor,
                properties.getSearch()
        );
    }
}
