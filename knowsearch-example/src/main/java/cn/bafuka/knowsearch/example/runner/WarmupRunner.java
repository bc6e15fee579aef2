package cn.bafuka.knowsearch.example.runner;

import cn.bafuka.knowsearch.config.KnowSearchProperties;
import cn.bafuka.knowsearch.model.FusedResult;
import cn.bafuka.knowsearch.model.SearchResponse;
import cn.bafuka.knowsearch.model.WarmupResult;
import cn.bafuka.knowsearch.service.CachedSearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时预热缓存，并演示一次命中缓存的检索
 */
@Slf4j
@Component
public class WarmupRunner implements ApplicationRunner {

    private final CachedSearchService searchService;

    private final WarmupProperties properties;

    private final KnowSearchProperties knowSearchProperties;

    public WarmupRunner(CachedSearchService searchService,
                        WarmupProperties properties,
                        KnowSearchProperties knowSearchProperties) {
        this.searchService = searchService;
        this.properties = properties;
        this.knowSearchProperties = knowSearchProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled() || properties.getQueries().isEmpty()) {
            log.info("跳过缓存预热");
            return;
        }

        WarmupResult warmup = searchService.warmupCache(
                properties.getQueries(), properties.getTopK(), properties.getMode());
        log.info("预热结果: requested={}, warmed={}, failed={}, totalMs={}",
                warmup.getRequested(), warmup.getWarmedCount(), warmup.getFailedCount(), warmup.getTotalMs());

        // 预热使用默认 alpha，相同参数再次检索应命中缓存
        String first = properties.getQueries().get(0);
        SearchResponse response = searchService.search(first, properties.getTopK(), properties.getMode(),
                knowSearchProperties.getSearch().getDefaultAlpha(), true);
        log.info("示例检索: query={}, fromCache={}, results={}", first, response.isFromCache(),
                response.getResults().size());
        for (FusedResult result : response.getResults()) {
            log.info("  {} [{} / {}] combinedScore={}, sources={}", result.getTitle(), result.getCategory(),
                    result.getLevel(), String.format("%.4f", result.getCombinedScore()), result.getSources());
        }

        log.info("缓存健康报告: {}", searchService.getCacheHealthReport().toJson());
    }
}
