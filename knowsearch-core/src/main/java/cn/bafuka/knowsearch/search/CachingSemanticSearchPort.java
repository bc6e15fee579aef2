package cn.bafuka.knowsearch.search;

import cn.bafuka.knowsearch.cache.CacheManager;
import cn.bafuka.knowsearch.exception.CacheException;
import cn.bafuka.knowsearch.model.SemanticMatches;
import cn.bafuka.knowsearch.spi.SemanticSearchPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 带缓存的语义检索端口
 * 按 (query, nResults) 把向量检索结果缓存到 semantic 命名空间；失败结果不缓存
 */
@Slf4j
public class CachingSemanticSearchPort implements SemanticSearchPort {

    private final SemanticSearchPort delegate;

    private final CacheManager cacheManager;

    public CachingSemanticSearchPort(SemanticSearchPort delegate, CacheManager cacheManager) {
        this.delegate = delegate;
        this.cacheManager = cacheManager;
    }

    @Override
    public SemanticMatches search(String query, int nResults) {
        try {
            Optional<SemanticMatches> cached = cacheManager.getCachedSemantic(query, nResults);
            if (cached.isPresent()) {
                log.debug("语义缓存命中: query={}, nResults={}", query, nResults);
                return cached.get();
            }
        } catch (CacheException e) {
            log.warn("语义缓存读取失败，绕过缓存: query={}, error={}", query, e.getMessage());
        }

        SemanticMatches matches = delegate.search(query, nResults);

        if (matches == null) {
            return null;
        }
        // 结构不完整的返回交给引擎按 MALFORMED_RESPONSE 处理，不写缓存
        if (!matches.isConsistent()) {
            log.warn("语义检索返回结构不完整，不写入缓存: query={}, nResults={}", query, nResults);
            return matches;
        }
        try {
            cacheManager.cacheSemantic(query, nResults, matches, null);
        } catch (CacheException e) {
            log.warn("语义缓存写入失败，绕过缓存: query={}, error={}", query, e.getMessage());
        }
        return matches;
    }

    public SemanticSearchPort getDelegate() {
        return delegate;
    }
}
