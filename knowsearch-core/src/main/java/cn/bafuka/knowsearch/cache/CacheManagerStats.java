package cn.bafuka.knowsearch.cache;

import cn.bafuka.knowsearch.core.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 缓存管理器统计：各命名空间统计 + 总条目数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheManagerStats {

    /**
     * Key: 命名空间名称（query / semantic / knowledge）
     */
    private Map<String, CacheStats> namespaces = new LinkedHashMap<>();

    private int totalSize;

    public CacheStats get(CacheNamespace namespace) {
        return namespaces.get(namespace.getCacheName());
    }
}
