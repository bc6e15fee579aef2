package cn.bafuka.knowsearch.example.runner;

import cn.bafuka.knowsearch.model.SearchMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 启动预热配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "example.warmup")
public class WarmupProperties {

    private boolean enabled = true;

    /**
     * 常用查询
     */
    private List<String> queries = new ArrayList<>();

    private int topK = 5;

    private SearchMode mode = SearchMode.HYBRID;
}
