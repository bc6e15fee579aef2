package cn.bafuka.knowsearch.example.port;

import cn.bafuka.knowsearch.example.entity.KnowledgeItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 内存知识库
 * 示例语料，供三个内存端口共用
 */
@Slf4j
@Component
public class InMemoryKnowledgeStore {

    private final Map<String, KnowledgeItem> items = new LinkedHashMap<>();

    public InMemoryKnowledgeStore() {
        add("hyd-001", "明渠均匀流", "水力学", "本科",
                "明渠均匀流 是 水深 流速 沿程 不变 的 流动 曼宁公式 计算 流量");
        add("hyd-002", "水跃", "水力学", "本科",
                "水跃 是 急流 向 缓流 过渡 的 局部 水力 现象 消能 计算 共轭水深");
        add("hyd-003", "圣维南方程组", "水力学", "硕士",
                "圣维南方程组 描述 明渠 非恒定流 连续方程 动量方程 数值 求解");
        add("hdr-001", "新安江模型", "水文学", "硕士",
                "新安江模型 蓄满产流 三水源 划分 流域 降雨 径流 模拟");
        add("hdr-002", "马斯京根法", "水文学", "本科",
                "马斯京根法 河道 洪水 演算 槽蓄方程 参数 率定");
        add("hdr-003", "SCE-UA 参数率定", "水文学", "博士",
                "SCE-UA 全局 优化 算法 水文 模型 参数 率定 复合形 进化");
        add("ctl-001", "渠道 PID 控制", "渠道控制", "硕士",
                "渠道 闸门 PID 控制 水位 流量 反馈 调节");
        add("ctl-002", "模型预测控制", "渠道控制", "博士",
                "模型预测控制 MPC 渠道 水位 滚动 优化 约束 控制");
        add("eco-001", "生境适宜性指数", "生态水力学", "通用",
                "生境适宜性 指数 鱼类 流速 水深 栖息地 评价");
        add("twn-001", "数字孪生流域", "智慧水利", "通用",
                "数字孪生 流域 实时 数据 模型 预报 调度 一体化");
        log.info("内存知识库初始化完成: items={}", items.size());
    }

    private void add(String id, String title, String category, String level, String content) {
        items.put(id, new KnowledgeItem(id, title, category, level, content));
    }

    public List<KnowledgeItem> all() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    public Optional<KnowledgeItem> findById(String id) {
        return Optional.ofNullable(items.get(id));
    }

    /**
     * 空白分词并转小写
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
