package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 语义检索端口返回的近邻结果
 * ids / metadatas / distances 三个列表按下标一一对应，按距离升序排列
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticMatches {

    @Builder.Default
    private List<String> ids = Collections.emptyList();

    @Builder.Default
    private List<KnowledgeMetadata> metadatas = Collections.emptyList();

    @Builder.Default
    private List<Double> distances = Collections.emptyList();

    public static SemanticMatches empty() {
        return new SemanticMatches(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public int size() {
        return ids == null ? 0 : ids.size();
    }

    /**
     * 三个列表非空、长度一致且距离不含 null
     *
     * @return 结构是否完整
     */
    public boolean isConsistent() {
        if (ids == null || metadatas == null || distances == null) {
            return false;
        }
        if (metadatas.size() != ids.size() || distances.size() != ids.size()) {
            return false;
        }
        for (Double distance : distances) {
            if (distance == null) {
                return false;
            }
        }
        return true;
    }
}
