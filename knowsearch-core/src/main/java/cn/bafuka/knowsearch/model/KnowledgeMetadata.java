package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量库中知识条目的元数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeMetadata {

    private String title;

    private String category;

    private String level;
}
