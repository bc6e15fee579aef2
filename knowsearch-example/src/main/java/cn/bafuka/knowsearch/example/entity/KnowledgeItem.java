package cn.bafuka.knowsearch.example.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 知识条目
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeItem {

    private String id;

    private String title;

    /**
     * 分类，如 "水力学"、"水文学"
     */
    private String category;

    /**
     * 层级：本科 / 硕士 / 博士 / 通用
     */
    private String level;

    private String content;
}
