package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 关键词检索端口返回的匹配项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordMatch {

    private String title;

    private String content;

    private String category;

    private String level;

    private double matchScore;
}
