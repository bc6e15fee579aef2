package cn.bafuka.knowsearch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 热点查询
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HotQuery {

    private String query;

    private long count;
}
