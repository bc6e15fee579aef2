package cn.bafuka.knowsearch.model;

/**
 * 检索模式
 */
public enum SearchMode {

    /**
     * 仅关键词检索
     */
    KEYWORD("keyword"),

    /**
     * 仅语义检索
     */
    SEMANTIC("semantic"),

    /**
     * 关键词 + 语义融合检索
     */
    HYBRID("hybrid");

    private final String value;

    SearchMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 根据外部传入的字符串解析检索模式（忽略大小写）
     *
     * @param value 模式名称，如 "hybrid"
     * @return 检索模式
     * @throws IllegalArgumentException 未知模式
     */
    public static SearchMode fromValue(String value) {
        if (value != null) {
            for (SearchMode mode : values()) {
                if (mode.value.equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("未知的检索模式: " + value);
    }
}
