package cn.bafuka.knowsearch.exception;

import cn.bafuka.knowsearch.model.SearchSource;

/**
 * 检索后端异常
 * 外部关键词/语义检索端口失败时抛出
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public abstract class SearchException extends KnowSearchException {

    /**
     * 失败的检索来源
     */
    private final SearchSource source;

    /**
     * 失败原因
     */
    private final FailureReason reason;

    protected SearchException(String message, Throwable cause,
                              SearchSource source, FailureReason reason) {
        super(message, cause);
        this.source = source;
        this.reason = reason;
    }

    public SearchSource getSource() {
        return source;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 检索失败原因枚举
     */
    public enum FailureReason {
        /**
         * 后端错误
         */
        BACKEND_ERROR("后端错误"),

        /**
         * 超时
         */
        TIMEOUT("超时"),

        /**
         * 返回数据格式错误
         */
        MALFORMED_RESPONSE("返回数据格式错误"),

        /**
         * 未知错误
         */
        UNKNOWN("未知错误");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "source=" + source +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
