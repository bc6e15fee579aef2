package cn.bafuka.knowsearch.exception;

import cn.bafuka.knowsearch.model.SearchSource;

/**
 * 关键词检索异常
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public class KeywordSearchException extends SearchException {

    public KeywordSearchException(String message) {
        this(message, null, FailureReason.BACKEND_ERROR);
    }

    public KeywordSearchException(String message, Throwable cause) {
        this(message, cause, FailureReason.BACKEND_ERROR);
    }

    public KeywordSearchException(String message, Throwable cause, FailureReason reason) {
        super(message, cause, SearchSource.KEYWORD, reason);
    }
}
