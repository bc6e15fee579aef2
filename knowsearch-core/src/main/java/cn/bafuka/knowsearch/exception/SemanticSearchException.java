package cn.bafuka.knowsearch.exception;

import cn.bafuka.knowsearch.model.SearchSource;

/**
 * 语义检索异常
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public class SemanticSearchException extends SearchException {

    public SemanticSearchException(String message) {
        this(message, null, FailureReason.BACKEND_ERROR);
    }

    public SemanticSearchException(String message, Throwable cause) {
        this(message, cause, FailureReason.BACKEND_ERROR);
    }

    public SemanticSearchException(String message, Throwable cause, FailureReason reason) {
        super(message, cause, SearchSource.SEMANTIC, reason);
    }
}
