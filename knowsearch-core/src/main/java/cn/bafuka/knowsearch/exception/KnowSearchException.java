package cn.bafuka.knowsearch.exception;

/**
 * KnowSearch 异常基类
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public class KnowSearchException extends RuntimeException {

    public KnowSearchException(String message) {
        super(message);
    }

    public KnowSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
