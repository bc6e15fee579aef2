package cn.bafuka.knowsearch.exception;

/**
 * 缓存异常
 * 缓存键派生或缓存读写失败时抛出。调用方应记录日志并绕过缓存，不得向用户暴露
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public class CacheException extends KnowSearchException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
