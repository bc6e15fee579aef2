package cn.bafuka.knowsearch.exception;

/**
 * 检索被取消
 * 调用线程被中断或端口任务被取消时抛出，融合过程随之中止
 *
 * @author KnowSearch Team
 * @since 1.0
 */
public class SearchCancelledException extends KnowSearchException {

    public SearchCancelledException(String message) {
        super(message);
    }

    public SearchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
