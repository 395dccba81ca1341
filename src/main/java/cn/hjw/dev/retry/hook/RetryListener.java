package cn.hjw.dev.retry.hook;

/**
 * 重试观察者
 * 每次尝试失败后回调，在重试条件判断之前触发
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param attempt 尝试序号 (从 0 开始)
     * @param cause 本次失败原因
     */
    void onRetry(int attempt, Exception cause);
}
