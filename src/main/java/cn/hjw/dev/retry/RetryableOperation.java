package cn.hjw.dev.retry;

/**
 * 可重试的操作
 * 抛出任意 Exception 即视为本次尝试失败，正常返回视为成功
 */
@FunctionalInterface
public interface RetryableOperation {

    /**
     * 执行一次操作
     * @throws Exception 执行异常 (由重试执行器记录)
     */
    void run() throws Exception;
}
