package cn.hjw.dev.retry;

import cn.hjw.dev.retry.config.RetryConfig;
import cn.hjw.dev.retry.config.RetryOption;
import cn.hjw.dev.retry.executor.RetryExecutor;

import java.util.concurrent.Callable;

/**
 * 入口：默认配置 + 选项 → 执行器 → 执行
 * <pre>
 * Retry.execute(() -> client.ping(),
 *         RetryOptions.attempts(3),
 *         RetryOptions.delay(50));
 * </pre>
 */
public final class Retry {

    private Retry() {
    }

    /**
     * 重试执行操作
     * @param operation 操作
     * @param options 配置选项，按顺序应用
     * @throws cn.hjw.dev.retry.exception.RetryException 全部失败时抛出，包含每次的异常
     */
    public static void execute(RetryableOperation operation, RetryOption... options) {
        new RetryExecutor(RetryConfig.of(options)).execute(operation);
    }

    public static <V> V call(Callable<V> operation, RetryOption... options) {
        return new RetryExecutor(RetryConfig.of(options)).call(operation);
    }
}
