package cn.hjw.dev.retry.executor;

import cn.hjw.dev.retry.RetryableOperation;
import cn.hjw.dev.retry.config.RetryConfig;
import cn.hjw.dev.retry.exception.RetryException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 重试执行器
 * 只持有不可变配置，每次调用的失败记录都在栈上，可被多个线程共用
 */
@Slf4j
@RequiredArgsConstructor
public class RetryExecutor {

    @Getter
    private final RetryConfig config;
    private final Sleeper sleeper;

    public RetryExecutor(RetryConfig config) {
        this(config, Sleeper.THREAD);
    }

    /**
     * 执行操作，成功则正常返回
     * @throws RetryException 次数耗尽或重试条件终止
     */
    public void execute(RetryableOperation operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    /**
     * 执行带返回值的操作
     * @return 成功那一次的返回值
     * @throws RetryException 次数耗尽或重试条件终止
     */
    public <V> V call(Callable<V> operation) {
        int attempts = config.getAttempts();
        List<Exception> errors = new ArrayList<>();
        log.debug("Retry started with {}", config);

        // 第 0 次无条件执行：预算为 0 时同样调用一次
        for (int n = 0; n == 0 || n < attempts; n++) {
            try {
                V result = operation.call();
                if (n > 0) {
                    log.info("Operation succeeded on attempt {}/{}.", n + 1, attempts);
                }
                return result;
            } catch (Exception e) {
                config.getOnRetry().onRetry(n, e);
                errors.add(e);

                // 操作自身被中断：恢复中断标记，不再重试
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    log.warn("Operation interrupted (attempt {}/{}), stop retrying.", n + 1, attempts);
                    throw new RetryException(errors);
                }
                if (!config.getRetryIf().shouldRetry(e)) {
                    log.warn("Operation failed (attempt {}/{}), retry condition declined: {}", n + 1, attempts, e.getMessage());
                    throw new RetryException(errors);
                }
                // 最后一次不再等待 (与循环条件一致，预算 <= 0 时同样适用)
                if (n + 1 >= attempts) {
                    break;
                }

                log.warn("Operation failed (attempt {}/{}), retrying in {} {}...", n + 1, attempts, config.getDelay(), config.getUnit());
                try {
                    sleeper.sleep(config.getDelay(), config.getUnit());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry interrupted while waiting after attempt {}/{}.", n + 1, attempts);
                    RetryException interrupted = new RetryException(errors);
                    interrupted.addSuppressed(ie);
                    throw interrupted;
                }
            }
        }
        log.error("Operation failed after {} attempt(s).", errors.size());
        throw new RetryException(errors);
    }
}
