package cn.hjw.dev.retry.config;

import cn.hjw.dev.retry.condition.RetryCondition;
import cn.hjw.dev.retry.hook.RetryListener;

import java.util.concurrent.TimeUnit;

/**
 * 选项工厂，每个配置字段一个
 */
public final class RetryOptions {

    private RetryOptions() {
    }

    /** 最大尝试次数 (含首次)。0 也会执行一次 */
    public static RetryOption attempts(int attempts) {
        return builder -> builder.attempts(attempts);
    }

    /** 两次尝试之间的等待时长，单位由 {@link #units(TimeUnit)} 决定 */
    public static RetryOption delay(long delay) {
        return builder -> builder.delay(delay);
    }

    public static RetryOption delay(long delay, TimeUnit unit) {
        return builder -> builder.delay(delay).unit(unit);
    }

    public static RetryOption units(TimeUnit unit) {
        return builder -> builder.unit(unit);
    }

    public static RetryOption onRetry(RetryListener listener) {
        return builder -> builder.onRetry(listener);
    }

    public static RetryOption retryIf(RetryCondition condition) {
        return builder -> builder.retryIf(condition);
    }
}
