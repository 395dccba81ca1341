package cn.hjw.dev.retry.condition;

/**
 * 重试条件 (守卫)
 * 用于判断失败后是否继续重试
 */
@FunctionalInterface
public interface RetryCondition {

    /**
     * 判断是否继续重试
     * @param cause 本次失败原因
     * @return true: 继续; false: 立即终止(不再等待)
     */
    boolean shouldRetry(Exception cause);
}
