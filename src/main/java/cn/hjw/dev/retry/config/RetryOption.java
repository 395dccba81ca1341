package cn.hjw.dev.retry.config;

/**
 * 配置选项：作用于 RetryConfig 构建器的修改函数
 */
@FunctionalInterface
public interface RetryOption {

    void apply(RetryConfig.RetryConfigBuilder builder);
}
